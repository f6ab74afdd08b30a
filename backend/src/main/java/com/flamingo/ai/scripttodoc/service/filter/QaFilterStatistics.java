package com.flamingo.ai.scripttodoc.service.filter;

/**
 * Before/after counts of a Q&A filtering pass.
 *
 * @param totalSegments segments before filtering
 * @param qaSegments segments detected as Q&A sections
 * @param filteredSegments segments kept
 * @param removedSegments segments dropped for any reason
 * @param totalQuestions questions across all segments
 * @param totalSentences sentences across all segments
 * @param overallQaDensity questions over sentences across all segments
 * @param filterRate share of segments dropped
 */
public record QaFilterStatistics(
    int totalSegments,
    int qaSegments,
    int filteredSegments,
    int removedSegments,
    int totalQuestions,
    int totalSentences,
    double overallQaDensity,
    double filterRate) {}
