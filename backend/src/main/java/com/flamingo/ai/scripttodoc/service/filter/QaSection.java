package com.flamingo.ai.scripttodoc.service.filter;

import java.util.List;

/**
 * Question density analysis of one topic segment.
 *
 * @param segmentIndex index of the analysed segment
 * @param startSentenceIndex first sentence index in the segment
 * @param endSentenceIndex last sentence index in the segment
 * @param questionCount number of question sentences
 * @param totalSentences number of sentences
 * @param qaDensity questions over sentences
 * @param qaDense whether the segment counts as a Q&A section
 * @param primarySpeaker most frequent speaker, may be null
 * @param speakers distinct speakers, sorted
 */
public record QaSection(
    int segmentIndex,
    int startSentenceIndex,
    int endSentenceIndex,
    int questionCount,
    int totalSentences,
    double qaDensity,
    boolean qaDense,
    String primarySpeaker,
    List<String> speakers) {}
