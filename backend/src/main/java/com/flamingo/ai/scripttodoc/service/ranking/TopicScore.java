package com.flamingo.ai.scripttodoc.service.ranking;

/**
 * Importance breakdown for one topic segment.
 *
 * @param segmentIndex index of the scored segment
 * @param importanceScore weighted sum of the three components
 * @param proceduralScore how instruction-like the segment reads
 * @param actionDensity action verbs per sentence, normalised
 * @param coherenceScore keyword coherence carried over from segmentation
 * @param weightedProcedural procedural component after weighting
 * @param weightedActionDensity action density component after weighting
 * @param weightedCoherence coherence component after weighting
 */
public record TopicScore(
    int segmentIndex,
    double importanceScore,
    double proceduralScore,
    double actionDensity,
    double coherenceScore,
    double weightedProcedural,
    double weightedActionDensity,
    double weightedCoherence) {}
