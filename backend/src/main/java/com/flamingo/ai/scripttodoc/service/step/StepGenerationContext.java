package com.flamingo.ai.scripttodoc.service.step;

/**
 * What the step generator knows about the segment it is writing a step for.
 *
 * @param segmentIndex index of the segment
 * @param totalSegments number of segments being turned into steps
 * @param tone writing tone for the step
 * @param audience intended readers
 */
public record StepGenerationContext(
    int segmentIndex, int totalSegments, String tone, String audience) {}
