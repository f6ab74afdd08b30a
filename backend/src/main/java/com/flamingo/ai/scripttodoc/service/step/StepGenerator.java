package com.flamingo.ai.scripttodoc.service.step;

/**
 * Writes one training step from a transcript segment, usually by prompting a language model.
 * Implementations live outside the pipeline and may throw on failure; the pipeline skips the
 * segment and carries on.
 */
@FunctionalInterface
public interface StepGenerator {

  /**
   * Generates a step for one segment.
   *
   * @param segmentText the segment's sentences joined by spaces
   * @param context position of the segment and writing style
   * @return the generated step
   */
  GeneratedStep generate(String segmentText, StepGenerationContext context);
}
