package com.flamingo.ai.scripttodoc.exception;

/** Exception thrown when Q&A and importance filtering leave no topic segments to generate from. */
public class NoSegmentsRemainingException extends TranscriptProcessingException {

  private final int originalSegmentCount;

  public NoSegmentsRemainingException(int originalSegmentCount) {
    super(
        "All " + originalSegmentCount + " topic segments were filtered out",
        "The transcript contains no procedural content. Try relaxing the Q&A or importance"
            + " filters.");
    this.originalSegmentCount = originalSegmentCount;
  }

  public int getOriginalSegmentCount() {
    return originalSegmentCount;
  }
}
