package com.flamingo.ai.scripttodoc.exception;

/** Exception thrown when no generated step passes grounding and structural validation. */
public class NoValidStepsException extends TranscriptProcessingException {

  private final int candidateCount;

  public NoValidStepsException(int candidateCount) {
    super(
        "No valid steps out of " + candidateCount + " candidates",
        "No training steps could be verified against the transcript.");
    this.candidateCount = candidateCount;
  }

  public int getCandidateCount() {
    return candidateCount;
  }
}
