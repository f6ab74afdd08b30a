package com.flamingo.ai.scripttodoc.service.grounding;

/** Kind of evidence a source reference points at. */
public enum SourceType {
  TRANSCRIPT,
  KNOWLEDGE,
  VISUAL;

  /** Transcript and knowledge sources count towards step confidence; visual ones do not. */
  public boolean countsTowardsConfidence() {
    return this != VISUAL;
  }
}
