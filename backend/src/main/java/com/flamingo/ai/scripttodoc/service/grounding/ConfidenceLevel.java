package com.flamingo.ai.scripttodoc.service.grounding;

/** Coarse quality band for a step's grounding confidence. */
public enum ConfidenceLevel {
  HIGH,
  MEDIUM,
  LOW;

  public static ConfidenceLevel fromScore(double confidence) {
    if (confidence >= 0.7) {
      return HIGH;
    }
    if (confidence >= 0.4) {
      return MEDIUM;
    }
    return LOW;
  }

  /** Five-step label shown next to a step in generated documents. */
  public static String label(double confidence) {
    if (confidence >= 0.75) {
      return "Very High";
    }
    if (confidence >= 0.55) {
      return "High";
    }
    if (confidence >= 0.35) {
      return "Medium";
    }
    if (confidence >= 0.20) {
      return "Low";
    }
    return "Very Low";
  }
}
