package com.flamingo.ai.scripttodoc.service.validation;

import java.util.Map;

/**
 * Aggregate view over the validation results of a document.
 *
 * @param totalSteps number of validated steps
 * @param validSteps steps without errors
 * @param invalidSteps steps with at least one error
 * @param validationRate valid steps over total steps
 * @param statistics score distribution, null when nothing was validated
 * @param issuesByType issue counts keyed by {@link IssueType#code()}
 * @param issuesBySeverity issue counts keyed by severity
 */
public record ValidationReport(
    int totalSteps,
    int validSteps,
    int invalidSteps,
    double validationRate,
    Statistics statistics,
    Map<String, Integer> issuesByType,
    Map<IssueSeverity, Integer> issuesBySeverity) {

  /**
   * @param averageQuality mean quality score
   * @param minQuality lowest quality score
   * @param maxQuality highest quality score
   * @param averageActionCount mean number of actions per step
   * @param averageConfidence mean grounding confidence
   * @param highQualitySteps steps at or above 0.8
   * @param mediumQualitySteps steps from 0.5 up to 0.8
   * @param lowQualitySteps steps below 0.5
   */
  public record Statistics(
      double averageQuality,
      double minQuality,
      double maxQuality,
      double averageActionCount,
      double averageConfidence,
      int highQualitySteps,
      int mediumQualitySteps,
      int lowQualitySteps) {}

  static ValidationReport empty() {
    return new ValidationReport(0, 0, 0, 0.0, null, Map.of(), Map.of());
  }
}
