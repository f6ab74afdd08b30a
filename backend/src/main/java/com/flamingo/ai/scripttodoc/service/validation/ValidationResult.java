package com.flamingo.ai.scripttodoc.service.validation;

import java.util.List;

/**
 * Structural validation outcome for one generated step.
 *
 * @param stepIndex position of the step in the document
 * @param valid true when the step has no errors
 * @param qualityScore weighted structural quality in [0, 1]
 * @param errors blocking issues
 * @param warnings non-blocking issues
 * @param info hints
 * @param actionCount number of actions
 * @param titleLength title length in characters
 * @param detailsLength details length in characters
 * @param confidenceScore grounding confidence the step was validated with
 * @param hasDuplicates whether two actions are the same ignoring case
 * @param autoFixAvailable whether remediation hints were produced
 * @param suggestedFixes remediation hints, empty for valid steps
 */
public record ValidationResult(
    int stepIndex,
    boolean valid,
    double qualityScore,
    List<ValidationIssue> errors,
    List<ValidationIssue> warnings,
    List<ValidationIssue> info,
    int actionCount,
    int titleLength,
    int detailsLength,
    double confidenceScore,
    boolean hasDuplicates,
    boolean autoFixAvailable,
    List<String> suggestedFixes) {

  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    info = List.copyOf(info);
    suggestedFixes = List.copyOf(suggestedFixes);
  }

  public boolean hasIssue(IssueType type) {
    return errors.stream().anyMatch(issue -> issue.type() == type)
        || warnings.stream().anyMatch(issue -> issue.type() == type)
        || info.stream().anyMatch(issue -> issue.type() == type);
  }
}
