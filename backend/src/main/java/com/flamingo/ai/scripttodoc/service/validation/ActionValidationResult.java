package com.flamingo.ai.scripttodoc.service.validation;

import java.util.List;

/**
 * Action-quality outcome for one step. Issues are advisory and end up as validation flags on the
 * step's evidence; they never reject the step.
 *
 * @param passed true when no issues were found
 * @param actionCount number of actions
 * @param issues problems with the step's wording
 * @param warnings softer hints
 * @param weakVerbs weak verbs found, in action order
 */
public record ActionValidationResult(
    boolean passed,
    int actionCount,
    List<String> issues,
    List<String> warnings,
    List<String> weakVerbs) {

  public ActionValidationResult {
    issues = List.copyOf(issues);
    warnings = List.copyOf(warnings);
    weakVerbs = List.copyOf(weakVerbs);
  }
}
