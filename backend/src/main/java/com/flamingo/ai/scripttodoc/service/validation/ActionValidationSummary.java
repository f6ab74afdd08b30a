package com.flamingo.ai.scripttodoc.service.validation;

import java.util.List;

/** Action-quality totals over a document's steps. */
public record ActionValidationSummary(
    int totalSteps,
    int passedSteps,
    int failedSteps,
    List<String> weakVerbs,
    int totalIssues,
    int totalWarnings) {

  public ActionValidationSummary {
    weakVerbs = List.copyOf(weakVerbs);
  }

  public static ActionValidationSummary empty() {
    return new ActionValidationSummary(0, 0, 0, List.of(), 0, 0);
  }
}
