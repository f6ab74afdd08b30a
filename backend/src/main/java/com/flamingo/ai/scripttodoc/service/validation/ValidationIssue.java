package com.flamingo.ai.scripttodoc.service.validation;

/**
 * A single problem found in a generated step.
 *
 * @param type what was checked
 * @param severity how serious the problem is
 * @param message human-readable description
 * @param field step field the issue refers to
 * @param suggestion how to fix it
 */
public record ValidationIssue(
    IssueType type, IssueSeverity severity, String message, String field, String suggestion) {

  static ValidationIssue error(IssueType type, String field, String message, String suggestion) {
    return new ValidationIssue(type, IssueSeverity.ERROR, message, field, suggestion);
  }

  static ValidationIssue warning(IssueType type, String field, String message, String suggestion) {
    return new ValidationIssue(type, IssueSeverity.WARNING, message, field, suggestion);
  }

  static ValidationIssue info(IssueType type, String field, String message, String suggestion) {
    return new ValidationIssue(type, IssueSeverity.INFO, message, field, suggestion);
  }
}
