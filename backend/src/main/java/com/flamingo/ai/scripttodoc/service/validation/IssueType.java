package com.flamingo.ai.scripttodoc.service.validation;

import java.util.Locale;

public enum IssueType {
  INSUFFICIENT_ACTIONS,
  TOO_MANY_ACTIONS,
  EMPTY_ACTIONS,
  MISSING_TITLE,
  SHORT_TITLE,
  LONG_TITLE,
  GENERIC_TITLE,
  MISSING_DETAILS,
  INSUFFICIENT_DETAILS,
  VERY_LOW_CONFIDENCE,
  LOW_CONFIDENCE,
  DUPLICATE_ACTIONS;

  /** Lower-case identifier used in reports, e.g. {@code missing_title}. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
