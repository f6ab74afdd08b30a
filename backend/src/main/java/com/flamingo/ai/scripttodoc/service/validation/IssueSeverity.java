package com.flamingo.ai.scripttodoc.service.validation;

/** Severity of a validation issue. Only errors make a step invalid. */
public enum IssueSeverity {
  ERROR,
  WARNING,
  INFO
}
