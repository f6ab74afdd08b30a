package com.flamingo.ai.scripttodoc.exception;

/** Exception thrown when a pipeline stage is constructed with inconsistent settings. */
public class InvalidConfigurationException extends RuntimeException {

  private final String section;

  public InvalidConfigurationException(String section, String message) {
    super(section + ": " + message);
    this.section = section;
  }

  public String getSection() {
    return section;
  }
}
