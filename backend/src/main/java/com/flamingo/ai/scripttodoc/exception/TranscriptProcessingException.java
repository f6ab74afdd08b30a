package com.flamingo.ai.scripttodoc.exception;

/** Exception thrown when a transcript cannot be turned into training steps. */
public class TranscriptProcessingException extends RuntimeException {

  private final String userMessage;

  public TranscriptProcessingException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
