package com.flamingo.ai.scripttodoc.service.transcript;

/** Role inferred for a speaker from how often they talk. */
public enum SpeakerRole {
  INSTRUCTOR,
  PARTICIPANT
}
