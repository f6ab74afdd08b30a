package com.flamingo.ai.scripttodoc.service.transcript;

/**
 * A single transcript sentence with the structural signals extracted around it.
 *
 * @param text sentence text used by downstream stages
 * @param rawText the full source line the sentence came from
 * @param sentenceIndex position in the transcript, unique and increasing
 * @param timestamp seconds from the start of the recording, or null when the line had none
 * @param speaker speaker label, or null when the line had none
 * @param speakerRole inferred role, or null for unlabelled sentences
 * @param question whether the sentence is a question
 * @param transition whether the sentence contains a topic transition phrase
 * @param emphasis whether the sentence carries emphasis markers
 * @param followsLongPause whether the gap to the previous sentence exceeds the pause threshold
 * @param speakerChanged whether the speaker differs from the previous sentence's speaker
 */
public record ParsedSentence(
    String text,
    String rawText,
    int sentenceIndex,
    Double timestamp,
    String speaker,
    SpeakerRole speakerRole,
    boolean question,
    boolean transition,
    boolean emphasis,
    boolean followsLongPause,
    boolean speakerChanged) {

  /** Creates a sentence before relational and role analysis. */
  public static ParsedSentence of(
      String text,
      String rawText,
      int sentenceIndex,
      Double timestamp,
      String speaker,
      boolean question,
      boolean transition,
      boolean emphasis) {
    return new ParsedSentence(
        text,
        rawText,
        sentenceIndex,
        timestamp,
        speaker,
        null,
        question,
        transition,
        emphasis,
        false,
        false);
  }

  public boolean hasTimestamp() {
    return timestamp != null;
  }

  public boolean hasSpeaker() {
    return speaker != null;
  }

  public boolean isParticipant() {
    return speakerRole == SpeakerRole.PARTICIPANT;
  }

  public boolean isInstructor() {
    return speakerRole == SpeakerRole.INSTRUCTOR;
  }

  public ParsedSentence withRelationships(boolean followsLongPause, boolean speakerChanged) {
    return new ParsedSentence(
        text,
        rawText,
        sentenceIndex,
        timestamp,
        speaker,
        speakerRole,
        question,
        transition,
        emphasis,
        followsLongPause,
        speakerChanged);
  }

  public ParsedSentence withSpeakerRole(SpeakerRole role) {
    return new ParsedSentence(
        text,
        rawText,
        sentenceIndex,
        timestamp,
        speaker,
        role,
        question,
        transition,
        emphasis,
        followsLongPause,
        speakerChanged);
  }

  public ParsedSentence withText(String newText) {
    return new ParsedSentence(
        newText,
        rawText,
        sentenceIndex,
        timestamp,
        speaker,
        speakerRole,
        question,
        transition,
        emphasis,
        followsLongPause,
        speakerChanged);
  }
}
