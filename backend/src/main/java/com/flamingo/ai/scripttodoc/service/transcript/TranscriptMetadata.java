package com.flamingo.ai.scripttodoc.service.transcript;

import java.util.List;

/**
 * Transcript-wide statistics computed after sentence analysis.
 *
 * @param totalSentences number of parsed sentences
 * @param totalSpeakers number of distinct speaker labels
 * @param speakerNames speaker labels in order of first appearance
 * @param primarySpeaker most frequent speaker, or null when no labels were found
 * @param primarySpeakerRatio primary speaker's sentences over all sentences
 * @param durationSeconds latest timestamp seen, or null without timestamps
 * @param hasTimestamps whether any sentence carries a timestamp
 * @param hasQaSections whether any participant asked a question
 * @param questionCount number of question sentences
 * @param transitionCount number of transition sentences
 */
public record TranscriptMetadata(
    int totalSentences,
    int totalSpeakers,
    List<String> speakerNames,
    String primarySpeaker,
    double primarySpeakerRatio,
    Double durationSeconds,
    boolean hasTimestamps,
    boolean hasQaSections,
    int questionCount,
    int transitionCount) {

  public static TranscriptMetadata empty() {
    return new TranscriptMetadata(0, 0, List.of(), null, 0.0, null, false, false, 0, 0);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(totalSentences).append(" sentences, ").append(totalSpeakers).append(" speakers");
    if (durationSeconds != null && durationSeconds > 0) {
      long total = durationSeconds.longValue();
      sb.append(", ").append(total / 60).append("m ").append(total % 60).append("s");
    }
    if (primarySpeaker != null) {
      sb.append(", primary: ")
          .append(primarySpeaker)
          .append(" (")
          .append(Math.round(primarySpeakerRatio * 100))
          .append("%)");
    }
    return sb.toString();
  }
}
