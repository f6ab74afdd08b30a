package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.List;

/**
 * A piece of evidence supporting a generated step.
 *
 * @param type kind of evidence
 * @param excerpt quoted evidence text
 * @param timestamp transcript time of the sentence, if known
 * @param sentenceIndex transcript sentence index, for transcript sources
 * @param screenshotRef screenshot file name, for visual sources
 * @param url document location, for knowledge sources
 * @param uiElements matched UI element labels, for visual sources
 * @param confidence match strength in [0, 1]
 */
public record SourceReference(
    SourceType type,
    String excerpt,
    Double timestamp,
    Integer sentenceIndex,
    String screenshotRef,
    String url,
    List<String> uiElements,
    double confidence) {

  public SourceReference {
    uiElements = uiElements == null ? List.of() : List.copyOf(uiElements);
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static SourceReference transcript(
      String excerpt, int sentenceIndex, Double timestamp, double confidence) {
    return new SourceReference(
        SourceType.TRANSCRIPT,
        excerpt,
        timestamp,
        sentenceIndex,
        null,
        null,
        List.of(),
        confidence);
  }

  public static SourceReference knowledge(String excerpt, String url, double confidence) {
    return new SourceReference(
        SourceType.KNOWLEDGE, excerpt, null, null, null, url, List.of(), confidence);
  }

  public static SourceReference visual(
      String excerpt, String screenshotRef, List<String> uiElements, double confidence) {
    return new SourceReference(
        SourceType.VISUAL, excerpt, null, null, screenshotRef, null, uiElements, confidence);
  }
}
