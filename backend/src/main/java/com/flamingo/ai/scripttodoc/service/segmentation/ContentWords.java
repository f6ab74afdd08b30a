package com.flamingo.ai.scripttodoc.service.segmentation;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/** Content-word extraction and overlap used for boundary and coherence scoring. */
public final class ContentWords {

  private static final Set<String> STOP_WORDS =
      Set.of("the", "and", "for", "with", "this", "that", "from", "will", "have", "your");

  private static final int MIN_WORD_LENGTH = 4;

  private ContentWords() {}

  /**
   * Lowercased words of four or more letters, minus a small stop list. Surrounding punctuation is
   * stripped so "portal." and "portal" compare equal.
   */
  public static Set<String> of(String text) {
    Set<String> words = new HashSet<>();
    if (text == null) {
      return words;
    }
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      String word = token.replaceAll("^\\p{Punct}+|\\p{Punct}+$", "");
      if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
        words.add(word);
      }
    }
    return words;
  }

  /** Jaccard similarity of two word sets; 0 when both are empty. */
  public static double jaccard(Set<String> first, Set<String> second) {
    if (first.isEmpty() && second.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(first);
    intersection.retainAll(second);
    Set<String> union = new HashSet<>(first);
    union.addAll(second);
    return (double) intersection.size() / union.size();
  }
}
