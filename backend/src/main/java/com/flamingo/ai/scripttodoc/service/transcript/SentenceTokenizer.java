package com.flamingo.ai.scripttodoc.service.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Splits a line of transcript text into sentences. */
public final class SentenceTokenizer {

  /** Break after terminal punctuation followed by whitespace and an uppercase letter. */
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z])");

  private static final int MIN_SENTENCE_LENGTH = 4;

  private SentenceTokenizer() {}

  public static List<String> tokenize(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    for (String part : SENTENCE_BREAK.split(text.trim())) {
      String sentence = part.trim();
      // Fragments like "Ok." carry no content
      if (sentence.length() >= MIN_SENTENCE_LENGTH) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }
}
