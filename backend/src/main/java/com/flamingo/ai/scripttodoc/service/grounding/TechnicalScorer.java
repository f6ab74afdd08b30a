package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rates how specific a transcript sentence is. Sentences with code, product terms, numbers or
 * quoted UI labels make better citations than small talk.
 */
final class TechnicalScorer {

  private static final List<String> CODE_KEYWORDS =
      List.of(
          "async", "await", "def", "class", "function", "import", "from", "return", "if", "else",
          "for", "while", "try", "except", "const", "var", "let", "public", "private", "static",
          "void");

  private static final List<String> TECHNICAL_TERMS =
      List.of(
          "api", "endpoint", "database", "cosmos", "blob", "storage", "pipeline", "workflow",
          "microservice", "container", "docker", "kubernetes", "deployment", "configuration",
          "authentication", "authorization", "throughput", "latency", "idempotent", "scalability",
          "asynchronous", "synchronous", "event", "trigger");

  private static final List<String> ACTION_VERBS =
      List.of(
          "click", "select", "open", "navigate", "configure", "create", "delete", "update",
          "install", "deploy", "build", "run", "execute");

  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern URL = Pattern.compile("https?://|www\\.");
  private static final Pattern PERCENTAGE = Pattern.compile("\\d+%");
  private static final Pattern MEASUREMENT = Pattern.compile("\\d+\\s*(ms|kb|mb|gb|tb|rpm|dpi|px)");
  private static final Pattern STRUCTURAL_MARKER =
      Pattern.compile("\\[screen\\s+shows|\\[diagram|\\[code|\\[architecture");

  private TechnicalScorer() {}

  static double score(String sentence) {
    String lower = sentence.toLowerCase(Locale.ROOT);
    String padded = " " + lower + " ";
    double score = 0.0;

    for (String keyword : CODE_KEYWORDS) {
      if (padded.contains(" " + keyword + " ")) {
        score += 0.15;
      }
    }
    for (String term : TECHNICAL_TERMS) {
      if (lower.contains(term)) {
        score += 0.10;
      }
    }

    if (NUMBER.matcher(sentence).find()) {
      score += 0.05;
    }
    if (URL.matcher(lower).find()) {
      score += 0.10;
    }
    if (PERCENTAGE.matcher(sentence).find()) {
      score += 0.08;
    }
    if (MEASUREMENT.matcher(lower).find()) {
      score += 0.12;
    }

    long quotes = sentence.chars().filter(c -> c == '"' || c == '\'' || c == '`').count();
    score += Math.min(0.15, quotes * 0.05);

    for (String verb : ACTION_VERBS) {
      if (lower.contains(verb)) {
        score += 0.06;
        break;
      }
    }

    if (STRUCTURAL_MARKER.matcher(lower).find()) {
      score += 0.10;
    }

    int words = lower.isBlank() ? 0 : lower.strip().split("\\s+").length;
    if (words < 5) {
      score *= 0.5;
    } else if (words > 15) {
      score += 0.05;
    }

    return Math.max(0.0, Math.min(1.0, score));
  }
}
