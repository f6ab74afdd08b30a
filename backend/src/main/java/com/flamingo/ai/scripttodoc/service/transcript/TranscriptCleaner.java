package com.flamingo.ai.scripttodoc.service.transcript;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes spoken noise from sentence text: transcriber tags, filler words and stock phrases.
 * Visual markers such as {@code [screen shows ...]} are kept because grounding scores them.
 */
@Service
@Slf4j
public class TranscriptCleaner {

  private static final List<String> DEFAULT_FILLER_WORDS =
      List.of(
          "um", "uh", "umm", "uhh", "er", "ah", "you know", "i mean", "sort of", "kind of",
          "basically", "actually", "literally", "okay", "ok", "yeah", "yep", "mhm");

  private static final List<String> TRANSCRIBER_TAGS =
      List.of(
          "[inaudible]", "[crosstalk]", "[laughter]", "[music]", "[applause]", "[silence]",
          "[unintelligible]", "(inaudible)", "(crosstalk)", "(laughter)", "(laughs)", "(music)",
          "(applause)", "(silence)", "(unintelligible)");

  private static final List<Pattern> REPETITIVE_TEMPLATES =
      compileAll(
          "continuing in our hands[- ]on section",
          "let's continue with (?:the|our) hands[- ]on",
          "moving on to (?:the )?next (?:part|section|topic)",
          "as (?:i|we) mentioned (?:before|earlier)",
          "like (?:i|we) said",
          "(?:so|now),? let's move on",
          "(?:okay|alright),? (?:so|now)",
          "and that's it for (?:this|that) (?:part|section)",
          "we(?:'ll| will) get (?:back )?to (?:this|that) later",
          "we(?:'ll| will) discuss (?:this|that) (?:more )?(?:later|soon)");

  private static final Pattern VISUAL_MARKER =
      Pattern.compile(
          "\\[(?:screen shows|diagram|slide|demo|code|architecture|showing)[^\\]]*\\]",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern BRACKETED_TAG = Pattern.compile("\\[[\\w\\s]+\\]");
  private static final Pattern PARENTHESIZED_TAG = Pattern.compile("\\([\\w\\s]+\\)");
  // Lowercase continuations are left alone so domains like portal.azure.com survive
  private static final Pattern MISSING_SPACE = Pattern.compile("([.!?,;:])([A-Z])");
  private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.!?,;:])");
  private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([.!?]){2,}");
  private static final Pattern DANGLING_SEPARATORS = Pattern.compile("([,;:])(?:\\s*[,;:])+");
  private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[,;:\\s]+");

  private final boolean enabled;
  private final List<Pattern> fillerPatterns;

  public TranscriptCleaner(PipelineConfig pipelineConfig) {
    PipelineConfig.Cleaning cleaning = pipelineConfig.getCleaning();
    this.enabled = cleaning.isEnabled();
    Set<String> fillers = new LinkedHashSet<>(DEFAULT_FILLER_WORDS);
    for (String extra : cleaning.getExtraFillerWords()) {
      fillers.add(extra.toLowerCase(Locale.ROOT).strip());
    }
    List<Pattern> patterns = new ArrayList<>();
    for (String filler : fillers) {
      if (!filler.isEmpty()) {
        patterns.add(
            Pattern.compile("\\b" + Pattern.quote(filler) + "\\b", Pattern.CASE_INSENSITIVE));
      }
    }
    this.fillerPatterns = List.copyOf(patterns);
  }

  /**
   * Cleans every sentence's text. A sentence that would become blank keeps its original text so
   * sentence indices stay aligned with the parsed transcript.
   *
   * @param sentences parsed sentences
   * @return sentences with cleaned text, same size and order
   */
  public List<ParsedSentence> cleanSentences(List<ParsedSentence> sentences) {
    if (!enabled) {
      return sentences;
    }
    List<ParsedSentence> cleaned = new ArrayList<>(sentences.size());
    int changed = 0;
    for (ParsedSentence sentence : sentences) {
      String text = clean(sentence.text());
      if (text.isBlank() || text.equals(sentence.text())) {
        cleaned.add(sentence);
      } else {
        cleaned.add(sentence.withText(text));
        changed++;
      }
    }
    log.debug("Cleaned {} of {} sentences", changed, sentences.size());
    return cleaned;
  }

  /**
   * Applies all cleaning steps to a piece of text.
   *
   * @param text input text
   * @return cleaned text, possibly empty
   */
  public String clean(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    String result = removeTranscriberTags(text);
    result = removeFillerWords(result);
    result = removeRepetitiveTemplates(result);
    result = fixPunctuation(result);
    return normalizeWhitespace(result);
  }

  String removeTranscriberTags(String text) {
    String result = text;
    for (String tag : TRANSCRIBER_TAGS) {
      result = result.replace(tag, "");
    }

    List<String> preserved = new ArrayList<>();
    Matcher matcher = VISUAL_MARKER.matcher(result);
    StringBuilder masked = new StringBuilder();
    while (matcher.find()) {
      preserved.add(matcher.group());
      matcher.appendReplacement(masked, "__VISUAL_MARKER_" + (preserved.size() - 1) + "__");
    }
    matcher.appendTail(masked);

    result = BRACKETED_TAG.matcher(masked.toString()).replaceAll("");
    result = PARENTHESIZED_TAG.matcher(result).replaceAll("");

    for (int i = 0; i < preserved.size(); i++) {
      result = result.replace("__VISUAL_MARKER_" + i + "__", preserved.get(i));
    }
    return result;
  }

  String removeFillerWords(String text) {
    String result = text;
    for (Pattern filler : fillerPatterns) {
      result = filler.matcher(result).replaceAll("");
    }
    return result;
  }

  String removeRepetitiveTemplates(String text) {
    String result = text;
    for (Pattern template : REPETITIVE_TEMPLATES) {
      result = template.matcher(result).replaceAll("");
    }
    return result;
  }

  String fixPunctuation(String text) {
    String result = MISSING_SPACE.matcher(text).replaceAll("$1 $2");
    result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
    result = REPEATED_PUNCTUATION.matcher(result).replaceAll("$1");
    result = DANGLING_SEPARATORS.matcher(result).replaceAll("$1");
    return LEADING_PUNCTUATION.matcher(result).replaceAll("");
  }

  String normalizeWhitespace(String text) {
    return text.replaceAll("\\s{2,}", " ").strip();
  }

  private static List<Pattern> compileAll(String... regexes) {
    List<Pattern> patterns = new ArrayList<>(regexes.length);
    for (String regex : regexes) {
      patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
    return List.copyOf(patterns);
  }
}
