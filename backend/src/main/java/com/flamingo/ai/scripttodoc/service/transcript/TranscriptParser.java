package com.flamingo.ai.scripttodoc.service.transcript;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Parses raw transcript text into analysed sentences.
 *
 * <p>Each line may start with a timestamp and a speaker label in any of the common caption and
 * meeting-notes formats. Lines that match neither are kept as plain text, so parsing never fails on
 * malformed input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptParser {

  private static final String CLOCK = "(\\d{1,2}):(\\d{2}):(\\d{2})(?:\\.(\\d{3}))?";

  private static final List<Pattern> TIMESTAMP_PATTERNS =
      List.of(
          Pattern.compile("^\\[" + CLOCK + "\\]\\s*"),
          Pattern.compile("^\\(" + CLOCK + "\\)\\s*"),
          Pattern.compile("^<" + CLOCK + ">?\\s*"),
          Pattern.compile("^" + CLOCK + "\\s*-\\s*"),
          Pattern.compile("^" + CLOCK + "\\s+"));

  private static final String SPEAKER_NAME = "(Speaker\\s*\\d*|[A-Z][a-z]+)";

  private static final List<Pattern> SPEAKER_PATTERNS =
      List.of(
          Pattern.compile("^(Speaker\\s*\\d*)\\s*:\\s*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^([A-Z][a-z]+)\\s*:\\s*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\[" + SPEAKER_NAME + "\\]\\s*:\\s*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^>>\\s*" + SPEAKER_NAME + "\\s*:\\s*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\*\\*" + SPEAKER_NAME + "\\*\\*\\s*:\\s*", Pattern.CASE_INSENSITIVE));

  private static final Pattern TRANSITION_PATTERN =
      Pattern.compile(
          String.join(
              "|",
              "\\b(?:now|next|okay|alright|so),?\\s+let'?s\\s+",
              "\\bmoving on\\b",
              "\\bnow (?:let's|we'll|we will)\\b",
              "\\bnext,?\\s+(?:we'll|we're|we will|up|step|part|section)\\b",
              "\\b(?:first|second|third|finally|lastly)\\b",
              "\\bstep \\d+\\b",
              "\\bpart \\d+\\b",
              "\\blet's talk about\\b",
              "\\blet's discuss\\b",
              "\\blet's move (?:on )?to\\b",
              "\\bthe next (?:thing|topic|item)\\b"),
          Pattern.CASE_INSENSITIVE);

  private static final List<String> QUESTION_WORDS =
      List.of(
          "what", "when", "where", "who", "whom", "whose", "why", "how", "which", "can", "could",
          "would", "should", "is", "are", "do", "does", "did");

  private static final Pattern CAPS_EMPHASIS = Pattern.compile("\\b[A-Z]{3,}\\b");
  private static final Pattern MARKDOWN_EMPHASIS =
      Pattern.compile("\\*\\*[^*]+\\*\\*|__[^_]+__|[*_][^*_]+[*_]");

  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Parses a raw transcript.
   *
   * @param rawTranscript transcript text, one utterance per line
   * @return analysed sentences with transcript metadata; empty for null or blank input
   */
  public ParsedTranscript parse(String rawTranscript) {
    if (rawTranscript == null || rawTranscript.isBlank()) {
      log.warn("Empty transcript provided");
      return new ParsedTranscript(List.of(), TranscriptMetadata.empty());
    }

    List<ParsedSentence> sentences = analyzeLines(rawTranscript);
    sentences = computeRelationships(sentences);
    sentences = assignRoles(sentences);
    TranscriptMetadata metadata = buildMetadata(sentences);

    meterRegistry.counter("transcript.sentences.parsed").increment(sentences.size());
    log.info("Parsed {} sentences: {}", sentences.size(), metadata);
    return new ParsedTranscript(sentences, metadata);
  }

  private List<ParsedSentence> analyzeLines(String rawTranscript) {
    List<ParsedSentence> sentences = new ArrayList<>();
    for (String rawLine : rawTranscript.split("\\R")) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }

      Double timestamp = null;
      String remaining = line;
      for (Pattern pattern : TIMESTAMP_PATTERNS) {
        Matcher matcher = pattern.matcher(remaining);
        if (matcher.find()) {
          // Milliseconds are dropped
          timestamp =
              (double)
                  (Integer.parseInt(matcher.group(1)) * 3600
                      + Integer.parseInt(matcher.group(2)) * 60
                      + Integer.parseInt(matcher.group(3)));
          remaining = remaining.substring(matcher.end());
          break;
        }
      }

      String speaker = null;
      for (Pattern pattern : SPEAKER_PATTERNS) {
        Matcher matcher = pattern.matcher(remaining);
        if (matcher.find()) {
          speaker = matcher.group(1);
          remaining = remaining.substring(matcher.end());
          break;
        }
      }

      for (String text : SentenceTokenizer.tokenize(remaining)) {
        sentences.add(
            ParsedSentence.of(
                text,
                line,
                sentences.size(),
                timestamp,
                speaker,
                isQuestion(text),
                isTransition(text),
                hasEmphasis(text)));
      }
    }
    return sentences;
  }

  static boolean isQuestion(String text) {
    String trimmed = text.strip();
    if (trimmed.endsWith("?")) {
      return true;
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    for (String word : QUESTION_WORDS) {
      if (lower.equals(word) || lower.startsWith(word + " ")) {
        return true;
      }
    }
    return false;
  }

  static boolean isTransition(String text) {
    return TRANSITION_PATTERN.matcher(text).find();
  }

  static boolean hasEmphasis(String text) {
    return CAPS_EMPHASIS.matcher(text).find() || MARKDOWN_EMPHASIS.matcher(text).find();
  }

  private List<ParsedSentence> computeRelationships(List<ParsedSentence> sentences) {
    double pauseThreshold = pipelineConfig.getSegmentation().getGapThresholdSeconds();
    List<ParsedSentence> result = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      ParsedSentence current = sentences.get(i);
      if (i == 0) {
        result.add(current);
        continue;
      }
      ParsedSentence previous = sentences.get(i - 1);
      boolean longPause =
          current.hasTimestamp()
              && previous.hasTimestamp()
              && current.timestamp() - previous.timestamp() > pauseThreshold;
      boolean speakerChanged =
          current.hasSpeaker()
              && previous.hasSpeaker()
              && !current.speaker().equals(previous.speaker());
      result.add(current.withRelationships(longPause, speakerChanged));
    }
    return result;
  }

  private List<ParsedSentence> assignRoles(List<ParsedSentence> sentences) {
    String primary = primarySpeaker(speakerCounts(sentences));
    if (primary == null) {
      return sentences;
    }
    List<ParsedSentence> result = new ArrayList<>(sentences.size());
    for (ParsedSentence sentence : sentences) {
      if (!sentence.hasSpeaker()) {
        result.add(sentence);
      } else if (sentence.speaker().equals(primary)) {
        result.add(sentence.withSpeakerRole(SpeakerRole.INSTRUCTOR));
      } else {
        result.add(sentence.withSpeakerRole(SpeakerRole.PARTICIPANT));
      }
    }
    return result;
  }

  private TranscriptMetadata buildMetadata(List<ParsedSentence> sentences) {
    if (sentences.isEmpty()) {
      return TranscriptMetadata.empty();
    }

    Map<String, Integer> counts = speakerCounts(sentences);
    String primary = primarySpeaker(counts);
    double primaryRatio = primary == null ? 0.0 : (double) counts.get(primary) / sentences.size();

    Double duration = null;
    int questions = 0;
    int transitions = 0;
    boolean participantQuestion = false;
    for (ParsedSentence sentence : sentences) {
      if (sentence.hasTimestamp()) {
        duration =
            duration == null ? sentence.timestamp() : Math.max(duration, sentence.timestamp());
      }
      if (sentence.question()) {
        questions++;
        participantQuestion |= sentence.isParticipant();
      }
      if (sentence.transition()) {
        transitions++;
      }
    }

    return new TranscriptMetadata(
        sentences.size(),
        counts.size(),
        List.copyOf(counts.keySet()),
        primary,
        primaryRatio,
        duration,
        duration != null,
        participantQuestion,
        questions,
        transitions);
  }

  private static Map<String, Integer> speakerCounts(List<ParsedSentence> sentences) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (ParsedSentence sentence : sentences) {
      if (sentence.hasSpeaker()) {
        counts.merge(sentence.speaker(), 1, Integer::sum);
      }
    }
    return counts;
  }

  /** Most frequent speaker; ties go to whoever spoke first. */
  private static String primarySpeaker(Map<String, Integer> counts) {
    String primary = null;
    int best = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > best) {
        primary = entry.getKey();
        best = entry.getValue();
      }
    }
    return primary;
  }
}
