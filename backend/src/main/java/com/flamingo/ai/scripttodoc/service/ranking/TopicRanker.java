package com.flamingo.ai.scripttodoc.service.ranking;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores topic segments by how procedural they are and drops the ones unlikely to yield a
 * training step.
 */
@Service
@Slf4j
public class TopicRanker {

  static final List<String> ACTION_VERBS =
      List.of(
          // Navigation
          "navigate", "go", "open", "access", "visit", "browse",
          // Interaction
          "click", "select", "choose", "press", "tap", "hit",
          // Input
          "type", "enter", "input", "fill", "write", "paste",
          // Configuration
          "configure", "set", "enable", "disable", "change", "modify", "adjust", "update", "edit",
          // Creation
          "create", "add", "insert", "make", "build", "generate",
          // Management
          "delete", "remove", "clear", "reset", "restore", "save",
          // Verification
          "verify", "check", "confirm", "validate", "review", "test");

  static final List<String> SEQUENCE_INDICATORS =
      List.of(
          "first", "second", "third", "next", "then", "after", "finally", "step", "now", "let's",
          "we'll", "going to");

  private static final double HIGH_IMPORTANCE = 0.7;
  private static final double MEDIUM_IMPORTANCE = 0.3;

  private static final List<Pattern> ACTION_PATTERNS = wordPatterns(ACTION_VERBS);
  private static final List<Pattern> SEQUENCE_PATTERNS = wordPatterns(SEQUENCE_INDICATORS);

  private final PipelineConfig.Ranking config;
  private final MeterRegistry meterRegistry;

  public TopicRanker(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getRanking();
    this.config.validate();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Scores every segment.
   *
   * @param segments topic segments
   * @return one score per segment, in input order
   */
  public List<TopicScore> scoreSegments(List<TopicSegment> segments) {
    List<TopicScore> scores = new ArrayList<>(segments.size());
    for (TopicSegment segment : segments) {
      scores.add(score(segment));
    }
    return scores;
  }

  /**
   * Scores one segment.
   *
   * @param segment topic segment
   * @return importance and its components
   */
  public TopicScore score(TopicSegment segment) {
    double procedural = proceduralScore(segment);
    double density = actionDensity(segment);
    double coherence = segment.getCoherenceScore();

    double weightedProcedural = procedural * config.getProceduralWeight();
    double weightedDensity = density * config.getActionDensityWeight();
    double weightedCoherence = coherence * config.getCoherenceWeight();
    double importance =
        Math.min(1.0, weightedProcedural + weightedDensity + weightedCoherence);

    log.debug(
        "Segment {}: importance={} (procedural={}, action_density={}, coherence={})",
        segment.getSegmentIndex(),
        String.format("%.2f", importance),
        String.format("%.2f", procedural),
        String.format("%.2f", density),
        String.format("%.2f", coherence));

    return new TopicScore(
        segment.getSegmentIndex(),
        importance,
        procedural,
        density,
        coherence,
        weightedProcedural,
        weightedDensity,
        weightedCoherence);
  }

  /**
   * Orders segments by importance, highest first. Equal scores keep their input order.
   *
   * @param segments topic segments
   * @return a new list sorted by descending importance
   */
  public List<TopicSegment> rankByImportance(List<TopicSegment> segments) {
    List<Scored> scored = scoreAll(segments);
    scored.sort(Comparator.comparingDouble((Scored s) -> s.score().importanceScore()).reversed());
    List<TopicSegment> ranked = new ArrayList<>(scored.size());
    for (Scored entry : scored) {
      ranked.add(entry.segment());
    }
    return ranked;
  }

  /** Filters with the configured minimum importance. */
  public List<TopicSegment> filterLowImportance(List<TopicSegment> segments) {
    return filterLowImportance(segments, config.getMinImportance());
  }

  /**
   * Drops segments below the importance threshold, then keeps the top N if configured.
   *
   * @param segments topic segments
   * @param threshold minimum importance to keep
   * @return kept segments in transcript order
   */
  public List<TopicSegment> filterLowImportance(List<TopicSegment> segments, double threshold) {
    if (!config.isEnabled()) {
      return segments;
    }

    List<Scored> kept = new ArrayList<>();
    for (Scored entry : scoreAll(segments)) {
      if (entry.score().importanceScore() >= threshold) {
        kept.add(entry);
      } else {
        log.info(
            "Filtering low-importance segment {}: score={} < {}",
            entry.segment().getSegmentIndex(),
            String.format("%.2f", entry.score().importanceScore()),
            String.format("%.2f", threshold));
      }
    }

    Integer topN = config.getKeepTopN();
    if (topN != null && kept.size() > topN) {
      kept.sort(Comparator.comparingDouble((Scored s) -> s.score().importanceScore()).reversed());
      kept = new ArrayList<>(kept.subList(0, topN));
      kept.sort(Comparator.comparingInt(s -> s.segment().getSegmentIndex()));
      log.info("Keeping top {} segments", topN);
    }

    List<TopicSegment> result = new ArrayList<>(kept.size());
    for (Scored entry : kept) {
      result.add(entry.segment());
    }
    meterRegistry.counter("pipeline.segments.low_importance_removed")
        .increment(segments.size() - result.size());
    log.info("Importance filter: {} -> {} segments", segments.size(), result.size());
    return result;
  }

  /**
   * Builds a report of scores and their distribution.
   *
   * @param segments topic segments
   * @return ranking report
   */
  public RankingReport getRankingReport(List<TopicSegment> segments) {
    List<TopicScore> scores = scoreSegments(segments);
    if (scores.isEmpty()) {
      return new RankingReport(0, List.of(), null);
    }

    List<TopicScore> rounded = new ArrayList<>(scores.size());
    double sum = 0.0;
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    int high = 0;
    int medium = 0;
    int low = 0;
    for (TopicScore score : scores) {
      double importance = score.importanceScore();
      sum += importance;
      max = Math.max(max, importance);
      min = Math.min(min, importance);
      if (importance >= HIGH_IMPORTANCE) {
        high++;
      } else if (importance >= MEDIUM_IMPORTANCE) {
        medium++;
      } else {
        low++;
      }
      rounded.add(
          new TopicScore(
              score.segmentIndex(),
              round3(importance),
              round3(score.proceduralScore()),
              round3(score.actionDensity()),
              round3(score.coherenceScore()),
              round3(score.weightedProcedural()),
              round3(score.weightedActionDensity()),
              round3(score.weightedCoherence())));
    }

    double mean = sum / scores.size();
    double variance = 0.0;
    for (TopicScore score : scores) {
      variance += Math.pow(score.importanceScore() - mean, 2);
    }
    double std = Math.sqrt(variance / scores.size());

    return new RankingReport(
        scores.size(),
        rounded,
        new RankingReport.Statistics(mean, max, min, std, high, medium, low));
  }

  double proceduralScore(TopicSegment segment) {
    String text = segment.getText().toLowerCase(Locale.ROOT);
    if (text.isBlank()) {
      return 0.0;
    }
    int sentences = segment.size();
    int actions = countDistinct(ACTION_PATTERNS, text);
    int sequences = countDistinct(SEQUENCE_PATTERNS, text);

    int imperative = 0;
    for (ParsedSentence sentence : segment.getSentences()) {
      if (isImperative(sentence.text())) {
        imperative++;
      }
    }

    double actionScore = Math.min(1.0, actions / (sentences * 2.0));
    double imperativeScore = (double) imperative / sentences;
    double sequenceScore = Math.min(1.0, sequences / Math.max(1.0, sentences / 3.0));
    return Math.min(1.0, actionScore * 0.5 + imperativeScore * 0.3 + sequenceScore * 0.2);
  }

  double actionDensity(TopicSegment segment) {
    String text = segment.getText().toLowerCase(Locale.ROOT);
    double perSentence = (double) countDistinct(ACTION_PATTERNS, text) / segment.size();
    return Math.min(1.0, perSentence / 3.0);
  }

  /** A sentence is imperative when one of its first two words is an action verb. */
  static boolean isImperative(String sentence) {
    String[] words = sentence.toLowerCase(Locale.ROOT).strip().split("\\s+");
    for (int i = 0; i < Math.min(2, words.length); i++) {
      String word = words[i].replaceAll("^\\p{Punct}+|\\p{Punct}+$", "");
      if (ACTION_VERBS.contains(word)) {
        return true;
      }
    }
    return false;
  }

  private List<Scored> scoreAll(List<TopicSegment> segments) {
    List<Scored> scored = new ArrayList<>(segments.size());
    for (TopicSegment segment : segments) {
      scored.add(new Scored(segment, score(segment)));
    }
    return scored;
  }

  private static int countDistinct(List<Pattern> patterns, String text) {
    int count = 0;
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        count++;
      }
    }
    return count;
  }

  private static List<Pattern> wordPatterns(List<String> words) {
    List<Pattern> patterns = new ArrayList<>(words.size());
    for (String word : words) {
      patterns.add(Pattern.compile("(?<![\\w'])" + Pattern.quote(word) + "(?![\\w'])"));
    }
    return List.copyOf(patterns);
  }

  private static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }

  private record Scored(TopicSegment segment, TopicScore score) {}
}
