package com.flamingo.ai.scripttodoc.service.segmentation;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import com.flamingo.ai.scripttodoc.service.transcript.SpeakerRole;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Partitions parsed sentences into topic segments.
 *
 * <p>Every consecutive pair of sentences gets a boundary score from four weighted signals:
 *
 * <ul>
 *   <li>timestamp gap, saturating at the long-pause threshold
 *   <li>speaker change, strongest when the instructor takes over from a participant
 *   <li>transition phrase on the later sentence
 *   <li>keyword dissimilarity (off by default)
 * </ul>
 *
 * Small segments are merged backwards, and the result is split further when it has fewer segments
 * than the configured minimum.
 */
@Service
@Slf4j
public class TopicSegmenter {

  private static final double HANDOFF_SCORE = 1.0;
  private static final double TRANSITION_HANDOFF_SCORE = 0.8;
  private static final double PLAIN_HANDOFF_SCORE = 0.3;
  private static final double NEUTRAL_SEMANTIC_SCORE = 0.5;

  private final PipelineConfig.Segmentation config;
  private final MeterRegistry meterRegistry;

  public TopicSegmenter(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getSegmentation();
    this.config.validate();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Segments sentences into topics.
   *
   * @param sentences parsed sentences in transcript order
   * @return segments covering every sentence exactly once, indexed from 0
   */
  public List<TopicSegment> segment(List<ParsedSentence> sentences) {
    if (sentences == null || sentences.isEmpty()) {
      log.warn("No sentences to segment");
      return List.of();
    }

    List<Integer> boundaries = identifyBoundaries(sentences);
    List<TopicSegment> segments = createSegments(sentences, boundaries);
    log.debug("Created {} initial segments from {} boundaries", segments.size(), boundaries.size());

    if (config.isMergeSmallSegments()) {
      segments = mergeSmallSegments(segments);
    }

    if (segments.size() < config.getMinTotalSegments()) {
      log.warn(
          "Only {} segments detected (min: {}), splitting largest segments",
          segments.size(),
          config.getMinTotalSegments());
      segments =
          SegmentSplitter.ensureMinimum(
              segments, config.getMinTotalSegments(), config.getMinSegmentSentences());
    }

    List<TopicSegment> result = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      TopicSegment segment = segments.get(i);
      result.add(
          new TopicSegment(
              i, segment.getSentences(), coherence(segment), segment.isFallbackSplit()));
    }

    meterRegistry.counter("pipeline.segments.created").increment(result.size());
    log.info("Segmented {} sentences into {} topics", sentences.size(), result.size());
    result.forEach(segment -> log.debug("  {}", segment));
    return result;
  }

  /**
   * Boundary score between two consecutive sentences, capped at 1.0.
   *
   * @param previous the earlier sentence
   * @param current the later sentence
   * @return weighted boundary score in [0, 1]
   */
  public double boundaryScore(ParsedSentence previous, ParsedSentence current) {
    double score =
        config.getTimestampWeight() * timestampGapScore(previous, current)
            + config.getSpeakerWeight() * speakerTransitionScore(previous, current)
            + config.getTransitionWeight() * (current.transition() ? 1.0 : 0.0);
    if (config.isUseSemanticSimilarity()) {
      score += config.getSemanticWeight() * semanticScore(previous, current);
    }
    return Math.min(score, 1.0);
  }

  double timestampGapScore(ParsedSentence previous, ParsedSentence current) {
    if (!previous.hasTimestamp() || !current.hasTimestamp()) {
      return 0.0;
    }
    if (current.followsLongPause()) {
      return 1.0;
    }
    double gap = current.timestamp() - previous.timestamp();
    return Math.max(0.0, Math.min(gap / config.getGapThresholdSeconds(), 1.0));
  }

  double speakerTransitionScore(ParsedSentence previous, ParsedSentence current) {
    if (!previous.hasSpeaker() || !current.hasSpeaker() || !current.speakerChanged()) {
      return 0.0;
    }
    if (previous.speakerRole() == SpeakerRole.PARTICIPANT
        && current.speakerRole() == SpeakerRole.INSTRUCTOR) {
      return HANDOFF_SCORE;
    }
    return current.transition() ? TRANSITION_HANDOFF_SCORE : PLAIN_HANDOFF_SCORE;
  }

  double semanticScore(ParsedSentence previous, ParsedSentence current) {
    Set<String> before = ContentWords.of(previous.text());
    Set<String> after = ContentWords.of(current.text());
    if (before.isEmpty() || after.isEmpty()) {
      return NEUTRAL_SEMANTIC_SCORE;
    }
    return 1.0 - ContentWords.jaccard(before, after);
  }

  boolean isBoundary(double score, ParsedSentence current) {
    if (score > config.getBoundaryThreshold()) {
      return true;
    }
    if (current.followsLongPause() && current.hasTimestamp()) {
      return true;
    }
    return current.transition() && score >= config.getTransitionBoundaryThreshold();
  }

  private List<Integer> identifyBoundaries(List<ParsedSentence> sentences) {
    List<Integer> boundaries = new ArrayList<>();
    boundaries.add(0);
    for (int i = 1; i < sentences.size(); i++) {
      ParsedSentence current = sentences.get(i);
      double score = boundaryScore(sentences.get(i - 1), current);
      if (isBoundary(score, current)) {
        boundaries.add(i);
        log.debug("Boundary at sentence {}: score={}", i, String.format("%.2f", score));
      }
    }
    return boundaries;
  }

  private List<TopicSegment> createSegments(
      List<ParsedSentence> sentences, List<Integer> boundaries) {
    List<TopicSegment> segments = new ArrayList<>(boundaries.size());
    for (int i = 0; i < boundaries.size(); i++) {
      int from = boundaries.get(i);
      int to = i < boundaries.size() - 1 ? boundaries.get(i + 1) : sentences.size();
      segments.add(new TopicSegment(i, sentences.subList(from, to)));
    }
    return segments;
  }

  /** Folds every undersized segment after the first into its predecessor. */
  List<TopicSegment> mergeSmallSegments(List<TopicSegment> segments) {
    if (segments.size() <= 1) {
      return segments;
    }
    List<TopicSegment> merged = new ArrayList<>();
    for (TopicSegment current : segments) {
      if (merged.isEmpty() || current.size() >= config.getMinSegmentSentences()) {
        merged.add(current);
        continue;
      }
      TopicSegment previous = merged.remove(merged.size() - 1);
      List<ParsedSentence> combined = new ArrayList<>(previous.getSentences());
      combined.addAll(current.getSentences());
      merged.add(new TopicSegment(previous.getSegmentIndex(), combined));
      log.debug(
          "Merged small segment {} ({} sentences) into segment {}",
          current.getSegmentIndex(),
          current.size(),
          previous.getSegmentIndex());
    }
    return SegmentSplitter.reindex(merged);
  }

  /** Mean pairwise keyword overlap between the segment's sentences. */
  double coherence(TopicSegment segment) {
    if (segment.size() < 2) {
      return 1.0;
    }
    List<Set<String>> keywords = new ArrayList<>(segment.size());
    for (ParsedSentence sentence : segment.getSentences()) {
      keywords.add(ContentWords.of(sentence.text()));
    }
    double total = 0.0;
    int pairs = 0;
    for (int i = 0; i < keywords.size(); i++) {
      for (int j = i + 1; j < keywords.size(); j++) {
        if (keywords.get(i).isEmpty() || keywords.get(j).isEmpty()) {
          continue;
        }
        total += ContentWords.jaccard(keywords.get(i), keywords.get(j));
        pairs++;
      }
    }
    return pairs == 0 ? NEUTRAL_SEMANTIC_SCORE : total / pairs;
  }
}
