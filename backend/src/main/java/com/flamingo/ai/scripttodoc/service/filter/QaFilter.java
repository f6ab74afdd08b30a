package com.flamingo.ai.scripttodoc.service.filter;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import com.flamingo.ai.scripttodoc.service.transcript.SpeakerRole;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drops question-and-answer segments so only procedural content reaches step generation. A
 * segment is Q&A-dense when both its question density and its question count reach the
 * configured minimums.
 */
@Service
@Slf4j
public class QaFilter {

  private final PipelineConfig.QaFiltering config;
  private final MeterRegistry meterRegistry;

  public QaFilter(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getQaFiltering();
    this.config.validate();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Analyses a single segment's question density.
   *
   * @param segment topic segment
   * @return density analysis, dense or not
   */
  public QaSection analyze(TopicSegment segment) {
    int questions = segment.getQuestionCount();
    double density = (double) questions / segment.size();
    boolean dense = density >= config.getMinQaDensity() && questions >= config.getMinQuestions();

    TreeSet<String> speakers = new TreeSet<>();
    for (ParsedSentence sentence : segment.getSentences()) {
      if (sentence.hasSpeaker()) {
        speakers.add(sentence.speaker());
      }
    }

    return new QaSection(
        segment.getSegmentIndex(),
        segment.getStartSentenceIndex(),
        segment.getEndSentenceIndex(),
        questions,
        segment.size(),
        density,
        dense,
        segment.getPrimarySpeaker(),
        List.copyOf(speakers));
  }

  /**
   * Finds the Q&A-dense segments.
   *
   * @param segments topic segments
   * @return analyses of the dense segments only
   */
  public List<QaSection> identifyQaSections(List<TopicSegment> segments) {
    List<QaSection> sections = new ArrayList<>();
    for (TopicSegment segment : segments) {
      QaSection section = analyze(segment);
      if (section.qaDense()) {
        sections.add(section);
        log.debug(
            "Q&A section detected: segment {}, {}/{} questions",
            section.segmentIndex(),
            section.questionCount(),
            section.totalSentences());
      }
    }
    return sections;
  }

  /**
   * Removes Q&A-dense segments and, when configured, segments not led by the instructor.
   *
   * @param segments topic segments
   * @return kept segments in their original order; the input itself when filtering is disabled
   */
  public List<TopicSegment> filterSegments(List<TopicSegment> segments) {
    if (!config.isEnabled()) {
      return segments;
    }

    List<TopicSegment> kept = new ArrayList<>();
    int qaRemoved = 0;
    for (TopicSegment segment : segments) {
      if (analyze(segment).qaDense()) {
        log.info("Filtering out Q&A segment {}", segment.getSegmentIndex());
        qaRemoved++;
        continue;
      }
      if (config.isKeepInstructorOnly() && !isInstructorLed(segment)) {
        log.info(
            "Filtering out non-instructor segment {} (primary speaker: {})",
            segment.getSegmentIndex(),
            segment.getPrimarySpeaker());
        continue;
      }
      kept.add(segment);
    }

    meterRegistry.counter("pipeline.segments.qa_removed").increment(qaRemoved);
    log.info(
        "Filtered segments: {} -> {} ({} Q&A sections removed)",
        segments.size(),
        kept.size(),
        qaRemoved);
    return kept;
  }

  /**
   * Whether the segment's primary speaker is the instructor. Without a role label, a speaker who
   * rarely asks questions is taken to be leading. Segments without any speaker labels count as
   * instructor-led.
   */
  boolean isInstructorLed(TopicSegment segment) {
    String primary = segment.getPrimarySpeaker();
    if (primary == null) {
      return true;
    }

    SpeakerRole role = null;
    int spoken = 0;
    int asked = 0;
    for (ParsedSentence sentence : segment.getSentences()) {
      if (!Objects.equals(sentence.speaker(), primary)) {
        continue;
      }
      spoken++;
      if (sentence.question()) {
        asked++;
      }
      if (role == null) {
        role = sentence.speakerRole();
      }
    }

    if (role != null) {
      return role == SpeakerRole.INSTRUCTOR;
    }
    return (double) asked / spoken < config.getInstructorQuestionRate();
  }

  /**
   * Summarises what filtering does to a set of segments.
   *
   * @param segments topic segments before filtering
   * @return counts and rates
   */
  public QaFilterStatistics getStatistics(List<TopicSegment> segments) {
    int qaSegments = 0;
    int kept = 0;
    int questions = 0;
    int sentences = 0;
    for (TopicSegment segment : segments) {
      boolean dense = analyze(segment).qaDense();
      if (dense) {
        qaSegments++;
      }
      if (!config.isEnabled()
          || (!dense && (!config.isKeepInstructorOnly() || isInstructorLed(segment)))) {
        kept++;
      }
      questions += segment.getQuestionCount();
      sentences += segment.size();
    }
    int removed = segments.size() - kept;
    return new QaFilterStatistics(
        segments.size(),
        qaSegments,
        kept,
        removed,
        questions,
        sentences,
        sentences > 0 ? (double) questions / sentences : 0.0,
        segments.isEmpty() ? 0.0 : (double) removed / segments.size());
  }
}
