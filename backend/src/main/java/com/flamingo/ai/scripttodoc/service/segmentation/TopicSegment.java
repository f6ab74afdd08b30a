package com.flamingo.ai.scripttodoc.service.segmentation;

import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A contiguous run of sentences about one topic. Derived fields are computed once from the
 * sentences; merges, splits and re-indexing produce new instances.
 */
public final class TopicSegment {

  private final int segmentIndex;
  private final List<ParsedSentence> sentences;
  private final Double startTimestamp;
  private final Double endTimestamp;
  private final Map<String, Integer> speakerCounts;
  private final String primarySpeaker;
  private final boolean hasTransitionStart;
  private final boolean hasQaSection;
  private final int questionCount;
  private final double coherenceScore;
  private final boolean fallbackSplit;

  public TopicSegment(int segmentIndex, List<ParsedSentence> sentences) {
    this(segmentIndex, sentences, 0.0, false);
  }

  public TopicSegment(
      int segmentIndex,
      List<ParsedSentence> sentences,
      double coherenceScore,
      boolean fallbackSplit) {
    if (sentences == null || sentences.isEmpty()) {
      throw new IllegalArgumentException("A topic segment needs at least one sentence");
    }
    this.segmentIndex = segmentIndex;
    this.sentences = List.copyOf(sentences);
    this.coherenceScore = coherenceScore;
    this.fallbackSplit = fallbackSplit;

    Double start = null;
    Double end = null;
    Map<String, Integer> counts = new LinkedHashMap<>();
    int questions = 0;
    boolean participantQuestion = false;
    for (ParsedSentence sentence : this.sentences) {
      if (sentence.hasTimestamp()) {
        start = start == null ? sentence.timestamp() : Math.min(start, sentence.timestamp());
        end = end == null ? sentence.timestamp() : Math.max(end, sentence.timestamp());
      }
      if (sentence.hasSpeaker()) {
        counts.merge(sentence.speaker(), 1, Integer::sum);
      }
      if (sentence.question()) {
        questions++;
        participantQuestion |= sentence.isParticipant();
      }
    }
    this.startTimestamp = start;
    this.endTimestamp = end;
    this.speakerCounts = Collections.unmodifiableMap(counts);
    this.primarySpeaker = mostFrequent(counts);
    this.hasTransitionStart = this.sentences.get(0).transition();
    this.questionCount = questions;
    this.hasQaSection = participantQuestion;
  }

  public TopicSegment withIndex(int index) {
    return new TopicSegment(index, sentences, coherenceScore, fallbackSplit);
  }

  public int getSegmentIndex() {
    return segmentIndex;
  }

  public List<ParsedSentence> getSentences() {
    return sentences;
  }

  public int size() {
    return sentences.size();
  }

  public int getStartSentenceIndex() {
    return sentences.get(0).sentenceIndex();
  }

  public int getEndSentenceIndex() {
    return sentences.get(sentences.size() - 1).sentenceIndex();
  }

  public Double getStartTimestamp() {
    return startTimestamp;
  }

  public Double getEndTimestamp() {
    return endTimestamp;
  }

  public Double getDurationSeconds() {
    return startTimestamp == null ? null : endTimestamp - startTimestamp;
  }

  public Map<String, Integer> getSpeakerCounts() {
    return speakerCounts;
  }

  public String getPrimarySpeaker() {
    return primarySpeaker;
  }

  public boolean hasTransitionStart() {
    return hasTransitionStart;
  }

  public boolean hasQaSection() {
    return hasQaSection;
  }

  public int getQuestionCount() {
    return questionCount;
  }

  public double getCoherenceScore() {
    return coherenceScore;
  }

  public boolean isFallbackSplit() {
    return fallbackSplit;
  }

  /** Sentence texts joined by single spaces. */
  public String getText() {
    return sentences.stream().map(ParsedSentence::text).collect(Collectors.joining(" "));
  }

  private static String mostFrequent(Map<String, Integer> counts) {
    String best = null;
    int bestCount = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Segment ").append(segmentIndex).append(": ");
    sb.append(sentences.size()).append(" sentences");
    if (startTimestamp != null) {
      sb.append(String.format(", %.0fs-%.0fs", startTimestamp, endTimestamp));
    }
    if (primarySpeaker != null) {
      sb.append(", ").append(primarySpeaker);
    }
    if (hasQaSection) {
      sb.append(", Q&A");
    }
    if (fallbackSplit) {
      sb.append(", fallback");
    }
    sb.append(String.format(", coherence=%.2f", coherenceScore));
    return sb.toString();
  }
}
