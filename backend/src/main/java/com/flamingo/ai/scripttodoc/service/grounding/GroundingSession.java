package com.flamingo.ai.scripttodoc.service.grounding;

import com.flamingo.ai.scripttodoc.service.grounding.similarity.SimilarityScorer;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-document grounding state: the sentence catalog, cached technical scores, how often each
 * sentence has been cited, and the evidence recorded for each step.
 *
 * <p>Not thread-safe. Open one session per transcript being processed.
 */
public class GroundingSession {

  private final List<ParsedSentence> catalog;
  private final double[] technicalScores;
  private final SimilarityScorer similarityScorer;
  private final Map<Integer, Integer> citationCounts = new HashMap<>();
  private final TreeMap<Integer, StepSourceData> stepSources = new TreeMap<>();

  GroundingSession(List<ParsedSentence> catalog, SimilarityScorer similarityScorer) {
    this.catalog = List.copyOf(catalog);
    this.similarityScorer = similarityScorer;
    this.technicalScores = new double[this.catalog.size()];
    for (int i = 0; i < this.catalog.size(); i++) {
      technicalScores[i] = TechnicalScorer.score(this.catalog.get(i).text());
    }
  }

  public List<ParsedSentence> getCatalog() {
    return catalog;
  }

  public int size() {
    return catalog.size();
  }

  /** Technical score of the sentence at a catalog position. */
  public double technicalScore(int position) {
    return technicalScores[position];
  }

  /** Number of steps that have already cited the sentence. */
  public int citationCount(int sentenceIndex) {
    return citationCounts.getOrDefault(sentenceIndex, 0);
  }

  void recordCitation(int sentenceIndex) {
    citationCounts.merge(sentenceIndex, 1, Integer::sum);
  }

  SimilarityScorer similarityScorer() {
    return similarityScorer;
  }

  void record(StepSourceData data) {
    stepSources.put(data.getStepIndex(), data);
  }

  public Optional<StepSourceData> stepSources(int stepIndex) {
    return Optional.ofNullable(stepSources.get(stepIndex));
  }

  /** Evidence for every step built so far, ordered by step index. */
  public List<StepSourceData> allStepSources() {
    return new ArrayList<>(stepSources.values());
  }
}
