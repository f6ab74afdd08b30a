package com.flamingo.ai.scripttodoc.service.grounding.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Cosine similarity of embeddings. Each grounding session gets its own instance so cached
 * vectors are released with the document. Any embedding failure scores 0 and grounding carries on
 * with its lexical signals.
 */
@Slf4j
public class EmbeddingSimilarityScorer implements SimilarityScorer {

  private final EmbeddingService embeddingService;
  private final Map<String, float[]> queryCache = new HashMap<>();
  private final Map<String, float[]> passageCache = new HashMap<>();

  public EmbeddingSimilarityScorer(EmbeddingService embeddingService) {
    this.embeddingService = embeddingService;
  }

  @Override
  public double score(String query, String passage) {
    try {
      float[] queryVector = queryCache.computeIfAbsent(query, embeddingService::embedQuery);
      float[] passageVector = passageVector(passage);
      if (queryVector.length == 0 || queryVector.length != passageVector.length) {
        return 0.0;
      }
      double cosine =
          CosineSimilarity.between(Embedding.from(queryVector), Embedding.from(passageVector));
      return Math.max(0.0, Math.min(1.0, cosine));
    } catch (RuntimeException e) {
      log.warn("Semantic similarity failed, scoring lexically: {}", e.getMessage());
      return 0.0;
    }
  }

  @Override
  public boolean isSemantic() {
    return true;
  }

  /** Starts a fresh cache and encodes the passages in one batch. */
  @Override
  public SimilarityScorer forSession(List<String> passages) {
    EmbeddingSimilarityScorer session = new EmbeddingSimilarityScorer(embeddingService);
    session.preload(passages);
    return session;
  }

  int cachedPassages() {
    return passageCache.size();
  }

  private void preload(List<String> passages) {
    List<String> distinct = passages.stream().distinct().toList();
    try {
      List<float[]> vectors = embeddingService.embedPassages(distinct);
      if (vectors.size() != distinct.size()) {
        log.warn(
            "Batch embedding returned {} vectors for {} passages, embedding on demand",
            vectors.size(),
            distinct.size());
        return;
      }
      for (int i = 0; i < distinct.size(); i++) {
        passageCache.put(distinct.get(i), vectors.get(i));
      }
      log.debug("Preloaded {} passage embeddings", distinct.size());
    } catch (RuntimeException e) {
      log.warn("Batch embedding failed, embedding on demand: {}", e.getMessage());
    }
  }

  private float[] passageVector(String passage) {
    float[] cached = passageCache.get(passage);
    if (cached != null) {
      return cached;
    }
    List<float[]> vectors = embeddingService.embedPassages(List.of(passage));
    float[] vector = vectors.isEmpty() ? new float[0] : vectors.get(0);
    passageCache.put(passage, vector);
    return vector;
  }
}
