package com.flamingo.ai.scripttodoc.service.grounding.similarity;

import java.util.List;

/**
 * Scores how closely a passage paraphrases a query. Implementations may hold per-document caches,
 * which is why grounding asks for a session-scoped instance before scoring a transcript.
 */
public interface SimilarityScorer {

  /**
   * Similarity between a query and a passage.
   *
   * @param query text of the generated step
   * @param passage candidate evidence
   * @return similarity in [0, 1]; 0 when it cannot be computed
   */
  double score(String query, String passage);

  /** Whether scores reflect meaning rather than always being zero. */
  boolean isSemantic();

  /**
   * Returns a scorer whose caches live only as long as one document's grounding session.
   *
   * @param passages passages that will be scored repeatedly, may be encoded up front
   * @return a session-scoped scorer
   */
  default SimilarityScorer forSession(List<String> passages) {
    return this;
  }
}
