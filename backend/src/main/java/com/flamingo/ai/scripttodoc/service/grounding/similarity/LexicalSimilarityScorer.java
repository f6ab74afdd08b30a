package com.flamingo.ai.scripttodoc.service.grounding.similarity;

/** Scorer used when no embedding model is configured; grounding then relies on lexical signals. */
public class LexicalSimilarityScorer implements SimilarityScorer {

  @Override
  public double score(String query, String passage) {
    return 0.0;
  }

  @Override
  public boolean isSemantic() {
    return false;
  }
}
