package com.flamingo.ai.scripttodoc.config;

import com.flamingo.ai.scripttodoc.service.grounding.similarity.EmbeddingService;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.EmbeddingSimilarityScorer;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.LexicalSimilarityScorer;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the similarity scorer grounding uses for its semantic signal. */
@Configuration
@Slf4j
public class SimilarityConfig {

  /**
   * Embedding-based scorer when semantic grounding is enabled, lexical-only otherwise.
   *
   * @param embeddingService present only when semantic grounding is enabled
   * @param pipelineConfig pipeline settings
   * @return the scorer for source matching
   */
  @Bean
  public SimilarityScorer similarityScorer(
      ObjectProvider<EmbeddingService> embeddingService, PipelineConfig pipelineConfig) {
    EmbeddingService service = embeddingService.getIfAvailable();
    if (service != null) {
      log.info("Semantic grounding enabled, using embedding similarity");
      return new EmbeddingSimilarityScorer(service);
    }
    if (pipelineConfig.getGrounding().isSemanticEnabled()) {
      log.warn("Semantic grounding requested but no embedding service available, using lexical");
    } else {
      log.info("Semantic grounding disabled, using lexical similarity");
    }
    return new LexicalSimilarityScorer();
  }
}
