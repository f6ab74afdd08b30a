package com.flamingo.ai.scripttodoc.service.grounding.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Embeds step text and transcript sentences for semantic grounding. */
@Service
@ConditionalOnProperty(
    prefix = "pipeline.grounding",
    name = "semantic-enabled",
    havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense text
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private static final String QUERY_PREFIX =
      "Represent this instruction for retrieving the transcript passages it came from: ";
  private static final String PASSAGE_PREFIX = "Represent this transcript passage for retrieval: ";

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds generated step text.
   *
   * @param query the step text
   * @return embedding vector, empty when the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed step text")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(QUERY_PREFIX + query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return response.content().vector();
  }

  /**
   * Embeds transcript passages in one batch request.
   *
   * @param passages passages to embed
   * @return one vector per passage, or an empty list when the model is unavailable
   */
  @Timed(value = "embedding.embedPassages", description = "Time to embed passage batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "embedding")
  public List<float[]> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(passages.size());
    for (String passage : passages) {
      segments.add(TextSegment.from(truncate(PASSAGE_PREFIX + passage)));
    }

    log.debug("Embedding batch of {} passages", segments.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<float[]> vectors = new ArrayList<>(segments.size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    meterRegistry.counter("embedding.requests.success", "type", "passages").increment();
    return vectors;
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String query, Throwable t) {
    log.error("Embedding failed for step text, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return new float[0];
  }

  @SuppressWarnings("unused")
  private List<float[]> embedPassagesFallback(List<String> passages, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", passages.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passages").increment();
    return List.of();
  }
}
