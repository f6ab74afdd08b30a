package com.flamingo.ai.scripttodoc.service.pipeline;

import com.flamingo.ai.scripttodoc.service.grounding.KnowledgeSource;
import com.flamingo.ai.scripttodoc.service.grounding.ScreenshotEvidence;
import java.util.List;

/**
 * Per-request options for processing one transcript.
 *
 * @param tone writing tone passed to the step generator, null for the configured default
 * @param audience intended readers, null for the configured default
 * @param knowledgeSources reference material used as extra evidence
 * @param screenshots screenshots used as visual evidence
 */
public record ProcessingOptions(
    String tone,
    String audience,
    List<KnowledgeSource> knowledgeSources,
    List<ScreenshotEvidence> screenshots) {

  public ProcessingOptions {
    knowledgeSources = knowledgeSources == null ? List.of() : List.copyOf(knowledgeSources);
    screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
  }

  public static ProcessingOptions defaults() {
    return new ProcessingOptions(null, null, List.of(), List.of());
  }
}
