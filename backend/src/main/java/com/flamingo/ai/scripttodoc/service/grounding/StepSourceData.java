package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Evidence gathered for one generated step. Confidence starts as the evidence score and may be
 * blended with the structural quality score once the step has been validated.
 */
@Getter
public class StepSourceData {

  private final int stepIndex;
  private final String stepContent;
  private final List<SourceReference> sources;

  @Getter(AccessLevel.NONE)
  private final boolean transcriptSupport;

  @Getter(AccessLevel.NONE)
  private final boolean visualSupport;

  @Setter private double overallConfidence;
  private List<String> validationFlags = new ArrayList<>();

  public StepSourceData(int stepIndex, String stepContent, List<SourceReference> sources) {
    this.stepIndex = stepIndex;
    this.stepContent = stepContent;
    this.sources = List.copyOf(sources);
    this.transcriptSupport =
        this.sources.stream().anyMatch(s -> s.type() == SourceType.TRANSCRIPT);
    this.visualSupport = this.sources.stream().anyMatch(s -> s.type() == SourceType.VISUAL);
  }

  public boolean hasTranscriptSupport() {
    return transcriptSupport;
  }

  public boolean hasVisualSupport() {
    return visualSupport;
  }

  public void setValidationFlags(List<String> flags) {
    this.validationFlags = new ArrayList<>(flags);
  }

  public void addValidationFlags(List<String> flags) {
    this.validationFlags.addAll(flags);
  }

  public List<SourceReference> sourcesOfType(SourceType type) {
    return sources.stream().filter(s -> s.type() == type).toList();
  }

  public ConfidenceLevel getConfidenceLevel() {
    return ConfidenceLevel.fromScore(overallConfidence);
  }

  public String getConfidenceLabel() {
    return ConfidenceLevel.label(overallConfidence);
  }
}
