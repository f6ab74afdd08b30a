package com.flamingo.ai.scripttodoc.service.pipeline;

import com.flamingo.ai.scripttodoc.service.grounding.StepSourceData;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import com.flamingo.ai.scripttodoc.service.validation.ActionValidationResult;
import com.flamingo.ai.scripttodoc.service.validation.ValidationResult;

/**
 * A generated step that passed grounding and structural validation.
 *
 * @param segmentIndex index of the topic segment the step was generated from
 * @param step the generated step
 * @param sources evidence, with confidence blended with the quality score
 * @param validation structural validation outcome
 * @param actionValidation advisory action-quality outcome
 */
public record AcceptedStep(
    int segmentIndex,
    GeneratedStep step,
    StepSourceData sources,
    ValidationResult validation,
    ActionValidationResult actionValidation) {

  public double confidence() {
    return sources.getOverallConfidence();
  }
}
