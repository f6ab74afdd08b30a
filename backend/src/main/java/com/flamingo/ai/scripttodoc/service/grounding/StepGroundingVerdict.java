package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.List;

/**
 * Outcome of checking a step's evidence.
 *
 * @param valid whether the step is grounded well enough to publish
 * @param warnings reader-facing notes about weak evidence
 */
public record StepGroundingVerdict(boolean valid, List<String> warnings) {}
