package com.flamingo.ai.scripttodoc.service.pipeline;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.exception.NoSegmentsRemainingException;
import com.flamingo.ai.scripttodoc.exception.NoValidStepsException;
import com.flamingo.ai.scripttodoc.service.filter.QaFilter;
import com.flamingo.ai.scripttodoc.service.filter.QaFilterStatistics;
import com.flamingo.ai.scripttodoc.service.grounding.GroundingSession;
import com.flamingo.ai.scripttodoc.service.grounding.SourceReferenceManager;
import com.flamingo.ai.scripttodoc.service.grounding.StepSourceData;
import com.flamingo.ai.scripttodoc.service.ranking.RankingReport;
import com.flamingo.ai.scripttodoc.service.ranking.TopicRanker;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegmenter;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import com.flamingo.ai.scripttodoc.service.step.StepGenerationContext;
import com.flamingo.ai.scripttodoc.service.step.StepGenerator;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedTranscript;
import com.flamingo.ai.scripttodoc.service.transcript.TranscriptCleaner;
import com.flamingo.ai.scripttodoc.service.transcript.TranscriptParser;
import com.flamingo.ai.scripttodoc.service.validation.ActionValidationResult;
import com.flamingo.ai.scripttodoc.service.validation.ActionValidator;
import com.flamingo.ai.scripttodoc.service.validation.StepValidator;
import com.flamingo.ai.scripttodoc.service.validation.ValidationResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates transcript processing: parse, clean, segment, filter, rank, generate, ground and
 * validate. Action-quality issues are attached to a step's evidence as flags and do not reject it.
 *
 * <p>Step generation is delegated to the caller's {@link StepGenerator}, so this service has no
 * knowledge of any specific language model. A generator failure for one segment skips that
 * segment only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptProcessingPipeline {

  private final TranscriptParser transcriptParser;
  private final TranscriptCleaner transcriptCleaner;
  private final TopicSegmenter topicSegmenter;
  private final QaFilter qaFilter;
  private final TopicRanker topicRanker;
  private final SourceReferenceManager sourceReferenceManager;
  private final ActionValidator actionValidator;
  private final StepValidator stepValidator;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Turns a raw transcript into validated, grounded steps.
   *
   * @param rawTranscript transcript text
   * @param stepGenerator produces one candidate step per segment
   * @param options tone, audience and optional evidence
   * @return accepted steps with their evidence and diagnostics
   * @throws NoSegmentsRemainingException when filtering leaves nothing to generate from
   * @throws NoValidStepsException when no generated step passes validation
   */
  @Timed(value = "transcript.process", description = "Time to process a transcript")
  public PipelineResult process(
      String rawTranscript, StepGenerator stepGenerator, ProcessingOptions options) {
    ProcessingOptions effective = options == null ? ProcessingOptions.defaults() : options;

    // --- 1. Parse and clean ---
    ParsedTranscript parsed = transcriptParser.parse(rawTranscript);
    List<ParsedSentence> sentences = transcriptCleaner.cleanSentences(parsed.sentences());

    // --- 2. Segment ---
    List<TopicSegment> segments = topicSegmenter.segment(sentences);
    int segmentCount = segments.size();

    // --- 3. Drop Q&A and low-value segments ---
    QaFilterStatistics qaStatistics = qaFilter.getStatistics(segments);
    segments = qaFilter.filterSegments(segments);
    RankingReport rankingReport = topicRanker.getRankingReport(segments);
    segments = topicRanker.filterLowImportance(segments);

    if (segments.isEmpty()) {
      meterRegistry.counter("transcript.process.failed", "reason", "no_segments").increment();
      throw new NoSegmentsRemainingException(segmentCount);
    }
    log.info("{} of {} segments selected for step generation", segments.size(), segmentCount);

    // --- 4. Generate one candidate step per segment ---
    List<Candidate> candidates = generateSteps(segments, stepGenerator, effective);
    int failedGenerations = segments.size() - candidates.size();

    // --- 5. Ground, validate and accept ---
    GroundingSession session = sourceReferenceManager.openSession(sentences);
    PipelineConfig.Acceptance acceptance = pipelineConfig.getAcceptance();
    List<AcceptedStep> accepted = new ArrayList<>();
    List<ValidationResult> validations = new ArrayList<>();
    List<ActionValidationResult> actionValidations = new ArrayList<>();

    for (int stepIndex = 0; stepIndex < candidates.size(); stepIndex++) {
      Candidate candidate = candidates.get(stepIndex);
      StepSourceData sources =
          sourceReferenceManager.buildStepSources(
              session,
              stepIndex,
              candidate.step(),
              effective.screenshots(),
              effective.knowledgeSources());

      ActionValidationResult actionValidation = actionValidator.validate(candidate.step());
      actionValidations.add(actionValidation);
      logActionIssues(stepIndex, actionValidation);

      ValidationResult validation =
          stepValidator.validate(candidate.step(), stepIndex, sources.getOverallConfidence());
      validations.add(validation);
      logIssues(stepIndex, validation);

      double evidenceConfidence = sources.getOverallConfidence();
      double blended =
          sourceReferenceManager.enhanceConfidenceWithValidation(
              evidenceConfidence, validation.qualityScore());
      sources.setOverallConfidence(blended);
      sourceReferenceManager.validateStep(sources);
      sources.addValidationFlags(actionValidation.issues());
      log.debug(
          "Step {} confidence enhanced: {} -> {} ({})",
          stepIndex,
          String.format("%.2f", evidenceConfidence),
          String.format("%.2f", blended),
          sources.getConfidenceLabel());

      boolean grounded = isGroundedEnough(sources, acceptance);
      if (grounded && validation.valid()) {
        accepted.add(
            new AcceptedStep(
                candidate.segmentIndex(), candidate.step(), sources, validation, actionValidation));
      } else if (!grounded) {
        log.warn(
            "Step {} rejected: confidence {} with {} sources",
            stepIndex,
            String.format("%.2f", blended),
            sources.getSources().size());
      } else {
        log.warn("Step {} rejected due to step validation failures", stepIndex);
      }
    }

    meterRegistry.counter("pipeline.steps.accepted").increment(accepted.size());
    meterRegistry.counter("pipeline.steps.rejected").increment(candidates.size() - accepted.size());
    log.info("Validated: {}/{} steps passed", accepted.size(), candidates.size());

    if (accepted.isEmpty()) {
      meterRegistry.counter("transcript.process.failed", "reason", "no_valid_steps").increment();
      throw new NoValidStepsException(candidates.size());
    }

    return new PipelineResult(
        parsed.metadata(),
        segments,
        accepted,
        candidates.size() - accepted.size(),
        failedGenerations,
        qaStatistics,
        rankingReport,
        stepValidator.getValidationReport(validations),
        actionValidator.summarize(actionValidations));
  }

  private List<Candidate> generateSteps(
      List<TopicSegment> segments, StepGenerator stepGenerator, ProcessingOptions options) {
    PipelineConfig.Acceptance acceptance = pipelineConfig.getAcceptance();
    String tone = options.tone() != null ? options.tone() : acceptance.getDefaultTone();
    String audience =
        options.audience() != null ? options.audience() : acceptance.getDefaultAudience();

    List<Candidate> candidates = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      TopicSegment segment = segments.get(i);
      StepGenerationContext context =
          new StepGenerationContext(i, segments.size(), tone, audience);
      try {
        GeneratedStep step = stepGenerator.generate(segment.getText(), context);
        if (step == null) {
          log.warn("Step generator returned nothing for segment {}", segment.getSegmentIndex());
          meterRegistry.counter("pipeline.steps.generation_failed").increment();
          continue;
        }
        candidates.add(new Candidate(segment.getSegmentIndex(), step));
      } catch (RuntimeException e) {
        log.warn(
            "Step generation failed for segment {}: {}", segment.getSegmentIndex(), e.getMessage());
        meterRegistry.counter("pipeline.steps.generation_failed").increment();
      }
    }
    log.info("Generated {} steps from {} segments", candidates.size(), segments.size());
    return candidates;
  }

  /** Accepts on the configured floor, or a lower one when at least one source was found. */
  private boolean isGroundedEnough(StepSourceData sources, PipelineConfig.Acceptance acceptance) {
    double confidence = sources.getOverallConfidence();
    if (confidence >= acceptance.getMinConfidence()) {
      return true;
    }
    return !sources.getSources().isEmpty()
        && confidence >= acceptance.getMinConfidenceWithSources();
  }

  private void logIssues(int stepIndex, ValidationResult validation) {
    if (!validation.errors().isEmpty()) {
      log.warn(
          "Step {} validation errors: {}",
          stepIndex,
          validation.errors().stream().map(e -> e.message()).collect(Collectors.joining(", ")));
    }
    if (!validation.warnings().isEmpty()) {
      log.info(
          "Step {} validation warnings: {}",
          stepIndex,
          validation.warnings().stream().map(w -> w.message()).collect(Collectors.joining(", ")));
    }
  }

  private void logActionIssues(int stepIndex, ActionValidationResult result) {
    if (!result.issues().isEmpty()) {
      log.warn("Step {} action issues: {}", stepIndex, String.join(", ", result.issues()));
    }
    if (!result.warnings().isEmpty()) {
      log.info("Step {} action warnings: {}", stepIndex, String.join(", ", result.warnings()));
    }
  }

  private record Candidate(int segmentIndex, GeneratedStep step) {}
}
