package com.flamingo.ai.scripttodoc.service.pipeline;

import com.flamingo.ai.scripttodoc.service.filter.QaFilterStatistics;
import com.flamingo.ai.scripttodoc.service.ranking.RankingReport;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.transcript.TranscriptMetadata;
import com.flamingo.ai.scripttodoc.service.validation.ActionValidationSummary;
import com.flamingo.ai.scripttodoc.service.validation.ValidationReport;
import java.util.List;

/**
 * Everything produced for one transcript.
 *
 * @param metadata transcript-wide summary from parsing
 * @param segments segments that steps were generated from, in transcript order
 * @param steps accepted steps, in segment order
 * @param rejectedSteps generated steps that failed validation
 * @param failedGenerations segments the step generator failed on
 * @param qaStatistics Q&A filtering statistics
 * @param rankingReport importance scores of the segments that survived Q&A filtering
 * @param validationReport structural validation summary over all generated steps
 * @param actionSummary action-quality totals over all generated steps
 */
public record PipelineResult(
    TranscriptMetadata metadata,
    List<TopicSegment> segments,
    List<AcceptedStep> steps,
    int rejectedSteps,
    int failedGenerations,
    QaFilterStatistics qaStatistics,
    RankingReport rankingReport,
    ValidationReport validationReport,
    ActionValidationSummary actionSummary) {

  public PipelineResult {
    segments = List.copyOf(segments);
    steps = List.copyOf(steps);
  }
}
