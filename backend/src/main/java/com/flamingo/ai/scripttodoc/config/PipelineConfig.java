package com.flamingo.ai.scripttodoc.config;

import com.flamingo.ai.scripttodoc.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the transcript processing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private static final double WEIGHT_TOLERANCE = 0.01;

  private Cleaning cleaning = new Cleaning();
  private Segmentation segmentation = new Segmentation();
  private QaFiltering qaFiltering = new QaFiltering();
  private Ranking ranking = new Ranking();
  private Grounding grounding = new Grounding();
  private Validation validation = new Validation();
  private ActionValidation actionValidation = new ActionValidation();
  private Acceptance acceptance = new Acceptance();

  @Getter
  @Setter
  public static class Cleaning {
    private boolean enabled = true;

    /** Extra filler words removed on top of the built-in list. */
    private List<String> extraFillerWords = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Segmentation {
    private double timestampWeight = 0.35;
    private double speakerWeight = 0.25;
    private double transitionWeight = 0.30;
    private double semanticWeight = 0.10;

    /** Gap in seconds that counts as a long pause. */
    private double gapThresholdSeconds = 90.0;

    private double boundaryThreshold = 0.40;

    /** Transitions open a segment at this lower score. */
    private double transitionBoundaryThreshold = 0.30;

    private int minSegmentSentences = 2;
    private int minTotalSegments = 3;
    private boolean useSemanticSimilarity = false;
    private boolean mergeSmallSegments = true;

    public void validate() {
      requireWeightSum(
          "segmentation",
          timestampWeight + speakerWeight + transitionWeight + semanticWeight);
      requireUnitInterval("segmentation", "boundary-threshold", boundaryThreshold);
      requireUnitInterval(
          "segmentation", "transition-boundary-threshold", transitionBoundaryThreshold);
      if (gapThresholdSeconds <= 0) {
        throw new InvalidConfigurationException(
            "segmentation", "gap-threshold-seconds must be positive, got " + gapThresholdSeconds);
      }
      if (minSegmentSentences < 1) {
        throw new InvalidConfigurationException(
            "segmentation", "min-segment-sentences must be at least 1");
      }
      if (minTotalSegments < 1) {
        throw new InvalidConfigurationException(
            "segmentation", "min-total-segments must be at least 1");
      }
    }
  }

  @Getter
  @Setter
  public static class QaFiltering {
    private boolean enabled = true;
    private double minQaDensity = 0.30;
    private int minQuestions = 2;
    private boolean keepInstructorOnly = false;

    /** Share of own utterances that are questions, below which an unlabelled speaker leads. */
    private double instructorQuestionRate = 0.2;

    public void validate() {
      requireUnitInterval("qa-filtering", "min-qa-density", minQaDensity);
      requireUnitInterval("qa-filtering", "instructor-question-rate", instructorQuestionRate);
      if (minQuestions < 0) {
        throw new InvalidConfigurationException(
            "qa-filtering", "min-questions must be non-negative, got " + minQuestions);
      }
    }
  }

  @Getter
  @Setter
  public static class Ranking {
    private boolean enabled = true;
    private double proceduralWeight = 0.4;
    private double actionDensityWeight = 0.3;
    private double coherenceWeight = 0.3;
    private double minImportance = 0.3;

    /** Keep only the N most important segments after thresholding; null keeps all. */
    private Integer keepTopN;

    public void validate() {
      requireWeightSum("ranking", proceduralWeight + actionDensityWeight + coherenceWeight);
      requireUnitInterval("ranking", "min-importance", minImportance);
      if (keepTopN != null && keepTopN < 1) {
        throw new InvalidConfigurationException(
            "ranking", "keep-top-n must be at least 1 when set, got " + keepTopN);
      }
    }
  }

  @Getter
  @Setter
  public static class Grounding {
    private boolean semanticEnabled = false;

    private double wordOverlapWeight = 0.5;
    private double keywordWeight = 0.0;
    private double phraseWeight = 0.0;
    private double semanticWeight = 0.5;
    private double characterWeight = 0.0;

    private double minTranscriptScore = 0.15;
    private int minSharedWords = 3;
    private int maxTranscriptSources = 5;

    private double minKnowledgeScore = 0.2;
    private int maxKnowledgeSources = 3;

    private double minVisualScore = 0.4;
    private int maxVisualSources = 3;

    /** Penalty per prior use of a sentence. */
    private double reusePenaltyStep = 0.15;

    private double maxReusePenalty = 0.6;

    /** Share of the technical score added to matches above the technical floor. */
    private double technicalBoost = 0.2;

    /** Minimum step confidence for a step to count as grounded. */
    private double minStepConfidence = 0.4;

    public double weightSum() {
      return wordOverlapWeight + keywordWeight + phraseWeight + semanticWeight + characterWeight;
    }

    public void validate() {
      if (wordOverlapWeight < 0
          || keywordWeight < 0
          || phraseWeight < 0
          || semanticWeight < 0
          || characterWeight < 0) {
        throw new InvalidConfigurationException("grounding", "weights must be non-negative");
      }
      if (weightSum() <= 0) {
        throw new InvalidConfigurationException("grounding", "at least one weight must be set");
      }
      requireUnitInterval("grounding", "min-transcript-score", minTranscriptScore);
      requireUnitInterval("grounding", "min-knowledge-score", minKnowledgeScore);
      requireUnitInterval("grounding", "min-visual-score", minVisualScore);
      requireUnitInterval("grounding", "min-step-confidence", minStepConfidence);
      requireUnitInterval("grounding", "max-reuse-penalty", maxReusePenalty);
    }
  }

  @Getter
  @Setter
  public static class Validation {
    private int minActions = 3;
    private int maxActions = 15;
    private int minTitleLength = 10;
    private int maxTitleLength = 100;
    private boolean requireDescriptiveTitle = true;
    private int minDetailsLength = 20;
    private boolean requireDetails = true;
    private double minConfidence = 0.2;
    private double lowConfidence = 0.4;

    private double actionWeight = 0.4;
    private double titleWeight = 0.2;
    private double detailsWeight = 0.2;
    private double confidenceWeight = 0.2;

    private boolean autoFixEnabled = true;
    private boolean warnOnDuplicates = true;

    public void validate() {
      if (minActions < 1) {
        throw new InvalidConfigurationException("validation", "min-actions must be at least 1");
      }
      if (maxActions < minActions) {
        throw new InvalidConfigurationException(
            "validation", "max-actions must be >= min-actions");
      }
      if (maxTitleLength < 1) {
        throw new InvalidConfigurationException(
            "validation", "max-title-length must be at least 1");
      }
      if (minDetailsLength < 1) {
        throw new InvalidConfigurationException(
            "validation", "min-details-length must be at least 1");
      }
      if (maxTitleLength < minTitleLength) {
        throw new InvalidConfigurationException(
            "validation", "max-title-length must be >= min-title-length");
      }
      requireUnitInterval("validation", "min-confidence", minConfidence);
      requireUnitInterval("validation", "low-confidence", lowConfidence);
      requireWeightSum(
          "validation", actionWeight + titleWeight + detailsWeight + confidenceWeight);
    }
  }

  @Getter
  @Setter
  public static class ActionValidation {
    private int minActions = 3;
    private int maxActions = 6;

    /** Words the details (or the summary when details are empty) should carry. */
    private int minContentWords = 50;

    public void validate() {
      if (minActions < 0) {
        throw new InvalidConfigurationException(
            "action-validation", "min-actions must be non-negative, got " + minActions);
      }
      if (maxActions < minActions) {
        throw new InvalidConfigurationException(
            "action-validation", "max-actions must be >= min-actions");
      }
      if (minContentWords < 0) {
        throw new InvalidConfigurationException(
            "action-validation", "min-content-words must be non-negative, got " + minContentWords);
      }
    }
  }

  @Getter
  @Setter
  public static class Acceptance {
    /** Grounding confidence a step needs to be accepted. */
    private double minConfidence = 0.25;

    /** Relaxed floor for steps that found at least one source. */
    private double minConfidenceWithSources = 0.2;

    private String defaultTone = "Professional";
    private String defaultAudience = "Technical Users";
  }

  static void requireWeightSum(String section, double sum) {
    if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
      throw new InvalidConfigurationException(
          section, String.format("Weights must sum to 1.0, got %.3f", sum));
    }
  }

  static void requireUnitInterval(String section, String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new InvalidConfigurationException(
          section, name + " must be between 0 and 1, got " + value);
    }
  }
}
