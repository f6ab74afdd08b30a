package com.flamingo.ai.scripttodoc.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.exception.NoSegmentsRemainingException;
import com.flamingo.ai.scripttodoc.exception.NoValidStepsException;
import com.flamingo.ai.scripttodoc.service.filter.QaFilter;
import com.flamingo.ai.scripttodoc.service.grounding.SourceReferenceManager;
import com.flamingo.ai.scripttodoc.service.grounding.SourceType;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.LexicalSimilarityScorer;
import com.flamingo.ai.scripttodoc.service.ranking.TopicRanker;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegmenter;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import com.flamingo.ai.scripttodoc.service.step.StepGenerationContext;
import com.flamingo.ai.scripttodoc.service.step.StepGenerator;
import com.flamingo.ai.scripttodoc.service.transcript.TranscriptCleaner;
import com.flamingo.ai.scripttodoc.service.transcript.TranscriptParser;
import com.flamingo.ai.scripttodoc.service.validation.ActionValidator;
import com.flamingo.ai.scripttodoc.service.validation.StepValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TranscriptProcessingPipeline Tests")
class TranscriptProcessingPipelineTest {

  private static final String TRANSCRIPT =
      String.join(
          "\n",
          "[00:00:00] Open the Azure portal and sign in with your account.",
          "[00:00:10] Click Create a resource and search for storage account.",
          "[00:00:20] Select your subscription and then choose a resource group.",
          "[00:01:55] Open the storage account and then select Containers.",
          "[00:02:05] Click Add container and type a name for the container.",
          "[00:02:15] Click Create to save the container.");

  private static final List<String> TITLES =
      List.of("Create a storage account", "Add a blob container");

  private static final StepGenerator FAITHFUL = TranscriptProcessingPipelineTest::faithfulStep;

  private PipelineConfig pipelineConfig;
  private MeterRegistry meterRegistry;
  private TranscriptProcessingPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getSegmentation().setMinTotalSegments(2);
    meterRegistry = new SimpleMeterRegistry();
    pipeline =
        new TranscriptProcessingPipeline(
            new TranscriptParser(pipelineConfig, meterRegistry),
            new TranscriptCleaner(pipelineConfig),
            new TopicSegmenter(pipelineConfig, meterRegistry),
            new QaFilter(pipelineConfig, meterRegistry),
            new TopicRanker(pipelineConfig, meterRegistry),
            new SourceReferenceManager(
                pipelineConfig, new LexicalSimilarityScorer(), meterRegistry),
            new ActionValidator(pipelineConfig, meterRegistry),
            new StepValidator(pipelineConfig, meterRegistry),
            pipelineConfig,
            meterRegistry);
  }

  /** Writes a step from the segment itself, the way a faithful model would. */
  private static GeneratedStep faithfulStep(String segmentText, StepGenerationContext context) {
    List<String> actions = Arrays.asList(segmentText.split("(?<=\\.)\\s+"));
    return new GeneratedStep(TITLES.get(context.segmentIndex()), "", segmentText, actions);
  }

  @Test
  @DisplayName("Should turn a procedural transcript into grounded steps")
  void shouldProduceGroundedSteps() {
    List<StepGenerationContext> contexts = new ArrayList<>();
    StepGenerator generator =
        (text, context) -> {
          contexts.add(context);
          return faithfulStep(text, context);
        };

    PipelineResult result = pipeline.process(TRANSCRIPT, generator, ProcessingOptions.defaults());

    assertThat(result.segments()).hasSize(2);
    assertThat(result.steps()).hasSize(2);
    assertThat(result.steps())
        .extracting(step -> step.step().title())
        .containsExactly("Create a storage account", "Add a blob container");
    assertThat(result.steps())
        .allSatisfy(
            step -> {
              assertThat(step.validation().valid()).isTrue();
              assertThat(step.sources().hasTranscriptSupport()).isTrue();
              assertThat(step.confidence()).isBetween(0.25, 1.0);
            });
    assertThat(result.rejectedSteps()).isZero();
    assertThat(result.failedGenerations()).isZero();
    assertThat(result.metadata().totalSentences()).isEqualTo(6);
    assertThat(result.validationReport().totalSteps()).isEqualTo(2);
    assertThat(result.qaStatistics().removedSegments()).isZero();
    assertThat(contexts)
        .extracting(StepGenerationContext::tone, StepGenerationContext::audience)
        .containsOnly(tuple("Professional", "Technical Users"));
    assertThat(meterRegistry.counter("pipeline.steps.accepted").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should cite transcript sentences from the step's own segment")
  void shouldCiteOwnSegment() {
    PipelineResult result =
        pipeline.process(TRANSCRIPT, FAITHFUL, null);

    AcceptedStep container = result.steps().get(1);
    assertThat(container.sources().sourcesOfType(SourceType.TRANSCRIPT))
        .extracting(source -> source.sentenceIndex())
        .contains(4);
  }

  @Test
  @DisplayName("Should flag thin steps without rejecting them")
  void shouldFlagActionIssuesOnEvidence() {
    PipelineResult result = pipeline.process(TRANSCRIPT, FAITHFUL, null);

    assertThat(result.steps()).hasSize(2);
    assertThat(result.steps())
        .allSatisfy(
            step -> {
              assertThat(step.actionValidation().passed()).isFalse();
              assertThat(step.actionValidation().weakVerbs()).isEmpty();
              assertThat(step.sources().getValidationFlags())
                  .anyMatch(flag -> flag.startsWith("Content too thin"));
            });
    assertThat(result.actionSummary().totalSteps()).isEqualTo(2);
    assertThat(result.actionSummary().failedSteps()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should skip segments whose generation fails")
  void shouldSkipFailedGenerations() {
    StepGenerator generator =
        (text, context) -> {
          if (context.segmentIndex() == 0) {
            throw new IllegalStateException("model timed out");
          }
          return faithfulStep(text, context);
        };

    PipelineResult result = pipeline.process(TRANSCRIPT, generator, ProcessingOptions.defaults());

    assertThat(result.failedGenerations()).isEqualTo(1);
    assertThat(result.steps()).hasSize(1);
    assertThat(result.steps().get(0).step().title()).isEqualTo("Add a blob container");
    assertThat(meterRegistry.counter("pipeline.steps.generation_failed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fail when every segment is Q&A")
  void shouldFailWhenOnlyQuestionsRemain() {
    String questions =
        String.join(
            "\n",
            "How do I reset my password?",
            "Can we get the slides afterwards?",
            "Where is the recording stored?",
            "Is there a lab for this module?");

    assertThatThrownBy(() -> pipeline.process(questions, FAITHFUL, null))
        .isInstanceOf(NoSegmentsRemainingException.class)
        .satisfies(
            e -> {
              NoSegmentsRemainingException failure = (NoSegmentsRemainingException) e;
              assertThat(failure.getOriginalSegmentCount()).isEqualTo(2);
              assertThat(failure.getUserMessage()).contains("no procedural content");
            });
    assertThat(
            meterRegistry.counter("transcript.process.failed", "reason", "no_segments").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fail when an empty transcript is given")
  void shouldFailOnEmptyTranscript() {
    assertThatThrownBy(() -> pipeline.process("  ", FAITHFUL, null))
        .isInstanceOf(NoSegmentsRemainingException.class);
  }

  @Test
  @DisplayName("Should fail when no generated step passes validation")
  void shouldFailWhenNoStepIsValid() {
    StepGenerator untitled =
        (text, context) -> new GeneratedStep("", "", text, List.of("Click Create"));

    assertThatThrownBy(() -> pipeline.process(TRANSCRIPT, untitled, ProcessingOptions.defaults()))
        .isInstanceOf(NoValidStepsException.class)
        .satisfies(
            e -> {
              NoValidStepsException failure = (NoValidStepsException) e;
              assertThat(failure.getCandidateCount()).isEqualTo(2);
              assertThat(failure.getUserMessage())
                  .isEqualTo("No training steps could be verified against the transcript.");
            });
    assertThat(meterRegistry.counter("pipeline.steps.rejected").count()).isEqualTo(2.0);
  }
}
