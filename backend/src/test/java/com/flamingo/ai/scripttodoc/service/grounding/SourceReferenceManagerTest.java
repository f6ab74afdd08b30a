package com.flamingo.ai.scripttodoc.service.grounding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.LexicalSimilarityScorer;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.SimilarityScorer;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SourceReferenceManager Tests")
class SourceReferenceManagerTest {

  private static final List<ParsedSentence> CATALOG =
      List.of(
          sentence(0, 0.0, "Open the Azure portal and sign in with your account."),
          sentence(1, 12.0, "Click Create a resource and search for storage account."),
          sentence(2, 30.0, "The weather is nice today."));

  private static final GeneratedStep STORAGE_STEP =
      new GeneratedStep(
          "Create a storage account",
          "",
          "Click Create a resource and search for storage account in the portal.",
          List.of(
              "Click Create a resource", "Search for storage account", "Select the subscription"));

  private PipelineConfig pipelineConfig;
  private MeterRegistry meterRegistry;
  private SourceReferenceManager manager;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    meterRegistry = new SimpleMeterRegistry();
    manager =
        new SourceReferenceManager(pipelineConfig, new LexicalSimilarityScorer(), meterRegistry);
  }

  private static ParsedSentence sentence(int index, Double timestamp, String text) {
    return ParsedSentence.of(text, text, index, timestamp, null, false, false, false);
  }

  @Nested
  @DisplayName("Transcript matching")
  class TranscriptMatching {

    @Test
    @DisplayName("Should find the sentence the step was written from")
    void shouldFindSupportingSentence() {
      GroundingSession session = manager.openSession(CATALOG);

      List<SourceReference> sources = manager.findTranscriptSources(session, STORAGE_STEP);

      assertThat(sources).hasSize(1);
      SourceReference source = sources.get(0);
      assertThat(source.type()).isEqualTo(SourceType.TRANSCRIPT);
      assertThat(source.sentenceIndex()).isEqualTo(1);
      assertThat(source.timestamp()).isEqualTo(12.0);
      assertThat(source.confidence()).isBetween(0.15, 1.0);
      assertThat(session.citationCount(1)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip sentences sharing fewer than three words with the step")
    void shouldSkipWeaklyRelatedSentences() {
      GroundingSession session = manager.openSession(CATALOG);

      List<SourceReference> sources = manager.findTranscriptSources(session, STORAGE_STEP);

      assertThat(sources).extracting(SourceReference::sentenceIndex).doesNotContain(0, 2);
    }

    @Test
    @DisplayName("Should keep word overlap at its configured weight without a semantic scorer")
    void shouldNotInflateWordOverlapWithoutSemanticScorer() {
      String unrelated = "the portal resource group view has many other items listed here";
      GroundingSession session = manager.openSession(List.of(sentence(0, null, unrelated)));
      GeneratedStep step = new GeneratedStep("Portal resource group settings", "", "", List.of());

      // Jaccard 0.25 at weight 0.5, less the first-use penalty: 0.106 is under the 0.15 floor
      assertThat(manager.findTranscriptSources(session, step)).isEmpty();
      assertThat(session.citationCount(0)).isZero();
    }

    @Test
    @DisplayName("Should normalize weights that do not sum to one")
    void shouldNormalizeOffSumWeights() {
      pipelineConfig.getGrounding().setWordOverlapWeight(1.0);
      pipelineConfig.getGrounding().setSemanticWeight(1.0);
      SourceReferenceManager doubled =
          new SourceReferenceManager(pipelineConfig, new LexicalSimilarityScorer(), meterRegistry);

      double normalized =
          doubled.findTranscriptSources(doubled.openSession(CATALOG), STORAGE_STEP)
              .get(0)
              .confidence();
      double configured =
          manager.findTranscriptSources(manager.openSession(CATALOG), STORAGE_STEP)
              .get(0)
              .confidence();

      assertThat(normalized).isCloseTo(configured, within(1e-9));
    }

    @Test
    @DisplayName("Should score a sentence lower each time it is cited again")
    void shouldPenalizeReusedSentences() {
      GroundingSession session = manager.openSession(CATALOG);

      double first = manager.findTranscriptSources(session, STORAGE_STEP).get(0).confidence();
      double second = manager.findTranscriptSources(session, STORAGE_STEP).get(0).confidence();

      assertThat(second).isLessThan(first);
      assertThat(session.citationCount(1)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should grow the reuse penalty up to its cap")
    void shouldCapReusePenalty() {
      double previous = 0.0;
      for (int uses = 0; uses < 8; uses++) {
        double penalty = manager.reusePenalty(uses);
        assertThat(penalty).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(0.6);
        previous = penalty;
      }
      assertThat(manager.reusePenalty(0)).isCloseTo(0.15, within(1e-9));
      assertThat(manager.reusePenalty(10)).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Should keep citation counts per session")
    void shouldKeepCitationCountsPerSession() {
      GroundingSession first = manager.openSession(CATALOG);
      manager.findTranscriptSources(first, STORAGE_STEP);

      GroundingSession second = manager.openSession(CATALOG);

      assertThat(second.citationCount(1)).isZero();
    }

    @Test
    @DisplayName("Should use the session scorer when a semantic scorer is available")
    void shouldUseSemanticScorer() {
      SimilarityScorer scorer = mock(SimilarityScorer.class);
      when(scorer.isSemantic()).thenReturn(true);
      when(scorer.forSession(anyList())).thenReturn(scorer);
      when(scorer.score(anyString(), anyString())).thenReturn(0.8);
      SourceReferenceManager semantic =
          new SourceReferenceManager(pipelineConfig, scorer, meterRegistry);

      GroundingSession session = semantic.openSession(CATALOG);
      List<SourceReference> sources = semantic.findTranscriptSources(session, STORAGE_STEP);

      verify(scorer).forSession(anyList());
      assertThat(sources).hasSize(1);
      double lexical =
          manager.findTranscriptSources(manager.openSession(CATALOG), STORAGE_STEP)
              .get(0)
              .confidence();
      assertThat(sources.get(0).confidence()).isGreaterThan(lexical);
    }
  }

  @Nested
  @DisplayName("Knowledge and visual matching")
  class KnowledgeAndVisual {

    @Test
    @DisplayName("Should match knowledge documents by word overlap")
    void shouldMatchKnowledgeDocuments() {
      KnowledgeSource docs =
          KnowledgeSource.of(
              "https://learn.microsoft.com/storage",
              "Azure docs",
              "To create a storage account, click Create a resource, search for storage account"
                  + " and select your subscription.");
      KnowledgeSource broken =
          new KnowledgeSource("https://example.com", "Broken", null, "document", "404");

      List<SourceReference> sources =
          manager.findKnowledgeSources(STORAGE_STEP, List.of(docs, broken));

      assertThat(sources).hasSize(1);
      assertThat(sources.get(0).type()).isEqualTo(SourceType.KNOWLEDGE);
      assertThat(sources.get(0).url()).isEqualTo("https://learn.microsoft.com/storage");
      assertThat(sources.get(0).excerpt())
          .startsWith("[Azure docs](https://learn.microsoft.com/storage)");
      assertThat(sources.get(0).confidence()).isGreaterThanOrEqualTo(0.4);
    }

    @Test
    @DisplayName("Should match UI elements against action targets")
    void shouldMatchUiElements() {
      GeneratedStep step =
          new GeneratedStep("Create it", "", "", List.of("Click the Create button"));
      ScreenshotEvidence screenshot =
          new ScreenshotEvidence(
              "portal.png",
              "",
              List.of(
                  new ScreenshotEvidence.UiElement("Create", "button"),
                  new ScreenshotEvidence.UiElement("", "label"),
                  new ScreenshotEvidence.UiElement("Delete", "button")));

      List<SourceReference> sources = manager.findVisualSources(step, List.of(screenshot));

      assertThat(sources).hasSize(1);
      assertThat(sources.get(0).type()).isEqualTo(SourceType.VISUAL);
      assertThat(sources.get(0).screenshotRef()).isEqualTo("portal.png");
      assertThat(sources.get(0).uiElements()).containsExactly("Create");
      assertThat(sources.get(0).confidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should extract action targets without articles")
    void shouldExtractActionTargets() {
      assertThat(
              SourceReferenceManager.actionTargets(
                  List.of("Click the Create button", "Type a name.", "Wait a moment")))
          .containsExactly("create button", "name");
    }
  }

  @Nested
  @DisplayName("Confidence")
  class Confidence {

    @Test
    @DisplayName("Should give zero confidence and fail validation without sources")
    void shouldGiveZeroConfidenceWithoutSources() {
      StepSourceData data = new StepSourceData(0, "Anything", List.of());
      data.setOverallConfidence(manager.calculateConfidence(data));

      StepGroundingVerdict verdict = manager.validateStep(data);

      assertThat(data.getOverallConfidence()).isZero();
      assertThat(verdict.valid()).isFalse();
      assertThat(verdict.warnings())
          .contains("No source references found - content may be fabricated");
      assertThat(data.getValidationFlags()).isEqualTo(verdict.warnings());
    }

    @Test
    @DisplayName("Should use a single source's confidence as is")
    void shouldUseSingleSourceConfidence() {
      StepSourceData data =
          new StepSourceData(0, "x", List.of(SourceReference.transcript("a", 0, null, 0.4)));

      assertThat(manager.calculateConfidence(data)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Should reward corroborating transcript and knowledge evidence")
    void shouldRewardCorroboration() {
      StepSourceData data =
          new StepSourceData(
              0,
              "x",
              List.of(
                  SourceReference.transcript("a", 0, null, 0.6),
                  SourceReference.knowledge("b", "https://docs", 0.5)));

      double expected = (0.6 * 0.6 + 0.5 * 0.4) * 1.08 * 1.12 * 1.10;
      assertThat(manager.calculateConfidence(data)).isCloseTo(expected, within(1e-9));
    }

    @Test
    @DisplayName("Should ignore visual evidence and clamp to one")
    void shouldIgnoreVisualEvidenceAndClamp() {
      StepSourceData visualOnly =
          new StepSourceData(
              0, "x", List.of(SourceReference.visual("shot", "a.png", List.of(), 0.9)));
      StepSourceData strong =
          new StepSourceData(
              0,
              "x",
              List.of(
                  SourceReference.transcript("a", 0, null, 0.9),
                  SourceReference.transcript("b", 1, null, 0.9),
                  SourceReference.transcript("c", 2, null, 0.9),
                  SourceReference.transcript("d", 3, null, 0.9)));

      assertThat(manager.calculateConfidence(visualOnly)).isZero();
      assertThat(manager.calculateConfidence(strong)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should blend confidence with validation quality")
    void shouldBlendConfidenceWithQuality() {
      assertThat(manager.enhanceConfidenceWithValidation(0.5, 0.85))
          .isCloseTo(0.6655, within(1e-9));
      assertThat(manager.enhanceConfidenceWithValidation(0.5, 0.65))
          .isCloseTo((0.35 + 0.195) * 1.05, within(1e-9));
      assertThat(manager.enhanceConfidenceWithValidation(0.5, 0.2))
          .isCloseTo(0.41 * 0.95, within(1e-9));
      assertThat(manager.enhanceConfidenceWithValidation(1.0, 1.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should build, score and record step evidence")
    void shouldBuildAndRecordStepSources() {
      GroundingSession session = manager.openSession(CATALOG);
      ScreenshotEvidence screenshot =
          new ScreenshotEvidence(
              "create.png", "", List.of(new ScreenshotEvidence.UiElement("Create", "button")));

      StepSourceData data =
          manager.buildStepSources(session, 3, STORAGE_STEP, List.of(screenshot), List.of());

      assertThat(data.getStepIndex()).isEqualTo(3);
      assertThat(data.hasTranscriptSupport()).isTrue();
      assertThat(data.hasVisualSupport()).isTrue();
      assertThat(data.getOverallConfidence()).isBetween(0.0, 1.0);
      assertThat(session.stepSources(3)).containsSame(data);
      assertThat(session.allStepSources()).containsExactly(data);
      assertThat(meterRegistry.counter("grounding.steps.built").count()).isEqualTo(1.0);
    }
  }
}
