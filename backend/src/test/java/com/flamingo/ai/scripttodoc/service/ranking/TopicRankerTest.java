package com.flamingo.ai.scripttodoc.service.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.exception.InvalidConfigurationException;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TopicRanker Tests")
class TopicRankerTest {

  private static final List<String> PROCEDURAL =
      List.of("Click the Create button.", "Then enter the name.", "Next, select the region.");

  private static final List<String> CHATTER =
      List.of("The weather was great yesterday.", "We had lunch together.", "It was fun.");

  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private PipelineConfig pipelineConfig;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    pipelineConfig = new PipelineConfig();
  }

  private TopicRanker ranker() {
    return new TopicRanker(pipelineConfig, meterRegistry);
  }

  private static TopicSegment segment(int index, List<String> texts, double coherence) {
    List<ParsedSentence> sentences = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      sentences.add(ParsedSentence.of(text, text, index * 10 + i, null, null, false, false, false));
    }
    return new TopicSegment(index, sentences, coherence, false);
  }

  @Test
  @DisplayName("Should score procedural language from verbs, imperatives and sequencing")
  void shouldScoreProceduralLanguage() {
    TopicScore score = ranker().score(segment(0, PROCEDURAL, 0.0));

    // 4 verbs over 3 sentences, every sentence imperative, 2 sequence words
    assertThat(score.proceduralScore()).isCloseTo(0.5 * 4 / 6 + 0.3 + 0.2, within(1e-9));
    assertThat(score.actionDensity()).isCloseTo(4.0 / 9, within(1e-9));
    assertThat(score.importanceScore())
        .isCloseTo(0.4 * score.proceduralScore() + 0.3 * score.actionDensity(), within(1e-9));
  }

  @Test
  @DisplayName("Should score conversation without actions as zero")
  void shouldScoreChatterAsZero() {
    TopicScore score = ranker().score(segment(0, CHATTER, 0.0));

    assertThat(score.proceduralScore()).isZero();
    assertThat(score.actionDensity()).isZero();
    assertThat(score.importanceScore()).isZero();
  }

  @Test
  @DisplayName("Should match verbs as whole words only")
  void shouldMatchVerbsAsWholeWords() {
    assertThat(TopicRanker.isImperative("Open the portal.")).isTrue();
    assertThat(TopicRanker.isImperative("Now, click save.")).isTrue();
    assertThat(TopicRanker.isImperative("The portal opens slowly.")).isFalse();
    assertThat(ranker().actionDensity(segment(0, List.of("The settings are ready."), 0.0)))
        .isZero();
  }

  @Test
  @DisplayName("Should rank segments by descending importance")
  void shouldRankByImportance() {
    TopicSegment chatter = segment(0, CHATTER, 0.0);
    TopicSegment procedural = segment(1, PROCEDURAL, 0.0);

    assertThat(ranker().rankByImportance(List.of(chatter, procedural)))
        .containsExactly(procedural, chatter);
  }

  @Test
  @DisplayName("Should drop segments below the importance threshold")
  void shouldDropLowImportanceSegments() {
    TopicSegment chatter = segment(0, CHATTER, 0.0);
    TopicSegment procedural = segment(1, PROCEDURAL, 0.0);

    assertThat(ranker().filterLowImportance(List.of(chatter, procedural)))
        .containsExactly(procedural);
  }

  @Test
  @DisplayName("Should keep top N in transcript order")
  void shouldKeepTopNInTranscriptOrder() {
    pipelineConfig.getRanking().setKeepTopN(2);
    TopicSegment weakest = segment(0, PROCEDURAL, 0.2);
    TopicSegment middle = segment(1, PROCEDURAL, 0.5);
    TopicSegment strongest = segment(2, PROCEDURAL, 0.9);

    List<TopicSegment> kept = ranker().filterLowImportance(List.of(weakest, middle, strongest));

    assertThat(kept).containsExactly(middle, strongest);
  }

  @Test
  @DisplayName("Should return input unchanged when ranking is disabled")
  void shouldReturnInputWhenDisabled() {
    pipelineConfig.getRanking().setEnabled(false);
    List<TopicSegment> segments = List.of(segment(0, CHATTER, 0.0));

    assertThat(ranker().filterLowImportance(segments)).isSameAs(segments);
  }

  @Test
  @DisplayName("Should report score distribution")
  void shouldReportScoreDistribution() {
    RankingReport report =
        ranker().getRankingReport(List.of(segment(0, CHATTER, 0.0), segment(1, PROCEDURAL, 1.0)));

    assertThat(report.totalSegments()).isEqualTo(2);
    assertThat(report.scores()).hasSize(2);
    assertThat(report.statistics().min()).isZero();
    assertThat(report.statistics().lowCount()).isEqualTo(1);
    assertThat(report.statistics().highCount() + report.statistics().mediumCount()).isEqualTo(1);
    assertThat(report.statistics().standardDeviation()).isPositive();
  }

  @Test
  @DisplayName("Should report nothing for no segments")
  void shouldReportNothingForNoSegments() {
    RankingReport report = ranker().getRankingReport(List.of());

    assertThat(report.totalSegments()).isZero();
    assertThat(report.statistics()).isNull();
  }

  @Test
  @DisplayName("Should reject weights that do not sum to one")
  void shouldRejectWeightsNotSummingToOne() {
    pipelineConfig.getRanking().setProceduralWeight(0.6);

    assertThatThrownBy(this::ranker).isInstanceOf(InvalidConfigurationException.class);
  }
}
