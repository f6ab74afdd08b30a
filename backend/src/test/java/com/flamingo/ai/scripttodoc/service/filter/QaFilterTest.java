package com.flamingo.ai.scripttodoc.service.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.segmentation.TopicSegment;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import com.flamingo.ai.scripttodoc.service.transcript.SpeakerRole;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QaFilter Tests")
class QaFilterTest {

  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private PipelineConfig pipelineConfig;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    pipelineConfig = new PipelineConfig();
  }

  private QaFilter filter() {
    return new QaFilter(pipelineConfig, meterRegistry);
  }

  private static ParsedSentence sentence(int index, String text, boolean question) {
    return ParsedSentence.of(text, text, index, null, null, question, false, false);
  }

  private static ParsedSentence spoken(
      int index, String text, String speaker, SpeakerRole role, boolean question) {
    return new ParsedSentence(
        text, text, index, null, speaker, role, question, false, false, false, false);
  }

  private static TopicSegment qaSegment(int segmentIndex, int firstSentence) {
    return new TopicSegment(
        segmentIndex,
        List.of(
            sentence(firstSentence, "What is a resource group?", true),
            sentence(firstSentence + 1, "It's a logical container.", false),
            sentence(firstSentence + 2, "How do I create one?", true)));
  }

  private static TopicSegment proceduralSegment(int segmentIndex, int firstSentence) {
    return new TopicSegment(
        segmentIndex,
        List.of(
            sentence(firstSentence, "Open the portal.", false),
            sentence(firstSentence + 1, "Click create resource.", false),
            sentence(firstSentence + 2, "Does everyone see the button?", true),
            sentence(firstSentence + 3, "Select the subscription.", false)));
  }

  @Test
  @DisplayName("Should flag a segment where two of three sentences are questions")
  void shouldFlagQuestionDenseSegment() {
    QaSection section = filter().analyze(qaSegment(0, 0));

    assertThat(section.qaDensity()).isCloseTo(0.667, within(0.001));
    assertThat(section.questionCount()).isEqualTo(2);
    assertThat(section.qaDense()).isTrue();
  }

  @Test
  @DisplayName("Should keep segments below the density threshold")
  void shouldKeepSegmentsBelowDensityThreshold() {
    QaSection section = filter().analyze(proceduralSegment(0, 0));

    assertThat(section.qaDensity()).isEqualTo(0.25);
    assertThat(section.qaDense()).isFalse();
  }

  @Test
  @DisplayName("Should require the minimum number of questions")
  void shouldRequireMinimumQuestions() {
    TopicSegment single =
        new TopicSegment(0, List.of(sentence(0, "Any questions so far?", true)));

    assertThat(filter().analyze(single).qaDense()).isFalse();
  }

  @Test
  @DisplayName("Should remove Q&A segments and keep order of the rest")
  void shouldRemoveQaSegments() {
    TopicSegment first = proceduralSegment(0, 0);
    TopicSegment qa = qaSegment(1, 4);
    TopicSegment last = proceduralSegment(2, 7);

    List<TopicSegment> kept = filter().filterSegments(List.of(first, qa, last));

    assertThat(kept).containsExactly(first, last);
    assertThat(filter().identifyQaSections(List.of(first, qa, last)))
        .extracting(QaSection::segmentIndex)
        .containsExactly(1);
  }

  @Test
  @DisplayName("Should return input unchanged when filtering is disabled")
  void shouldReturnInputWhenDisabled() {
    pipelineConfig.getQaFiltering().setEnabled(false);
    List<TopicSegment> segments = List.of(qaSegment(0, 0));

    assertThat(filter().filterSegments(segments)).isSameAs(segments);
  }

  @Test
  @DisplayName("Should drop participant-led segments in instructor-only mode")
  void shouldDropParticipantLedSegments() {
    pipelineConfig.getQaFiltering().setKeepInstructorOnly(true);
    TopicSegment participantLed =
        new TopicSegment(
            0,
            List.of(
                spoken(0, "I tried the CLI yesterday.", "Bob", SpeakerRole.PARTICIPANT, false),
                spoken(1, "It failed on login.", "Bob", SpeakerRole.PARTICIPANT, false),
                spoken(2, "Let me show the fix.", "Alice", SpeakerRole.INSTRUCTOR, false)));
    TopicSegment instructorLed =
        new TopicSegment(
            1,
            List.of(
                spoken(3, "Run az login first.", "Alice", SpeakerRole.INSTRUCTOR, false),
                spoken(4, "Then pick the tenant.", "Alice", SpeakerRole.INSTRUCTOR, false)));

    List<TopicSegment> kept = filter().filterSegments(List.of(participantLed, instructorLed));

    assertThat(kept).containsExactly(instructorLed);
  }

  @Test
  @DisplayName("Should infer instructor from question rate when roles are missing")
  void shouldInferInstructorFromQuestionRate() {
    TopicSegment asker =
        new TopicSegment(
            0,
            List.of(
                spoken(0, "Where is the setting?", "Carol", null, true),
                spoken(1, "I cannot find it.", "Carol", null, false)));
    TopicSegment explainer =
        new TopicSegment(
            1,
            List.of(
                spoken(2, "Open the settings page.", "Dan", null, false),
                spoken(3, "Scroll to the bottom.", "Dan", null, false)));

    assertThat(filter().isInstructorLed(asker)).isFalse();
    assertThat(filter().isInstructorLed(explainer)).isTrue();
  }

  @Test
  @DisplayName("Should report statistics before and after filtering")
  void shouldReportStatistics() {
    List<TopicSegment> segments = List.of(proceduralSegment(0, 0), qaSegment(1, 4));

    QaFilterStatistics statistics = filter().getStatistics(segments);

    assertThat(statistics.totalSegments()).isEqualTo(2);
    assertThat(statistics.qaSegments()).isEqualTo(1);
    assertThat(statistics.filteredSegments()).isEqualTo(1);
    assertThat(statistics.removedSegments()).isEqualTo(1);
    assertThat(statistics.totalQuestions()).isEqualTo(3);
    assertThat(statistics.totalSentences()).isEqualTo(7);
    assertThat(statistics.overallQaDensity()).isCloseTo(3.0 / 7, within(1e-9));
    assertThat(statistics.filterRate()).isEqualTo(0.5);
  }
}
