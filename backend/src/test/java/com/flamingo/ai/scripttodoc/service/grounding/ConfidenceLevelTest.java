package com.flamingo.ai.scripttodoc.service.grounding;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfidenceLevel Tests")
class ConfidenceLevelTest {

  @Test
  @DisplayName("Should band confidence into three levels")
  void shouldBandConfidence() {
    assertThat(ConfidenceLevel.fromScore(0.7)).isEqualTo(ConfidenceLevel.HIGH);
    assertThat(ConfidenceLevel.fromScore(0.69)).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(ConfidenceLevel.fromScore(0.4)).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(ConfidenceLevel.fromScore(0.39)).isEqualTo(ConfidenceLevel.LOW);
  }

  @Test
  @DisplayName("Should label confidence in five steps")
  void shouldLabelConfidence() {
    assertThat(List.of(0.8, 0.6, 0.4, 0.2, 0.1))
        .extracting(ConfidenceLevel::label)
        .containsExactly("Very High", "High", "Medium", "Low", "Very Low");
  }

  @Test
  @DisplayName("Should expose the level and label of step evidence")
  void shouldDescribeStepEvidence() {
    StepSourceData data = new StepSourceData(0, "x", List.of());
    data.setOverallConfidence(0.72);

    assertThat(data.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
    assertThat(data.getConfidenceLabel()).isEqualTo("High");
  }
}
