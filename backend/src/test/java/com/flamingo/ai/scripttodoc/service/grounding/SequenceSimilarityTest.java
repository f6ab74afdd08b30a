package com.flamingo.ai.scripttodoc.service.grounding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SequenceSimilarity Tests")
class SequenceSimilarityTest {

  @Test
  @DisplayName("Should count matching blocks on both sides of the longest match")
  void shouldCountMatchingBlocks() {
    assertThat(SequenceSimilarity.matchingCharacters("abxcd", "abycd")).isEqualTo(4);
    assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isCloseTo(0.75, within(1e-9));
  }

  @Test
  @DisplayName("Should treat identical and empty strings as equal")
  void shouldTreatIdenticalStringsAsEqual() {
    assertThat(SequenceSimilarity.ratio("open the portal", "open the portal")).isEqualTo(1.0);
    assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should score unrelated strings as zero")
  void shouldScoreUnrelatedStringsAsZero() {
    assertThat(SequenceSimilarity.ratio("abc", "xyz")).isZero();
    assertThat(SequenceSimilarity.ratio("abc", "")).isZero();
  }
}
