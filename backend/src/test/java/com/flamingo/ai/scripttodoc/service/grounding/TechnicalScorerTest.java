package com.flamingo.ai.scripttodoc.service.grounding;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TechnicalScorer Tests")
class TechnicalScorerTest {

  @Test
  @DisplayName("Should prefer specific technical sentences over small talk")
  void shouldPreferTechnicalSentences() {
    double technical =
        TechnicalScorer.score(
            "Set the container throughput to 400 RU and deploy the api endpoint.");
    double smallTalk = TechnicalScorer.score("I hope everyone had a good weekend so far.");

    assertThat(technical).isGreaterThan(smallTalk);
    assertThat(technical).isBetween(0.0, 1.0);
  }

  @Test
  @DisplayName("Should halve the score of very short sentences")
  void shouldHalveShortSentences() {
    assertThat(TechnicalScorer.score("Open the database."))
        .isLessThan(TechnicalScorer.score("Open the database in the next window."));
  }
}
