package com.thinkfast.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScoringEngineTest {

  @Test
  void fastCorrectStreakThenMiss() {
    ScoreDelta first = ScoringEngine.score(0, true, 500);
    assertThat(first).isEqualTo(new ScoreDelta(100, 1));

    ScoreDelta second = ScoringEngine.score(first.newCombo(), true, 500);
    assertThat(second).isEqualTo(new ScoreDelta(105, 2));

    ScoreDelta miss = ScoringEngine.score(second.newCombo(), false, 500);
    assertThat(miss).isEqualTo(new ScoreDelta(-26, 0));
  }

  @Test
  void slowCorrectAnswerIsFlatAndBreaksCombo() {
    assertThat(ScoringEngine.score(7, true, 10_001)).isEqualTo(new ScoreDelta(100, 0));
  }

  @Test
  void answerAtTheTenSecondMarkStillCountsAsFast() {
    assertThat(ScoringEngine.score(2, true, 10_000)).isEqualTo(new ScoreDelta(110, 3));
  }

  @Test
  void multiplierCapsAtDouble() {
    // level 20 and beyond -> 2.0x
    assertThat(ScoringEngine.score(20, true, 100).delta()).isEqualTo(200);
    assertThat(ScoringEngine.score(50, true, 100)).isEqualTo(new ScoreDelta(200, 51));
  }

  @Test
  void penaltyCapsAtOneAndAHalf() {
    assertThat(ScoringEngine.score(0, false, 0)).isEqualTo(new ScoreDelta(-25, 0));
    assertThat(ScoringEngine.score(1, false, 0)).isEqualTo(new ScoreDelta(-25, 0));
    assertThat(ScoringEngine.score(11, false, 0).delta()).isEqualTo(-38);
    assertThat(ScoringEngine.score(40, false, 0).delta()).isEqualTo(-38);
  }

  @Test
  void slowWrongAnswerIsPenalizedLikeAFastOne() {
    assertThat(ScoringEngine.score(3, false, 60_000))
        .isEqualTo(ScoringEngine.score(3, false, 100));
  }

  @Test
  void negativeElapsedCountsAsZero() {
    assertThat(ScoringEngine.score(0, true, -5)).isEqualTo(new ScoreDelta(100, 1));
  }
}
