package com.thinkfast.domain;

/**
 * Answer scoring with a combo multiplier.
 *
 * <p>A fast correct answer extends the combo; each combo level beyond the first adds 5% to the
 * base 100 points, up to 2x. A slow correct answer earns a flat 100 and breaks the combo. A wrong
 * answer breaks the combo and costs 25 points scaled by the combo it broke, capped at 1.5x.
 */
public final class ScoringEngine {
  public static final long FAST_ANSWER_MS = 10_000;

  private static final int BASE_POINTS = 100;
  private static final int BASE_PENALTY = 25;
  private static final double STEP = 0.05;
  private static final double MAX_MULTIPLIER = 2.0;
  private static final double MAX_PENALTY_MULTIPLIER = 1.5;

  private ScoringEngine() {}

  /**
   * Score one answer.
   *
   * @param previousCombo the player's combo before this answer
   * @param correct whether the answer was right
   * @param elapsedMs time the player took; negative values count as 0
   * @return score change (may be negative) and the player's new combo
   */
  public static ScoreDelta score(int previousCombo, boolean correct, long elapsedMs) {
    int prev = Math.max(0, previousCombo);
    long elapsed = Math.max(0, elapsedMs);

    if (correct && elapsed <= FAST_ANSWER_MS) {
      int combo = prev + 1;
      return new ScoreDelta((int) Math.round(BASE_POINTS * multiplier(combo - 1)), combo);
    }
    if (correct) {
      return new ScoreDelta(BASE_POINTS, 0);
    }
    double penalty = Math.min(multiplier(prev - 1), MAX_PENALTY_MULTIPLIER);
    return new ScoreDelta(-(int) Math.round(BASE_PENALTY * penalty), 0);
  }

  private static double multiplier(int level) {
    return Math.min(1.0 + Math.max(0, level) * STEP, MAX_MULTIPLIER);
  }
}
