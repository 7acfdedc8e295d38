package com.thinkfast.domain;

public record Settings(
    Difficulty difficulty, int duration, int questionCount, Operations operations) {

  public static final int MIN_DURATION = 10;
  public static final int MAX_DURATION = 600;
  public static final int MIN_QUESTIONS = 1;
  public static final int MAX_QUESTIONS = 100;

  public static Settings defaults() {
    return new Settings(Difficulty.EASY, 120, 10, Operations.defaults());
  }

  /**
   * Apply a partial update. Fields absent from the patch are kept as they are.
   *
   * @param patch supplied fields (may be null)
   * @return merged settings
   * @throws IllegalArgumentException if a supplied value is out of range; nothing is applied
   */
  public Settings merge(SettingsPatch patch) {
    if (patch == null) return this;
    if (patch.duration() != null
        && (patch.duration() < MIN_DURATION || patch.duration() > MAX_DURATION)) {
      throw new IllegalArgumentException(
          "duration must be between " + MIN_DURATION + " and " + MAX_DURATION);
    }
    if (patch.questionCount() != null
        && (patch.questionCount() < MIN_QUESTIONS || patch.questionCount() > MAX_QUESTIONS)) {
      throw new IllegalArgumentException(
          "questionCount must be between " + MIN_QUESTIONS + " and " + MAX_QUESTIONS);
    }
    return new Settings(
        patch.difficulty() != null ? patch.difficulty() : difficulty,
        patch.duration() != null ? patch.duration() : duration,
        patch.questionCount() != null ? patch.questionCount() : questionCount,
        operations.merge(patch.operations()));
  }
}
