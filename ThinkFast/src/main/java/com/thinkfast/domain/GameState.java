package com.thinkfast.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Round state of a lobby.
 *
 * <p>{@code currentQuestionIndex}, {@code comboCount}, {@code isComboActive} and
 * {@code comboTimeRemaining} are display fields clients still read. Combo is tracked per player,
 * so these stay at their initial values.
 */
public record GameState(
    @JsonProperty("isActive") boolean isActive,
    int currentQuestionIndex,
    List<Question> questions,
    int timeRemaining,
    int comboCount,
    @JsonProperty("isComboActive") boolean isComboActive,
    int comboTimeRemaining,
    @JsonProperty("isEnded") boolean isEnded) {

  public GameState {
    questions = List.copyOf(questions);
  }

  public static GameState empty() {
    return new GameState(false, 0, List.of(), 0, 0, false, 0, false);
  }

  public static GameState started(List<Question> questions, int duration) {
    return new GameState(true, 0, questions, duration, 0, false, 0, false);
  }

  public GameState withTimeRemaining(int t) {
    return new GameState(
        isActive, currentQuestionIndex, questions, t, comboCount, isComboActive,
        comboTimeRemaining, isEnded);
  }

  public GameState ended() {
    return new GameState(
        false, currentQuestionIndex, questions, 0, comboCount, isComboActive,
        comboTimeRemaining, true);
  }

  public Question question(int id) {
    return questions.stream().filter(q -> q.id() == id).findFirst().orElse(null);
  }
}
