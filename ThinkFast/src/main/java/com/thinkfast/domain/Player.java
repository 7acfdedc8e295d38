package com.thinkfast.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public record Player(
    String id,
    String name,
    @JsonProperty("isHost") boolean isHost,
    @JsonProperty("isReady") boolean isReady,
    int score,
    int comboCount,
    List<Integer> answeredQuestionIds) {

  public Player {
    answeredQuestionIds = List.copyOf(answeredQuestionIds);
  }

  public static Player newcomer(String id, String name, boolean host) {
    return new Player(id, name, host, false, 0, 0, List.of());
  }

  public Player withHost(boolean host) {
    return new Player(id, name, host, isReady, score, comboCount, answeredQuestionIds);
  }

  public Player withReady(boolean ready) {
    return new Player(id, name, isHost, ready, score, comboCount, answeredQuestionIds);
  }

  public boolean hasAnswered(int questionId) {
    return answeredQuestionIds.contains(questionId);
  }

  /** Apply a scoring result for {@code questionId}. Score is clamped at zero. */
  public Player answered(int questionId, ScoreDelta d) {
    if (hasAnswered(questionId)) {
      throw new IllegalStateException("Question " + questionId + " already answered");
    }
    List<Integer> ids = new ArrayList<>(answeredQuestionIds);
    ids.add(questionId);
    return new Player(
        id, name, isHost, isReady, Math.max(0, score + d.delta()), d.newCombo(), ids);
  }

  /** Clear round progress. Host flag is kept. */
  public Player resetRound(boolean ready) {
    return new Player(id, name, isHost, ready, 0, 0, List.of());
  }
}
