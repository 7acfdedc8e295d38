package com.thinkfast.domain;

/**
 * Partial settings update sent by the host. A null component means "leave unchanged".
 */
public record SettingsPatch(
    Difficulty difficulty, Integer duration, Integer questionCount, OperationsPatch operations) {

  public record OperationsPatch(
      Boolean addition,
      Boolean subtraction,
      Boolean multiplication,
      Boolean division,
      Boolean exponents) {}
}
