package com.thinkfast.dto;

import com.thinkfast.domain.Difficulty;
import com.thinkfast.domain.Settings;
import com.thinkfast.domain.SettingsPatch;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/** Partial settings update; omitted fields stay unchanged. */
public record UpdateSettingsRequest(
    Difficulty difficulty,
    @Min(Settings.MIN_DURATION) @Max(Settings.MAX_DURATION) Integer duration,
    @Min(Settings.MIN_QUESTIONS) @Max(Settings.MAX_QUESTIONS) Integer questionCount,
    SettingsPatch.OperationsPatch operations) {

  public SettingsPatch toPatch() {
    return new SettingsPatch(difficulty, duration, questionCount, operations);
  }
}
