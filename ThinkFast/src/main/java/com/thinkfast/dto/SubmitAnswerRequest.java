package com.thinkfast.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record SubmitAnswerRequest(
    @NotNull @Positive Integer questionId,
    @NotNull @Size(max = 16) String answer,
    @NotNull @PositiveOrZero Long timeTaken) {}
