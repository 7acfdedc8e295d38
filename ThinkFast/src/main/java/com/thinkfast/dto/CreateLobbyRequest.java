package com.thinkfast.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateLobbyRequest(@NotBlank @Size(max = 24) String playerName) {}
