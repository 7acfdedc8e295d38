package com.thinkfast.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinLobbyRequest(
    @NotBlank @Size(min = 4, max = 4) String lobbyCode,
    @NotBlank @Size(max = 24) String playerName) {}
