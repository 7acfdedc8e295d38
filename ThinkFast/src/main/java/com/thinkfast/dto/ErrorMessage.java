package com.thinkfast.dto;

import com.thinkfast.domain.LobbyEvent;

public record ErrorMessage(LobbyEvent event, String payload) {
  public ErrorMessage(String message) {
    this(LobbyEvent.ERROR, message);
  }
}
