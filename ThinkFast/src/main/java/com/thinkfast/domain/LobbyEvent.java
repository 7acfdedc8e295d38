package com.thinkfast.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outbound event names as clients know them. */
public enum LobbyEvent {
  LOBBY_UPDATED("lobby-updated"),
  GAME_STARTED("game-started"),
  TIMER_UPDATE("timer-update"),
  GAME_ENDED("game-ended"),
  ERROR("error");

  private final String wire;

  LobbyEvent(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }
}
