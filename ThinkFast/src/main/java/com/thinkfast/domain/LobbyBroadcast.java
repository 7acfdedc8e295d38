package com.thinkfast.domain;

import java.util.List;

public record LobbyBroadcast(String code, LobbyEvent event, Object payload) {
  public static LobbyBroadcast lobbyUpdated(Lobby l) {
    return new LobbyBroadcast(l.code(), LobbyEvent.LOBBY_UPDATED, l);
  }

  public static LobbyBroadcast gameStarted(Lobby l) {
    return new LobbyBroadcast(l.code(), LobbyEvent.GAME_STARTED, l.gameState());
  }

  public static LobbyBroadcast timerUpdate(String code, int secondsRemaining) {
    return new LobbyBroadcast(code, LobbyEvent.TIMER_UPDATE, secondsRemaining);
  }

  public static LobbyBroadcast gameEnded(String code, List<Player> standings) {
    return new LobbyBroadcast(code, LobbyEvent.GAME_ENDED, standings);
  }
}
