package com.thinkfast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.thinkfast.domain.Lobby;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LobbyReply(boolean success, Lobby lobby, String error) {
  public static LobbyReply ok(Lobby lobby) {
    return new LobbyReply(true, lobby, null);
  }

  public static LobbyReply failure(String error) {
    return new LobbyReply(false, null, error);
  }
}
