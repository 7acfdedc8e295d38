package com.thinkfast.infrastructure;

import com.thinkfast.application.port.LobbyPublisher;
import com.thinkfast.domain.LobbyBroadcast;
import com.thinkfast.dto.LobbyEventMessage;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Component
public class StompLobbyPublisher implements LobbyPublisher {
  static final String TOPIC_PREFIX = "/topic/lobbies/";

  private final SimpMessagingTemplate ws;

  public StompLobbyPublisher(SimpMessagingTemplate ws) {
    this.ws = ws;
  }

  @Override
  public void publish(LobbyBroadcast b) {
    ws.convertAndSend(TOPIC_PREFIX + b.code(), new LobbyEventMessage(b.event(), b.payload()));
  }
}
