package com.thinkfast.application.port;

import com.thinkfast.domain.LobbyBroadcast;

public interface LobbyPublisher {
  void publish(LobbyBroadcast b);
}
