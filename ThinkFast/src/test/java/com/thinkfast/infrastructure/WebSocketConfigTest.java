package com.thinkfast.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Answers.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;

class WebSocketConfigTest {

  @Test
  void splitsCommaSeparatedOrigins() {
    WebSocketConfig config = new WebSocketConfig(" http://a.test , http://b.test,,");

    assertThat(config.allowedOrigins()).containsExactly("http://a.test", "http://b.test");
  }

  @Test
  void sessionFramesAreHandledInArrivalOrder() {
    WebSocketConfig config = new WebSocketConfig("http://localhost:3000");
    StompEndpointRegistry endpoints = mock(StompEndpointRegistry.class, RETURNS_DEEP_STUBS);

    config.registerStompEndpoints(endpoints);

    verify(endpoints).setPreserveReceiveOrder(true);
    verify(endpoints).addEndpoint("/ws");
  }

  @Test
  void brokerKeepsPublishOrder() {
    WebSocketConfig config = new WebSocketConfig("*");
    MessageBrokerRegistry broker = mock(MessageBrokerRegistry.class, RETURNS_DEEP_STUBS);

    config.configureMessageBroker(broker);

    verify(broker).enableSimpleBroker("/topic", "/queue");
    verify(broker).setApplicationDestinationPrefixes("/app");
    verify(broker).setPreservePublishOrder(true);
  }
}
