package com.thinkfast.infrastructure;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket. Clients subscribe to {@code /topic/lobbies/{code}} for lobby events and
 * to {@code /user/queue/reply} and {@code /user/queue/errors} for direct replies.
 *
 * <p>Frames of one session are handled in arrival order, and messages to one session leave in
 * publish order, so a disconnect is never overtaken by an earlier join.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
  static final String ENDPOINT = "/ws";

  private final String[] allowedOrigins;

  public WebSocketConfig(@Value("${thinkfast.allowed-origins:*}") String allowedOrigins) {
    this.allowedOrigins =
        Arrays.stream(allowedOrigins.split(","))
            .map(String::trim)
            .filter(o -> !o.isEmpty())
            .toArray(String[]::new);
  }

  @Override
  public void configureMessageBroker(MessageBrokerRegistry registry) {
    registry.enableSimpleBroker("/topic", "/queue");
    registry.setApplicationDestinationPrefixes("/app");
    registry.setUserDestinationPrefix("/user");
    registry.setPreservePublishOrder(true);
  }

  @Override
  public void registerStompEndpoints(StompEndpointRegistry registry) {
    registry.setPreserveReceiveOrder(true);
    registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins).withSockJS();
  }

  String[] allowedOrigins() {
    return allowedOrigins.clone();
  }
}
