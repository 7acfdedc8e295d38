package com.thinkfast.interfaces.rest;

import com.thinkfast.domain.Settings;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final long tickMillis;

  public ConfigController(@Value("${thinkfast.timer.tick-millis:1000}") long tickMillis) {
    this.tickMillis = tickMillis;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "defaultSettings", Settings.defaults(),
        "minDuration", Settings.MIN_DURATION,
        "maxDuration", Settings.MAX_DURATION,
        "minQuestions", Settings.MIN_QUESTIONS,
        "maxQuestions", Settings.MAX_QUESTIONS,
        "tickMillis", tickMillis,
        "protocolVersion", 1);
  }
}
