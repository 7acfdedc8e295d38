package com.thinkfast.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  /** Runs round countdown ticks. Kept apart from the broker's own scheduler. */
  @Bean
  public ThreadPoolTaskScheduler sessionTimerScheduler(
      @Value("${thinkfast.timer.pool-size:2}") int poolSize) {
    ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
    s.setPoolSize(poolSize);
    s.setThreadNamePrefix("session-timer-");
    s.setRemoveOnCancelPolicy(true);
    s.setWaitForTasksToCompleteOnShutdown(false);
    return s;
  }
}
