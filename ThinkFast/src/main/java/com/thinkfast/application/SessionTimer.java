package com.thinkfast.application;

import com.thinkfast.application.port.LobbyPublisher;
import com.thinkfast.domain.Lobby;
import com.thinkfast.domain.LobbyBroadcast;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Per-lobby round countdown.
 *
 * <p>Each running round owns one {@link Handle}. Ticks run under the lobby lock from
 * {@link LobbyStore#lockFor(String)} and only act while their handle is still the current one for
 * the lobby, so once {@link #cancel(String)} returns (called under the same lock) that handle
 * never touches the store again.
 */
@Component
public class SessionTimer {
  private static final Logger log = LoggerFactory.getLogger(SessionTimer.class);

  private final LobbyStore store;
  private final LobbyPublisher publisher;
  private final TaskScheduler scheduler;
  private final Duration period;

  private final Map<String, Handle> running = new ConcurrentHashMap<>();

  public SessionTimer(
      LobbyStore store,
      LobbyPublisher publisher,
      @Qualifier("sessionTimerScheduler") TaskScheduler scheduler,
      @Value("${thinkfast.timer.tick-millis:1000}") long tickMillis) {
    if (tickMillis <= 0) throw new IllegalArgumentException("thinkfast.timer.tick-millis must be > 0");
    this.store = store;
    this.publisher = publisher;
    this.scheduler = scheduler;
    this.period = Duration.ofMillis(tickMillis);
  }

  /**
   * Start counting down the active round of {@code code}, replacing any previous countdown.
   * The caller must hold the lobby lock.
   */
  public void start(String code) {
    cancel(code);
    Handle h = new Handle(code);
    h.future = scheduler.scheduleAtFixedRate(() -> tick(h), Instant.now().plus(period), period);
    running.put(code, h);
    log.debug("Timer started for lobby {}", code);
  }

  /** Stop the countdown of {@code code} if one runs. The caller must hold the lobby lock. */
  public void cancel(String code) {
    Handle h = running.remove(code);
    if (h != null) {
      h.stop();
      log.debug("Timer cancelled for lobby {}", code);
    }
  }

  boolean isRunning(String code) {
    return running.containsKey(code);
  }

  @PreDestroy
  public void cancelAll() {
    running.keySet().forEach(this::cancel);
  }

  void tick(Handle h) {
    ReentrantLock lock = store.lockFor(h.code);
    lock.lock();
    try {
      if (h.stopped || running.get(h.code) != h) return;

      Optional<Lobby> current = store.get(h.code);
      if (current.isEmpty() || !current.get().gameState().isActive()) {
        finish(h);
        log.info("Timer cleared - lobby {} no longer running a round", h.code);
        return;
      }

      Lobby lobby = current.get();
      int left = Math.max(0, lobby.gameState().timeRemaining() - 1);
      Lobby ticked = lobby.withGameState(lobby.gameState().withTimeRemaining(left));
      store.put(h.code, ticked);
      publisher.publish(LobbyBroadcast.timerUpdate(h.code, left));

      if (left == 0) {
        finish(h);
        Lobby ended = ticked.withGameState(ticked.gameState().ended());
        store.put(h.code, ended);
        publisher.publish(LobbyBroadcast.gameEnded(h.code, ended.standings()));
        log.info("Game ended in lobby {} - timer reached zero", h.code);
      }
    } catch (RuntimeException e) {
      log.error("Timer tick failed for lobby {}", h.code, e);
      finish(h);
      endAfterFailure(h.code);
    } finally {
      lock.unlock();
    }
  }

  /** Close a round whose countdown broke so clients still see it end. */
  private void endAfterFailure(String code) {
    Optional<Lobby> current = store.get(code).filter(l -> l.gameState().isActive());
    if (current.isEmpty()) return;
    Lobby lobby = current.get();
    Lobby ended = lobby.withGameState(lobby.gameState().ended());
    store.put(code, ended);
    try {
      publisher.publish(LobbyBroadcast.gameEnded(code, ended.standings()));
    } catch (RuntimeException e) {
      log.error("Could not announce end of game in lobby {}", code, e);
    }
  }

  private void finish(Handle h) {
    running.remove(h.code, h);
    h.stop();
  }

  /** Cancellable countdown of one round. */
  static final class Handle {
    private final String code;
    private volatile ScheduledFuture<?> future;
    private volatile boolean stopped;

    Handle(String code) {
      this.code = code;
    }

    void stop() {
      stopped = true;
      ScheduledFuture<?> f = future;
      if (f != null) f.cancel(false);
    }
  }
}
