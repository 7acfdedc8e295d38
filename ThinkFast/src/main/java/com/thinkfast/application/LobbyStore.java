package com.thinkfast.application;

import com.thinkfast.domain.Lobby;
import com.thinkfast.domain.Player;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of live lobbies.
 *
 * <p>Keeps the code-to-lobby map and the connection-to-code reverse index in step on every
 * write. Callers serialize work on one lobby with {@link #lockFor(String)}; writes for a code are
 * expected to happen while holding that code's lock.
 *
 * <p>Membership changes of one connection are serialized with {@link #lockForConnection(String)},
 * which is always taken before any lobby lock. Closed connections are remembered for a while so
 * their late frames can be refused.
 */
@Component
public class LobbyStore {
  private static final Logger log = LoggerFactory.getLogger(LobbyStore.class);

  private final Map<String, Lobby> lobbies = new ConcurrentHashMap<>();
  /** Connection-to-lobby reverse index. */
  private final Map<String, String> connectionLobby = new ConcurrentHashMap<>();
  /** One lock per code ever used; bounded by the 26^4 code space, never removed. */
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> connectionLocks = new ConcurrentHashMap<>();
  /** Closed connection ids and when they closed. */
  private final Map<String, Instant> closed = new ConcurrentHashMap<>();

  static final Duration CLOSED_RETENTION = Duration.ofMinutes(5);

  /**
   * Register a new lobby unless its code is taken.
   *
   * @return false if a lobby with the same code already exists
   */
  public boolean create(Lobby lobby) {
    if (lobbies.putIfAbsent(lobby.code(), lobby) != null) {
      return false;
    }
    lobby.players().forEach(p -> connectionLobby.put(p.id(), lobby.code()));
    return true;
  }

  public Optional<Lobby> get(String code) {
    return code == null ? Optional.empty() : Optional.ofNullable(lobbies.get(code));
  }

  /** Replace the lobby stored under {@code code} and reconcile the reverse index. */
  public void put(String code, Lobby lobby) {
    Lobby prev = lobbies.put(code, lobby);
    if (prev != null) {
      for (Player p : prev.players()) {
        if (!lobby.contains(p.id())) unmap(p.id(), code);
      }
    }
    lobby.players().forEach(p -> connectionLobby.put(p.id(), code));
  }

  public void delete(String code) {
    Lobby prev = lobbies.remove(code);
    if (prev == null) return;
    prev.players().forEach(p -> unmap(p.id(), code));
    log.info("Lobby {} removed.", code);
  }

  /** Find the lobby a connection currently belongs to. */
  public Optional<Lobby> locateByConnection(String connectionId) {
    if (connectionId == null) return Optional.empty();
    String code = connectionLobby.get(connectionId);
    if (code == null) return Optional.empty();
    Lobby lobby = lobbies.get(code);
    if (lobby == null || !lobby.contains(connectionId)) {
      // Stale entry left by a concurrent delete
      unmap(connectionId, code);
      return Optional.empty();
    }
    return Optional.of(lobby);
  }

  /** Code the connection is mapped to, without checking the lobby. */
  Optional<String> codeOf(String connectionId) {
    return connectionId == null
        ? Optional.empty()
        : Optional.ofNullable(connectionLobby.get(connectionId));
  }

  public ReentrantLock lockFor(String code) {
    return locks.computeIfAbsent(code, c -> new ReentrantLock());
  }

  public ReentrantLock lockForConnection(String connectionId) {
    return connectionLocks.computeIfAbsent(connectionId, c -> new ReentrantLock());
  }

  /** Drop the connection's lock once the connection is gone. */
  public void releaseConnection(String connectionId) {
    connectionLocks.remove(connectionId);
  }

  /** Remember that a connection closed; old entries are purged on the way. */
  public void markClosed(String connectionId) {
    Instant now = Instant.now();
    Instant cutoff = now.minus(CLOSED_RETENTION);
    closed.values().removeIf(at -> at.isBefore(cutoff));
    closed.put(connectionId, now);
  }

  public boolean isClosed(String connectionId) {
    return closed.containsKey(connectionId);
  }

  public boolean exists(String code) {
    return code != null && lobbies.containsKey(code);
  }

  public int size() {
    return lobbies.size();
  }

  private void unmap(String connectionId, String code) {
    connectionLobby.remove(connectionId, code);
  }
}
