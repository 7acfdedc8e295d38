package com.thinkfast.application;

import com.thinkfast.application.port.LobbyPublisher;
import com.thinkfast.application.port.QuestionGenerator;
import com.thinkfast.domain.GameState;
import com.thinkfast.domain.Lobby;
import com.thinkfast.domain.LobbyBroadcast;
import com.thinkfast.domain.Player;
import com.thinkfast.domain.Question;
import com.thinkfast.domain.ScoreDelta;
import com.thinkfast.domain.ScoringEngine;
import com.thinkfast.domain.Settings;
import com.thinkfast.domain.SettingsPatch;
import com.thinkfast.dto.LobbyReply;
import com.thinkfast.dto.ReadyReply;
import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lobby and round orchestration.
 *
 * <p>Responsibilities:
 * - Create/join/leave lobbies and keep exactly one host per lobby
 * - Ready toggling and host-only settings changes
 * - Start rounds, score answers and reset back to the lobby
 * - Publish real-time updates to clients
 *
 * <p>Lobbies are immutable values owned by {@link LobbyStore}. Every action takes the lobby's
 * lock, re-reads the lobby, validates, writes the next value back with a single put and publishes
 * before releasing the lock. At most one lobby lock is held at a time.
 *
 * <p>Create, join, leave and disconnect first take the caller's connection lock, then at most one
 * lobby lock at a time. A connection therefore sits in at most one lobby, and frames that arrive
 * after its disconnect cannot add it back.
 *
 * <p>Create, join and toggle-ready answer the caller with a reply. The other actions have no
 * reply channel: invalid requests are logged and ignored.
 */
@Service
public class LobbyCoordinator {
  private static final String CODE_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
  private static final int CODE_LENGTH = 4;
  private static final int MAX_CODE_ATTEMPTS = 64;

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final SecureRandom rnd = new SecureRandom();

  private final LobbyStore store;
  private final SessionTimer timer;
  private final QuestionGenerator questions;
  private final LobbyPublisher publisher;

  public LobbyCoordinator(
      LobbyStore store, SessionTimer timer, QuestionGenerator questions, LobbyPublisher publisher) {
    this.store = store;
    this.timer = timer;
    this.questions = questions;
    this.publisher = publisher;
  }

  /**
   * Create a lobby with the caller as its only player and host.
   *
   * <p>A caller already sitting in a lobby leaves it first.
   *
   * @param sid connection id of the creator
   * @param playerName display name
   * @return reply carrying the new lobby, or the failure reason
   */
  public LobbyReply createLobby(String sid, String playerName) {
    String name = cleanName(playerName);
    if (name == null) {
      return LobbyReply.failure("Player name is required");
    }
    ReentrantLock conn = store.lockForConnection(sid);
    conn.lock();
    try {
      if (store.isClosed(sid)) {
        return LobbyReply.failure("Connection closed");
      }
      removeFromLobby(sid);
      Lobby lobby = register(Player.newcomer(sid, name, true));
      log.info(
          "Created lobby {} with host {} ({}), {} lobbies open", lobby.code(), name, sid,
          store.size());
      return LobbyReply.ok(lobby);
    } catch (RuntimeException e) {
      log.error("Error creating lobby for {}", sid, e);
      return LobbyReply.failure("Failed to create lobby");
    } finally {
      conn.unlock();
    }
  }

  /**
   * Join an existing lobby as a non-host, non-ready player.
   *
   * <p>Behavior:
   * - If the caller is in a different lobby, it leaves that lobby first.
   * - If the caller is already in this lobby, the current lobby is returned unchanged.
   * - A connection that already disconnected is refused.
   *
   * @param sid connection id
   * @param lobbyCode lobby code (case-insensitive)
   * @param playerName display name
   * @return reply carrying the joined lobby, or the failure reason
   */
  public LobbyReply joinLobby(String sid, String lobbyCode, String playerName) {
    String name = cleanName(playerName);
    if (name == null) {
      return LobbyReply.failure("Player name is required");
    }
    String code = norm(lobbyCode);
    ReentrantLock conn = store.lockForConnection(sid);
    conn.lock();
    try {
      if (store.isClosed(sid)) {
        return LobbyReply.failure("Connection closed");
      }
      if (!store.exists(code)) {
        return LobbyReply.failure("Lobby not found");
      }
      Optional<String> prev = lobbyCodeOf(sid);
      if (prev.isPresent() && !prev.get().equals(code)) {
        removeFromLobby(sid);
      }

      ReentrantLock lock = store.lockFor(code);
      lock.lock();
      try {
        Optional<Lobby> current = store.get(code);
        if (current.isEmpty()) {
          return LobbyReply.failure("Lobby not found");
        }
        Lobby lobby = current.get();
        if (lobby.contains(sid)) {
          return LobbyReply.ok(lobby);
        }
        Lobby next = lobby.withPlayerAdded(Player.newcomer(sid, name, false));
        store.put(code, next);
        publisher.publish(LobbyBroadcast.lobbyUpdated(next));
        log.info("Player {} ({}) joined lobby {}", name, sid, code);
        return LobbyReply.ok(next);
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException e) {
      log.error("Error joining lobby {} for {}", code, sid, e);
      return LobbyReply.failure("Failed to join lobby");
    } finally {
      conn.unlock();
    }
  }

  /**
   * Remove the caller from its lobby.
   *
   * <p>If nobody is left the lobby is deleted and its timer stopped. If the host left, the first
   * remaining player in join order becomes host.
   *
   * @param sid connection id to remove
   */
  public void leaveLobby(String sid) {
    ReentrantLock conn = store.lockForConnection(sid);
    conn.lock();
    try {
      removeFromLobby(sid);
    } finally {
      conn.unlock();
    }
  }

  /**
   * Handle a closed connection: leave its lobby and refuse any of its frames still in flight.
   *
   * @param sid connection id that went away
   */
  public void disconnect(String sid) {
    ReentrantLock conn = store.lockForConnection(sid);
    conn.lock();
    try {
      store.markClosed(sid);
      removeFromLobby(sid);
    } finally {
      conn.unlock();
      store.releaseConnection(sid);
    }
  }

  /**
   * Flip the caller's ready flag.
   *
   * @param sid connection id
   * @return reply carrying the new ready flag, or the failure reason
   */
  public ReadyReply toggleReady(String sid) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) {
      return ReadyReply.failure("Player not found in any lobby");
    }
    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) {
        return ReadyReply.failure("Player not found in any lobby");
      }
      Lobby next = current.get().withPlayer(sid, p -> p.withReady(!p.isReady()));
      boolean ready = next.player(sid).map(Player::isReady).orElse(false);
      store.put(next.code(), next);
      publisher.publish(LobbyBroadcast.lobbyUpdated(next));
      log.info("Player {} toggled ready to {} in lobby {}", sid, ready, next.code());
      return ReadyReply.ok(ready);
    } catch (RuntimeException e) {
      log.error("Error toggling ready status for {}", sid, e);
      return ReadyReply.failure("Failed to toggle ready status");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Merge a partial settings update. Host only; an out-of-range value rejects the whole update.
   *
   * @param sid connection id of the caller
   * @param patch fields to change
   */
  public void updateSettings(String sid, SettingsPatch patch) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) {
      log.debug("Player {} tried to update settings but is not in any lobby", sid);
      return;
    }
    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) return;
      Lobby lobby = current.get();
      if (!lobby.isHost(sid)) {
        log.debug("Player {} tried to update settings but is not the host", sid);
        return;
      }

      Settings merged;
      try {
        merged = lobby.settings().merge(patch);
      } catch (IllegalArgumentException e) {
        log.debug("Rejected settings update in lobby {}: {}", lobby.code(), e.getMessage());
        return;
      }
      Lobby next = lobby.withSettings(merged);
      store.put(lobby.code(), next);
      publisher.publish(LobbyBroadcast.lobbyUpdated(next));
      log.info("Host {} updated settings in lobby {}: {}", sid, lobby.code(), merged);
    } catch (RuntimeException e) {
      log.error("Error updating settings for {}", sid, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Start a round. Host only, every player must be ready and no round may be running.
   *
   * <p>Generates the question batch, clears each player's round progress, sets the clock to the
   * configured duration and starts the lobby's {@link SessionTimer}.
   *
   * @param sid connection id of the caller
   */
  public void startGame(String sid) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) {
      log.debug("Player {} tried to start game but is not in any lobby", sid);
      return;
    }
    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) return;
      Lobby lobby = current.get();
      if (!lobby.isHost(sid)) {
        log.debug("Player {} tried to start game but is not the host", sid);
        return;
      }
      if (lobby.gameState().isActive()) {
        log.debug("Host tried to start game in lobby {} but a round is running", lobby.code());
        return;
      }
      if (!lobby.allReady()) {
        log.debug("Host tried to start game in lobby {} but not all players are ready", lobby.code());
        return;
      }

      List<Question> batch = questions.generate(lobby.settings());
      Lobby next =
          lobby
              .withEveryPlayer(p -> p.resetRound(p.isReady()))
              .withGameState(GameState.started(batch, lobby.settings().duration()));
      timer.start(lobby.code());
      store.put(lobby.code(), next);
      publisher.publish(LobbyBroadcast.gameStarted(next));
      log.info("Host started game in lobby {} with {} questions", lobby.code(), batch.size());
    } catch (RuntimeException e) {
      log.error("Error starting game for {}", sid, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Score an answer to one question of the running round. Each question counts once per player.
   *
   * @param sid connection id of the caller
   * @param questionId id of the answered question
   * @param answer the player's answer as typed
   * @param timeTakenMs time the player took to answer
   */
  public void submitAnswer(String sid, int questionId, String answer, long timeTakenMs) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) return;

    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) return;
      Lobby lobby = current.get();
      if (!lobby.isGameActive()) {
        log.debug("Answer from {} ignored, no round running in lobby {}", sid, lobby.code());
        return;
      }
      Question q = lobby.gameState().question(questionId);
      if (q == null) {
        log.debug("Answer from {} ignored, unknown question {}", sid, questionId);
        return;
      }
      Player player = lobby.player(sid).orElseThrow();
      if (player.hasAnswered(questionId)) {
        log.info("Player {} submitted a duplicate answer for question {}.", player.name(), questionId);
        return;
      }

      boolean correct = isCorrect(q, answer);
      ScoreDelta d = ScoringEngine.score(player.comboCount(), correct, timeTakenMs);
      Lobby next = lobby.withPlayer(sid, p -> p.answered(questionId, d));
      store.put(lobby.code(), next);
      publisher.publish(LobbyBroadcast.lobbyUpdated(next));

      Player updated = next.player(sid).orElseThrow();
      log.info(
          "Player {} answered. Correct: {}. Score change: {}. New score: {}. Combo: {}",
          updated.name(),
          correct,
          d.delta(),
          updated.score(),
          updated.comboCount());
    } catch (RuntimeException e) {
      log.error("Error submitting answer for {}", sid, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Bring an ended round back to the lobby. Host only, and only after the round has ended.
   *
   * <p>Clears every player's score, ready flag, combo and answers; the host keeps the host role.
   *
   * @param sid connection id of the caller
   */
  public void returnToLobby(String sid) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) return;

    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) return;
      Lobby lobby = current.get();
      if (!lobby.isHost(sid)) {
        log.debug("Player {} tried to return to lobby but is not the host", sid);
        return;
      }
      if (!lobby.gameState().isEnded()) {
        log.debug("Return to lobby ignored, game in lobby {} has not ended", lobby.code());
        return;
      }

      timer.cancel(lobby.code());
      Lobby next =
          lobby.withEveryPlayer(p -> p.resetRound(false)).withGameState(GameState.empty());
      store.put(lobby.code(), next);
      publisher.publish(LobbyBroadcast.lobbyUpdated(next));
      log.info("Host returned lobby {} to lobby state", lobby.code());
    } catch (RuntimeException e) {
      log.error("Error returning to lobby for {}", sid, e);
    } finally {
      lock.unlock();
    }
  }

  // Helpers

  /** Take {@code sid} out of its lobby. The caller holds the connection lock. */
  private void removeFromLobby(String sid) {
    Optional<String> code = lobbyCodeOf(sid);
    if (code.isEmpty()) return;

    ReentrantLock lock = store.lockFor(code.get());
    lock.lock();
    try {
      Optional<Lobby> current = memberLobby(code.get(), sid);
      if (current.isEmpty()) return;
      Lobby lobby = current.get();

      Optional<Lobby> rest = lobby.withPlayerRemoved(sid);
      if (rest.isEmpty()) {
        timer.cancel(lobby.code());
        store.delete(lobby.code());
        log.info("Lobby {} is empty and has been deleted.", lobby.code());
        return;
      }
      Lobby next = rest.get();
      store.put(lobby.code(), next);
      publisher.publish(LobbyBroadcast.lobbyUpdated(next));
      if (lobby.isHost(sid)) {
        log.info(
            "Host left lobby {}. New host is {}.",
            lobby.code(),
            next.player(next.host()).map(Player::name).orElse(next.host()));
      }
    } catch (RuntimeException e) {
      log.error("Error removing {} from lobby {}", sid, code.get(), e);
    } finally {
      lock.unlock();
    }
  }

  /** Normalize a lobby code (trim and upper-case). */
  private String norm(String code) {
    return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
  }

  private String cleanName(String name) {
    if (name == null) return null;
    String n = name.trim();
    return n.isEmpty() ? null : n;
  }

  private Optional<String> lobbyCodeOf(String sid) {
    return store.locateByConnection(sid).map(Lobby::code);
  }

  /** Re-read the lobby under its lock; empty if the caller is no longer part of it. */
  private Optional<Lobby> memberLobby(String code, String sid) {
    return store.get(code).filter(l -> l.contains(sid));
  }

  private boolean isCorrect(Question q, String answer) {
    return answer != null && answer.trim().equals(Integer.toString(q.answer()));
  }

  /**
   * Store a new lobby under a fresh random code.
   *
   * @throws IllegalStateException if no free code was found
   */
  private Lobby register(Player host) {
    for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
      Lobby lobby = Lobby.open(newLobbyCode(), host);
      if (store.create(lobby)) {
        return lobby;
      }
      log.debug("Lobby code {} already in use, retrying", lobby.code());
    }
    throw new IllegalStateException("No free lobby code after " + MAX_CODE_ATTEMPTS + " attempts");
  }

  /** Four uniform letters A-Z. */
  String newLobbyCode() {
    StringBuilder sb = new StringBuilder(CODE_LENGTH);
    for (int i = 0; i < CODE_LENGTH; i++) {
      sb.append(CODE_CHARS.charAt(rnd.nextInt(CODE_CHARS.length())));
    }
    return sb.toString();
  }
}
