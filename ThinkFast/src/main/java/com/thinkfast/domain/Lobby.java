package com.thinkfast.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable lobby value. Every transition returns a new instance; the store replaces the old one
 * wholesale. Player order is join order.
 */
public record Lobby(
    String code,
    List<Player> players,
    Settings settings,
    GameState gameState,
    String host,
    @JsonProperty("isGameActive") boolean isGameActive) {

  public Lobby {
    players = List.copyOf(players);
  }

  public static Lobby open(String code, Player host) {
    return new Lobby(
        code, List.of(host.withHost(true)), Settings.defaults(), GameState.empty(), host.id(),
        false);
  }

  public Optional<Player> player(String id) {
    return players.stream().filter(p -> p.id().equals(id)).findFirst();
  }

  public boolean contains(String id) {
    return player(id).isPresent();
  }

  public boolean isHost(String id) {
    return host.equals(id);
  }

  public boolean allReady() {
    return players.stream().allMatch(Player::isReady);
  }

  public Lobby withPlayerAdded(Player p) {
    List<Player> next = new ArrayList<>(players);
    next.add(p);
    return new Lobby(code, next, settings, gameState, host, isGameActive);
  }

  /**
   * Remove a player. If the host leaves, the first remaining player (join order) takes over.
   *
   * @return the remaining lobby, or empty if nobody is left
   */
  public Optional<Lobby> withPlayerRemoved(String id) {
    List<Player> rest = players.stream().filter(p -> !p.id().equals(id)).toList();
    if (rest.isEmpty()) return Optional.empty();
    String nextHost = host.equals(id) ? rest.get(0).id() : host;
    List<Player> fixed = rest.stream().map(p -> p.withHost(p.id().equals(nextHost))).toList();
    return Optional.of(new Lobby(code, fixed, settings, gameState, nextHost, isGameActive));
  }

  public Lobby withPlayer(String id, UnaryOperator<Player> change) {
    List<Player> next =
        players.stream().map(p -> p.id().equals(id) ? change.apply(p) : p).toList();
    return new Lobby(code, next, settings, gameState, host, isGameActive);
  }

  public Lobby withEveryPlayer(UnaryOperator<Player> change) {
    return new Lobby(
        code, players.stream().map(change).toList(), settings, gameState, host, isGameActive);
  }

  public Lobby withSettings(Settings s) {
    return new Lobby(code, players, s, gameState, host, isGameActive);
  }

  /** Replace the game state; {@code isGameActive} follows {@code gameState.isActive}. */
  public Lobby withGameState(GameState g) {
    return new Lobby(code, players, settings, g, host, g.isActive());
  }

  /** Players by score, highest first. Equal scores keep join order. */
  public List<Player> standings() {
    return players.stream().sorted(Comparator.comparingInt(Player::score).reversed()).toList();
  }
}
