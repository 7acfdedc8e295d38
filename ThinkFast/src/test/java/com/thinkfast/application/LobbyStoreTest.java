package com.thinkfast.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.thinkfast.domain.Lobby;
import com.thinkfast.domain.Player;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.Test;

class LobbyStoreTest {
  private final LobbyStore store = new LobbyStore();

  @Test
  void createRefusesTakenCode() {
    assertThat(store.create(Lobby.open("ABCD", Player.newcomer("a", "Ann", true)))).isTrue();
    assertThat(store.create(Lobby.open("ABCD", Player.newcomer("b", "Bob", true)))).isFalse();

    assertThat(store.get("ABCD").orElseThrow().host()).isEqualTo("a");
    assertThat(store.locateByConnection("b")).isEmpty();
  }

  @Test
  void putKeepsReverseIndexInStep() {
    Lobby lobby =
        Lobby.open("ABCD", Player.newcomer("a", "Ann", true))
            .withPlayerAdded(Player.newcomer("b", "Bob", false));
    store.create(lobby);
    assertThat(store.locateByConnection("b").map(Lobby::code)).contains("ABCD");

    store.put("ABCD", lobby.withPlayerRemoved("b").orElseThrow());

    assertThat(store.locateByConnection("b")).isEmpty();
    assertThat(store.codeOf("b")).isEmpty();
    assertThat(store.locateByConnection("a").map(Lobby::code)).contains("ABCD");
  }

  @Test
  void deleteUnmapsEveryPlayer() {
    store.create(
        Lobby.open("WXYZ", Player.newcomer("a", "Ann", true))
            .withPlayerAdded(Player.newcomer("b", "Bob", false)));

    store.delete("WXYZ");

    assertThat(store.get("WXYZ")).isEmpty();
    assertThat(store.exists("WXYZ")).isFalse();
    assertThat(store.codeOf("a")).isEmpty();
    assertThat(store.codeOf("b")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void deletingOldLobbyDoesNotUnmapPlayerWhoMovedOn() {
    store.create(Lobby.open("AAAA", Player.newcomer("a", "Ann", true)));
    store.create(
        Lobby.open("BBBB", Player.newcomer("b", "Bob", true))
            .withPlayerAdded(Player.newcomer("a", "Ann", false)));

    store.delete("AAAA");

    assertThat(store.codeOf("a")).contains("BBBB");
  }

  @Test
  void lockIsStablePerCode() {
    assertThat(store.lockFor("ABCD")).isSameAs(store.lockFor("ABCD"));
    assertThat(store.lockFor("ABCD")).isNotSameAs(store.lockFor("ABCE"));
  }

  @Test
  void closedConnectionsAreRemembered() {
    assertThat(store.isClosed("a")).isFalse();

    store.markClosed("a");

    assertThat(store.isClosed("a")).isTrue();
    assertThat(store.isClosed("b")).isFalse();
  }

  @Test
  void connectionLockIsStableUntilReleased() {
    ReentrantLock lock = store.lockForConnection("a");
    assertThat(store.lockForConnection("a")).isSameAs(lock);
    assertThat(store.lockForConnection("b")).isNotSameAs(lock);

    store.releaseConnection("a");

    assertThat(store.lockForConnection("a")).isNotSameAs(lock);
  }
}
