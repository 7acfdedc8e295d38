package com.thinkfast.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.thinkfast.application.port.LobbyPublisher;
import com.thinkfast.domain.GameState;
import com.thinkfast.domain.Lobby;
import com.thinkfast.domain.LobbyBroadcast;
import com.thinkfast.domain.LobbyEvent;
import com.thinkfast.domain.Player;
import com.thinkfast.domain.Question;
import com.thinkfast.domain.ScoreDelta;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class SessionTimerTest {
  private static final String CODE = "ABCD";

  @Mock private TaskScheduler scheduler;
  @Mock private LobbyPublisher publisher;
  @Mock private ScheduledFuture<Object> future;

  private final LobbyStore store = new LobbyStore();
  private SessionTimer timer;

  @BeforeEach
  void setUp() {
    timer = new SessionTimer(store, publisher, scheduler, 1000);
    doReturn(future)
        .when(scheduler)
        .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
  }

  private void openRound(int duration) {
    Lobby lobby =
        Lobby.open(CODE, Player.newcomer("a", "Ann", true))
            .withPlayerAdded(Player.newcomer("b", "Bob", false))
            .withGameState(
                GameState.started(List.of(new Question(1, "3 * 4", 12, "*")), duration));
    store.create(lobby);
  }

  private List<Runnable> scheduledTicks() {
    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler, atLeastOnce())
        .scheduleAtFixedRate(task.capture(), any(Instant.class), any(Duration.class));
    return task.getAllValues();
  }

  @Test
  void fiveSecondRoundTicksFiveTimesThenEnds() {
    openRound(5);
    timer.start(CODE);
    Runnable tick = scheduledTicks().get(0);

    for (int i = 0; i < 5; i++) tick.run();

    ArgumentCaptor<LobbyBroadcast> sent = ArgumentCaptor.forClass(LobbyBroadcast.class);
    verify(publisher, times(6)).publish(sent.capture());
    List<LobbyBroadcast> events = sent.getAllValues();
    assertThat(events.subList(0, 5))
        .extracting(LobbyBroadcast::payload)
        .containsExactly(4, 3, 2, 1, 0);
    assertThat(events.subList(0, 5))
        .extracting(LobbyBroadcast::event)
        .containsOnly(LobbyEvent.TIMER_UPDATE);
    assertThat(events.get(5).event()).isEqualTo(LobbyEvent.GAME_ENDED);

    Lobby ended = store.get(CODE).orElseThrow();
    assertThat(ended.gameState().timeRemaining()).isZero();
    assertThat(ended.gameState().isActive()).isFalse();
    assertThat(ended.gameState().isEnded()).isTrue();
    assertThat(ended.isGameActive()).isFalse();
    assertThat(timer.isRunning(CODE)).isFalse();
    verify(future).cancel(false);
  }

  @Test
  void finalStandingsAreSortedByScore() {
    openRound(1);
    Lobby lobby = store.get(CODE).orElseThrow();
    store.put(CODE, lobby.withPlayer("b", p -> p.answered(1, new ScoreDelta(100, 1))));
    timer.start(CODE);

    scheduledTicks().get(0).run();

    verify(publisher)
        .publish(
            LobbyBroadcast.gameEnded(CODE, store.get(CODE).orElseThrow().standings()));
    assertThat(store.get(CODE).orElseThrow().standings())
        .extracting(Player::id)
        .containsExactly("b", "a");
  }

  @Test
  void tickAfterEndDoesNothing() {
    openRound(1);
    timer.start(CODE);
    Runnable tick = scheduledTicks().get(0);
    tick.run();
    Lobby ended = store.get(CODE).orElseThrow();

    tick.run();

    verify(publisher, times(2)).publish(any());
    assertThat(store.get(CODE).orElseThrow()).isEqualTo(ended);
  }

  @Test
  void cancelledTimerNeverTouchesTheLobby() {
    openRound(10);
    timer.start(CODE);
    Runnable tick = scheduledTicks().get(0);

    timer.cancel(CODE);
    tick.run();

    verify(future).cancel(false);
    verify(publisher, never()).publish(any());
    assertThat(store.get(CODE).orElseThrow().gameState().timeRemaining()).isEqualTo(10);
  }

  @Test
  void restartingReplacesThePreviousCountdown() {
    openRound(10);
    timer.start(CODE);
    timer.start(CODE);
    List<Runnable> ticks = scheduledTicks();
    assertThat(ticks).hasSize(2);

    ticks.get(0).run();
    verify(publisher, never()).publish(any());

    ticks.get(1).run();
    verify(publisher).publish(LobbyBroadcast.timerUpdate(CODE, 9));
  }

  @Test
  void deletedLobbyStopsTheTimer() {
    openRound(10);
    timer.start(CODE);
    Runnable tick = scheduledTicks().get(0);

    store.delete(CODE);
    tick.run();

    assertThat(timer.isRunning(CODE)).isFalse();
    verify(future).cancel(false);
    verify(publisher, never()).publish(any());
  }

  @Test
  void cancelAllStopsEveryRound() {
    openRound(10);
    timer.start(CODE);

    timer.cancelAll();

    assertThat(timer.isRunning(CODE)).isFalse();
    verify(future).cancel(false);
  }

  @Test
  void failedTickStillAnnouncesTheEnd() {
    openRound(10);
    lenient()
        .doThrow(new IllegalStateException("broker down"))
        .when(publisher)
        .publish(argThat(b -> b != null && b.event() == LobbyEvent.TIMER_UPDATE));
    timer.start(CODE);
    Runnable tick = scheduledTicks().get(0);

    tick.run();

    Lobby ended = store.get(CODE).orElseThrow();
    assertThat(ended.gameState().isEnded()).isTrue();
    assertThat(ended.isGameActive()).isFalse();
    verify(publisher).publish(LobbyBroadcast.gameEnded(CODE, ended.standings()));
    assertThat(timer.isRunning(CODE)).isFalse();
    verify(future).cancel(false);

    tick.run();
    verify(publisher, times(2)).publish(any());
  }
}
