package com.thinkfast.interfaces.ws;

import com.thinkfast.application.LobbyCoordinator;
import com.thinkfast.dto.CreateLobbyRequest;
import com.thinkfast.dto.ErrorMessage;
import com.thinkfast.dto.JoinLobbyRequest;
import com.thinkfast.dto.LobbyReply;
import com.thinkfast.dto.ReadyReply;
import com.thinkfast.dto.SubmitAnswerRequest;
import com.thinkfast.dto.UpdateSettingsRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Validated
@Controller
public class LobbyWsController {
  private static final Logger log = LoggerFactory.getLogger(LobbyWsController.class);

  private final LobbyCoordinator lobbies;

  public LobbyWsController(LobbyCoordinator lobbies) {
    this.lobbies = lobbies;
  }

  @MessageMapping("/create-lobby")
  @SendToUser("/queue/reply")
  public LobbyReply create(@Valid CreateLobbyRequest req, @Header("simpSessionId") String sid) {
    return lobbies.createLobby(sid, req.playerName());
  }

  @MessageMapping("/join-lobby")
  @SendToUser("/queue/reply")
  public LobbyReply join(@Valid JoinLobbyRequest req, @Header("simpSessionId") String sid) {
    return lobbies.joinLobby(sid, req.lobbyCode(), req.playerName());
  }

  @MessageMapping("/leave-lobby")
  public void leave(@Header("simpSessionId") String sid) {
    log.debug("Player {} is leaving lobby", sid);
    lobbies.leaveLobby(sid);
  }

  @MessageMapping("/toggle-ready")
  @SendToUser("/queue/reply")
  public ReadyReply toggleReady(@Header("simpSessionId") String sid) {
    return lobbies.toggleReady(sid);
  }

  @MessageMapping("/update-settings")
  public void updateSettings(
      @Valid UpdateSettingsRequest req, @Header("simpSessionId") String sid) {
    lobbies.updateSettings(sid, req.toPatch());
  }

  @MessageMapping("/start-game")
  public void start(@Header("simpSessionId") String sid) {
    lobbies.startGame(sid);
  }

  @MessageMapping("/submit-answer")
  public void submitAnswer(@Valid SubmitAnswerRequest req, @Header("simpSessionId") String sid) {
    lobbies.submitAnswer(sid, req.questionId(), req.answer(), req.timeTaken());
  }

  @MessageMapping("/return-to-lobby")
  public void returnToLobby(@Header("simpSessionId") String sid) {
    lobbies.returnToLobby(sid);
  }

  @MessageExceptionHandler(Exception.class)
  @SendToUser("/queue/errors")
  public ErrorMessage onError(Exception e) {
    if (e instanceof MethodArgumentNotValidException) {
      log.debug("Rejected invalid message: {}", e.getMessage());
      return new ErrorMessage("Invalid request");
    }
    log.warn("Message handling failed: {}", e.getMessage());
    return new ErrorMessage(e.getMessage() != null ? e.getMessage() : "Request failed");
  }

  @EventListener
  public void onConnect(SessionConnectedEvent e) {
    log.info("Player connected: {}", e.getMessage().getHeaders().get("simpSessionId"));
  }

  @EventListener
  public void onDisconnect(SessionDisconnectEvent e) {
    log.info("Player disconnected: {}", e.getSessionId());
    lobbies.disconnect(e.getSessionId());
  }
}
