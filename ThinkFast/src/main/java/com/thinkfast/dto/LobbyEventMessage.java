package com.thinkfast.dto;

import com.thinkfast.domain.LobbyEvent;

/** Envelope for everything sent on a lobby topic. */
public record LobbyEventMessage(LobbyEvent event, Object payload) {}
