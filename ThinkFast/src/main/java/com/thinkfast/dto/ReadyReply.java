package com.thinkfast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReadyReply(boolean success, @JsonProperty("isReady") Boolean isReady, String error) {
  public static ReadyReply ok(boolean ready) {
    return new ReadyReply(true, ready, null);
  }

  public static ReadyReply failure(String error) {
    return new ReadyReply(false, null, error);
  }
}
