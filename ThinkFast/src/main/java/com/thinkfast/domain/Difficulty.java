package com.thinkfast.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Difficulty {
  EASY("easy", 20),
  MEDIUM("medium", 50),
  HARD("hard", 100);

  private final String wire;
  private final int maxOperand;

  Difficulty(String wire, int maxOperand) {
    this.wire = wire;
    this.maxOperand = maxOperand;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  /** Largest operand drawn for +, -, * and / at this difficulty. */
  public int maxOperand() {
    return maxOperand;
  }

  @JsonCreator
  public static Difficulty from(String s) {
    if (s == null) throw new IllegalArgumentException("Difficulty is required");
    String n = s.trim().toLowerCase(Locale.ROOT);
    for (Difficulty d : values()) {
      if (d.wire.equals(n)) return d;
    }
    throw new IllegalArgumentException("Unknown difficulty: " + s);
  }
}
