package com.thinkfast.domain;

public record Operations(
    boolean addition,
    boolean subtraction,
    boolean multiplication,
    boolean division,
    boolean exponents) {

  public static Operations defaults() {
    return new Operations(true, true, true, true, false);
  }

  /** Overlay the non-null flags of {@code p}; null flags keep their current value. */
  public Operations merge(SettingsPatch.OperationsPatch p) {
    if (p == null) return this;
    return new Operations(
        p.addition() != null ? p.addition() : addition,
        p.subtraction() != null ? p.subtraction() : subtraction,
        p.multiplication() != null ? p.multiplication() : multiplication,
        p.division() != null ? p.division() : division,
        p.exponents() != null ? p.exponents() : exponents);
  }
}
