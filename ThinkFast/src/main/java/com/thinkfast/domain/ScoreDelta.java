package com.thinkfast.domain;

public record ScoreDelta(int delta, int newCombo) {}
