package com.thinkfast.domain;

public record Question(int id, String equation, int answer, String operation) {}
