package com.remindme.backend.guard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum CircuitState {
  CLOSED("closed"),
  OPEN("open"),
  HALF_OPEN("half_open");

  private final String value;

  CircuitState(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static CircuitState fromValue(String value) {
    return Arrays.stream(values())
        .filter(state -> state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported circuit state: " + value));
  }
}
