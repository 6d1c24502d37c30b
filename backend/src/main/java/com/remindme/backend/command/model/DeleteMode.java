package com.remindme.backend.command.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeleteMode {
  BY_FILTER("by_filter"),
  LAST_N("last_n");

  private final String value;

  DeleteMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static DeleteMode fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (DeleteMode mode : values()) {
      if (mode.value.equalsIgnoreCase(raw.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown delete mode: " + raw);
  }
}
