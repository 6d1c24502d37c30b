package com.remindme.backend.command.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterMode {
  ALL("all"),
  TODAY("today"),
  STATUS("status"),
  SEARCH("search"),
  INTERVAL("interval"),
  ID("id");

  private final String value;

  FilterMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static FilterMode fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (FilterMode mode : values()) {
      if (mode.value.equalsIgnoreCase(raw.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown filter mode: " + raw);
  }
}
