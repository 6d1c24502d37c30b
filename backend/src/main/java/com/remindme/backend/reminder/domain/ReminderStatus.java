package com.remindme.backend.reminder.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReminderStatus {
  PENDING("pending"),
  SENT("sent"),
  CANCELLED("cancelled");

  private final String value;

  ReminderStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ReminderStatus fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (ReminderStatus status : values()) {
      if (status.value.equalsIgnoreCase(raw.trim())) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown reminder status: " + raw);
  }
}
