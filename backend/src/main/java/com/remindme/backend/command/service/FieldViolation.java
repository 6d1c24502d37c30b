package com.remindme.backend.command.service;

/**
 * A single rejected field of a command. {@code field} is the property path inside the command
 * (for example {@code reminders[1].time}) and {@code rule} names the violated constraint.
 */
public record FieldViolation(String field, String rule, String message) {

  @Override
  public String toString() {
    return field + " (" + rule + "): " + message;
  }
}
