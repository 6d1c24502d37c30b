package com.remindme.backend.reminder.service;

/** The reminder store failed; the command that hit it had no effect. */
public class ReminderStoreException extends RuntimeException {

  private final String operation;

  public ReminderStoreException(String operation, Throwable cause) {
    super("Reminder store failed during " + operation, cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
