package com.remindme.backend.reminder.scheduler;

public class ReminderDeliveryException extends RuntimeException {

  public ReminderDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
