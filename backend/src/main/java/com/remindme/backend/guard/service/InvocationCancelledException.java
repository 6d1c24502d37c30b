package com.remindme.backend.guard.service;

/** The invoking thread was interrupted while a guarded call was running or backing off. */
public class InvocationCancelledException extends RuntimeException {

  public InvocationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
