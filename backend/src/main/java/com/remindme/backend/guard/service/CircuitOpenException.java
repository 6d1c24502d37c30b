package com.remindme.backend.guard.service;

/** The model circuit is open; the call was not attempted. */
public class CircuitOpenException extends RuntimeException {

  public CircuitOpenException(String circuitName, Throwable cause) {
    super("Circuit " + circuitName + " is open", cause);
  }
}
