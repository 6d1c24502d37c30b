package com.remindme.backend.guard.service;

import java.time.Duration;

/** The chat sent more requests than its window allows. */
public class RateLimitedException extends RuntimeException {

  private final long chatId;
  private final Duration window;

  public RateLimitedException(long chatId, Duration window) {
    super("Chat " + chatId + " exceeded its request rate");
    this.chatId = chatId;
    this.window = window;
  }

  public long getChatId() {
    return chatId;
  }

  public Duration getWindow() {
    return window;
  }
}
