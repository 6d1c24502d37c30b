package com.remindme.backend.llm.client;

public enum UpstreamFailureKind {
  /** Provider quota or "too many requests": fails fast, still counts toward the circuit. */
  QUOTA(true, false),
  CONNECTION(true, true),
  TIMEOUT(true, true),
  MALFORMED_RESPONSE(false, false),
  AUTHENTICATION(false, false),
  REJECTED(false, false);

  private final boolean transientFailure;
  private final boolean retryable;

  UpstreamFailureKind(boolean transientFailure, boolean retryable) {
    this.transientFailure = transientFailure;
    this.retryable = retryable;
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
