package com.remindme.backend.llm.client;

/** Malformed model output, authentication failure or a rejected request. Never retried. */
public class PermanentUpstreamException extends RuntimeException {

  private final UpstreamFailureKind kind;

  public PermanentUpstreamException(UpstreamFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    if (kind.isTransient()) {
      throw new IllegalArgumentException(kind + " is a transient failure");
    }
    this.kind = kind;
  }

  public PermanentUpstreamException(UpstreamFailureKind kind, String message) {
    this(kind, message, null);
  }

  public UpstreamFailureKind getKind() {
    return kind;
  }
}
