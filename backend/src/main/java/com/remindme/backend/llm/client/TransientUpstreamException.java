package com.remindme.backend.llm.client;

/** Rate-limit, connection or timeout failure of the language model call. */
public class TransientUpstreamException extends RuntimeException {

  private final UpstreamFailureKind kind;

  public TransientUpstreamException(UpstreamFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    if (!kind.isTransient()) {
      throw new IllegalArgumentException(kind + " is not a transient failure");
    }
    this.kind = kind;
  }

  public TransientUpstreamException(UpstreamFailureKind kind, String message) {
    this(kind, message, null);
  }

  public UpstreamFailureKind getKind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }
}
