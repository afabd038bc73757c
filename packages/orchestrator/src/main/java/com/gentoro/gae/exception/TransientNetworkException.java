package com.gentoro.gae.exception;

/**
 * Timeout, connection reset or 5xx answer from a remote API. Retryable until the retry policy
 * gives up, at which point it is rethrown as a fatal instance (see {@link #exhausted}).
 */
public class TransientNetworkException extends GaeException {
  private final int statusCode;
  private final boolean exhausted;

  public TransientNetworkException(String message, int statusCode) {
    this(message, statusCode, null, false);
  }

  public TransientNetworkException(String message, Throwable cause) {
    this(message, 0, cause, false);
  }

  private TransientNetworkException(
      String message, int statusCode, Throwable cause, boolean exhausted) {
    super(GaeErrorCode.TRANSIENT_NETWORK_ERROR, message, cause);
    this.statusCode = statusCode;
    this.exhausted = exhausted;
  }

  /** Fatal copy produced once the attempt limit is reached. */
  public static TransientNetworkException exhausted(
      String operation, int attempts, TransientNetworkException last) {
    return new TransientNetworkException(
        "%s failed after %d attempts: %s".formatted(operation, attempts, last.getMessage()),
        last.statusCode,
        last,
        true);
  }

  /** HTTP status of the failed call, or 0 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }

  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public boolean isRetryable() {
    return !exhausted;
  }
}
