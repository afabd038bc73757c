package com.gentoro.gae.exception;

import java.io.IOException;
import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or execution results. If
   * the throwable is a {@link GaeException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof GaeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          extractErrorMessage(ex),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        extractErrorMessage(t),
        classify(t),
        null,
        Instant.now());
  }

  /**
   * Best-effort classification of throwables that did not originate in the orchestrator, e.g.
   * an {@link IOException} leaking out of a driver.
   */
  public static GaeErrorCode classify(Throwable t) {
    if (t instanceof GaeException ex) return ex.getCode();
    if (t instanceof IOException) return GaeErrorCode.TRANSIENT_NETWORK_ERROR;
    if (t instanceof IllegalArgumentException) return GaeErrorCode.CONFIG_ERROR;
    return GaeErrorCode.UNKNOWN;
  }

  /**
   * Extract just the error message from a throwable, without stack trace information. Falls back
   * to the deepest cause carrying a message, then to the class name.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = t.getMessage();
    if (message != null && !message.isBlank()) {
      return message.trim();
    }
    Throwable current = t.getCause();
    while (current != null) {
      String nested = current.getMessage();
      if (nested != null && !nested.isBlank()) {
        return t.getClass().getSimpleName() + ": " + nested.trim();
      }
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }
}
