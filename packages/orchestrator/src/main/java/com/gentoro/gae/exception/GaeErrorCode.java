package com.gentoro.gae.exception;

/** Classification attached to every {@link GaeException}. */
public enum GaeErrorCode {
  /** Credential acquisition or refresh failed. Never retried. */
  AUTH_ERROR,
  /** Malformed request or missing configuration. Never retried. */
  CONFIG_ERROR,
  /** Timeout, connection reset or 5xx answer. Retried up to the configured limit. */
  TRANSIENT_NETWORK_ERROR,
  /** The remote API refused a request (4xx other than auth) or answered with garbage. */
  REQUEST_REJECTED,
  /** The engine reported a failed job. */
  JOB_FAILED,
  /** Stored results failed a sanity check on the target collection. */
  RESULT_INVALID,
  /** A job did not reach a terminal state within its wait budget. */
  TIMEOUT_EXCEEDED,
  /** Engine teardown failed; the engine may still be running. */
  CLEANUP_ERROR,
  /** The caller cancelled the execution. */
  CANCELLED,
  UNKNOWN
}
