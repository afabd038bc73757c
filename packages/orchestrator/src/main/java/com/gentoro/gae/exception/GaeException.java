package com.gentoro.gae.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the orchestrator. Carries an error code, the retry classification
 * and optional structured context for logging.
 */
public class GaeException extends RuntimeException {
  private final GaeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public GaeException(GaeErrorCode code, String message) {
    super(message);
    this.code = code == null ? GaeErrorCode.UNKNOWN : code;
  }

  public GaeException(GaeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? GaeErrorCode.UNKNOWN : code;
  }

  public GaeErrorCode getCode() {
    return code;
  }

  /** Whether the failed operation may succeed if attempted again. */
  public boolean isRetryable() {
    return false;
  }

  public GaeException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
