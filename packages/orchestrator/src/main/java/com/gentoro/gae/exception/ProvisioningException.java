package com.gentoro.gae.exception;

import com.gentoro.gae.engine.EngineHandle;
import java.util.Optional;

/**
 * An engine was created but never became ready. The handle of that engine is attached so the
 * caller can still tear it down. Never retried: a second attempt would provision another engine.
 */
public class ProvisioningException extends GaeException {
  private final transient EngineHandle orphan;

  public ProvisioningException(String message, EngineHandle orphan, Throwable cause) {
    super(
        cause instanceof GaeException gae ? gae.getCode() : GaeErrorCode.TIMEOUT_EXCEEDED,
        message,
        cause);
    this.orphan = orphan;
  }

  public Optional<EngineHandle> getOrphan() {
    return Optional.ofNullable(orphan);
  }
}
