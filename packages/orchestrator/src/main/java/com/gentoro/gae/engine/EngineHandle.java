package com.gentoro.gae.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * One remote engine instance acquired for an execution. The state machine owns the handle for the
 * duration of one request; only the status changes after creation.
 */
public final class EngineHandle {
  private final String id;
  private final String size;
  private final Instant createdAt;
  private final String engineUrl;
  private final boolean reused;
  private volatile EngineStatus status;

  /**
   * @param createdAt start of billing for this execution: provisioning time for new engines,
   *     acquisition time for reused ones
   * @param engineUrl base URL of the engine API, {@code null} while still provisioning
   */
  public EngineHandle(
      String id,
      String size,
      Instant createdAt,
      String engineUrl,
      boolean reused,
      EngineStatus status) {
    this.id = Objects.requireNonNull(id, "id");
    this.size = size;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.engineUrl = engineUrl;
    this.reused = reused;
    this.status = status == null ? EngineStatus.PROVISIONING : status;
  }

  public String id() {
    return id;
  }

  public String size() {
    return size;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public String engineUrl() {
    return engineUrl;
  }

  public boolean isReused() {
    return reused;
  }

  public EngineStatus status() {
    return status;
  }

  /** Copy carrying the engine API URL, once the remote reports it. */
  public EngineHandle withEngineUrl(String url) {
    return new EngineHandle(id, size, createdAt, url, reused, status);
  }

  public void markReady() {
    this.status = EngineStatus.READY;
  }

  public void markStopped() {
    this.status = EngineStatus.STOPPED;
  }

  public void markError() {
    this.status = EngineStatus.ERROR;
  }

  @Override
  public String toString() {
    return "EngineHandle{id=%s, size=%s, status=%s, reused=%s}".formatted(id, size, status, reused);
  }
}
