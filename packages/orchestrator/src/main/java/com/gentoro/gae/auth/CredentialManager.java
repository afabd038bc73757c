package com.gentoro.gae.auth;

import com.gentoro.gae.exception.AuthException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the current {@link Credential} and refreshes it shortly before expiry.
 *
 * <p>Readers go lock-free against the cached value. A refresh takes an exclusive lock and
 * re-checks the cache, so callers that find the credential expired at the same time collapse into
 * a single call to the {@link CredentialSource}. A failed refresh is always fatal for the caller.
 */
public class CredentialManager {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(CredentialManager.class);

  private final CredentialSource source;
  private final Duration refreshMargin;
  private final Clock clock;
  private final ReentrantLock refreshLock = new ReentrantLock();
  private final AtomicInteger refreshCount = new AtomicInteger();
  private volatile Credential current;

  public CredentialManager(CredentialSource source, Duration refreshMargin, Clock clock) {
    this.source = source;
    this.refreshMargin = refreshMargin == null ? Duration.ZERO : refreshMargin;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /** Cached credential if still fresh, otherwise a newly obtained one. */
  public Credential getCredential() {
    Credential c = current;
    if (c != null && !c.isExpired(clock.instant(), refreshMargin)) {
      return c;
    }
    refreshLock.lock();
    try {
      c = current;
      if (c != null && !c.isExpired(clock.instant(), refreshMargin)) {
        return c;
      }
      return refresh(c == null ? "no cached credential" : "credential about to expire");
    } finally {
      refreshLock.unlock();
    }
  }

  /** Obtain a new credential regardless of the cached one. */
  public Credential forceRefresh() {
    refreshLock.lock();
    try {
      return refresh("forced");
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Refresh only if {@code rejected} is still the cached credential. Used when a remote call
   * answers 401: concurrent rejections of the same token trigger one refresh.
   */
  public Credential refreshIfCurrent(Credential rejected) {
    refreshLock.lock();
    try {
      Credential c = current;
      if (c != null && c != rejected) {
        return c;
      }
      return refresh("credential rejected by remote");
    } finally {
      refreshLock.unlock();
    }
  }

  /** Drop the cached credential; the next call obtains a new one. */
  public void invalidate() {
    current = null;
  }

  /** Number of completed calls to the credential source. */
  public int refreshCount() {
    return refreshCount.get();
  }

  private Credential refresh(String reason) {
    if (source == null) {
      throw new AuthException("No credential source configured");
    }
    log.debug("Refreshing credential via {} ({})", source.describe(), reason);
    Credential fresh;
    try {
      fresh = source.obtain();
    } catch (AuthException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AuthException("Credential refresh via " + source.describe() + " failed", e);
    }
    if (fresh == null) {
      throw new AuthException(source.describe() + " returned no credential");
    }
    refreshCount.incrementAndGet();
    current = fresh;
    log.info("Credential refreshed via {}, valid until {}", source.describe(), fresh.expiresAt());
    return fresh;
  }
}
