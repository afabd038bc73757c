package com.gentoro.gae.auth;

import com.gentoro.gae.exception.AuthException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hands out an externally issued token once. Later refreshes go to the fallback source, or fail
 * when there is none: the token cannot be renewed from here.
 */
public class PreIssuedTokenCredentialSource implements CredentialSource {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(PreIssuedTokenCredentialSource.class);

  private final String token;
  private final Duration validity;
  private final CredentialSource fallback;
  private final Clock clock;
  private final AtomicBoolean used = new AtomicBoolean(false);

  public PreIssuedTokenCredentialSource(
      String token, Duration validity, CredentialSource fallback, Clock clock) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
    this.token = token.trim();
    this.validity = validity;
    this.fallback = fallback;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public Credential obtain() {
    if (used.compareAndSet(false, true)) {
      log.debug("Using pre-issued access token");
      return new Credential(token, clock.instant(), validity);
    }
    if (fallback == null) {
      throw new AuthException(
          "Pre-issued access token needs renewal and no API key is configured to obtain a new one");
    }
    return fallback.obtain();
  }

  @Override
  public String describe() {
    return fallback == null ? "pre-issued token" : "pre-issued token, then " + fallback.describe();
  }
}
