package com.gentoro.gae.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived bearer credential. Replaced wholesale on refresh, never mutated.
 *
 * @param token opaque bearer token
 * @param issuedAt when the token was obtained
 * @param validity how long the issuer considers the token valid
 */
public record Credential(String token, Instant issuedAt, Duration validity) {

  public Credential {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(validity, "validity");
  }

  public Instant expiresAt() {
    return issuedAt.plus(validity);
  }

  /**
   * Expired once {@code now >= issuedAt + validity - margin}, where the margin is {@code
   * refreshMargin} capped at half the validity. A token that lives no longer than the configured
   * margin is still used for the first half of its life.
   */
  public boolean isExpired(Instant now, Duration refreshMargin) {
    return !now.isBefore(expiresAt().minus(effectiveMargin(refreshMargin)));
  }

  Duration effectiveMargin(Duration refreshMargin) {
    if (refreshMargin == null || refreshMargin.isNegative()) return Duration.ZERO;
    Duration half = validity.dividedBy(2);
    return refreshMargin.compareTo(half) > 0 ? half : refreshMargin;
  }

  @Override
  public String toString() {
    return "Credential{token=%s, issuedAt=%s, validity=%s}"
        .formatted(mask(token), issuedAt, validity);
  }

  static String mask(String token) {
    if (token.length() <= 8) return "****";
    return token.substring(0, 4) + "****";
  }
}
