package com.gentoro.gae.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.support.MutableClock;
import com.gentoro.gae.support.StaticCredentialSource;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PreIssuedTokenCredentialSourceTest {
  private final MutableClock clock = new MutableClock();

  @Test
  @DisplayName("the pre-issued token is handed out once, then the fallback takes over")
  void fallsBack() {
    StaticCredentialSource fallback = new StaticCredentialSource(clock);
    PreIssuedTokenCredentialSource source =
        new PreIssuedTokenCredentialSource(" issued ", Duration.ofHours(24), fallback, clock);

    assertEquals("issued", source.obtain().token());
    assertEquals("token-1", source.obtain().token());
    assertEquals(1, fallback.calls());
  }

  @Test
  @DisplayName("without a fallback the token cannot be renewed")
  void noFallback() {
    PreIssuedTokenCredentialSource source =
        new PreIssuedTokenCredentialSource("issued", Duration.ofHours(24), null, clock);

    source.obtain();
    assertThrows(AuthException.class, source::obtain);
  }

  @Test
  @DisplayName("blank tokens are rejected")
  void blankRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PreIssuedTokenCredentialSource(" ", Duration.ofHours(1), null, clock));
  }
}
