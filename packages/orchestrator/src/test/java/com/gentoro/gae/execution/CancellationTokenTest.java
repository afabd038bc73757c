package com.gentoro.gae.execution;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.TimeoutExceededException;
import com.gentoro.gae.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  @DisplayName("cancelling a parent cancels linked children")
  void parentPropagates() {
    CancellationToken parent = CancellationToken.create();
    CancellationToken child = CancellationToken.linked(parent, null, null);

    assertFalse(child.isCancelled());
    parent.cancel("batch aborted");

    assertTrue(child.isCancelled());
    CancelledException e =
        assertThrows(CancelledException.class, () -> child.throwIfCancelled("graph load"));
    assertEquals("Cancelled during graph load (batch aborted)", e.getMessage());
  }

  @Test
  @DisplayName("cancelling a child leaves the parent alone")
  void childIsolated() {
    CancellationToken parent = CancellationToken.create();
    CancellationToken child = CancellationToken.linked(parent, null, null);

    child.cancel(null);

    assertTrue(child.isCancelled());
    assertFalse(parent.isCancelled());
  }

  @Test
  @DisplayName("a deadline expires with a timeout, not a cancellation")
  void deadline() {
    MutableClock clock = new MutableClock();
    CancellationToken token =
        CancellationToken.linked(
            CancellationToken.create(), clock.instant().plusSeconds(10), clock);

    assertEquals(Duration.ofSeconds(10), token.remaining());
    token.throwIfCancelled("poll");

    clock.advance(Duration.ofSeconds(11));

    assertTrue(token.isExpired());
    assertFalse(token.isCancelled());
    assertEquals(Duration.ZERO, token.remaining());
    assertThrows(TimeoutExceededException.class, () -> token.throwIfCancelled("poll"));
  }

  @Test
  @DisplayName("tokens without deadline have no remaining time")
  void noDeadline() {
    assertNull(CancellationToken.create().remaining());
    assertFalse(CancellationToken.create().isExpired());
  }
}
