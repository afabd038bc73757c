package com.gentoro.gae.utility;

import java.time.Duration;

/** Blocking pause between polls and retries. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = d -> Thread.sleep(Math.max(0L, d.toMillis()));

  void sleep(Duration duration) throws InterruptedException;
}
