package com.harness.noti.schedule;

import java.time.Instant;

/** Blocks the calling task until an absolute instant. Interruption cancels the wait. */
@FunctionalInterface
public interface Sleeper {

  /** Returns immediately when {@code target} is not in the future. */
  void sleepUntil(Instant target) throws InterruptedException;
}
