package com.harness.noti.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sleeps against an absolute target rather than a relative delay, re-reading the clock at
 * least once a minute so a corrected system clock does not leave the task asleep.
 */
public final class ClockSleeper implements Sleeper {

  private static final long MAX_SLICE_MS = 60_000L;

  private final Clock clock;

  public ClockSleeper(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  @Override
  public void sleepUntil(Instant target) throws InterruptedException {
    while (true) {
      long remaining = Duration.between(clock.instant(), target).toMillis();
      if (remaining <= 0) {
        return;
      }
      TimeUnit.MILLISECONDS.sleep(Math.min(remaining, MAX_SLICE_MS));
    }
  }
}
