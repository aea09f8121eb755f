package com.harness.noti.schedule;

import com.harness.noti.model.NotificationRecord;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Occurrence arithmetic on UTC instants. Every occurrence of a repeating notification lies on
 * the grid {@code base + k * interval}; nothing here reads the wall clock.
 */
public final class OccurrenceClock {

  private OccurrenceClock() {}

  /**
   * Next occurrence as shown to users.
   *
   * <p>A one-off notification reports its start time until it has been triggered, even if the
   * start already passed: the dispatch path still has to resolve it. A repeating notification
   * reports the first grid point after {@code now}, or {@code base} itself while {@code now} has
   * not reached it; nothing is reported past the end time.
   */
  public static Optional<Instant> nextOccurrence(Instant start,
                                                 boolean repeating,
                                                 Duration interval,
                                                 Instant endTime,
                                                 Instant lastTriggered,
                                                 Instant now) {
    if (!repeating || interval == null) {
      return lastTriggered != null ? Optional.empty() : Optional.of(start);
    }
    requirePositive(interval);
    Instant base = lastTriggered != null ? lastTriggered : start;
    if (!now.isAfter(base)) {
      return endTime != null && base.isAfter(endTime) ? Optional.empty() : Optional.of(base);
    }
    long missed = Duration.between(base, now).dividedBy(interval);
    return gridPoint(base, interval, missed + 1)
        .filter(next -> endTime == null || !next.isAfter(endTime));
  }

  public static Optional<Instant> nextOccurrence(NotificationRecord record, Instant now) {
    if (record.exhausted()) {
      return Optional.empty();
    }
    return nextOccurrence(
        record.startTime(),
        record.repeating(),
        record.intervalDuration().orElse(null),
        record.endTime(),
        record.lastTriggered(),
        now
    );
  }

  /**
   * Occurrences {@code base + k * interval} (k >= 1) that are already due and still inside the
   * late-delivery window: {@code t < now} and {@code now - t <= lateWindow}. Ascending.
   */
  public static List<Instant> missedOccurrences(Instant base,
                                                Duration interval,
                                                Instant now,
                                                Duration lateWindow) {
    requirePositive(interval);
    List<Instant> missed = new ArrayList<>();
    Instant cutoff = now.minus(lateWindow);
    long k = 1;
    if (cutoff.isAfter(base)) {
      k = Math.max(1, countBefore(base, interval, cutoff));
    }
    Optional<Instant> t = gridPoint(base, interval, k);
    while (t.isPresent() && t.get().isBefore(now)) {
      if (!t.get().isBefore(cutoff)) {
        missed.add(t.get());
      }
      t = after(t.get(), interval);
    }
    return missed;
  }

  /**
   * The occurrence a task restored from {@code record} targets first: the start time for a
   * record never triggered, otherwise the grid point after {@code lastTriggered}. Empty for a
   * one-off record that was already triggered, or when that grid point is past {@link Instant#MAX}.
   */
  public static Optional<Instant> pendingOccurrence(NotificationRecord record) {
    if (record.lastTriggered() == null) {
      return Optional.of(record.startTime());
    }
    return record.intervalDuration().flatMap(interval -> after(record.lastTriggered(), interval));
  }

  /** {@code occurrence + interval}, or empty when that is not a representable instant. */
  public static Optional<Instant> after(Instant occurrence, Duration interval) {
    return gridPoint(occurrence, interval, 1);
  }

  /** Number of grid points {@code first + k * interval} (k >= 0) strictly before {@code limit}. */
  public static long countBefore(Instant first, Duration interval, Instant limit) {
    requirePositive(interval);
    if (!first.isBefore(limit)) {
      return 0;
    }
    long whole = Duration.between(first, limit).dividedBy(interval);
    Instant last = first.plus(interval.multipliedBy(whole));
    return last.isBefore(limit) ? whole + 1 : whole;
  }

  private static Optional<Instant> gridPoint(Instant base, Duration interval, long k) {
    try {
      return Optional.of(base.plus(interval.multipliedBy(k)));
    } catch (DateTimeException | ArithmeticException e) {
      return Optional.empty();
    }
  }

  private static void requirePositive(Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive, got " + interval);
    }
  }
}
