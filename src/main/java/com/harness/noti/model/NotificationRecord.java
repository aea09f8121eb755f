package com.harness.noti.model;

import com.harness.noti.interval.Interval;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of one scheduled notification.
 *
 * <p>Only {@code maxOccurrences} and {@code lastTriggered} change over a record's life; the
 * dispatch path replaces its snapshot through {@link #withProgress} after each occurrence.
 */
public record NotificationRecord(
    Long id,
    long guildId,
    long channelId,
    long userId,
    Instant startTime,
    String message,
    boolean repeating,
    Interval interval,
    Instant endTime,
    Integer maxOccurrences,
    Instant lastTriggered,
    Instant createdAt
) {

  public NotificationRecord {
    if (startTime == null) {
      throw new IllegalArgumentException("startTime must not be null");
    }
    if (message == null) {
      throw new IllegalArgumentException("message must not be null");
    }
    if (repeating && interval == null) {
      throw new IllegalArgumentException("repeating notification requires an interval");
    }
    if (!repeating && interval != null) {
      throw new IllegalArgumentException("one-off notification must not have an interval");
    }
  }

  public static NotificationRecord oneOff(long guildId, long channelId, long userId,
                                          Instant startTime, String message) {
    return new NotificationRecord(null, guildId, channelId, userId, startTime, message,
        false, null, null, null, null, null);
  }

  public static NotificationRecord repeating(long guildId, long channelId, long userId,
                                             Instant startTime, String message, Interval interval,
                                             Instant endTime, Integer maxOccurrences) {
    return new NotificationRecord(null, guildId, channelId, userId, startTime, message,
        true, interval, endTime, maxOccurrences, null, null);
  }

  public Destination destination() {
    return new Destination(guildId, channelId);
  }

  public Optional<Duration> intervalDuration() {
    return interval != null ? Optional.of(interval.toDuration()) : Optional.empty();
  }

  /** True when {@code occurrence} lies after the end time, i.e. must never be dispatched. */
  public boolean endsBefore(Instant occurrence) {
    return endTime != null && occurrence.isAfter(endTime);
  }

  public boolean hasEnded(Instant occurrence) {
    return exhausted() || endsBefore(occurrence);
  }

  /** Remaining occurrences, or empty for an unbounded record. */
  public Optional<Integer> remainingOccurrences() {
    return Optional.ofNullable(maxOccurrences);
  }

  public boolean exhausted() {
    return maxOccurrences != null && maxOccurrences <= 0;
  }

  public NotificationRecord withId(long newId) {
    return new NotificationRecord(newId, guildId, channelId, userId, startTime, message,
        repeating, interval, endTime, maxOccurrences, lastTriggered, createdAt);
  }

  public NotificationRecord withProgress(Instant newLastTriggered, Integer newMaxOccurrences) {
    return new NotificationRecord(id, guildId, channelId, userId, startTime, message,
        repeating, interval, endTime, newMaxOccurrences, newLastTriggered, createdAt);
  }
}
