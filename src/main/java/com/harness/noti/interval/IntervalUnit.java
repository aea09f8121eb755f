package com.harness.noti.interval;

import java.util.Locale;
import java.util.Optional;

public enum IntervalUnit {
  SECOND('s', 1L),
  MINUTE('m', 60L),
  HOUR('h', 3_600L),
  DAY('d', 86_400L),
  WEEK('w', 7L * 86_400L);

  private final char code;
  private final long seconds;

  IntervalUnit(char code, long seconds) {
    this.code = code;
    this.seconds = seconds;
  }

  /** Single-letter code used in persisted rows and in interval text ("30m"). */
  public char code() {
    return code;
  }

  public long seconds() {
    return seconds;
  }

  public static Optional<IntervalUnit> fromCode(String code) {
    if (code == null || code.length() != 1) {
      return Optional.empty();
    }
    char c = code.toLowerCase(Locale.ROOT).charAt(0);
    for (IntervalUnit unit : values()) {
      if (unit.code == c) {
        return Optional.of(unit);
      }
    }
    return Optional.empty();
  }
}
