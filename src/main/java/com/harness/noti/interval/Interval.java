package com.harness.noti.interval;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repeat interval of a notification: a positive whole number of fixed-length units.
 *
 * <p>Accepted text is a number followed by a unit token, for example {@code 30m}, {@code 2 hours}
 * or {@code 1w}. Months and years are not supported because they have no fixed length.
 * Parsed intervals are at most {@link #MAX_DURATION} long.
 */
public record Interval(long value, IntervalUnit unit) {

  /** Longest interval accepted from user input, about a hundred years. */
  public static final Duration MAX_DURATION = Duration.ofDays(36_500);

  private static final Pattern TEXT = Pattern.compile(
      "^(\\d+)\\s*([smhdw])(?:ec(?:ond)?|in(?:ute)?|our|ay|(?:ee)?k)?s?$",
      Pattern.CASE_INSENSITIVE
  );

  public Interval {
    if (unit == null) {
      throw new IllegalArgumentException("unit must not be null");
    }
    if (value < 1) {
      throw new IllegalArgumentException("interval value must be >= 1, got " + value);
    }
  }

  /**
   * Parses interval text such as {@code 30m}, {@code 2h} or {@code 10 seconds}.
   *
   * @return the interval, or empty when the text is malformed, zero or longer than
   *     {@link #MAX_DURATION}
   */
  public static Optional<Interval> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = TEXT.matcher(text.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    long value;
    try {
      value = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    IntervalUnit unit = IntervalUnit.fromCode(matcher.group(2)).orElseThrow();
    if (!validate(value, unit)) {
      return Optional.empty();
    }
    return Optional.of(new Interval(value, unit));
  }

  public static boolean validate(long value, IntervalUnit unit) {
    return unit != null && value >= 1 && value <= MAX_DURATION.getSeconds() / unit.seconds();
  }

  /** @throws ArithmeticException when a stored value does not fit a {@link Duration} */
  public Duration toDuration() {
    return Duration.ofSeconds(Math.multiplyExact(value, unit.seconds()));
  }

  /** Compact form used for display and logs, e.g. {@code 30m}. */
  public String toText() {
    return value + String.valueOf(unit.code());
  }
}
