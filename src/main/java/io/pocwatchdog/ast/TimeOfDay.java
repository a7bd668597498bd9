package io.pocwatchdog.ast;

import java.time.LocalTime;

/**
 * Represents a time of day (hour and minute).
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 */
public record TimeOfDay(int hour, int minute) {
  /** Validates the hour and minute ranges. */
  public TimeOfDay {
    if (hour < 0 || hour > 23) {
      throw new IllegalArgumentException("hour out of range: " + hour);
    }
    if (minute < 0 || minute > 59) {
      throw new IllegalArgumentException("minute out of range: " + minute);
    }
  }

  /**
   * Converts this time to a java.time.LocalTime.
   *
   * @return the corresponding LocalTime
   */
  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute);
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
