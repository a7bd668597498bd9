package io.pocwatchdog.ast;

import io.pocwatchdog.parser.WeekdayAliases;
import java.util.Optional;

/** Represents a day of the week. */
public enum Weekday {
  MONDAY(1, "monday"),
  TUESDAY(2, "tuesday"),
  WEDNESDAY(3, "wednesday"),
  THURSDAY(4, "thursday"),
  FRIDAY(5, "friday"),
  SATURDAY(6, "saturday"),
  SUNDAY(7, "sunday");

  private final int isoNumber;
  private final String displayName;

  Weekday(int isoNumber, String displayName) {
    this.isoNumber = isoNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a weekday alias such as "Mon", "tu", "7" or "周一".
   *
   * @param s the string to parse
   * @return the weekday if the alias is known
   * @see WeekdayAliases
   */
  public static Optional<Weekday> parse(String s) {
    return WeekdayAliases.lookup(s);
  }

  /**
   * Returns a Weekday from an ISO 8601 day number.
   *
   * @param n the ISO day number (1-7)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 1 || n > 7) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }
}
