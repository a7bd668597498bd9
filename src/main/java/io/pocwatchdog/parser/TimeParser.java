package io.pocwatchdog.parser;

import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.TimeOfDay;

/** Strict parser for {@code HH:MM} wall-clock times. */
public final class TimeParser {
  private TimeParser() {}

  /**
   * Parses a time of day. Exactly two hour digits, a colon and two minute digits are accepted;
   * no surrounding whitespace, seconds or am/pm suffix.
   *
   * @param input the text to parse
   * @return the parsed time
   * @throws WatchdogException if the input is not a valid {@code HH:MM} time
   */
  public static TimeOfDay parse(String input) throws WatchdogException {
    if (input == null
        || input.length() != 5
        || !isDigit(input.charAt(0))
        || !isDigit(input.charAt(1))
        || input.charAt(2) != ':'
        || !isDigit(input.charAt(3))
        || !isDigit(input.charAt(4))) {
      throw WatchdogException.invalidSchedule(
          "invalid time '" + input + "', expected HH:MM", input);
    }

    int hour = Integer.parseInt(input.substring(0, 2));
    int minute = Integer.parseInt(input.substring(3, 5));
    if (hour > 23 || minute > 59) {
      throw WatchdogException.invalidSchedule(
          "time out of range '" + input + "', expected 00:00 to 23:59", input);
    }
    return new TimeOfDay(hour, minute);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
