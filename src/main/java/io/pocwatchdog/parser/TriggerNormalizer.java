package io.pocwatchdog.parser;

import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.Firing;
import io.pocwatchdog.ast.IntervalFiring;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.ast.TimepointFiring;
import java.util.ArrayList;
import java.util.List;

/** Turns one atomic schedule value into its firing descriptors. */
public final class TriggerNormalizer {
  /** Longest accepted interval: 100 years of 366 days. */
  public static final long MAX_INTERVAL_SECONDS = 100L * 366 * 86_400;

  private TriggerNormalizer() {}

  /**
   * Normalizes an atomic value.
   *
   * <p>A number gives one interval, a {@code HH:MM} string one timepoint, and a list the
   * concatenation of its elements' descriptors in list order. Lists do not nest.
   *
   * @param value the atomic value
   * @return the firing descriptors, never empty
   * @throws WatchdogException if the value is malformed or of an unsupported shape
   */
  public static List<Firing> normalize(ScheduleValue value) throws WatchdogException {
    if (value instanceof ScheduleValue.Items items) {
      if (items.items().isEmpty()) {
        throw WatchdogException.invalidSchedule("empty time list", items.toString());
      }
      List<Firing> firings = new ArrayList<>(items.items().size());
      for (ScheduleValue item : items.items()) {
        firings.add(normalizeScalar(item));
      }
      return firings;
    }
    return List.of(normalizeScalar(value));
  }

  private static Firing normalizeScalar(ScheduleValue value) throws WatchdogException {
    if (value instanceof ScheduleValue.Seconds s) {
      if (s.seconds() <= 0) {
        throw WatchdogException.invalidSchedule(
            "interval must be a positive number of seconds, got " + s.seconds(),
            s.toString());
      }
      if (s.seconds() > MAX_INTERVAL_SECONDS) {
        throw WatchdogException.invalidSchedule(
            "interval too large: "
                + s.seconds()
                + " seconds, at most "
                + MAX_INTERVAL_SECONDS
                + " allowed",
            s.toString());
      }
      return new IntervalFiring(s.seconds());
    }
    if (value instanceof ScheduleValue.Text t) {
      return new TimepointFiring(TimeParser.parse(t.text()));
    }
    if (value instanceof ScheduleValue.Items items) {
      throw WatchdogException.invalidSchedule("nested lists are not allowed", items.toString());
    }
    if (value instanceof ScheduleValue.Mapping m) {
      throw WatchdogException.invalidSchedule(
          "a mapping is only allowed at the top level", m.toString());
    }
    return rejectUnsupported(value);
  }

  private static Firing rejectUnsupported(ScheduleValue value) throws WatchdogException {
    Object raw = value instanceof ScheduleValue.Unsupported u ? u.raw() : value;
    if (raw instanceof Number) {
      throw WatchdogException.invalidSchedule(
          "interval must be a whole number of seconds, got " + raw, String.valueOf(raw));
    }
    String type = raw == null ? "null" : raw.getClass().getSimpleName();
    throw WatchdogException.invalidSchedule(
        "unsupported schedule value of type " + type, String.valueOf(raw));
  }
}
