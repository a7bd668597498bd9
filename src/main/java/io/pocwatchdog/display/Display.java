package io.pocwatchdog.display;

import io.pocwatchdog.ast.DayRestriction;
import io.pocwatchdog.ast.Firing;
import io.pocwatchdog.ast.IntervalFiring;
import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.ast.TimepointFiring;
import io.pocwatchdog.ast.TriggerRule;
import java.util.stream.Collectors;

/** Renders resolved schedules as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders schedule data as a canonical string, one clause per rule separated by {@code "; "}.
   *
   * @param data the schedule data to render
   * @return the canonical string representation
   */
  public static String render(ScheduleData data) {
    return data.rules().stream().map(Display::renderRule).collect(Collectors.joining("; "));
  }

  /**
   * Renders one rule, e.g. {@code "every 30 seconds"}, {@code "every monday at 08:00"} or {@code
   * "on day 1 at 08:00"}.
   *
   * @param rule the rule to render
   * @return the canonical string representation
   */
  public static String renderRule(TriggerRule rule) {
    Firing firing = rule.firing();
    DayRestriction r = rule.restriction();
    if (firing instanceof IntervalFiring interval) {
      String base = renderInterval(interval);
      return switch (r.kind()) {
        case NONE -> base;
        case CALENDAR_DAY -> base + " on day " + r.calendarDay();
        case WEEKDAY -> base + " on " + r.weekday();
      };
    }
    TimepointFiring tp = (TimepointFiring) firing;
    return switch (r.kind()) {
      case NONE -> "every day at " + tp.time();
      case CALENDAR_DAY -> "on day " + r.calendarDay() + " at " + tp.time();
      case WEEKDAY -> "every " + r.weekday() + " at " + tp.time();
    };
  }

  private static String renderInterval(IntervalFiring interval) {
    if (interval.seconds() == 1) {
      return "every 1 second";
    }
    return String.format("every %d seconds", interval.seconds());
  }
}
