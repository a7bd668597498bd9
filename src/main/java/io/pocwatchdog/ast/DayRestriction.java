package io.pocwatchdog.ast;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Represents a restriction on which days a trigger rule applies to.
 *
 * @param kind the type of restriction
 * @param calendarDay the day of month (only used when kind is CALENDAR_DAY)
 * @param weekday the day of week (only used when kind is WEEKDAY)
 */
public record DayRestriction(Kind kind, int calendarDay, Weekday weekday) {

  /** The type of day restriction. */
  public enum Kind {
    /** Matches every day. */
    NONE,
    /** Matches one day of the month (1-31). */
    CALENDAR_DAY,
    /** Matches one day of the week. */
    WEEKDAY
  }

  private static final DayRestriction NONE_INSTANCE = new DayRestriction(Kind.NONE, 0, null);

  /** Validates that the fields agree with the kind. */
  public DayRestriction {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.CALENDAR_DAY && (calendarDay < 1 || calendarDay > 31)) {
      throw new IllegalArgumentException("calendar day out of range: " + calendarDay);
    }
    if (kind == Kind.WEEKDAY) {
      Objects.requireNonNull(weekday, "weekday");
    }
  }

  /**
   * Creates a restriction that matches every day.
   *
   * @return the unrestricted instance
   */
  public static DayRestriction none() {
    return NONE_INSTANCE;
  }

  /**
   * Creates a restriction to one day of the month.
   *
   * @param day the day of month (1-31)
   * @return a new calendar-day restriction
   */
  public static DayRestriction calendarDay(int day) {
    return new DayRestriction(Kind.CALENDAR_DAY, day, null);
  }

  /**
   * Creates a restriction to one day of the week.
   *
   * @param weekday the weekday
   * @return a new weekday restriction
   */
  public static DayRestriction weekday(Weekday weekday) {
    return new DayRestriction(Kind.WEEKDAY, 0, weekday);
  }

  /**
   * Checks whether the given date satisfies this restriction.
   *
   * @param date the local date
   * @return true if the rule may fire on that date
   */
  public boolean matches(LocalDate date) {
    return switch (kind) {
      case NONE -> true;
      case CALENDAR_DAY -> date.getDayOfMonth() == calendarDay;
      case WEEKDAY -> Weekday.fromDayOfWeek(date.getDayOfWeek()) == weekday;
    };
  }
}
