package io.pocwatchdog.parser;

import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.DayRestriction;
import io.pocwatchdog.ast.Firing;
import io.pocwatchdog.ast.MappingKey;
import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.ast.TriggerRule;
import io.pocwatchdog.ast.Weekday;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Resolves a top-level schedule value into the trigger rules of a schedule. */
public final class ScheduleResolver {
  private final List<TriggerRule> rules = new ArrayList<>();

  private ScheduleResolver() {}

  /**
   * Resolves a schedule value.
   *
   * <p>Numbers, strings and lists apply every day. A mapping restricts each of its values to the
   * calendar day or weekday named by the key. Rules are returned in input order.
   *
   * @param value the schedule value
   * @return the resolved schedule data
   * @throws WatchdogException if the value is invalid
   */
  public static ScheduleData resolve(ScheduleValue value) throws WatchdogException {
    if (value == null) {
      throw WatchdogException.invalidSchedule("schedule is required", null);
    }
    ScheduleResolver resolver = new ScheduleResolver();
    if (value instanceof ScheduleValue.Mapping mapping) {
      resolver.resolveMapping(mapping);
    } else {
      resolver.add(value, DayRestriction.none());
    }
    return new ScheduleData(resolver.rules);
  }

  private void resolveMapping(ScheduleValue.Mapping mapping) throws WatchdogException {
    if (mapping.entries().isEmpty()) {
      throw WatchdogException.invalidSchedule("empty schedule mapping", mapping.toString());
    }
    for (Map.Entry<MappingKey, ScheduleValue> entry : mapping.entries().entrySet()) {
      add(entry.getValue(), classify(entry.getKey()));
    }
  }

  private void add(ScheduleValue value, DayRestriction restriction) throws WatchdogException {
    for (Firing firing : TriggerNormalizer.normalize(value)) {
      rules.add(new TriggerRule(firing, restriction));
    }
  }

  private static DayRestriction classify(MappingKey key) throws WatchdogException {
    if (key instanceof MappingKey.CalendarDayKey day) {
      if (day.day() < 1 || day.day() > 31) {
        throw WatchdogException.invalidSchedule(
            "calendar day out of range: " + day.day() + ", expected 1 to 31", key.toString());
      }
      return DayRestriction.calendarDay(day.day());
    }
    if (key instanceof MappingKey.NamedKey named) {
      Weekday weekday =
          WeekdayAliases.lookup(named.name())
              .orElseThrow(
                  () ->
                      WatchdogException.invalidSchedule(
                          "invalid day of week: '" + named.name() + "'", named.name()));
      return DayRestriction.weekday(weekday);
    }
    MappingKey.UnsupportedKey unsupported = (MappingKey.UnsupportedKey) key;
    Object raw = unsupported.raw();
    String type = raw == null ? "null" : raw.getClass().getSimpleName();
    throw WatchdogException.invalidSchedule(
        "invalid schedule key type: " + type, String.valueOf(raw));
  }
}
