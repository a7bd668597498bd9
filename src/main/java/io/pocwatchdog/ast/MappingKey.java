package io.pocwatchdog.ast;

import java.util.Objects;

/**
 * Sealed interface for keys of a {@link ScheduleValue.Mapping}.
 *
 * <ul>
 *   <li>{@link CalendarDayKey} - a numeric key, the day of the month
 *   <li>{@link NamedKey} - a textual key, looked up as a weekday alias
 *   <li>{@link UnsupportedKey} - any other key type, rejected during resolution
 * </ul>
 */
public sealed interface MappingKey
    permits MappingKey.CalendarDayKey, MappingKey.NamedKey, MappingKey.UnsupportedKey {

  /**
   * A numeric key.
   *
   * @param day the day of month (validated during resolution)
   */
  record CalendarDayKey(int day) implements MappingKey {
    @Override
    public String toString() {
      return Integer.toString(day);
    }
  }

  /**
   * A textual key.
   *
   * @param name the raw key text
   */
  record NamedKey(String name) implements MappingKey {
    /** Validates non-null name. */
    public NamedKey {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return "\"" + name + "\"";
    }
  }

  /**
   * A key of a type no mapping accepts.
   *
   * @param raw the raw key (may be null)
   */
  record UnsupportedKey(Object raw) implements MappingKey {
    @Override
    public String toString() {
      return String.valueOf(raw);
    }
  }

  /**
   * Converts a plain Java map key.
   *
   * @param raw the key
   * @return a calendar day key for integral numbers, a named key for strings, else unsupported
   */
  static MappingKey of(Object raw) {
    if (raw instanceof MappingKey key) {
      return key;
    }
    if (raw instanceof Integer || raw instanceof Short) {
      return new CalendarDayKey(((Number) raw).intValue());
    }
    if (raw instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
      return new CalendarDayKey(l.intValue());
    }
    if (raw instanceof String s) {
      return new NamedKey(s);
    }
    return new UnsupportedKey(raw);
  }
}
