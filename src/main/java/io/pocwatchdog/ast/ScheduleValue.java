package io.pocwatchdog.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The caller-facing "when to run" value before resolution.
 *
 * <p>There are 5 shapes:
 *
 * <ul>
 *   <li>{@link Seconds} - {@code 30}: every 30 seconds
 *   <li>{@link Text} - {@code "08:00"}: every day at 08:00
 *   <li>{@link Items} - {@code ["08:00", "12:00"]}: every day at each listed time
 *   <li>{@link Mapping} - {@code {1: "08:00", "mon": 3600}}: per calendar day or weekday
 *   <li>{@link Unsupported} - anything else, rejected during resolution
 * </ul>
 */
public sealed interface ScheduleValue
    permits ScheduleValue.Seconds,
        ScheduleValue.Text,
        ScheduleValue.Items,
        ScheduleValue.Mapping,
        ScheduleValue.Unsupported {

  /**
   * An interval in whole seconds.
   *
   * @param seconds the interval (validated during resolution)
   */
  record Seconds(long seconds) implements ScheduleValue {
    @Override
    public String toString() {
      return Long.toString(seconds);
    }
  }

  /**
   * A textual time of day, expected as {@code HH:MM}.
   *
   * @param text the raw text
   */
  record Text(String text) implements ScheduleValue {
    /** Validates non-null text. */
    public Text {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
      return "\"" + text + "\"";
    }
  }

  /**
   * An ordered list of atomic values.
   *
   * @param items the list elements
   */
  record Items(List<ScheduleValue> items) implements ScheduleValue {
    /** Creates a new Items with a defensive copy. */
    public Items {
      items = List.copyOf(items);
    }

    @Override
    public String toString() {
      return items.toString();
    }
  }

  /**
   * A mapping from calendar day or weekday keys to atomic values.
   *
   * @param entries the entries, in insertion order
   */
  record Mapping(Map<MappingKey, ScheduleValue> entries) implements ScheduleValue {
    /** Creates a new Mapping with an order-preserving defensive copy. */
    public Mapping {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public String toString() {
      return entries.toString();
    }
  }

  /**
   * A value of a type no schedule shape accepts.
   *
   * @param raw the raw value (may be null)
   */
  record Unsupported(Object raw) implements ScheduleValue {
    @Override
    public String toString() {
      return String.valueOf(raw);
    }
  }

  /**
   * Creates an interval value.
   *
   * @param seconds the interval in seconds
   * @return a new Seconds value
   */
  static ScheduleValue seconds(long seconds) {
    return new Seconds(seconds);
  }

  /**
   * Creates a time of day value.
   *
   * @param time the time as {@code HH:MM}
   * @return a new Text value
   */
  static ScheduleValue at(String time) {
    return new Text(time);
  }

  /**
   * Creates a list of time of day values.
   *
   * @param times the times as {@code HH:MM}
   * @return a new Items value
   */
  static ScheduleValue at(String... times) {
    return new Items(Arrays.stream(times).<ScheduleValue>map(Text::new).toList());
  }

  /**
   * Starts building a mapping value.
   *
   * @return a new mapping builder
   */
  static MappingBuilder mapping() {
    return new MappingBuilder();
  }

  /**
   * Converts a plain Java value into a ScheduleValue.
   *
   * <p>Integral numbers become {@link Seconds}, strings {@link Text}, lists {@link Items} and maps
   * {@link Mapping}. Map keys that are integral numbers become calendar days, string keys become
   * weekday aliases. Everything else becomes {@link Unsupported}.
   *
   * @param raw the plain value
   * @return the corresponding ScheduleValue
   */
  static ScheduleValue of(Object raw) {
    if (raw instanceof ScheduleValue value) {
      return value;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return new Seconds(((Number) raw).longValue());
    }
    if (raw instanceof String s) {
      return new Text(s);
    }
    if (raw instanceof List<?> list) {
      List<ScheduleValue> items = new ArrayList<>();
      for (Object item : list) {
        items.add(of(item));
      }
      return new Items(items);
    }
    if (raw instanceof Map<?, ?> map) {
      Map<MappingKey, ScheduleValue> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        entries.put(MappingKey.of(entry.getKey()), of(entry.getValue()));
      }
      return new Mapping(entries);
    }
    return new Unsupported(raw);
  }

  /** Fluent builder for {@link Mapping} values. */
  final class MappingBuilder {
    private final Map<MappingKey, ScheduleValue> entries = new LinkedHashMap<>();

    private MappingBuilder() {}

    /**
     * Adds an entry keyed by calendar day.
     *
     * @param day the day of month (1-31)
     * @param value the schedule for that day
     * @return this builder
     */
    public MappingBuilder day(int day, ScheduleValue value) {
      entries.put(new MappingKey.CalendarDayKey(day), value);
      return this;
    }

    /**
     * Adds an entry keyed by a weekday alias.
     *
     * @param alias the weekday alias, e.g. "mon"
     * @param value the schedule for that weekday
     * @return this builder
     */
    public MappingBuilder named(String alias, ScheduleValue value) {
      entries.put(new MappingKey.NamedKey(alias), value);
      return this;
    }

    /**
     * Builds the mapping.
     *
     * @return a new Mapping value
     */
    public ScheduleValue build() {
      return new Mapping(entries);
    }
  }
}
