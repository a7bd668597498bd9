package io.pocwatchdog;

import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.ast.TriggerRule;
import io.pocwatchdog.display.Display;
import io.pocwatchdog.eval.Evaluator;
import io.pocwatchdog.parser.JsonScheduleReader;
import io.pocwatchdog.parser.ScheduleResolver;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * The main entry point for resolving and inspecting schedules.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Schedule schedule = Schedule.parse("{\"mon\": [\"08:00\", \"12:00\"], \"15\": 3600}");
 * Optional<ZonedDateTime> next = schedule.nextFrom(ZonedDateTime.now());
 * if (next.isPresent()) {
 *     System.out.println("Next run: " + next.get());
 * }
 * }</pre>
 */
public final class Schedule {
  private final ScheduleData data;

  private Schedule(ScheduleData data) {
    this.data = data;
  }

  /**
   * Resolves a schedule value into a Schedule.
   *
   * @param value the schedule value
   * @return the resolved schedule
   * @throws WatchdogException if the value is invalid
   */
  public static Schedule resolve(ScheduleValue value) throws WatchdogException {
    return new Schedule(ScheduleResolver.resolve(value));
  }

  /**
   * Resolves a plain Java value such as {@code 30}, {@code "08:00"}, a list or a map.
   *
   * @param raw the plain value
   * @return the resolved schedule
   * @throws WatchdogException if the value is invalid
   * @see ScheduleValue#of(Object)
   */
  public static Schedule of(Object raw) throws WatchdogException {
    return resolve(ScheduleValue.of(raw));
  }

  /**
   * Parses a JSON schedule into a Schedule.
   *
   * @param json the JSON text
   * @return the resolved schedule
   * @throws WatchdogException if the text or the schedule is invalid
   * @see JsonScheduleReader
   */
  public static Schedule parse(String json) throws WatchdogException {
    return resolve(JsonScheduleReader.read(json));
  }

  /**
   * Validates a JSON schedule without throwing.
   *
   * @param json the JSON text
   * @return true if the schedule is valid
   */
  public static boolean validate(String json) {
    try {
      parse(json);
      return true;
    } catch (WatchdogException e) {
      return false;
    }
  }

  /**
   * Computes the next run after the given time, as a freshly started loop would see it.
   *
   * @param now the reference time
   * @return the next run, or empty if none exists
   */
  public Optional<ZonedDateTime> nextFrom(ZonedDateTime now) {
    return Evaluator.nextFrom(data, now);
  }

  /**
   * Computes the next n runs after the given time, as a freshly started loop would see them.
   *
   * @param now the reference time
   * @param n the number of runs to compute
   * @return a list of up to n runs
   */
  public List<ZonedDateTime> nextNFrom(ZonedDateTime now, int n) {
    return Evaluator.nextNFrom(data, now, n);
  }

  /**
   * Returns the resolved trigger rules.
   *
   * @return the rules, in resolution order
   */
  public List<TriggerRule> rules() {
    return data.rules();
  }

  /**
   * Returns the canonical string representation of this schedule.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(data);
  }

  /**
   * Returns the underlying schedule data.
   *
   * @return the schedule data
   */
  public ScheduleData data() {
    return data;
  }
}
