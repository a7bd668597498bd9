package io.pocwatchdog.eval;

import io.pocwatchdog.ast.DayRestriction;
import io.pocwatchdog.ast.IntervalFiring;
import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.ast.TimeOfDay;
import io.pocwatchdog.ast.TimepointFiring;
import io.pocwatchdog.ast.TriggerRule;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes when trigger rules fire next.
 *
 * <h2>Timepoint rules</h2>
 *
 * <p>The next occurrence is the earliest wall-clock instant strictly after {@code now} on a date
 * the rule's restriction accepts. Dates are scanned forward from today; a calendar day missing
 * from a month (e.g. the 31st) is simply never matched in that month.
 *
 * <h2>Interval rules</h2>
 *
 * <p>The next tick is the previous tick plus the interval, or {@code now} if the rule has never
 * ticked. The restriction does not move the tick; it only decides whether a tick is honored.
 *
 * <h2>DST handling</h2>
 *
 * <p>A wall-clock time inside a spring-forward gap is pushed forward by the length of the gap. An
 * ambiguous time in a fall-back overlap resolves to the earlier offset.
 */
public final class Evaluator {
  /** Maximum days scanned forward for a timepoint rule. */
  private static final int MAX_DAYS = 1000;

  /** Maximum planning steps when simulating several wakes. */
  private static final int MAX_SIMULATION_STEPS = 100_000;

  private Evaluator() {}

  /**
   * Plans the next wake across all rules.
   *
   * @param data the resolved schedule
   * @param now the current time
   * @param ticks the last tick of each interval rule
   * @return the plan, or empty if no rule can ever fire
   */
  public static Optional<WakePlan> plan(ScheduleData data, ZonedDateTime now, TickLedger ticks) {
    List<WakePlan.Candidate> candidates = new ArrayList<>(data.size());
    for (int i = 0; i < data.size(); i++) {
      TriggerRule rule = data.rules().get(i);
      Optional<ZonedDateTime> at = nextCandidate(i, rule, now, ticks);
      if (at.isPresent()) {
        candidates.add(new WakePlan.Candidate(i, rule, at.get()));
      }
    }
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new WakePlan(candidates));
  }

  /**
   * Computes the next instant at which the job would run, assuming no interval rule has ticked.
   *
   * @param data the resolved schedule
   * @param now the reference time
   * @return the next run, or empty if none exists
   */
  public static Optional<ZonedDateTime> nextFrom(ScheduleData data, ZonedDateTime now) {
    List<ZonedDateTime> next = nextNFrom(data, now, 1);
    return next.isEmpty() ? Optional.empty() : Optional.of(next.get(0));
  }

  /**
   * Simulates the execution loop and returns the instants at which the job would run.
   *
   * <p>Jobs are assumed to take no time. Wakes at which only skipped interval ticks are due do not
   * count as runs. The simulation gives up after a bounded number of wakes.
   *
   * @param data the resolved schedule
   * @param now the reference time
   * @param n the number of runs to compute
   * @return up to n run instants, in ascending order
   */
  public static List<ZonedDateTime> nextNFrom(ScheduleData data, ZonedDateTime now, int n) {
    List<ZonedDateTime> runs = new ArrayList<>(Math.max(0, n));
    TickLedger ticks = new TickLedger();
    ZonedDateTime current = now;

    for (int step = 0; step < MAX_SIMULATION_STEPS && runs.size() < n; step++) {
      Optional<WakePlan> plan = plan(data, current, ticks);
      if (plan.isEmpty()) {
        break;
      }
      ZonedDateTime wake = plan.get().wake();
      List<WakePlan.Candidate> due = plan.get().dueAt(wake);
      if (honorDue(due, wake, ticks)) {
        runs.add(wake);
      }
      current = wake;
    }
    return runs;
  }

  /**
   * Records the ticks of due interval rules and decides whether the job should run.
   *
   * @param due the candidates satisfied at this wake
   * @param at the instant of the wake
   * @param ticks the tick ledger to update
   * @return true if at least one due candidate is honored on the date of {@code at}
   */
  public static boolean honorDue(
      List<WakePlan.Candidate> due, ZonedDateTime at, TickLedger ticks) {
    boolean honored = false;
    for (WakePlan.Candidate c : due) {
      if (c.rule().isInterval()) {
        ticks.record(c.index(), at);
      }
      if (isHonored(c.rule(), at)) {
        honored = true;
      }
    }
    return honored;
  }

  /**
   * Checks whether a due rule actually fires the job at the given instant.
   *
   * @param rule the rule
   * @param at the instant
   * @return true if the rule's restriction accepts the date of {@code at}
   */
  public static boolean isHonored(TriggerRule rule, ZonedDateTime at) {
    return rule.restriction().matches(at.toLocalDate());
  }

  private static Optional<ZonedDateTime> nextCandidate(
      int index, TriggerRule rule, ZonedDateTime now, TickLedger ticks) {
    if (rule.firing() instanceof IntervalFiring interval) {
      try {
        return Optional.of(nextIntervalTick(interval, ticks.last(index), now));
      } catch (DateTimeException | ArithmeticException e) {
        // Next tick lies beyond the supported date range: the rule never fires again.
        return Optional.empty();
      }
    }
    TimepointFiring tp = (TimepointFiring) rule.firing();
    return nextTimepoint(tp.time(), rule.restriction(), now);
  }

  private static ZonedDateTime nextIntervalTick(
      IntervalFiring interval, Optional<ZonedDateTime> lastTick, ZonedDateTime now) {
    if (lastTick.isEmpty()) {
      return now;
    }
    return lastTick.get().withZoneSameInstant(now.getZone()).plusSeconds(interval.seconds());
  }

  static Optional<ZonedDateTime> nextTimepoint(
      TimeOfDay tod, DayRestriction restriction, ZonedDateTime now) {
    ZoneId location = now.getZone();
    LocalDate day = now.toLocalDate();

    for (int i = 0; i < MAX_DAYS; i++) {
      if (restriction.matches(day)) {
        ZonedDateTime candidate = atTimeOnDate(day, tod, location);
        if (candidate.isAfter(now)) {
          return Optional.of(candidate);
        }
      }
      day = day.plusDays(1);
    }

    return Optional.empty();
  }

  /**
   * Creates a ZonedDateTime at the given date and time in the given timezone. Java already pushes
   * times in a DST gap forward and picks the earlier offset in an overlap.
   */
  private static ZonedDateTime atTimeOnDate(LocalDate date, TimeOfDay tod, ZoneId location) {
    return ZonedDateTime.of(LocalDateTime.of(date, tod.toLocalTime()), location);
  }
}
