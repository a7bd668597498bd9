package io.pocwatchdog.loop;

import io.pocwatchdog.RunOutcome;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * The result of one pass through the execution loop.
 *
 * @param kind what happened
 * @param at the instant the loop woke up (null when stopped)
 * @param outcome the job's outcome (only for RAN)
 */
public record Cycle(Kind kind, ZonedDateTime at, RunOutcome outcome) {

  /** What a cycle did. */
  public enum Kind {
    /** The job ran once. */
    RAN,
    /** Only ticks of rules whose day restriction did not match were due; the job did not run. */
    SKIPPED,
    /** No rule can ever fire again. */
    STOPPED
  }

  static Cycle ran(ZonedDateTime at, RunOutcome outcome) {
    return new Cycle(Kind.RAN, at, outcome);
  }

  static Cycle skipped(ZonedDateTime at) {
    return new Cycle(Kind.SKIPPED, at, null);
  }

  static Cycle stopped() {
    return new Cycle(Kind.STOPPED, null, null);
  }

  /**
   * Returns the job's outcome, if it ran.
   *
   * @return the outcome, or empty if the job did not run
   */
  public Optional<RunOutcome> runOutcome() {
    return Optional.ofNullable(outcome);
  }
}
