package io.pocwatchdog.ast;

import java.util.Objects;

/**
 * A resolved, immutable trigger: one firing descriptor combined with a day restriction.
 *
 * @param firing what fires (interval or time of day)
 * @param restriction which days the firing is honored on
 */
public record TriggerRule(Firing firing, DayRestriction restriction) {
  /** Validates non-null components. */
  public TriggerRule {
    Objects.requireNonNull(firing, "firing");
    Objects.requireNonNull(restriction, "restriction");
  }

  /**
   * Returns whether this rule fires on a fixed interval.
   *
   * @return true for interval rules
   */
  public boolean isInterval() {
    return firing instanceof IntervalFiring;
  }
}
