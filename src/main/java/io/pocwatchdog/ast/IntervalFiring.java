package io.pocwatchdog.ast;

import java.time.Duration;

/**
 * Fires every given number of seconds.
 *
 * @param seconds the interval in seconds (positive)
 */
public record IntervalFiring(long seconds) implements Firing {
  /** Validates that the interval is positive. */
  public IntervalFiring {
    if (seconds <= 0) {
      throw new IllegalArgumentException("interval must be positive: " + seconds);
    }
  }

  /**
   * Returns the interval as a Duration.
   *
   * @return the interval
   */
  public Duration interval() {
    return Duration.ofSeconds(seconds);
  }
}
