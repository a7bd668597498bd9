package io.pocwatchdog.loop;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Production sleeper backed by {@link Thread#sleep(long)}. Sleeps in bounded steps and re-reads the
 * clock after each one, so wall-clock adjustments are picked up within a step.
 */
public final class ThreadSleeper implements Sleeper {
  private static final Duration MAX_STEP = Duration.ofSeconds(1);

  private final Clock clock;

  public ThreadSleeper(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  @Override
  public void sleepUntil(Instant deadline) throws InterruptedException {
    while (true) {
      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        return;
      }
      Duration step = remaining.compareTo(MAX_STEP) < 0 ? remaining : MAX_STEP;
      Thread.sleep(Math.max(1, step.toMillis()));
    }
  }
}
