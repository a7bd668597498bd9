package io.pocwatchdog.loop;

import java.time.Instant;

/**
 * Abstraction for waiting until an instant. This makes time-based behavior testable without real
 * waiting.
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks until the given instant has been reached.
   *
   * @param deadline the instant to wait for; returns immediately if it has passed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  void sleepUntil(Instant deadline) throws InterruptedException;
}
