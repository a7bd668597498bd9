package io.pocwatchdog.loop;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

public class ThreadSleeperTest {

  @Test
  void testPastDeadlineReturnsImmediately() throws InterruptedException {
    Clock clock = Clock.fixed(Instant.parse("2026-02-02T10:00:00Z"), ZoneId.of("UTC"));
    new ThreadSleeper(clock).sleepUntil(Instant.parse("2026-02-02T09:00:00Z"));
  }

  @Test
  void testSleepsUntilDeadline() throws InterruptedException {
    Clock clock = Clock.systemUTC();
    Instant deadline = clock.instant().plus(Duration.ofMillis(50));
    new ThreadSleeper(clock).sleepUntil(deadline);
    assertFalse(clock.instant().isBefore(deadline));
  }

  @Test
  void testInterruptedWhileSleeping() {
    Clock clock = Clock.systemUTC();
    Thread.currentThread().interrupt();
    assertThrows(
        InterruptedException.class,
        () -> new ThreadSleeper(clock).sleepUntil(clock.instant().plusSeconds(60)));
    assertFalse(Thread.currentThread().isInterrupted());
  }
}
