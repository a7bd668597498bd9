package io.pocwatchdog.loop;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Jumps the fake clock to each deadline, plus an optional lag, and records the deadlines. */
final class FakeSleeper implements Sleeper {
  private final FakeClock clock;
  private final List<Instant> deadlines = new ArrayList<>();
  private Duration lag = Duration.ZERO;

  FakeSleeper(FakeClock clock) {
    this.clock = clock;
  }

  void lag(Duration lag) {
    this.lag = lag;
  }

  List<Instant> deadlines() {
    return deadlines;
  }

  @Override
  public void sleepUntil(Instant deadline) {
    deadlines.add(deadline);
    if (clock.instant().isBefore(deadline)) {
      clock.set(deadline);
    }
    clock.advance(lag);
  }
}
