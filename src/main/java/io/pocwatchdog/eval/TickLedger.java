package io.pocwatchdog.eval;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Last tick of each interval rule, keyed by rule index. Not thread-safe. */
public final class TickLedger {
  private final Map<Integer, ZonedDateTime> lastTicks = new HashMap<>();

  /**
   * Returns the last tick of a rule.
   *
   * @param ruleIndex the rule's position in the schedule
   * @return the last tick, or empty if the rule never ticked
   */
  public Optional<ZonedDateTime> last(int ruleIndex) {
    return Optional.ofNullable(lastTicks.get(ruleIndex));
  }

  /**
   * Records a tick.
   *
   * @param ruleIndex the rule's position in the schedule
   * @param at the instant of the tick
   */
  public void record(int ruleIndex, ZonedDateTime at) {
    lastTicks.put(ruleIndex, at);
  }
}
