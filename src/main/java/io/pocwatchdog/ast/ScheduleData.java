package io.pocwatchdog.ast;

import java.util.List;

/**
 * Represents the complete resolved schedule.
 *
 * @param rules the trigger rules, in resolution order
 */
public record ScheduleData(List<TriggerRule> rules) {
  /** Creates a new ScheduleData with a defensive copy of the rules. */
  public ScheduleData {
    rules = rules == null ? List.of() : List.copyOf(rules);
  }

  /**
   * Returns the number of rules.
   *
   * @return the rule count
   */
  public int size() {
    return rules.size();
  }
}
