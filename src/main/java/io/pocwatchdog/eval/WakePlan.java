package io.pocwatchdog.eval;

import io.pocwatchdog.ast.TriggerRule;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * The next candidate instant of every rule that can still fire.
 *
 * @param candidates one candidate per rule, in rule order (never empty)
 */
public record WakePlan(List<Candidate> candidates) {

  /**
   * One rule's next candidate instant.
   *
   * @param index the rule's position in the schedule
   * @param rule the rule
   * @param at the candidate instant
   */
  public record Candidate(int index, TriggerRule rule, ZonedDateTime at) {}

  /** Creates a new WakePlan with a defensive copy of the candidates. */
  public WakePlan {
    candidates = List.copyOf(candidates);
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("a wake plan needs at least one candidate");
    }
  }

  /**
   * Returns the earliest candidate instant across all rules.
   *
   * @return the wake time
   */
  public ZonedDateTime wake() {
    return candidates.stream()
        .map(Candidate::at)
        .min(Comparator.comparing(ZonedDateTime::toInstant))
        .orElseThrow();
  }

  /**
   * Returns the candidates due at or before the given instant.
   *
   * @param t the instant (usually the time the loop woke up)
   * @return the due candidates, in rule order
   */
  public List<Candidate> dueAt(ZonedDateTime t) {
    return candidates.stream().filter(c -> !c.at().isAfter(t)).toList();
  }
}
