package io.pocwatchdog.config;

import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.notify.NotificationConfig;
import java.util.Objects;

/**
 * Schedule and notification settings loaded from a configuration source.
 *
 * @param schedule the unresolved schedule value
 * @param notifications the validated notification config
 */
public record WatchdogConfig(ScheduleValue schedule, NotificationConfig notifications) {
  /** Validates non-null components. */
  public WatchdogConfig {
    Objects.requireNonNull(schedule, "schedule");
    Objects.requireNonNull(notifications, "notifications");
  }
}
