package io.pocwatchdog.notify;

import io.pocwatchdog.RunOutcome;
import java.util.Optional;

/** Decides whether an outcome is notified and composes the notification from the templates. */
public final class NotificationPolicy {
  private NotificationPolicy() {}

  /**
   * Composes the notification for an outcome.
   *
   * @param outcome the run outcome
   * @param config the notification config
   * @return the notification, or empty if this kind of outcome is not notified
   */
  public static Optional<Notification> compose(RunOutcome outcome, NotificationConfig config) {
    if (outcome instanceof RunOutcome.Failure failure) {
      if (!config.notifyFailure()) {
        return Optional.empty();
      }
      NotificationConfig.Template t = config.failure();
      String body = t.body().replace(NotificationConfig.ERROR_PLACEHOLDER, failure.description());
      return Optional.of(new Notification(t.subject(), body, t.files(), t.images()));
    }
    if (!config.notifySuccess()) {
      return Optional.empty();
    }
    NotificationConfig.Template t = config.success();
    return Optional.of(new Notification(t.subject(), t.body(), t.files(), t.images()));
  }
}
