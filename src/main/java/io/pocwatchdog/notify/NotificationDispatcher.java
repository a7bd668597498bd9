package io.pocwatchdog.notify;

import io.pocwatchdog.WatchdogException;

/** Sends a composed notification to the configured recipients. */
public interface NotificationDispatcher {
  /**
   * Sends a notification. Blocks until the message is handed to the server.
   *
   * @param notification the composed notification
   * @param config the config holding sender, credentials and recipients
   * @param smtp the resolved SMTP endpoint
   * @throws WatchdogException with kind NOTIFICATION_SEND if sending fails
   */
  void send(Notification notification, NotificationConfig config, SmtpSettings smtp)
      throws WatchdogException;
}
