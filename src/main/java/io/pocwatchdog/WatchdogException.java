package io.pocwatchdog;

import java.util.Optional;

/** Exception thrown for errors in schedule resolution, configuration, or notification. */
public final class WatchdogException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input value, if any. */
  private final String value;

  private WatchdogException(ErrorKind kind, String message, String value, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.value = value;
  }

  /**
   * Creates a new invalid schedule error.
   *
   * @param message the error message
   * @param value the offending schedule value, rendered as text (may be null)
   * @return a new WatchdogException for an invalid schedule
   */
  public static WatchdogException invalidSchedule(String message, String value) {
    return new WatchdogException(ErrorKind.INVALID_SCHEDULE, message, value, null);
  }

  /**
   * Creates a new configuration error.
   *
   * @param message the error message
   * @return a new WatchdogException for a configuration error
   */
  public static WatchdogException configuration(String message) {
    return new WatchdogException(ErrorKind.CONFIGURATION, message, null, null);
  }

  /**
   * Creates a new configuration error with an underlying cause.
   *
   * @param message the error message
   * @param cause the underlying cause
   * @return a new WatchdogException for a configuration error
   */
  public static WatchdogException configuration(String message, Throwable cause) {
    return new WatchdogException(ErrorKind.CONFIGURATION, message, null, cause);
  }

  /**
   * Creates a new unsupported domain error.
   *
   * @param domain the sender domain that could not be classified
   * @return a new WatchdogException for an unsupported domain
   */
  public static WatchdogException unsupportedDomain(String domain) {
    return new WatchdogException(
        ErrorKind.UNSUPPORTED_DOMAIN,
        "no SMTP settings known for domain '" + domain + "'; set the SMTP host explicitly",
        domain,
        null);
  }

  /**
   * Creates a new notification send error.
   *
   * @param message the error message
   * @param cause the underlying cause
   * @return a new WatchdogException for a notification send failure
   */
  public static WatchdogException notificationSend(String message, Throwable cause) {
    return new WatchdogException(ErrorKind.NOTIFICATION_SEND, message, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending value, if available.
   *
   * @return the value, or empty if not available
   */
  public Optional<String> value() {
    return Optional.ofNullable(value);
  }

  /**
   * Formats the error with its kind prefix, e.g. {@code error[invalid_schedule]: ...}.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    return "error[" + kind + "]: " + getMessage();
  }
}
