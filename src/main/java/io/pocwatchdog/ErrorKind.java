package io.pocwatchdog;

/** The type of error raised while configuring or running a watchdog. */
public enum ErrorKind {
  /** Invalid schedule - malformed or type-invalid schedule value. */
  INVALID_SCHEDULE("invalid_schedule"),
  /** Configuration error - notifications requested without complete credentials. */
  CONFIGURATION("configuration"),
  /** Unsupported domain - SMTP settings cannot be auto-selected for the sender. */
  UNSUPPORTED_DOMAIN("unsupported_domain"),
  /** Notification send error - SMTP or network failure while sending. */
  NOTIFICATION_SEND("notification_send");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Returns whether errors of this kind abort startup.
   *
   * @return true for configuration-time kinds
   */
  public boolean fatal() {
    return this != NOTIFICATION_SEND;
  }

  @Override
  public String toString() {
    return value;
  }
}
