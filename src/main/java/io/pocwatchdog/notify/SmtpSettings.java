package io.pocwatchdog.notify;

import io.pocwatchdog.WatchdogException;
import java.util.Locale;
import java.util.Optional;

/**
 * A concrete SMTP endpoint.
 *
 * @param host the SMTP host
 * @param port the SMTP port
 * @param ssl true for implicit SSL, false for STARTTLS
 */
public record SmtpSettings(String host, int port, boolean ssl) {
  /** The implicit SSL port. */
  public static final int SSL_PORT = 465;

  /** The submission (STARTTLS) port. */
  public static final int SUBMISSION_PORT = 587;

  /**
   * Fills the unset SMTP fields of a config.
   *
   * <p>An explicit host is used as is; a missing port then defaults to {@value #SSL_PORT} with SSL
   * and {@value #SUBMISSION_PORT} without, and a missing SSL flag defaults to on. Without a host,
   * the sender's domain is looked up in {@link SmtpProviders} and explicit port and SSL values
   * override the table.
   *
   * @param config the notification config
   * @return the resolved settings
   * @throws WatchdogException if no host is set and the sender's domain is unknown
   */
  public static SmtpSettings resolve(NotificationConfig config) throws WatchdogException {
    Optional<String> host = config.smtpHost();
    if (host.isPresent()) {
      boolean ssl = config.smtpSsl().orElse(true);
      int port = config.smtpPort().orElse(ssl ? SSL_PORT : SUBMISSION_PORT);
      return new SmtpSettings(host.get(), port, ssl);
    }

    String sender =
        config
            .sender()
            .orElseThrow(
                () -> WatchdogException.configuration("a sender is required to select SMTP"));
    SmtpSettings known =
        SmtpProviders.lookup(sender)
            .orElseThrow(() -> WatchdogException.unsupportedDomain(domainOf(sender)));
    return new SmtpSettings(
        known.host(),
        config.smtpPort().orElse(known.port()),
        config.smtpSsl().orElse(known.ssl()));
  }

  static String domainOf(String address) {
    int at = address.lastIndexOf('@');
    return address.substring(at + 1).strip().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return host + ":" + port + (ssl ? " (ssl)" : " (starttls)");
  }
}
