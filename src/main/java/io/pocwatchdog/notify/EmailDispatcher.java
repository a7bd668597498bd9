package io.pocwatchdog.notify;

import io.pocwatchdog.WatchdogException;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.time.Duration;
import java.util.Date;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends notifications as HTML email over SMTP. */
public class EmailDispatcher implements NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(EmailDispatcher.class);

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final Duration timeout;

  public EmailDispatcher() {
    this(DEFAULT_TIMEOUT);
  }

  /**
   * Creates a dispatcher with the given connect, read and write timeout.
   *
   * @param timeout the socket timeout
   */
  public EmailDispatcher(Duration timeout) {
    this.timeout = timeout;
  }

  @Override
  public void send(Notification notification, NotificationConfig config, SmtpSettings smtp)
      throws WatchdogException {
    String sender =
        config
            .sender()
            .orElseThrow(() -> WatchdogException.configuration("a sender is required to send"));
    String password = config.password().orElse("");

    Session session =
        Session.getInstance(
            getProperties(smtp, timeout),
            new Authenticator() {
              @Override
              protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(sender, password);
              }
            });

    try {
      MimeMessage msg = compose(session, notification, config);
      deliver(msg);
      logger.info(
          "Email '{}' sent to {} via {}", notification.subject(), config.recipients(), smtp);
    } catch (MessagingException e) {
      throw WatchdogException.notificationSend(
          "failed to send email to " + config.recipients() + " via " + smtp + ": " + e.getMessage(),
          e);
    }
  }

  /**
   * Builds the message without sending it.
   *
   * @param session the mail session
   * @param notification the composed notification
   * @param config the config holding sender and recipients
   * @return the message
   * @throws MessagingException if an address or part is malformed
   */
  MimeMessage compose(Session session, Notification notification, NotificationConfig config)
      throws MessagingException {
    MimeMessage msg = new MimeMessage(session);
    msg.setFrom(new InternetAddress(config.sender().orElseThrow()));
    msg.setRecipients(
        Message.RecipientType.TO, InternetAddress.parse(String.join(",", config.recipients())));
    msg.setSubject(notification.subject(), "UTF-8");
    msg.setSentDate(new Date());
    msg.setContent(
        EmailHelper.buildContent(notification.body(), notification.files(), notification.images()));
    msg.saveChanges();
    return msg;
  }

  /** Hands the message to the SMTP server. */
  protected void deliver(MimeMessage msg) throws MessagingException {
    Transport.send(msg);
  }

  static Properties getProperties(SmtpSettings smtp, Duration timeout) {
    Properties props = new Properties();
    props.put("mail.smtp.auth", "true");
    props.put("mail.smtp.host", smtp.host());
    props.put("mail.smtp.port", String.valueOf(smtp.port()));
    if (smtp.ssl()) {
      props.put("mail.smtp.ssl.enable", "true");
    } else {
      props.put("mail.smtp.starttls.enable", "true");
      props.put("mail.smtp.starttls.required", "true");
    }
    String millis = String.valueOf(timeout.toMillis());
    props.put("mail.smtp.connectiontimeout", millis);
    props.put("mail.smtp.timeout", millis);
    props.put("mail.smtp.writetimeout", millis);
    return props;
  }
}
