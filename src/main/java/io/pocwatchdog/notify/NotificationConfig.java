package io.pocwatchdog.notify;

import io.pocwatchdog.WatchdogException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Who to notify, how to reach the SMTP server, and what to send after a run.
 *
 * <p>Instances are immutable and built with {@link #builder()}. When either notification flag is
 * set, the sender, password and at least one recipient are required.
 */
public final class NotificationConfig {
  /** The token in the failure body replaced by the error description. */
  public static final String ERROR_PLACEHOLDER = "error_message";

  private final String sender;
  private final String password;
  private final List<String> recipients;
  private final String smtpHost;
  private final Integer smtpPort;
  private final Boolean smtpSsl;
  private final Template success;
  private final Template failure;
  private final boolean notifySuccess;
  private final boolean notifyFailure;

  /**
   * Subject, body and attachments sent for one kind of outcome.
   *
   * @param subject the subject
   * @param body the HTML body
   * @param files files to attach
   * @param images images to embed inline after the body
   */
  public record Template(String subject, String body, List<Path> files, List<Path> images) {
    /** Creates a new Template with defensive copies. */
    public Template {
      subject = subject == null ? "" : subject;
      body = body == null ? "" : body;
      files = files == null ? List.of() : List.copyOf(files);
      images = images == null ? List.of() : List.copyOf(images);
    }
  }

  private NotificationConfig(Builder b) {
    this.sender = blankToNull(b.sender);
    this.password = b.password == null || b.password.isEmpty() ? null : b.password;
    this.recipients = List.copyOf(b.recipients);
    this.smtpHost = blankToNull(b.smtpHost);
    this.smtpPort = b.smtpPort;
    this.smtpSsl = b.smtpSsl;
    this.success = new Template(b.successSubject, b.successBody, b.successFiles, b.successImages);
    this.failure = new Template(b.failureSubject, b.failureBody, b.failureFiles, b.failureImages);
    this.notifySuccess = b.notifySuccess;
    this.notifyFailure = b.notifyFailure;
  }

  /**
   * Returns a config with both notifications switched off.
   *
   * @return a disabled config
   */
  public static NotificationConfig disabled() {
    return new NotificationConfig(new Builder());
  }

  /**
   * Starts building a config.
   *
   * @return a new builder with the default templates
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether any notification is enabled.
   *
   * @return true if success or failure notifications are on
   */
  public boolean enabled() {
    return notifySuccess || notifyFailure;
  }

  /** @return the sender address, if set */
  public Optional<String> sender() {
    return Optional.ofNullable(sender);
  }

  /** @return the sender's password, if set */
  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  /** @return the recipient addresses */
  public List<String> recipients() {
    return recipients;
  }

  /** @return the explicit SMTP host, or empty to auto-select */
  public Optional<String> smtpHost() {
    return Optional.ofNullable(smtpHost);
  }

  /** @return the explicit SMTP port, or empty to auto-select */
  public Optional<Integer> smtpPort() {
    return Optional.ofNullable(smtpPort);
  }

  /** @return the explicit SSL flag, or empty to auto-select */
  public Optional<Boolean> smtpSsl() {
    return Optional.ofNullable(smtpSsl);
  }

  /** @return the template sent after a successful run */
  public Template success() {
    return success;
  }

  /** @return the template sent after a failed run */
  public Template failure() {
    return failure;
  }

  /** @return whether to notify after a successful run */
  public boolean notifySuccess() {
    return notifySuccess;
  }

  /** @return whether to notify after a failed run */
  public boolean notifyFailure() {
    return notifyFailure;
  }

  @Override
  public String toString() {
    return "NotificationConfig{sender="
        + sender
        + ", recipients="
        + recipients
        + ", smtpHost="
        + smtpHost
        + ", smtpPort="
        + smtpPort
        + ", smtpSsl="
        + smtpSsl
        + ", notifySuccess="
        + notifySuccess
        + ", notifyFailure="
        + notifyFailure
        + "}";
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.strip();
  }

  /** Builder for {@link NotificationConfig}. */
  public static final class Builder {
    private String sender;
    private String password;
    private final List<String> recipients = new ArrayList<>();
    private String smtpHost;
    private Integer smtpPort;
    private Boolean smtpSsl;
    private String successSubject = "success";
    private String successBody = "success";
    private final List<Path> successFiles = new ArrayList<>();
    private final List<Path> successImages = new ArrayList<>();
    private String failureSubject = "failure";
    private String failureBody = "task failure: " + ERROR_PLACEHOLDER;
    private final List<Path> failureFiles = new ArrayList<>();
    private final List<Path> failureImages = new ArrayList<>();
    private boolean notifySuccess;
    private boolean notifyFailure;

    private Builder() {}

    public Builder sender(String sender) {
      this.sender = sender;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder recipients(List<String> recipients) {
      this.recipients.clear();
      for (String r : Objects.requireNonNull(recipients, "recipients")) {
        if (r != null && !r.isBlank()) {
          this.recipients.add(r.strip());
        }
      }
      return this;
    }

    public Builder recipients(String... recipients) {
      return recipients(List.of(recipients));
    }

    /** Sets the SMTP host; null selects it from the sender's domain. */
    public Builder smtpHost(String smtpHost) {
      this.smtpHost = smtpHost;
      return this;
    }

    /** Sets the SMTP port; null selects it from the sender's domain. */
    public Builder smtpPort(Integer smtpPort) {
      this.smtpPort = smtpPort;
      return this;
    }

    /** Sets implicit SSL (true) or STARTTLS (false); null selects it from the port. */
    public Builder smtpSsl(Boolean smtpSsl) {
      this.smtpSsl = smtpSsl;
      return this;
    }

    public Builder successSubject(String subject) {
      this.successSubject = subject;
      return this;
    }

    public Builder successBody(String body) {
      this.successBody = body;
      return this;
    }

    public Builder successFiles(List<Path> files) {
      this.successFiles.clear();
      this.successFiles.addAll(files);
      return this;
    }

    public Builder successImages(List<Path> images) {
      this.successImages.clear();
      this.successImages.addAll(images);
      return this;
    }

    public Builder failureSubject(String subject) {
      this.failureSubject = subject;
      return this;
    }

    /** Sets the failure body; every {@code error_message} token is replaced on send. */
    public Builder failureBody(String body) {
      this.failureBody = body;
      return this;
    }

    public Builder failureFiles(List<Path> files) {
      this.failureFiles.clear();
      this.failureFiles.addAll(files);
      return this;
    }

    public Builder failureImages(List<Path> images) {
      this.failureImages.clear();
      this.failureImages.addAll(images);
      return this;
    }

    public Builder notifySuccess(boolean notifySuccess) {
      this.notifySuccess = notifySuccess;
      return this;
    }

    public Builder notifyFailure(boolean notifyFailure) {
      this.notifyFailure = notifyFailure;
      return this;
    }

    /**
     * Validates and builds the config.
     *
     * @return the config
     * @throws WatchdogException if notifications are enabled without sender, password and
     *     recipients, or the SMTP port is out of range
     */
    public NotificationConfig build() throws WatchdogException {
      NotificationConfig config = new NotificationConfig(this);
      if (config.enabled()) {
        List<String> missing = new ArrayList<>();
        if (config.sender == null) {
          missing.add("sender");
        }
        if (config.password == null) {
          missing.add("password");
        }
        if (config.recipients.isEmpty()) {
          missing.add("recipients");
        }
        if (!missing.isEmpty()) {
          throw WatchdogException.configuration(
              "when notifications are enabled, sender, password and recipients must be"
                  + " provided; missing: "
                  + String.join(", ", missing));
        }
      }
      if (smtpPort != null && (smtpPort < 1 || smtpPort > 65535)) {
        throw WatchdogException.configuration("SMTP port out of range: " + smtpPort);
      }
      return config;
    }
  }
}
