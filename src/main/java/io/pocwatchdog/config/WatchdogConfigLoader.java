package io.pocwatchdog.config;

import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.notify.NotificationConfig;
import io.pocwatchdog.parser.JsonScheduleReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads a {@link WatchdogConfig} from a properties file.
 *
 * <p>Required keys:
 *
 * <ul>
 *   <li>{@code watchdog.schedule} - the schedule as JSON, e.g. {@code {"mon": "08:00"}}
 * </ul>
 *
 * <p>Optional keys: {@code watchdog.mail.sender}, {@code watchdog.mail.password}, {@code
 * watchdog.mail.recipients} (comma-separated), {@code watchdog.mail.smtp.host}, {@code
 * watchdog.mail.smtp.port}, {@code watchdog.mail.smtp.ssl}, {@code
 * watchdog.mail.{success,failure}.{subject,body,files,images}} (files and images comma-separated),
 * {@code watchdog.notify.success} and {@code watchdog.notify.failure}.
 *
 * <p>Files are read as UTF-8.
 */
public final class WatchdogConfigLoader {
  static final String PREFIX = "watchdog.";

  private WatchdogConfigLoader() {}

  /**
   * Loads the config from a properties file on the classpath.
   *
   * @param fileName the resource name
   * @return the config
   * @throws WatchdogException if the file is missing or a value is malformed
   */
  public static WatchdogConfig loadFromClasspath(String fileName) throws WatchdogException {
    Properties props = new Properties();
    try (InputStream in =
        WatchdogConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
      if (in == null) {
        throw WatchdogException.configuration("config file not found on classpath: " + fileName);
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
    } catch (IOException e) {
      throw WatchdogException.configuration("failed to load config: " + fileName, e);
    }
    return load(props);
  }

  /**
   * Builds the config from already loaded properties.
   *
   * @param props the properties
   * @return the config
   * @throws WatchdogException if a required key is missing or a value is malformed
   */
  public static WatchdogConfig load(Properties props) throws WatchdogException {
    ScheduleValue schedule = JsonScheduleReader.read(getString(props, "schedule"));

    NotificationConfig.Builder b =
        NotificationConfig.builder()
            .sender(getOptional(props, "mail.sender"))
            .password(getOptional(props, "mail.password"))
            .recipients(getList(props, "mail.recipients"))
            .smtpHost(getOptional(props, "mail.smtp.host"))
            .smtpPort(getInt(props, "mail.smtp.port"))
            .smtpSsl(getBoolean(props, "mail.smtp.ssl"))
            .successFiles(getPaths(props, "mail.success.files"))
            .successImages(getPaths(props, "mail.success.images"))
            .failureFiles(getPaths(props, "mail.failure.files"))
            .failureImages(getPaths(props, "mail.failure.images"))
            .notifySuccess(Boolean.TRUE.equals(getBoolean(props, "notify.success")))
            .notifyFailure(Boolean.TRUE.equals(getBoolean(props, "notify.failure")));

    Optional.ofNullable(getOptional(props, "mail.success.subject")).ifPresent(b::successSubject);
    Optional.ofNullable(getOptional(props, "mail.success.body")).ifPresent(b::successBody);
    Optional.ofNullable(getOptional(props, "mail.failure.subject")).ifPresent(b::failureSubject);
    Optional.ofNullable(getOptional(props, "mail.failure.body")).ifPresent(b::failureBody);

    return new WatchdogConfig(schedule, b.build());
  }

  private static String getString(Properties props, String key) throws WatchdogException {
    String value = getOptional(props, key);
    if (value == null) {
      throw WatchdogException.configuration("missing required config key: " + PREFIX + key);
    }
    return value;
  }

  private static String getOptional(Properties props, String key) {
    String value = props.getProperty(PREFIX + key);
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.strip();
  }

  private static Integer getInt(Properties props, String key) throws WatchdogException {
    String value = getOptional(props, key);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw WatchdogException.configuration(
          "config key " + PREFIX + key + " must be an integer, got '" + value + "'", e);
    }
  }

  private static Boolean getBoolean(Properties props, String key) throws WatchdogException {
    String value = getOptional(props, key);
    if (value == null) {
      return null;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1":
        return Boolean.TRUE;
      case "false", "no", "off", "0":
        return Boolean.FALSE;
      default:
        throw WatchdogException.configuration(
            "config key " + PREFIX + key + " must be true or false, got '" + value + "'");
    }
  }

  private static List<String> getList(Properties props, String key) {
    String value = getOptional(props, key);
    List<String> items = new ArrayList<>();
    if (value == null) {
      return items;
    }
    for (String item : value.split(",")) {
      if (!item.isBlank()) {
        items.add(item.strip());
      }
    }
    return items;
  }

  private static List<Path> getPaths(Properties props, String key) throws WatchdogException {
    List<Path> paths = new ArrayList<>();
    for (String item : getList(props, key)) {
      try {
        paths.add(Path.of(item));
      } catch (InvalidPathException e) {
        throw WatchdogException.configuration(
            "config key " + PREFIX + key + " has an invalid path '" + item + "'", e);
      }
    }
    return paths;
  }
}
