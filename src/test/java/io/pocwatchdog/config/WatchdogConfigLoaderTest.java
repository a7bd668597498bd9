package io.pocwatchdog.config;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ErrorKind;
import io.pocwatchdog.Schedule;
import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.notify.NotificationConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class WatchdogConfigLoaderTest {

  private static Properties props(String... pairs) {
    Properties p = new Properties();
    for (int i = 0; i < pairs.length; i += 2) {
      p.setProperty(WatchdogConfigLoader.PREFIX + pairs[i], pairs[i + 1]);
    }
    return p;
  }

  @Test
  void testLoadFromClasspath() throws WatchdogException {
    WatchdogConfig config = WatchdogConfigLoader.loadFromClasspath("watchdog-test.properties");

    assertEquals(
        "every monday at 08:00; every monday at 12:00; every 3600 seconds on day 15",
        Schedule.resolve(config.schedule()).toString());

    NotificationConfig n = config.notifications();
    assertEquals("ops@gmail.com", n.sender().orElseThrow());
    assertEquals(List.of("team@example.com", "oncall@example.com"), n.recipients());
    assertEquals("Nightly report failed", n.failure().subject());
    assertEquals("<b>Error:</b> error_message", n.failure().body());
    assertEquals("success", n.success().subject());
    assertFalse(n.notifySuccess());
    assertTrue(n.notifyFailure());
  }

  @Test
  void testMissingFile() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> WatchdogConfigLoader.loadFromClasspath("no-such-file.properties"));
    assertEquals(ErrorKind.CONFIGURATION, e.kind());
    assertTrue(e.getMessage().contains("no-such-file.properties"));
  }

  @Test
  void testIncompleteCredentials() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> WatchdogConfigLoader.loadFromClasspath("watchdog-incomplete.properties"));
    assertEquals(ErrorKind.CONFIGURATION, e.kind());
    assertTrue(e.getMessage().contains("sender, password, recipients"), e.getMessage());
  }

  @Test
  void testScheduleRequired() {
    WatchdogException e =
        assertThrows(WatchdogException.class, () -> WatchdogConfigLoader.load(props()));
    assertEquals("missing required config key: watchdog.schedule", e.getMessage());
  }

  @Test
  void testInvalidScheduleJson() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class, () -> WatchdogConfigLoader.load(props("schedule", "{mon")));
    assertEquals(ErrorKind.INVALID_SCHEDULE, e.kind());
  }

  @Test
  void testSmtpAndAttachmentKeys() throws WatchdogException {
    WatchdogConfig config =
        WatchdogConfigLoader.load(
            props(
                "schedule", "60",
                "mail.smtp.host", "mail.corp.example",
                "mail.smtp.port", "2525",
                "mail.smtp.ssl", "no",
                "mail.success.files", "out/report.csv, out/summary.txt",
                "mail.failure.images", "out/chart.png"));

    NotificationConfig n = config.notifications();
    assertEquals("mail.corp.example", n.smtpHost().orElseThrow());
    assertEquals(2525, n.smtpPort().orElseThrow());
    assertEquals(Boolean.FALSE, n.smtpSsl().orElseThrow());
    assertEquals(
        List.of(Path.of("out/report.csv"), Path.of("out/summary.txt")), n.success().files());
    assertEquals(List.of(Path.of("out/chart.png")), n.failure().images());
    assertFalse(n.enabled());
  }

  @Test
  void testMalformedNumbersAndFlags() {
    WatchdogException port =
        assertThrows(
            WatchdogException.class,
            () -> WatchdogConfigLoader.load(props("schedule", "60", "mail.smtp.port", "smtp")));
    assertEquals(ErrorKind.CONFIGURATION, port.kind());

    WatchdogException flag =
        assertThrows(
            WatchdogException.class,
            () -> WatchdogConfigLoader.load(props("schedule", "60", "notify.failure", "maybe")));
    assertTrue(flag.getMessage().contains("watchdog.notify.failure"));
  }

  @Test
  void testInvalidAttachmentPath() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () ->
                WatchdogConfigLoader.load(
                    props("schedule", "60", "mail.failure.files", "ok.log, bad\u0000name.log")));
    assertEquals(ErrorKind.CONFIGURATION, e.kind());
    assertTrue(e.getMessage().contains("watchdog.mail.failure.files"), e.getMessage());
  }
}
