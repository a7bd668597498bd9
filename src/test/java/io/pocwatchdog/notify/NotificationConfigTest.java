package io.pocwatchdog.notify;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ErrorKind;
import io.pocwatchdog.WatchdogException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class NotificationConfigTest {

  @Test
  void testDisabledNeedsNothing() {
    NotificationConfig config = NotificationConfig.disabled();
    assertFalse(config.enabled());
    assertTrue(config.sender().isEmpty());
    assertTrue(config.recipients().isEmpty());
  }

  @Test
  void testDefaultTemplates() throws WatchdogException {
    NotificationConfig config = NotificationConfig.builder().build();
    assertEquals("success", config.success().subject());
    assertEquals("success", config.success().body());
    assertEquals("failure", config.failure().subject());
    assertEquals("task failure: error_message", config.failure().body());
    assertTrue(config.failure().files().isEmpty());
  }

  @Test
  void testEnabledRequiresCredentials() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> NotificationConfig.builder().sender("ops@qq.com").notifySuccess(true).build());
    assertEquals(ErrorKind.CONFIGURATION, e.kind());
    assertTrue(e.getMessage().endsWith("missing: password, recipients"), e.getMessage());
  }

  @Test
  void testBlankValuesCountAsMissing() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () ->
                NotificationConfig.builder()
                    .sender("  ")
                    .password("")
                    .recipients(Arrays.asList(" ", null))
                    .notifyFailure(true)
                    .build());
    assertTrue(e.getMessage().endsWith("missing: sender, password, recipients"), e.getMessage());
  }

  @Test
  void testRecipientsAreTrimmed() throws WatchdogException {
    NotificationConfig config =
        NotificationConfig.builder()
            .sender(" ops@qq.com ")
            .password("pw")
            .recipients(" a@example.com", "", "b@example.com ")
            .notifyFailure(true)
            .build();
    assertEquals("ops@qq.com", config.sender().orElseThrow());
    assertEquals(List.of("a@example.com", "b@example.com"), config.recipients());
  }

  @Test
  void testPortRange() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class, () -> NotificationConfig.builder().smtpPort(70000).build());
    assertEquals(ErrorKind.CONFIGURATION, e.kind());
  }

  @Test
  void testTemplatesAndAttachments() throws WatchdogException {
    NotificationConfig config =
        NotificationConfig.builder()
            .successSubject("done")
            .failureImages(List.of(Path.of("chart.png")))
            .successFiles(List.of(Path.of("report.csv")))
            .build();
    assertEquals("done", config.success().subject());
    assertEquals(List.of(Path.of("report.csv")), config.success().files());
    assertEquals(List.of(Path.of("chart.png")), config.failure().images());
  }

  @Test
  void testToStringHidesPassword() throws WatchdogException {
    NotificationConfig config =
        NotificationConfig.builder()
            .sender("ops@qq.com")
            .password("hunter2")
            .recipients("a@example.com")
            .notifyFailure(true)
            .build();
    assertFalse(config.toString().contains("hunter2"));
  }
}
