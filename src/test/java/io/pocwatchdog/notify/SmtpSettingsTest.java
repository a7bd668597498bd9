package io.pocwatchdog.notify;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ErrorKind;
import io.pocwatchdog.WatchdogException;
import org.junit.jupiter.api.Test;

public class SmtpSettingsTest {

  private static NotificationConfig.Builder sender(String address) {
    return NotificationConfig.builder()
        .sender(address)
        .password("pw")
        .recipients("team@example.com")
        .notifyFailure(true);
  }

  @Test
  void testKnownDomain() throws WatchdogException {
    assertEquals(
        new SmtpSettings("smtp.qq.com", 465, true),
        SmtpSettings.resolve(sender("me@qq.com").build()));
    assertEquals(
        new SmtpSettings("smtp.gmail.com", 587, false),
        SmtpSettings.resolve(sender("Me@Gmail.COM").build()));
  }

  @Test
  void testExplicitPortAndSslOverrideTable() throws WatchdogException {
    SmtpSettings smtp =
        SmtpSettings.resolve(sender("me@gmail.com").smtpPort(465).smtpSsl(true).build());
    assertEquals(new SmtpSettings("smtp.gmail.com", 465, true), smtp);
  }

  @Test
  void testExplicitHostDefaults() throws WatchdogException {
    assertEquals(
        new SmtpSettings("mail.corp.example", 465, true),
        SmtpSettings.resolve(sender("me@corp.example").smtpHost("mail.corp.example").build()));
    assertEquals(
        new SmtpSettings("mail.corp.example", 587, false),
        SmtpSettings.resolve(
            sender("me@corp.example").smtpHost("mail.corp.example").smtpSsl(false).build()));
    assertEquals(
        new SmtpSettings("mail.corp.example", 2525, false),
        SmtpSettings.resolve(
            sender("me@corp.example")
                .smtpHost("mail.corp.example")
                .smtpPort(2525)
                .smtpSsl(false)
                .build()));
  }

  @Test
  void testUnknownDomain() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> SmtpSettings.resolve(sender("me@corp.example").build()));
    assertEquals(ErrorKind.UNSUPPORTED_DOMAIN, e.kind());
    assertEquals("corp.example", e.value().orElseThrow());
    assertTrue(e.kind().fatal());
  }

  @Test
  void testToString() {
    assertEquals("smtp.qq.com:465 (ssl)", new SmtpSettings("smtp.qq.com", 465, true).toString());
    assertEquals(
        "smtp.gmail.com:587 (starttls)", new SmtpSettings("smtp.gmail.com", 587, false).toString());
  }
}
