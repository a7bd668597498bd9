package io.pocwatchdog.notify;

import java.util.Map;
import java.util.Optional;

/** Built-in SMTP endpoints of common mail providers, keyed by sender domain. */
public final class SmtpProviders {
  private static final Map<String, SmtpSettings> PROVIDERS =
      Map.ofEntries(
          Map.entry("qq.com", ssl("smtp.qq.com")),
          Map.entry("exmail.qq.com", ssl("smtp.exmail.qq.com")),
          Map.entry("163.com", ssl("smtp.163.com")),
          Map.entry("126.com", ssl("smtp.126.com")),
          Map.entry("yeah.net", ssl("smtp.yeah.net")),
          Map.entry("sina.com", ssl("smtp.sina.com")),
          Map.entry("sina.cn", ssl("smtp.sina.cn")),
          Map.entry("sohu.com", ssl("smtp.sohu.com")),
          Map.entry("outlook.com", starttls("smtp.office365.com")),
          Map.entry("hotmail.com", starttls("smtp.office365.com")),
          Map.entry("live.com", starttls("smtp.office365.com")),
          Map.entry("gmail.com", starttls("smtp.gmail.com")),
          Map.entry("yahoo.com", ssl("smtp.mail.yahoo.com")),
          Map.entry("yahoo.com.cn", ssl("smtp.mail.yahoo.com.cn")),
          Map.entry("aliyun.com", ssl("smtp.aliyun.com")),
          Map.entry("139.com", ssl("smtp.139.com")),
          Map.entry("189.cn", ssl("smtp.189.cn")),
          Map.entry("21cn.com", ssl("smtp.21cn.com")));

  private SmtpProviders() {}

  /**
   * Looks up the SMTP endpoint for a sender address.
   *
   * @param senderAddress the sender, e.g. {@code alice@gmail.com}
   * @return the endpoint, or empty if the domain is not in the table
   */
  public static Optional<SmtpSettings> lookup(String senderAddress) {
    if (senderAddress == null || senderAddress.indexOf('@') < 0) {
      return Optional.empty();
    }
    return Optional.ofNullable(PROVIDERS.get(SmtpSettings.domainOf(senderAddress)));
  }

  private static SmtpSettings ssl(String host) {
    return new SmtpSettings(host, SmtpSettings.SSL_PORT, true);
  }

  private static SmtpSettings starttls(String host) {
    return new SmtpSettings(host, SmtpSettings.SUBMISSION_PORT, false);
  }
}
