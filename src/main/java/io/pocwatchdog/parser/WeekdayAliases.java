package io.pocwatchdog.parser;

import io.pocwatchdog.ast.Weekday;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps textual spellings of weekdays to a {@link Weekday}.
 *
 * <p>Keys are NFKC-normalized, trimmed and lower-cased before lookup. Accepted forms:
 *
 * <ul>
 *   <li>ISO numbers {@code "1"} (Monday) to {@code "7"} (Sunday)
 *   <li>full English names and three-letter abbreviations, with or without a trailing period
 *   <li>two-letter forms {@code mo tu we th fr sa su}
 *   <li>single letters {@code m}, {@code w} and {@code f}
 *   <li>Chinese forms such as 星期一, 周一 and 礼拜一
 * </ul>
 *
 * <p>A bare {@code t} (Tuesday or Thursday) or {@code s} (Saturday or Sunday) is ambiguous and
 * never matches.
 */
public final class WeekdayAliases {
  private static final Map<String, Weekday> ALIASES = new HashMap<>();

  static {
    register(Weekday.MONDAY, "1", "monday", "mon", "mo", "m", "星期一", "周一", "礼拜一");
    register(Weekday.TUESDAY, "2", "tuesday", "tue", "tues", "tu", "星期二", "周二", "礼拜二");
    register(
        Weekday.WEDNESDAY,
        "3",
        "wednesday",
        "wed",
        "weds",
        "wednes",
        "we",
        "w",
        "星期三",
        "周三",
        "礼拜三");
    register(
        Weekday.THURSDAY, "4", "thursday", "thu", "thur", "thurs", "th", "星期四", "周四", "礼拜四");
    register(Weekday.FRIDAY, "5", "friday", "fri", "fr", "f", "星期五", "周五", "礼拜五");
    register(Weekday.SATURDAY, "6", "saturday", "sat", "sa", "星期六", "周六", "礼拜六");
    register(
        Weekday.SUNDAY, "7", "sunday", "sun", "su", "星期日", "星期天", "周日", "周天", "礼拜日", "礼拜天");
  }

  private WeekdayAliases() {}

  private static void register(Weekday day, String... aliases) {
    for (String alias : aliases) {
      ALIASES.put(alias, day);
    }
  }

  /**
   * Looks up a weekday alias.
   *
   * @param key the caller-supplied key
   * @return the weekday, or empty if the key is not a known alias
   */
  public static Optional<Weekday> lookup(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String normalized = normalize(key);
    Weekday day = ALIASES.get(normalized);
    if (day == null && normalized.length() > 1 && normalized.endsWith(".")) {
      day = ALIASES.get(normalized.substring(0, normalized.length() - 1));
    }
    return Optional.ofNullable(day);
  }

  static String normalize(String key) {
    return Normalizer.normalize(key, Normalizer.Form.NFKC).strip().toLowerCase(Locale.ROOT);
  }
}
