package io.pocwatchdog.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ast.Weekday;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class WeekdayAliasesTest {

  @ParameterizedTest
  @CsvSource({
    "1, MONDAY",
    "mon, MONDAY",
    "Monday, MONDAY",
    "m, MONDAY",
    "tu, TUESDAY",
    "Tues., TUESDAY",
    "w, WEDNESDAY",
    "th, THURSDAY",
    "THUR, THURSDAY",
    "f, FRIDAY",
    "sa, SATURDAY",
    "su, SUNDAY",
    "7, SUNDAY",
    "星期一, MONDAY",
    "周三, WEDNESDAY",
    "礼拜天, SUNDAY",
    "星期日, SUNDAY",
  })
  void testKnownAliases(String alias, Weekday expected) {
    assertEquals(Optional.of(expected), WeekdayAliases.lookup(alias));
  }

  @ParameterizedTest
  @ValueSource(strings = {"t", "s", "T", "S.", "", "0", "8", "funday", "mond", ".", "周八"})
  void testUnknownOrAmbiguous(String alias) {
    assertTrue(WeekdayAliases.lookup(alias).isEmpty(), alias);
  }

  @ParameterizedTest
  @ValueSource(strings = {"  fri ", "FRI", "Fri.", "ｆｒｉ"})
  void testNormalization(String alias) {
    assertEquals(Optional.of(Weekday.FRIDAY), WeekdayAliases.lookup(alias));
  }

  @ParameterizedTest
  @ValueSource(strings = {"mon", "tue", "wed", "thu", "fri", "sat", "sun"})
  void testCanonicalNamesRoundTripThroughWeekday(String alias) {
    Weekday day = WeekdayAliases.lookup(alias).orElseThrow();
    assertEquals(day, Weekday.parse(day.toString()).orElseThrow());
  }

  @Test
  void testNullNeverMatches() {
    assertTrue(WeekdayAliases.lookup(null).isEmpty());
  }
}
