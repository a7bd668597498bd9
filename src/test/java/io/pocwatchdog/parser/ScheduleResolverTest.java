package io.pocwatchdog.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ErrorKind;
import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.DayRestriction;
import io.pocwatchdog.ast.MappingKey;
import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.ast.TriggerRule;
import io.pocwatchdog.ast.Weekday;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ScheduleResolverTest {

  private static ScheduleData resolveSingle(MappingKey key, ScheduleValue value)
      throws WatchdogException {
    return ScheduleResolver.resolve(new ScheduleValue.Mapping(Map.of(key, value)));
  }

  @Test
  void testNonMappingAppliesEveryDay() throws WatchdogException {
    ScheduleData data = ScheduleResolver.resolve(ScheduleValue.at("08:00", "20:00"));
    assertEquals(2, data.size());
    for (TriggerRule rule : data.rules()) {
      assertEquals(DayRestriction.none(), rule.restriction());
    }
  }

  @Test
  void testKeysAreClassifiedByType() throws WatchdogException {
    Map<MappingKey, ScheduleValue> entries = new LinkedHashMap<>();
    entries.put(new MappingKey.CalendarDayKey(1), ScheduleValue.at("08:00"));
    entries.put(new MappingKey.NamedKey("1"), ScheduleValue.at("08:00"));
    entries.put(new MappingKey.NamedKey("Sat"), ScheduleValue.seconds(600));

    ScheduleData data = ScheduleResolver.resolve(new ScheduleValue.Mapping(entries));

    assertEquals(
        List.of(
            DayRestriction.calendarDay(1),
            DayRestriction.weekday(Weekday.MONDAY),
            DayRestriction.weekday(Weekday.SATURDAY)),
        data.rules().stream().map(TriggerRule::restriction).toList());
  }

  @Test
  void testCalendarDayRange() {
    for (int day : new int[] {0, 32, -1}) {
      WatchdogException e =
          assertThrows(
              WatchdogException.class,
              () -> resolveSingle(new MappingKey.CalendarDayKey(day), ScheduleValue.at("08:00")));
      assertEquals(ErrorKind.INVALID_SCHEDULE, e.kind());
      assertTrue(e.getMessage().contains("1 to 31"), e.getMessage());
    }
  }

  @Test
  void testAmbiguousAliasRejected() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> resolveSingle(new MappingKey.NamedKey("t"), ScheduleValue.seconds(60)));
    assertEquals("invalid day of week: 't'", e.getMessage());
    assertEquals("t", e.value().orElseThrow());
  }

  @Test
  void testValueErrorsInsideMappingPropagate() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> resolveSingle(new MappingKey.NamedKey("mon"), ScheduleValue.at("8:00")));
    assertEquals("8:00", e.value().orElseThrow());
  }

  @Test
  void testEmptyMappingAndNullRejected() {
    assertThrows(
        WatchdogException.class, () -> ScheduleResolver.resolve(ScheduleValue.mapping().build()));
    assertThrows(WatchdogException.class, () -> ScheduleResolver.resolve(null));
  }
}
