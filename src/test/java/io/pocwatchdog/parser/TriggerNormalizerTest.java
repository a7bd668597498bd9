package io.pocwatchdog.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.pocwatchdog.ErrorKind;
import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.Firing;
import io.pocwatchdog.ast.IntervalFiring;
import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.ast.TimeOfDay;
import io.pocwatchdog.ast.TimepointFiring;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class TriggerNormalizerTest {

  @Test
  void testNumberGivesInterval() throws WatchdogException {
    List<Firing> firings = TriggerNormalizer.normalize(ScheduleValue.seconds(90));
    assertEquals(List.of(new IntervalFiring(90)), firings);
    assertEquals(Duration.ofSeconds(90), ((IntervalFiring) firings.get(0)).interval());
  }

  @Test
  void testTextGivesTimepoint() throws WatchdogException {
    assertEquals(
        List.of(new TimepointFiring(new TimeOfDay(7, 30))),
        TriggerNormalizer.normalize(ScheduleValue.at("07:30")));
  }

  @Test
  void testListKeepsOrderAndMixesShapes() throws WatchdogException {
    List<Firing> firings =
        TriggerNormalizer.normalize(ScheduleValue.of(List.of("12:00", 60, "08:00")));
    assertEquals(
        List.of(
            new TimepointFiring(new TimeOfDay(12, 0)),
            new IntervalFiring(60),
            new TimepointFiring(new TimeOfDay(8, 0))),
        firings);
  }

  @Test
  void testEmptyListRejected() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> TriggerNormalizer.normalize(ScheduleValue.of(List.of())));
    assertTrue(e.getMessage().contains("empty"));
  }

  @Test
  void testNestedShapesRejected() {
    WatchdogException nested =
        assertThrows(
            WatchdogException.class,
            () -> TriggerNormalizer.normalize(ScheduleValue.of(List.of(List.of("08:00")))));
    assertTrue(nested.getMessage().contains("nested"));

    WatchdogException mapping =
        assertThrows(
            WatchdogException.class,
            () -> TriggerNormalizer.normalize(ScheduleValue.of(Map.of("mon", "08:00"))));
    assertTrue(mapping.getMessage().contains("top level"));
  }

  @Test
  void testNonPositiveIntervalRejected() {
    assertThrows(
        WatchdogException.class, () -> TriggerNormalizer.normalize(ScheduleValue.seconds(0)));
    assertThrows(
        WatchdogException.class, () -> TriggerNormalizer.normalize(ScheduleValue.seconds(-1)));
  }

  @Test
  void testIntervalUpperBound() throws WatchdogException {
    long max = TriggerNormalizer.MAX_INTERVAL_SECONDS;
    assertEquals(
        List.of(new IntervalFiring(max)),
        TriggerNormalizer.normalize(ScheduleValue.seconds(max)));

    WatchdogException e =
        assertThrows(
            WatchdogException.class,
            () -> TriggerNormalizer.normalize(ScheduleValue.seconds(Long.MAX_VALUE)));
    assertEquals(ErrorKind.INVALID_SCHEDULE, e.kind());
    assertTrue(e.getMessage().contains("too large"), e.getMessage());
  }

  @Test
  void testUnsupportedTypeNamed() {
    WatchdogException e =
        assertThrows(
            WatchdogException.class, () -> TriggerNormalizer.normalize(ScheduleValue.of(true)));
    assertTrue(e.getMessage().contains("Boolean"), e.getMessage());
  }
}
