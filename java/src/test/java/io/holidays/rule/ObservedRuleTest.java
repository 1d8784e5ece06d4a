package io.holidays.rule;

import static java.time.DayOfWeek.*;
import static org.junit.jupiter.api.Assertions.*;

import io.holidays.HolidayException;
import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class ObservedRuleTest {

  @Test
  void testDeltaLookup() {
    ObservedRule rule = ObservedRule.of(SATURDAY, -1, SUNDAY, +1);
    assertEquals(OptionalInt.of(-1), rule.delta(SATURDAY));
    assertEquals(OptionalInt.of(1), rule.delta(SUNDAY));
    assertTrue(rule.delta(MONDAY).isEmpty());
  }

  @Test
  void testScanEntries() {
    ObservedRule rule = ObservedRules.SAT_SUN_TO_NEXT_WORKDAY.plus(ObservedRules.SAT_TO_PREV_FRI);
    assertFalse(rule.isScan(SATURDAY));
    assertTrue(rule.isScan(SUNDAY));
    assertFalse(rule.isScan(MONDAY));
  }

  @Test
  void testPlusRightOperandWins() {
    ObservedRule left = ObservedRule.of(SATURDAY, +2, SUNDAY, +1);
    ObservedRule right = ObservedRule.of(SATURDAY, -1);

    ObservedRule composed = left.plus(right);
    assertEquals(OptionalInt.of(-1), composed.delta(SATURDAY));
    assertEquals(OptionalInt.of(1), composed.delta(SUNDAY));

    // Operands are untouched.
    assertEquals(OptionalInt.of(2), left.delta(SATURDAY));
    assertEquals(1, right.deltas().size());
  }

  @Test
  void testPlusIsNotCommutativeOnSharedDays() {
    ObservedRule a = ObservedRules.SAT_SUN_TO_NEXT_MON;
    ObservedRule b = ObservedRules.SAT_TO_PREV_FRI;
    assertNotEquals(a.plus(b), b.plus(a));
    assertEquals(OptionalInt.of(2), b.plus(a).delta(SATURDAY));
  }

  @Test
  void testPlusEmptyIsIdentity() {
    ObservedRule rule = ObservedRules.WORKDAY_TO_NEAREST_MON;
    assertEquals(rule, rule.plus(ObservedRule.empty()));
    assertEquals(rule, ObservedRule.empty().plus(rule));
  }

  @Test
  void testZeroDeltaRejected() {
    assertThrows(IllegalArgumentException.class, () -> ObservedRule.of(MONDAY, 0));
  }

  @Test
  void testNullEntriesRejected() {
    Map<DayOfWeek, Integer> nullValue = new HashMap<>();
    nullValue.put(MONDAY, null);
    assertThrows(IllegalArgumentException.class, () -> ObservedRule.of(nullValue));

    Map<DayOfWeek, Integer> nullKey = new HashMap<>();
    nullKey.put(null, 1);
    assertThrows(IllegalArgumentException.class, () -> ObservedRule.of(nullKey));

    assertThrows(IllegalArgumentException.class, () -> ObservedRule.of(null));
  }

  @Test
  void testEntriesAreCopied() {
    Map<DayOfWeek, Integer> source = new EnumMap<>(DayOfWeek.class);
    source.put(SUNDAY, 1);
    ObservedRule rule = ObservedRule.of(source);
    source.put(SATURDAY, 2);

    assertTrue(rule.delta(SATURDAY).isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> rule.deltas().put(MONDAY, 1));
  }

  @Test
  void testCatalogTables() {
    assertEquals(
        ObservedRule.of(SATURDAY, ObservedRule.PREVIOUS_WORKDAY, SUNDAY, ObservedRule.NEXT_WORKDAY),
        ObservedRules.SAT_TO_PREV_WORKDAY.plus(ObservedRules.SUN_TO_NEXT_WORKDAY));
    assertEquals(OptionalInt.of(-1), ObservedRules.ALL_TO_NEAREST_MON.delta(TUESDAY));
    assertEquals(OptionalInt.of(3), ObservedRules.ALL_TO_NEAREST_MON.delta(FRIDAY));
    assertEquals(OptionalInt.of(4), ObservedRules.ALL_TO_NEAREST_MON_LATAM.delta(THURSDAY));
    assertEquals(OptionalInt.of(-3), ObservedRules.ALL_TO_NEAREST_MON.delta(THURSDAY));
    assertTrue(ObservedRules.ALL_TO_NEAREST_MON.delta(MONDAY).isEmpty());
  }

  @Test
  void testCatalogByName() {
    assertEquals(
        ObservedRules.SAT_SUN_TO_NEXT_MON, ObservedRules.byName("SAT_SUN_TO_NEXT_MON").get());
    assertEquals(
        ObservedRules.SAT_SUN_TO_NEXT_MON, ObservedRules.byName("sat_sun_to_next_mon").get());
    assertTrue(ObservedRules.byName("SAT_TO_NEXT_FRI").isEmpty());
    assertTrue(ObservedRules.byName(null).isEmpty());
    assertTrue(ObservedRules.names().contains("WORKDAY_TO_NEXT_WORKDAY"));
  }

  @Test
  void testCatalogTablesRoundTripThroughText() throws HolidayException {
    for (String name : ObservedRules.names()) {
      ObservedRule rule = ObservedRules.byName(name).get();
      assertEquals(rule, ObservedRule.parse(rule.toString()), name);
      assertEquals(rule, ObservedRule.parse(name), name);
    }
  }
}
