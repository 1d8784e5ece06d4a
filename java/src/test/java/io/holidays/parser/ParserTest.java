package io.holidays.parser;

import static java.time.DayOfWeek.*;
import static org.junit.jupiter.api.Assertions.*;

import io.holidays.ErrorKind;
import io.holidays.HolidayException;
import io.holidays.Span;
import io.holidays.rule.ObservedRule;
import io.holidays.rule.ObservedRules;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Unit tests for the observed rule text parser. */
public class ParserTest {

  @Test
  void testParseEntries() throws HolidayException {
    ObservedRule rule = Parser.parse("sat -1, sun +1");
    assertEquals(ObservedRule.of(SATURDAY, -1, SUNDAY, +1), rule);
    assertEquals("sat -1, sun +1", rule.toString());
  }

  @Test
  void testParseUnsignedAndFullDayNames() throws HolidayException {
    ObservedRule rule = Parser.parse("Saturday 2, SUNDAY 1");
    assertEquals(ObservedRules.SAT_SUN_TO_NEXT_MON, rule);
  }

  @Test
  void testParseWorkdayScans() throws HolidayException {
    ObservedRule rule = Parser.parse("sat previous workday, sun next workday");
    assertEquals(
        ObservedRule.of(SATURDAY, ObservedRule.PREVIOUS_WORKDAY, SUNDAY, ObservedRule.NEXT_WORKDAY),
        rule);
    assertEquals("sat prev workday, sun next workday", rule.toString());
  }

  @Test
  void testCanonicalOrderIsMondayFirst() throws HolidayException {
    assertEquals("mon +1, sun +1", Parser.parse("sun +1, mon +1").toString());
  }

  @Test
  void testParseNone() throws HolidayException {
    ObservedRule rule = Parser.parse("none");
    assertTrue(rule.isEmpty());
    assertEquals("none", rule.toString());
  }

  @Test
  void testParseComposition() throws HolidayException {
    ObservedRule rule = Parser.parse("SAT_SUN_TO_NEXT_MON + sat -1");
    assertEquals(OptionalInt.of(-1), rule.delta(SATURDAY));
    assertEquals(OptionalInt.of(1), rule.delta(SUNDAY));
    assertEquals(ObservedRules.SAT_SUN_TO_NEXT_MON.plus(ObservedRules.SAT_TO_PREV_FRI), rule);
  }

  @Test
  void testCompositionWithoutSpaces() throws HolidayException {
    ObservedRule rule = Parser.parse("sat+2+sun+1");
    assertEquals(ObservedRules.SAT_SUN_TO_NEXT_MON, rule);
  }

  @Test
  void testEmptyInput() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("   "));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("empty input", e.getMessage());
  }

  @Test
  void testZeroDelta() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("sat 0"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals(new Span(4, 5), e.span().get());
  }

  @Test
  void testDuplicateDay() {
    HolidayException e =
        assertThrows(HolidayException.class, () -> Parser.parse("sat +2, sat -1"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertTrue(e.getMessage().contains("duplicate"));
    assertEquals(new Span(8, 11), e.span().get());
  }

  @Test
  void testMissingDelta() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("sat"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals(new Span(3, 3), e.span().get());
  }

  @Test
  void testMissingWorkdayKeyword() {
    assertThrows(HolidayException.class, () -> Parser.parse("sat next monday"));
  }

  @Test
  void testUnexpectedCharacter() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("sat; sun"));
    assertEquals(ErrorKind.LEX, e.kind());
    assertEquals(new Span(3, 4), e.span().get());
  }

  @Test
  void testDeltaOutOfRange() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("sat +1000"));
    assertEquals(ErrorKind.LEX, e.kind());
  }

  @Test
  void testUnknownRuleNameSuggestsClosest() {
    HolidayException e =
        assertThrows(HolidayException.class, () -> Parser.parse("SAT_SUN_TO_NEXT_MOM + fri +3"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("SAT_SUN_TO_NEXT_MON", e.suggestion().get());
    assertEquals(
        "error: unknown rule 'SAT_SUN_TO_NEXT_MOM' (line 1, column 1)\n"
            + "  SAT_SUN_TO_NEXT_MOM + fri +3\n"
            + "  ^^^^^^^^^^^^^^^^^^^\n"
            + "  did you mean \"SAT_SUN_TO_NEXT_MON\"?",
        e.displayRich());
  }

  @Test
  void testErrorOnLaterLine() {
    HolidayException e =
        assertThrows(
            HolidayException.class, () -> Parser.parse("SAT_SUN_TO_NEXT_MON\n  + sat 0"));
    assertEquals(Optional.of(2), e.line());
    assertEquals(Optional.of(9), e.column());
    assertEquals(
        "error: day delta must not be zero (line 2, column 9)\n" + "    + sat 0\n" + "          ^",
        e.displayRich());
  }

  @Test
  void testErrorAtEndOfInput() {
    HolidayException e = assertThrows(HolidayException.class, () -> Parser.parse("sun next"));
    assertEquals(Optional.of(9), e.column());
    assertTrue(e.displayRich().endsWith("\n  sun next\n          ^"));
  }

  @Test
  void testUnknownRuleNameFarFromCatalog() {
    HolidayException e =
        assertThrows(HolidayException.class, () -> Parser.parse("EVERY_OTHER_TUESDAY"));
    assertTrue(e.suggestion().isEmpty());
  }

  @Test
  void testTrailingGarbage() {
    HolidayException e =
        assertThrows(HolidayException.class, () -> Parser.parse("sat +2 sun +1"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals(new Span(7, 10), e.span().get());
  }
}
