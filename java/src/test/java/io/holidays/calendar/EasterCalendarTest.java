package io.holidays.calendar;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

public class EasterCalendarTest {
  private final EasterCalendar western = new EasterCalendar(EasterMethod.WESTERN);
  private final EasterCalendar orthodox = new EasterCalendar(EasterMethod.ORTHODOX);

  @Test
  void testWesternEaster() {
    assertEquals(LocalDate.of(2023, 4, 9), western.easterSunday(2023));
    assertEquals(LocalDate.of(2024, 3, 31), western.easterSunday(2024));
    assertEquals(LocalDate.of(2025, 4, 20), western.easterSunday(2025));
    assertEquals(LocalDate.of(2000, 4, 23), western.easterSunday(2000));
  }

  @Test
  void testOrthodoxEaster() {
    assertEquals(LocalDate.of(2023, 4, 16), orthodox.easterSunday(2023));
    assertEquals(LocalDate.of(2024, 5, 5), orthodox.easterSunday(2024));
    assertEquals(LocalDate.of(2025, 4, 20), orthodox.easterSunday(2025));
  }

  @Test
  void testEasterIsAlwaysSunday() {
    for (int year = 1900; year <= 2100; year++) {
      assertEquals(DayOfWeek.SUNDAY, western.easterSunday(year).getDayOfWeek(), "" + year);
      assertEquals(DayOfWeek.SUNDAY, orthodox.easterSunday(year).getDayOfWeek(), "" + year);
    }
  }

  @Test
  void testEasterOffset() {
    // Good Friday and Easter Monday.
    assertEquals(LocalDate.of(2024, 3, 29), western.easterOffset(2024, -2));
    assertEquals(LocalDate.of(2024, 4, 1), western.easterOffset(2024, 1));
  }

  @Test
  void testYearOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> western.easterSunday(1582));
    assertThrows(IllegalArgumentException.class, () -> orthodox.easterSunday(4100));
  }
}
