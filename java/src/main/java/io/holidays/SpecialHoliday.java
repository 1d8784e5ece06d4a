package io.holidays;

import java.time.LocalDate;
import java.time.MonthDay;

/**
 * A one-off holiday declared for a single year, e.g. a state funeral or an election day.
 *
 * @param monthDay the month and day
 * @param name the holiday name
 */
public record SpecialHoliday(MonthDay monthDay, String name) {
  /** Creates a new SpecialHoliday. */
  public SpecialHoliday {
    if (monthDay == null || name == null || name.isBlank()) {
      throw new IllegalArgumentException("special holiday needs a month/day and a name");
    }
  }

  /**
   * Creates a special holiday.
   *
   * @param month the month (1-12)
   * @param day the day of month
   * @param name the holiday name
   * @return a new special holiday
   */
  public static SpecialHoliday of(int month, int day, String name) {
    return new SpecialHoliday(MonthDay.of(month, day), name);
  }

  /**
   * Returns the date of this holiday in a year.
   *
   * @param year the year
   * @return the date
   * @throws IllegalArgumentException if the month and day do not exist in that year (February 29
   *     outside leap years)
   */
  public LocalDate atYear(int year) {
    if (!monthDay.isValidYear(year)) {
      throw new IllegalArgumentException(
          "special holiday '" + name + "' on " + monthDay + " does not exist in " + year);
    }
    return LocalDate.of(year, monthDay.getMonth(), monthDay.getDayOfMonth());
  }
}
