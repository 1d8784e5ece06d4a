package io.holidays.calendar;

import java.time.LocalDate;

/**
 * Dates Easter Sunday and the movable feasts defined relative to it.
 *
 * <p>Jurisdictions hold an instance per computus they need:
 *
 * <pre>{@code
 * EasterCalendar easter = new EasterCalendar(EasterMethod.WESTERN);
 * LocalDate goodFriday = easter.easterOffset(2024, -2); // 2024-03-29
 * }</pre>
 */
public final class EasterCalendar {
  /** First year of the Gregorian calendar. */
  private static final int MIN_YEAR = 1583;

  /** Last year for which the Julian to Gregorian shift below holds. */
  private static final int MAX_YEAR = 4099;

  private final EasterMethod method;

  /**
   * Creates a calendar for a computus.
   *
   * @param method the computus
   */
  public EasterCalendar(EasterMethod method) {
    if (method == null) {
      throw new IllegalArgumentException("easter method must not be null");
    }
    this.method = method;
  }

  /**
   * Returns the Gregorian date of Easter Sunday.
   *
   * @param year the year, 1583 to 4099
   * @return the date of Easter Sunday
   * @throws IllegalArgumentException if the year is out of range
   */
  public LocalDate easterSunday(int year) {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      throw new IllegalArgumentException(
          "easter is computed for years " + MIN_YEAR + " to " + MAX_YEAR + ", got " + year);
    }
    return switch (method) {
      case WESTERN -> westernEaster(year);
      case ORTHODOX -> orthodoxEaster(year);
    };
  }

  /**
   * Returns the date a number of days from Easter Sunday, e.g. -2 for Good Friday or +1 for
   * Easter Monday.
   *
   * @param year the year
   * @param days the offset in days
   * @return the date
   */
  public LocalDate easterOffset(int year, int days) {
    return easterSunday(year).plusDays(days);
  }

  /**
   * Returns the computus of this calendar.
   *
   * @return the computus
   */
  public EasterMethod method() {
    return method;
  }

  // Anonymous Gregorian algorithm (Meeus/Jones/Butcher).
  private static LocalDate westernEaster(int year) {
    int a = year % 19;
    int b = year / 100;
    int c = year % 100;
    int d = b / 4;
    int e = b % 4;
    int f = (b + 8) / 25;
    int g = (b - f + 1) / 3;
    int h = (19 * a + b - d - g + 15) % 30;
    int i = c / 4;
    int k = c % 4;
    int l = (32 + 2 * e + 2 * i - h - k) % 7;
    int m = (a + 11 * h + 22 * l) / 451;
    int n = h + l - 7 * m + 114;
    return LocalDate.of(year, n / 31, n % 31 + 1);
  }

  // Meeus Julian algorithm, then shifted by the Julian/Gregorian difference of the century.
  private static LocalDate orthodoxEaster(int year) {
    int a = year % 4;
    int b = year % 7;
    int c = year % 19;
    int d = (19 * c + 15) % 30;
    int e = (2 * a + 4 * b - d + 34) % 7;
    int n = d + e + 114;
    int shift = year / 100 - year / 400 - 2;
    return LocalDate.of(year, n / 31, n % 31 + 1).plusDays(shift);
  }
}
