package io.holidays.calendar;

import java.util.List;
import java.util.Optional;

/**
 * A calendar capability that dates holidays of some kind, e.g. lunar or lunisolar festivals.
 *
 * @param <K> the holiday kind
 */
public interface HolidayDateProvider<K> {
  /**
   * Returns the dates of a holiday within a Gregorian year, in ascending order. A lunar holiday
   * may fall twice in one Gregorian year.
   *
   * @param kind the holiday kind
   * @param year the Gregorian year
   * @return the dates, empty if the year is not covered
   */
  List<EstimatedDate> dates(K kind, int year);

  /**
   * Returns the first date of a holiday within a Gregorian year.
   *
   * @param kind the holiday kind
   * @param year the Gregorian year
   * @return the first date, or empty if the year is not covered
   */
  default Optional<EstimatedDate> date(K kind, int year) {
    List<EstimatedDate> dates = dates(kind, year);
    return dates.isEmpty() ? Optional.empty() : Optional.of(dates.get(0));
  }
}
