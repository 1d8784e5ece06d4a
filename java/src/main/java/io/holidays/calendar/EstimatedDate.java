package io.holidays.calendar;

import java.time.LocalDate;

/**
 * A holiday date supplied by a calendar provider, flagged when it is an estimate rather than an
 * officially confirmed date.
 *
 * @param date the date
 * @param estimate true if the date is estimated
 */
public record EstimatedDate(LocalDate date, boolean estimate) {
  /** Creates a new EstimatedDate. */
  public EstimatedDate {
    if (date == null) {
      throw new IllegalArgumentException("date must not be null");
    }
  }

  /**
   * Creates a confirmed date.
   *
   * @param date the date
   * @return a new non-estimated date
   */
  public static EstimatedDate exact(LocalDate date) {
    return new EstimatedDate(date, false);
  }

  /**
   * Creates an estimated date.
   *
   * @param date the date
   * @return a new estimated date
   */
  public static EstimatedDate estimated(LocalDate date) {
    return new EstimatedDate(date, true);
  }
}
