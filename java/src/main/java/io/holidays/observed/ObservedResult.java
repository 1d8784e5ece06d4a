package io.holidays.observed;

import java.time.LocalDate;

/**
 * Outcome of an observed-date operation.
 *
 * @param observed true if an observed entry was written to the store
 * @param date the observed date, or the nominal date when nothing was written
 */
public record ObservedResult(boolean observed, LocalDate date) {
  /**
   * Creates a result for a committed observed date.
   *
   * @param date the observed date
   * @return a new result
   */
  public static ObservedResult observed(LocalDate date) {
    return new ObservedResult(true, date);
  }

  /**
   * Creates a result for a holiday that stays on its nominal date.
   *
   * @param nominal the nominal date
   * @return a new result
   */
  public static ObservedResult notObserved(LocalDate nominal) {
    return new ObservedResult(false, nominal);
  }
}
