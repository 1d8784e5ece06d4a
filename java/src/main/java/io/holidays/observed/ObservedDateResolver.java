package io.holidays.observed;

import io.holidays.rule.ObservedRule;
import io.holidays.store.HolidayStore;
import java.time.LocalDate;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the observed date of one nominal holiday date.
 *
 * <h2>Fixed offsets</h2>
 *
 * <p>A delta other than +7/-7 shifts the nominal date by that many calendar days. The result is
 * not checked against weekends or other holidays, so tables may chain shifts deliberately.
 *
 * <h2>Workday scans</h2>
 *
 * <p>A delta of +7 or -7 scans one day at a time, starting next to the nominal date, for the
 * first day that is neither a weekend day nor already in the store. The scan is bounded by the
 * calendar year of the nominal date: when it would leave that year, the nominal date is returned
 * and no observed date exists.
 */
public final class ObservedDateResolver {
  private static final Logger log = LoggerFactory.getLogger(ObservedDateResolver.class);

  private ObservedDateResolver() {}

  /**
   * Resolves the observed date of a nominal date.
   *
   * @param nominal the nominal holiday date
   * @param rule the transition table
   * @param store the holidays already known, consulted by workday scans
   * @param context the resolution parameters (weekend days)
   * @return the observed date, or {@code nominal} when the holiday does not move
   */
  public static LocalDate resolve(
      LocalDate nominal, ObservedRule rule, HolidayStore store, ResolutionContext context) {
    OptionalInt delta = rule.delta(nominal.getDayOfWeek());
    if (delta.isEmpty()) {
      return nominal;
    }

    int days = delta.getAsInt();
    if (Math.abs(days) != ObservedRule.NEXT_WORKDAY) {
      return nominal.plusDays(days);
    }
    return nextWorkday(nominal, Integer.signum(days), store, context);
  }

  /**
   * Scans from a date in one direction for the closest free workday of the same year.
   *
   * @param from the date to start next to
   * @param direction +1 to scan forward, -1 to scan backward
   * @param store the holidays already known
   * @param context the resolution parameters (weekend days)
   * @return the free workday, or {@code from} if the scan leaves the year
   */
  public static LocalDate nextWorkday(
      LocalDate from, int direction, HolidayStore store, ResolutionContext context) {
    int year = from.getYear();
    LocalDate candidate = from.plusDays(direction);
    while (candidate.getYear() == year) {
      if (!store.contains(candidate) && !context.isWeekend(candidate)) {
        return candidate;
      }
      log.trace("Skipping {} while scanning from {}", candidate, from);
      candidate = candidate.plusDays(direction);
    }
    log.debug("No free workday next to {} within {}", from, year);
    return from;
  }
}
