package io.holidays.observed;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The explicit parameters of one observed-date computation.
 *
 * @param year the year being populated
 * @param observed whether observed dates are computed at all
 * @param observedSince the first year with observed dates (may be null for no threshold)
 * @param weekend the weekend days skipped by workday scans
 */
public record ResolutionContext(
    int year, boolean observed, Integer observedSince, Set<DayOfWeek> weekend) {
  /** The default weekend: Saturday and Sunday. */
  public static final Set<DayOfWeek> DEFAULT_WEEKEND =
      Collections.unmodifiableSet(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

  /** Creates a new ResolutionContext with a defensive copy of the weekend days. */
  public ResolutionContext {
    if (weekend == null) {
      weekend = DEFAULT_WEEKEND;
    } else {
      if (weekend.size() == DayOfWeek.values().length) {
        throw new IllegalArgumentException("weekend days cannot include all days of the week");
      }
      EnumSet<DayOfWeek> copy = EnumSet.noneOf(DayOfWeek.class);
      copy.addAll(weekend);
      weekend = Collections.unmodifiableSet(copy);
    }
  }

  /**
   * Creates a context for a year with observance enabled, no threshold and the default weekend.
   *
   * @param year the year being populated
   * @return a new context
   */
  public static ResolutionContext of(int year) {
    return new ResolutionContext(year, true, null, DEFAULT_WEEKEND);
  }

  /**
   * Returns a copy for another year.
   *
   * @param year the year
   * @return a new context with the updated year
   */
  public ResolutionContext withYear(int year) {
    return new ResolutionContext(year, observed, observedSince, weekend);
  }

  /**
   * Returns a copy with observance switched on or off.
   *
   * @param observed whether observed dates are computed
   * @return a new context with the updated flag
   */
  public ResolutionContext withObserved(boolean observed) {
    return new ResolutionContext(year, observed, observedSince, weekend);
  }

  /**
   * Returns a copy with the specified observed-since threshold.
   *
   * @param observedSince the first year with observed dates, or null
   * @return a new context with the updated threshold
   */
  public ResolutionContext withObservedSince(Integer observedSince) {
    return new ResolutionContext(year, observed, observedSince, weekend);
  }

  /**
   * Returns a copy with the specified weekend days.
   *
   * @param weekend the weekend days
   * @return a new context with the updated weekend
   */
  public ResolutionContext withWeekend(Set<DayOfWeek> weekend) {
    return new ResolutionContext(year, observed, observedSince, weekend);
  }

  /**
   * Returns true if observed dates are computed for this context's year.
   *
   * @return true if observance is enabled and the year is not below the threshold
   */
  public boolean isObservedInEffect() {
    return observed && (observedSince == null || year >= observedSince);
  }

  /**
   * Returns true if the date falls on a weekend day.
   *
   * @param date the date
   * @return true for weekend days
   */
  public boolean isWeekend(LocalDate date) {
    return weekend.contains(date.getDayOfWeek());
  }
}
