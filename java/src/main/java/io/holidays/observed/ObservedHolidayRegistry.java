package io.holidays.observed;

import io.holidays.calendar.EstimatedDate;
import io.holidays.rule.ObservedRule;
import io.holidays.store.HolidayStore;
import java.time.LocalDate;
import java.time.Month;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds holidays and their observed dates to the store of one (jurisdiction, year) computation.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * HolidayStore store = new HolidayStore();
 * ObservedHolidayRegistry registry =
 *     new ObservedHolidayRegistry(
 *         store,
 *         ResolutionContext.of(2022),
 *         ObservedRules.SAT_SUN_TO_NEXT_MON,
 *         ObservedLabels.DEFAULT);
 * LocalDate christmas = registry.addHoliday(Month.DECEMBER, 25, "Christmas Day");
 * registry.addObserved(christmas); // Monday 2022-12-26: "Christmas Day (observed)"
 * }</pre>
 *
 * <h2>Ordering</h2>
 *
 * <p>An observed entry occupies its date, so later workday scans step over it. Batches are
 * therefore resolved in ascending date order, and a registry must not be shared between threads.
 */
public final class ObservedHolidayRegistry {
  private static final Logger log = LoggerFactory.getLogger(ObservedHolidayRegistry.class);

  private final HolidayStore store;
  private final ResolutionContext context;
  private final ObservedRule defaultRule;
  private final ObservedLabels labels;

  /**
   * Creates a registry writing to the given store.
   *
   * @param store the store of the year being populated
   * @param context the resolution parameters
   * @param defaultRule the transition table used when a call names none
   * @param labels the observed and estimated name templates
   */
  public ObservedHolidayRegistry(
      HolidayStore store,
      ResolutionContext context,
      ObservedRule defaultRule,
      ObservedLabels labels) {
    if (store == null || context == null || defaultRule == null || labels == null) {
      throw new IllegalArgumentException("store, context, default rule and labels are required");
    }
    this.store = store;
    this.context = context;
    this.defaultRule = defaultRule;
    this.labels = labels;
  }

  /**
   * Adds a holiday on its nominal date.
   *
   * @param date the date
   * @param name the holiday name
   * @return the date
   */
  public LocalDate addHoliday(LocalDate date, String name) {
    store.add(date, name);
    return date;
  }

  /**
   * Adds a holiday on a month and day of the year being populated.
   *
   * @param month the month
   * @param day the day of month
   * @param name the holiday name
   * @return the date
   */
  public LocalDate addHoliday(Month month, int day, String name) {
    return addHoliday(LocalDate.of(context.year(), month, day), name);
  }

  /**
   * Adds a holiday supplied by a calendar provider, marking the name when the date is estimated.
   *
   * @param date the provider date
   * @param name the holiday name
   * @return the date
   */
  public LocalDate addEstimated(EstimatedDate date, String name) {
    return addHoliday(date.date(), date.estimate() ? labels.estimatedName(name) : name);
  }

  /**
   * Adds the observed entries of every holiday on a date, using the default table.
   *
   * @param date the nominal date
   * @return the outcome
   */
  public ObservedResult addObserved(LocalDate date) {
    return addObserved(date, null, null);
  }

  /**
   * Adds the observed entries of every holiday on a date.
   *
   * @param date the nominal date
   * @param rule the transition table, or null for the default table
   * @return the outcome
   */
  public ObservedResult addObserved(LocalDate date, ObservedRule rule) {
    return addObserved(date, null, rule);
  }

  /**
   * Adds the observed entry of one holiday, using the default table.
   *
   * @param date the nominal date
   * @param name the holiday name
   * @return the outcome
   */
  public ObservedResult addObserved(LocalDate date, String name) {
    return addObserved(date, name, null);
  }

  /**
   * Adds an observed entry for a holiday. The nominal entry is kept.
   *
   * <p>Nothing is written, and the nominal date is returned, when observance is not in effect for
   * the year, when the table does not move the date, or when there is no name to observe.
   *
   * @param date the nominal date
   * @param name the holiday name, or null for every name on the date
   * @param rule the transition table, or null for the default table
   * @return the outcome
   */
  public ObservedResult addObserved(LocalDate date, String name, ObservedRule rule) {
    if (!context.isObservedInEffect()) {
      return ObservedResult.notObserved(date);
    }

    ObservedRule effective = rule != null ? rule : defaultRule;
    LocalDate observed = ObservedDateResolver.resolve(date, effective, store, context);
    if (observed.equals(date)) {
      return ObservedResult.notObserved(date);
    }

    List<String> names = name != null ? List.of(name) : List.copyOf(store.namesAt(date));
    if (names.isEmpty()) {
      log.debug("No holiday on {} to observe", date);
      return ObservedResult.notObserved(date);
    }

    boolean before = observed.isBefore(date);
    for (String holiday : names) {
      String observedName = labels.observedName(holiday, before);
      store.add(observed, observedName);
      log.debug("Observed {} on {} as '{}'", date, observed, observedName);
    }
    return ObservedResult.observed(observed);
  }

  /**
   * Moves every holiday on a date to its observed date, using the default table.
   *
   * @param date the nominal date
   * @return the outcome
   */
  public ObservedResult moveHoliday(LocalDate date) {
    return moveHoliday(date, null);
  }

  /**
   * Moves every holiday on a date to its observed date: the observed entries are added and the
   * nominal entry is removed. When the holiday does not move the store is unchanged.
   *
   * @param date the nominal date
   * @param rule the transition table, or null for the default table
   * @return the outcome, holding the nominal date when nothing moved
   */
  public ObservedResult moveHoliday(LocalDate date, ObservedRule rule) {
    ObservedResult result = addObserved(date, null, rule);
    if (result.observed()) {
      store.remove(date);
      log.debug("Moved holiday from {} to {}", date, result.date());
    }
    return result;
  }

  /**
   * Adds observed entries for a set of dates, collapsing all names of a date together.
   *
   * @param dates the nominal dates
   */
  public void populateObserved(Collection<LocalDate> dates) {
    populateObserved(dates, false);
  }

  /**
   * Adds observed entries for a set of dates in ascending order, using the default table.
   *
   * @param dates the nominal dates
   * @param perName if true each name on a date gets its own observed date; otherwise all names
   *     on a date move together
   */
  public void populateObserved(Collection<LocalDate> dates, boolean perName) {
    if (!context.isObservedInEffect()) {
      return;
    }

    for (LocalDate date : new TreeSet<>(dates)) {
      if (perName) {
        for (String name : List.copyOf(store.namesAt(date))) {
          addObserved(date, name, null);
        }
      } else {
        addObserved(date);
      }
    }
  }

  /**
   * Returns the year being populated.
   *
   * @return the year
   */
  public int year() {
    return context.year();
  }

  /**
   * Returns the resolution parameters.
   *
   * @return the context
   */
  public ResolutionContext context() {
    return context;
  }

  /**
   * Returns the store being populated.
   *
   * @return the store
   */
  public HolidayStore store() {
    return store;
  }

  /**
   * Returns the default transition table.
   *
   * @return the default table
   */
  public ObservedRule defaultRule() {
    return defaultRule;
  }

  /**
   * Returns the name templates.
   *
   * @return the labels
   */
  public ObservedLabels labels() {
    return labels;
  }
}
