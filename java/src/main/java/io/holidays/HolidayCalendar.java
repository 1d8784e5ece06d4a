package io.holidays;

import io.holidays.observed.ObservedHolidayRegistry;
import io.holidays.observed.ResolutionContext;
import io.holidays.store.HolidayStore;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The holidays of one jurisdiction, computed a year at a time.
 *
 * <p>Subclasses define the holidays of each category through {@link #populate}. Each year is
 * computed once, with its own store and registry, and cached:
 *
 * <pre>{@code
 * HolidayCalendar calendar = new UnitedKingdomCalendar("ENG", true, EnumSet.of(PUBLIC, BANK));
 * calendar.isHoliday(LocalDate.of(2022, 12, 27)); // true, Christmas Day (observed)
 * }</pre>
 *
 * <h2>Year boundaries</h2>
 *
 * <p>Single-date queries read the holidays computed for {@code date.getYear()}. A fixed offset can
 * push an observed entry past December 31 (e.g. Saturday December 31 moved to Monday January 2);
 * that entry belongs to the year it was computed for. It appears in {@link #holidays(int)} for
 * that year and in {@link #holidays(int, int)} ranges covering it, but {@link #isHoliday}, {@link
 * #get} and {@link #namesAt} on the later date do not report it.
 *
 * <p>Instances are safe to query from several threads.
 */
public abstract class HolidayCalendar {
  private static final Logger log = LoggerFactory.getLogger(HolidayCalendar.class);

  private final JurisdictionConfig config;
  private final String subdivision;
  private final boolean observed;
  private final Set<HolidayCategory> categories;
  private final Map<Integer, HolidayStore> years = new ConcurrentHashMap<>();

  /**
   * Creates a calendar for the whole jurisdiction, with observed dates and public holidays.
   *
   * @param config the jurisdiction configuration
   */
  protected HolidayCalendar(JurisdictionConfig config) {
    this(config, null, true, null);
  }

  /**
   * Creates a calendar.
   *
   * @param config the jurisdiction configuration
   * @param subdivision the subdivision code, or null for the whole jurisdiction
   * @param observed whether observed dates are computed
   * @param categories the categories to include, or null for public holidays only
   * @throws IllegalArgumentException if the subdivision or a category is not supported
   */
  protected HolidayCalendar(
      JurisdictionConfig config,
      String subdivision,
      boolean observed,
      Set<HolidayCategory> categories) {
    if (config == null) {
      throw new IllegalArgumentException("jurisdiction config must not be null");
    }
    if (subdivision != null && !config.subdivisions().contains(subdivision)) {
      throw new IllegalArgumentException(
          "subdivision '" + subdivision + "' is not supported for " + config.code());
    }
    Set<HolidayCategory> requested =
        categories == null || categories.isEmpty()
            ? EnumSet.of(HolidayCategory.PUBLIC)
            : EnumSet.copyOf(categories);
    for (HolidayCategory category : requested) {
      if (!config.supportedCategories().contains(category)) {
        throw new IllegalArgumentException(
            "category " + category + " is not supported for " + config.code());
      }
    }
    this.config = config;
    this.subdivision = subdivision;
    this.observed = observed;
    this.categories = Collections.unmodifiableSet(requested);
  }

  /**
   * Adds the holidays of one category for the registry's year.
   *
   * @param category the category being populated
   * @param registry the registry of the year
   */
  protected abstract void populate(HolidayCategory category, ObservedHolidayRegistry registry);

  /**
   * Returns the one-off holidays of a category in a year. Called only for the requested
   * categories; subdivision-specific specials can be selected through {@link #subdivision()}.
   *
   * @param category the category being populated
   * @param year the year
   * @return the special holidays, empty by default
   */
  protected List<SpecialHoliday> specialHolidays(HolidayCategory category, int year) {
    return List.of();
  }

  /**
   * Returns the one-off observed holidays of a category in a year. Their names are labelled as
   * observed, and they are skipped when observance is not in effect for the year.
   *
   * @param category the category being populated
   * @param year the year
   * @return the special observed holidays, empty by default
   */
  protected List<SpecialHoliday> specialObservedHolidays(HolidayCategory category, int year) {
    return List.of();
  }

  /**
   * Returns true if the date is a holiday.
   *
   * @param date the date
   * @return true for holidays
   */
  public boolean isHoliday(LocalDate date) {
    return store(date.getYear()).contains(date);
  }

  /**
   * Returns the holiday names of a date joined with {@link HolidayStore#NAME_SEPARATOR}.
   *
   * @param date the date
   * @return the names, or empty if the date is not a holiday
   */
  public Optional<String> get(LocalDate date) {
    return store(date.getYear()).get(date);
  }

  /**
   * Returns the holiday names of a date.
   *
   * @param date the date
   * @return the names, empty if the date is not a holiday
   */
  public List<String> namesAt(LocalDate date) {
    return store(date.getYear()).namesAt(date);
  }

  /**
   * Returns the holidays computed for a year.
   *
   * @param year the year
   * @return date to joined names, in date order
   */
  public NavigableMap<LocalDate, String> holidays(int year) {
    return store(year).asMap();
  }

  /**
   * Returns the holidays of an inclusive range of years, merged in date order.
   *
   * @param fromYear the first year
   * @param toYear the last year
   * @return date to joined names, in date order
   */
  public NavigableMap<LocalDate, String> holidays(int fromYear, int toYear) {
    if (fromYear > toYear) {
      throw new IllegalArgumentException("fromYear " + fromYear + " is after toYear " + toYear);
    }
    HolidayStore merged = new HolidayStore();
    for (int year = fromYear; year <= toYear; year++) {
      merged.putAll(store(year));
    }
    return merged.asMap();
  }

  public String code() {
    return config.code();
  }

  public Optional<String> subdivision() {
    return Optional.ofNullable(subdivision);
  }

  public boolean isObserved() {
    return observed;
  }

  public Set<HolidayCategory> categories() {
    return categories;
  }

  public JurisdictionConfig config() {
    return config;
  }

  private HolidayStore store(int year) {
    HolidayStore store = years.get(year);
    if (store == null) {
      // Not computeIfAbsent: populate may query other years of this calendar.
      HolidayStore computed = compute(year);
      store = years.putIfAbsent(year, computed);
      if (store == null) {
        store = computed;
      }
    }
    return store;
  }

  private HolidayStore compute(int year) {
    HolidayStore store = new HolidayStore();
    ResolutionContext context = config.context(year, observed);
    ObservedHolidayRegistry registry =
        new ObservedHolidayRegistry(store, context, config.defaultRule(), config.labels());

    for (HolidayCategory category : categories) {
      populate(category, registry);
    }
    for (HolidayCategory category : categories) {
      for (SpecialHoliday special : specialHolidays(category, year)) {
        store.add(special.atYear(year), special.name());
      }
    }
    if (context.isObservedInEffect()) {
      for (HolidayCategory category : categories) {
        for (SpecialHoliday special : specialObservedHolidays(category, year)) {
          store.add(special.atYear(year), config.labels().observedName(special.name(), false));
        }
      }
    }

    log.debug("Computed {} holidays for {} in {}", store.size(), config.code(), year);
    return store;
  }
}
