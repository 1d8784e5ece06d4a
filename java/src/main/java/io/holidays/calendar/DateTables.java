package io.holidays.calendar;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Table-driven holiday dates with a two-tier lookup per holiday kind: an exact table of
 * confirmed dates and an estimated table used when the exact table has no entry for the year.
 *
 * <p>Shared estimated tables are typically overlaid with a jurisdiction's confirmed dates:
 *
 * <pre>{@code
 * DateTables<Festival> local =
 *     shared.toBuilder().exact(Festival.EID_AL_FITR, LocalDate.of(2023, 4, 21)).build();
 * }</pre>
 *
 * @param <K> the holiday kind
 */
public final class DateTables<K extends Enum<K>> implements HolidayDateProvider<K> {
  private final Class<K> kindType;
  private final Map<K, Tiers> tiers;

  private DateTables(Class<K> kindType, Map<K, Tiers> tiers) {
    this.kindType = kindType;
    this.tiers = tiers;
  }

  /**
   * Creates an empty builder.
   *
   * @param kindType the holiday kind enum
   * @param <K> the holiday kind
   * @return a new builder
   */
  public static <K extends Enum<K>> Builder<K> builder(Class<K> kindType) {
    return new Builder<>(kindType);
  }

  /**
   * Returns the dates of a holiday within a year. Confirmed dates win over estimates: when the
   * exact table has the year only its dates are returned, flagged as not estimated.
   *
   * @param kind the holiday kind
   * @param year the Gregorian year
   * @return the dates in ascending order, empty if neither table has the year
   */
  @Override
  public List<EstimatedDate> dates(K kind, int year) {
    Tiers tier = tiers.get(kind);
    if (tier == null) {
      return List.of();
    }

    List<LocalDate> exact = tier.exact().get(year);
    if (exact != null) {
      return wrap(exact, false);
    }
    List<LocalDate> estimated = tier.estimated().get(year);
    if (estimated != null) {
      return wrap(estimated, true);
    }
    return List.of();
  }

  /**
   * Returns a builder holding a copy of these tables.
   *
   * @return a new builder
   */
  public Builder<K> toBuilder() {
    Builder<K> builder = new Builder<>(kindType);
    for (Map.Entry<K, Tiers> entry : tiers.entrySet()) {
      K kind = entry.getKey();
      for (List<LocalDate> dates : entry.getValue().exact().values()) {
        dates.forEach(date -> builder.exact(kind, date));
      }
      for (List<LocalDate> dates : entry.getValue().estimated().values()) {
        dates.forEach(date -> builder.estimated(kind, date));
      }
    }
    return builder;
  }

  private static List<EstimatedDate> wrap(List<LocalDate> dates, boolean estimate) {
    List<EstimatedDate> result = new ArrayList<>(dates.size());
    for (LocalDate date : dates) {
      result.add(new EstimatedDate(date, estimate));
    }
    return Collections.unmodifiableList(result);
  }

  /** The exact and estimated tables of one holiday kind, keyed by Gregorian year. */
  private record Tiers(
      Map<Integer, List<LocalDate>> exact, Map<Integer, List<LocalDate>> estimated) {}

  /**
   * Builds {@link DateTables}.
   *
   * @param <K> the holiday kind
   */
  public static final class Builder<K extends Enum<K>> {
    private final Class<K> kindType;
    private final Map<K, TreeMap<Integer, List<LocalDate>>> exact;
    private final Map<K, TreeMap<Integer, List<LocalDate>>> estimated;

    private Builder(Class<K> kindType) {
      if (kindType == null) {
        throw new IllegalArgumentException("kind type must not be null");
      }
      this.kindType = kindType;
      this.exact = new EnumMap<>(kindType);
      this.estimated = new EnumMap<>(kindType);
    }

    /**
     * Adds a confirmed date.
     *
     * @param kind the holiday kind
     * @param date the date
     * @return this builder
     */
    public Builder<K> exact(K kind, LocalDate date) {
      put(exact, kind, date);
      return this;
    }

    /**
     * Adds a confirmed date.
     *
     * @param kind the holiday kind
     * @param year the year
     * @param month the month
     * @param day the day of month
     * @return this builder
     */
    public Builder<K> exact(K kind, int year, Month month, int day) {
      return exact(kind, LocalDate.of(year, month, day));
    }

    /**
     * Adds an estimated date.
     *
     * @param kind the holiday kind
     * @param date the date
     * @return this builder
     */
    public Builder<K> estimated(K kind, LocalDate date) {
      put(estimated, kind, date);
      return this;
    }

    /**
     * Adds an estimated date.
     *
     * @param kind the holiday kind
     * @param year the year
     * @param month the month
     * @param day the day of month
     * @return this builder
     */
    public Builder<K> estimated(K kind, int year, Month month, int day) {
      return estimated(kind, LocalDate.of(year, month, day));
    }

    /**
     * Builds the immutable tables.
     *
     * @return the tables
     */
    public DateTables<K> build() {
      Map<K, Tiers> tiers = new EnumMap<>(kindType);
      for (K kind : kindType.getEnumConstants()) {
        if (exact.containsKey(kind) || estimated.containsKey(kind)) {
          tiers.put(kind, new Tiers(freeze(exact.get(kind)), freeze(estimated.get(kind))));
        }
      }
      return new DateTables<>(kindType, Collections.unmodifiableMap(tiers));
    }

    private static <T> void put(
        Map<T, TreeMap<Integer, List<LocalDate>>> table, T kind, LocalDate date) {
      if (kind == null || date == null) {
        throw new IllegalArgumentException("holiday kind and date are required");
      }
      List<LocalDate> dates =
          table
              .computeIfAbsent(kind, k -> new TreeMap<>())
              .computeIfAbsent(date.getYear(), y -> new ArrayList<>());
      if (!dates.contains(date)) {
        dates.add(date);
        Collections.sort(dates);
      }
    }

    private static Map<Integer, List<LocalDate>> freeze(TreeMap<Integer, List<LocalDate>> table) {
      if (table == null) {
        return Map.of();
      }
      Map<Integer, List<LocalDate>> frozen = new TreeMap<>();
      table.forEach((year, dates) -> frozen.put(year, List.copyOf(dates)));
      return Collections.unmodifiableMap(frozen);
    }
  }
}
