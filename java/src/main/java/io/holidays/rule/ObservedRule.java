package io.holidays.rule;

import io.holidays.HolidayException;
import io.holidays.display.Display;
import io.holidays.parser.Parser;
import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * A weekday transition table: for each weekday, how a holiday falling on that weekday is
 * shifted to its observed date.
 *
 * <p>A delta of {@link #NEXT_WORKDAY} (+7) or {@link #PREVIOUS_WORKDAY} (-7) is not a fixed
 * offset but a scan to the nearest day that is neither a weekend day nor already a holiday.
 * Any other delta is a fixed number of calendar days. Weekdays without an entry are never
 * shifted.
 *
 * <p>Tables are immutable and compose with {@link #plus(ObservedRule)}:
 *
 * <pre>{@code
 * ObservedRule rule = ObservedRules.WORKDAY_TO_NEAREST_MON.plus(ObservedRules.FRI_TO_NEXT_WORKDAY);
 * }</pre>
 *
 * @param deltas the weekday to delta entries
 */
public record ObservedRule(Map<DayOfWeek, Integer> deltas) {
  /** Scan forward to the next free workday. */
  public static final int NEXT_WORKDAY = +7;

  /** Scan backward to the previous free workday. */
  public static final int PREVIOUS_WORKDAY = -7;

  private static final ObservedRule EMPTY = new ObservedRule(Map.of());

  /** Creates a new ObservedRule, validating and copying the entries. */
  public ObservedRule {
    if (deltas == null) {
      throw new IllegalArgumentException("deltas must not be null");
    }
    EnumMap<DayOfWeek, Integer> copy = new EnumMap<>(DayOfWeek.class);
    for (Map.Entry<DayOfWeek, Integer> entry : deltas.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("weekday must not be null");
      }
      if (entry.getValue() == null || entry.getValue() == 0) {
        throw new IllegalArgumentException(
            "delta for " + entry.getKey() + " must be a non-zero number of days");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    deltas = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the table with no entries.
   *
   * @return the empty table
   */
  public static ObservedRule empty() {
    return EMPTY;
  }

  /**
   * Creates a table from weekday to delta entries.
   *
   * @param deltas the entries
   * @return a new table
   * @throws IllegalArgumentException if a delta is zero or an entry is null
   */
  public static ObservedRule of(Map<DayOfWeek, Integer> deltas) {
    return new ObservedRule(deltas);
  }

  /**
   * Creates a single-entry table.
   *
   * @param day the weekday
   * @param delta the delta for that weekday
   * @return a new table
   */
  public static ObservedRule of(DayOfWeek day, int delta) {
    return new ObservedRule(Map.of(day, delta));
  }

  /**
   * Creates a two-entry table.
   *
   * @param day1 the first weekday
   * @param delta1 the delta for the first weekday
   * @param day2 the second weekday
   * @param delta2 the delta for the second weekday
   * @return a new table
   */
  public static ObservedRule of(DayOfWeek day1, int delta1, DayOfWeek day2, int delta2) {
    return new ObservedRule(Map.of(day1, delta1, day2, delta2));
  }

  /**
   * Parses a table from its text form, e.g. {@code "sat prev workday, sun next workday"} or
   * {@code "SAT_SUN_TO_NEXT_MON + fri +3"}.
   *
   * @param text the rule text
   * @return the parsed table
   * @throws HolidayException if the text is invalid
   */
  public static ObservedRule parse(String text) throws HolidayException {
    return Parser.parse(text);
  }

  /**
   * Composes this table with another. Entries of {@code other} win on shared weekdays.
   *
   * @param other the table whose entries take precedence
   * @return a new table holding the union of both tables
   */
  public ObservedRule plus(ObservedRule other) {
    EnumMap<DayOfWeek, Integer> merged = new EnumMap<>(DayOfWeek.class);
    merged.putAll(deltas);
    merged.putAll(other.deltas);
    return new ObservedRule(merged);
  }

  /**
   * Returns the delta for a weekday.
   *
   * @param day the weekday
   * @return the delta, or empty if the weekday is never shifted
   */
  public OptionalInt delta(DayOfWeek day) {
    Integer delta = deltas.get(day);
    return delta == null ? OptionalInt.empty() : OptionalInt.of(delta);
  }

  /**
   * Returns true if holidays on this weekday are moved by scanning for a free workday.
   *
   * @param day the weekday
   * @return true for the +7 and -7 entries
   */
  public boolean isScan(DayOfWeek day) {
    Integer delta = deltas.get(day);
    return delta != null && Math.abs(delta) == NEXT_WORKDAY;
  }

  /**
   * Returns true if the table has no entries.
   *
   * @return true if no weekday is shifted
   */
  public boolean isEmpty() {
    return deltas.isEmpty();
  }

  /**
   * Returns the canonical text form of this table.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(this);
  }
}
