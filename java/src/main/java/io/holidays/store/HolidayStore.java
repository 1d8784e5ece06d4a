package io.holidays.store;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The working date to holiday name(s) mapping of one (jurisdiction, year) computation.
 *
 * <p>Dates are kept in ascending order. Each date holds one or more distinct names in insertion
 * order; a date without names is never present. Instances are not thread-safe: each computation
 * uses its own store.
 */
public final class HolidayStore {
  /** Separator used when several names share a date. */
  public static final String NAME_SEPARATOR = "; ";

  private final TreeMap<LocalDate, List<String>> entries = new TreeMap<>();

  /**
   * Adds a holiday name on a date. A name already present on that date is not repeated.
   *
   * @param date the date
   * @param name the holiday name
   * @throws IllegalArgumentException if the name is null or blank
   */
  public void add(LocalDate date, String name) {
    if (date == null) {
      throw new IllegalArgumentException("holiday date must not be null");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("holiday name must not be empty (date " + date + ")");
    }
    List<String> names = entries.computeIfAbsent(date, d -> new ArrayList<>(1));
    if (!names.contains(name)) {
      names.add(name);
    }
  }

  /**
   * Removes every name on a date.
   *
   * @param date the date
   * @return the removed names, or an empty list if the date held none
   */
  public List<String> remove(LocalDate date) {
    List<String> removed = entries.remove(date);
    return removed == null ? List.of() : Collections.unmodifiableList(removed);
  }

  /**
   * Removes a single name from a date, dropping the date if it was the last one.
   *
   * @param date the date
   * @param name the holiday name
   * @return true if the name was present
   */
  public boolean removeName(LocalDate date, String name) {
    List<String> names = entries.get(date);
    if (names == null || !names.remove(name)) {
      return false;
    }
    if (names.isEmpty()) {
      entries.remove(date);
    }
    return true;
  }

  /**
   * Returns true if the date holds at least one holiday.
   *
   * @param date the date
   * @return true if the date is a holiday
   */
  public boolean contains(LocalDate date) {
    return entries.containsKey(date);
  }

  /**
   * Returns the names on a date in insertion order.
   *
   * @param date the date
   * @return an unmodifiable list, empty if the date is not a holiday
   */
  public List<String> namesAt(LocalDate date) {
    List<String> names = entries.get(date);
    return names == null ? List.of() : Collections.unmodifiableList(names);
  }

  /**
   * Returns the display name of a date: all names joined with {@link #NAME_SEPARATOR}.
   *
   * @param date the date
   * @return the joined names, or empty if the date is not a holiday
   */
  public Optional<String> get(LocalDate date) {
    List<String> names = entries.get(date);
    return names == null ? Optional.empty() : Optional.of(String.join(NAME_SEPARATOR, names));
  }

  /**
   * Copies every entry of another store into this one.
   *
   * @param other the store to merge
   */
  public void putAll(HolidayStore other) {
    for (Map.Entry<LocalDate, List<String>> entry : other.entries.entrySet()) {
      for (String name : entry.getValue()) {
        add(entry.getKey(), name);
      }
    }
  }

  /**
   * Returns an independent copy of this store.
   *
   * @return a new store holding the same entries
   */
  public HolidayStore copy() {
    HolidayStore copy = new HolidayStore();
    copy.putAll(this);
    return copy;
  }

  /**
   * Returns the holiday dates in ascending order.
   *
   * @return an unmodifiable view of the dates
   */
  public NavigableSet<LocalDate> dates() {
    return Collections.unmodifiableNavigableSet(entries.navigableKeySet());
  }

  /**
   * Returns a snapshot of the store as date to display name.
   *
   * @return an unmodifiable ordered map
   */
  public NavigableMap<LocalDate, String> asMap() {
    TreeMap<LocalDate, String> view = new TreeMap<>();
    for (Map.Entry<LocalDate, List<String>> entry : entries.entrySet()) {
      view.put(entry.getKey(), String.join(NAME_SEPARATOR, entry.getValue()));
    }
    return Collections.unmodifiableNavigableMap(view);
  }

  /**
   * Returns the number of holiday dates.
   *
   * @return the number of dates
   */
  public int size() {
    return entries.size();
  }

  /**
   * Returns true if no date is stored.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HolidayStore other && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
