package io.holidays;

import io.holidays.observed.ObservedLabels;
import io.holidays.observed.ResolutionContext;
import io.holidays.rule.ObservedRule;
import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The static configuration of a jurisdiction.
 *
 * @param code the jurisdiction code, e.g. {@code "US"}
 * @param defaultRule the transition table used when a holiday names none
 * @param observedSince the first year with observed dates (may be null for no threshold)
 * @param labels the observed and estimated name templates
 * @param weekend the weekend days
 * @param subdivisions the supported subdivision codes
 * @param supportedCategories the categories the jurisdiction defines
 */
public record JurisdictionConfig(
    String code,
    ObservedRule defaultRule,
    Integer observedSince,
    ObservedLabels labels,
    Set<DayOfWeek> weekend,
    Set<String> subdivisions,
    Set<HolidayCategory> supportedCategories) {
  /** Creates a new JurisdictionConfig, filling defaults for null components. */
  public JurisdictionConfig {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("jurisdiction code must not be empty");
    }
    if (defaultRule == null) {
      defaultRule = ObservedRule.empty();
    }
    if (labels == null) {
      labels = ObservedLabels.DEFAULT;
    }
    if (weekend == null) {
      weekend = ResolutionContext.DEFAULT_WEEKEND;
    } else {
      if (weekend.size() == DayOfWeek.values().length) {
        throw new IllegalArgumentException("weekend days cannot include all days of the week");
      }
      EnumSet<DayOfWeek> copy = EnumSet.noneOf(DayOfWeek.class);
      copy.addAll(weekend);
      weekend = Collections.unmodifiableSet(copy);
    }
    subdivisions =
        subdivisions == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(subdivisions));
    if (supportedCategories == null || supportedCategories.isEmpty()) {
      supportedCategories = Collections.unmodifiableSet(EnumSet.of(HolidayCategory.PUBLIC));
    } else {
      supportedCategories = Collections.unmodifiableSet(EnumSet.copyOf(supportedCategories));
    }
  }

  /**
   * Creates a configuration with default labels, weekend and categories.
   *
   * @param code the jurisdiction code
   * @param defaultRule the default transition table
   * @return a new configuration
   */
  public static JurisdictionConfig of(String code, ObservedRule defaultRule) {
    return new JurisdictionConfig(code, defaultRule, null, null, null, null, null);
  }

  /**
   * Returns a copy with the specified default table.
   *
   * @param defaultRule the default transition table
   * @return a new configuration
   */
  public JurisdictionConfig withDefaultRule(ObservedRule defaultRule) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns a copy with the specified observed-since threshold.
   *
   * @param observedSince the first year with observed dates, or null
   * @return a new configuration
   */
  public JurisdictionConfig withObservedSince(Integer observedSince) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns a copy with the specified name templates.
   *
   * @param labels the labels
   * @return a new configuration
   */
  public JurisdictionConfig withLabels(ObservedLabels labels) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns a copy with the specified weekend days.
   *
   * @param weekend the weekend days
   * @return a new configuration
   */
  public JurisdictionConfig withWeekend(Set<DayOfWeek> weekend) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns a copy with the specified subdivision codes.
   *
   * @param subdivisions the subdivision codes
   * @return a new configuration
   */
  public JurisdictionConfig withSubdivisions(Set<String> subdivisions) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns a copy with the specified supported categories.
   *
   * @param supportedCategories the categories
   * @return a new configuration
   */
  public JurisdictionConfig withSupportedCategories(Set<HolidayCategory> supportedCategories) {
    return new JurisdictionConfig(
        code, defaultRule, observedSince, labels, weekend, subdivisions, supportedCategories);
  }

  /**
   * Returns the resolution parameters for one year.
   *
   * @param year the year
   * @param observed whether observed dates are computed
   * @return a new context
   */
  public ResolutionContext context(int year, boolean observed) {
    return new ResolutionContext(year, observed, observedSince, weekend);
  }
}
