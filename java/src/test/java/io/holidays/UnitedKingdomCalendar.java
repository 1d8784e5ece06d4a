package io.holidays;

import static java.time.DayOfWeek.MONDAY;
import static java.time.temporal.TemporalAdjusters.firstInMonth;
import static java.time.temporal.TemporalAdjusters.lastInMonth;

import io.holidays.calendar.EasterCalendar;
import io.holidays.calendar.EasterMethod;
import io.holidays.observed.ObservedHolidayRegistry;
import io.holidays.rule.ObservedRules;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Bank holidays of the United Kingdom, used as a sample jurisdiction in tests. */
public class UnitedKingdomCalendar extends HolidayCalendar {
  static final JurisdictionConfig CONFIG =
      JurisdictionConfig.of("GB", ObservedRules.SAT_SUN_TO_NEXT_WORKDAY)
          .withSubdivisions(Set.of("ENG", "NIR", "SCT", "WLS"))
          .withSupportedCategories(EnumSet.of(HolidayCategory.PUBLIC, HolidayCategory.BANK));

  private final EasterCalendar easter = new EasterCalendar(EasterMethod.WESTERN);

  public UnitedKingdomCalendar() {
    super(CONFIG);
  }

  public UnitedKingdomCalendar(
      String subdivision, boolean observed, Set<HolidayCategory> categories) {
    super(CONFIG, subdivision, observed, categories);
  }

  @Override
  protected void populate(HolidayCategory category, ObservedHolidayRegistry registry) {
    switch (category) {
      case PUBLIC -> populatePublic(registry);
      case BANK -> populateBank(registry);
      default -> throw new IllegalStateException("unsupported category " + category);
    }
  }

  private void populatePublic(ObservedHolidayRegistry registry) {
    int year = registry.year();
    boolean scotland = isSubdivision("SCT");
    List<LocalDate> observed = new ArrayList<>();

    observed.add(registry.addHoliday(Month.JANUARY, 1, "New Year's Day"));
    if (scotland) {
      observed.add(registry.addHoliday(Month.JANUARY, 2, "New Year Holiday"));
    }
    if (isSubdivision("NIR")) {
      observed.add(registry.addHoliday(Month.MARCH, 17, "Saint Patrick's Day"));
    }

    registry.addHoliday(easter.easterOffset(year, -2), "Good Friday");
    if (!scotland) {
      registry.addHoliday(easter.easterOffset(year, 1), "Easter Monday");
    }

    LocalDate may = LocalDate.of(year, Month.MAY, 1);
    registry.addHoliday(may.with(firstInMonth(MONDAY)), "May Day");
    registry.addHoliday(
        year == 2022 ? LocalDate.of(year, Month.JUNE, 2) : may.with(lastInMonth(MONDAY)),
        "Spring Bank Holiday");

    LocalDate august = LocalDate.of(year, Month.AUGUST, 1);
    registry.addHoliday(
        august.with(scotland ? firstInMonth(MONDAY) : lastInMonth(MONDAY)),
        "Summer Bank Holiday");

    observed.add(registry.addHoliday(Month.DECEMBER, 25, "Christmas Day"));
    observed.add(registry.addHoliday(Month.DECEMBER, 26, "Boxing Day"));

    registry.populateObserved(observed);
  }

  private void populateBank(ObservedHolidayRegistry registry) {
    if (isSubdivision("SCT")) {
      LocalDate standrews = registry.addHoliday(Month.NOVEMBER, 30, "Saint Andrew's Day");
      registry.addObserved(standrews, ObservedRules.SAT_SUN_TO_NEXT_MON);
    }
  }

  @Override
  protected List<SpecialHoliday> specialHolidays(HolidayCategory category, int year) {
    if (category != HolidayCategory.PUBLIC) {
      return List.of();
    }
    switch (year) {
      case 2022:
        return List.of(
            SpecialHoliday.of(6, 3, "Platinum Jubilee of Elizabeth II"),
            SpecialHoliday.of(9, 19, "State Funeral of Queen Elizabeth II"));
      case 2023:
        return List.of(SpecialHoliday.of(5, 8, "Coronation of Charles III"));
      default:
        return List.of();
    }
  }

  private boolean isSubdivision(String code) {
    return subdivision().map(code::equals).orElse(false);
  }
}
