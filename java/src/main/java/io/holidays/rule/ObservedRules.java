package io.holidays.rule;

import static io.holidays.rule.ObservedRule.NEXT_WORKDAY;
import static io.holidays.rule.ObservedRule.PREVIOUS_WORKDAY;
import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.THURSDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of the named transition tables shared by jurisdictions.
 *
 * <p>Names read as {@code <weekdays>_TO_<target>}: {@code SAT_SUN_TO_NEXT_MON} moves Saturday and
 * Sunday holidays to the following Monday, {@code SAT_TO_PREV_WORKDAY} scans back from Saturday
 * to the closest free workday.
 */
public final class ObservedRules {
  private ObservedRules() {}

  // Single days.
  public static final ObservedRule MON_TO_NEXT_TUE = ObservedRule.of(MONDAY, +1);
  public static final ObservedRule TUE_TO_PREV_MON = ObservedRule.of(TUESDAY, -1);
  public static final ObservedRule TUE_TO_PREV_FRI = ObservedRule.of(TUESDAY, -4);
  public static final ObservedRule WED_TO_PREV_MON = ObservedRule.of(WEDNESDAY, -2);
  public static final ObservedRule WED_TO_NEXT_FRI = ObservedRule.of(WEDNESDAY, +2);
  public static final ObservedRule THU_TO_PREV_MON = ObservedRule.of(THURSDAY, -3);
  public static final ObservedRule THU_TO_PREV_WED = ObservedRule.of(THURSDAY, -1);
  public static final ObservedRule THU_TO_NEXT_MON = ObservedRule.of(THURSDAY, +4);
  public static final ObservedRule THU_TO_NEXT_FRI = ObservedRule.of(THURSDAY, +1);
  public static final ObservedRule FRI_TO_PREV_WED = ObservedRule.of(FRIDAY, -2);
  public static final ObservedRule FRI_TO_PREV_THU = ObservedRule.of(FRIDAY, -1);
  public static final ObservedRule FRI_TO_NEXT_MON = ObservedRule.of(FRIDAY, +3);
  public static final ObservedRule FRI_TO_NEXT_TUE = ObservedRule.of(FRIDAY, +4);
  public static final ObservedRule FRI_TO_NEXT_SAT = ObservedRule.of(FRIDAY, +1);
  public static final ObservedRule FRI_TO_NEXT_WORKDAY = ObservedRule.of(FRIDAY, NEXT_WORKDAY);
  public static final ObservedRule SAT_TO_PREV_THU = ObservedRule.of(SATURDAY, -2);
  public static final ObservedRule SAT_TO_PREV_FRI = ObservedRule.of(SATURDAY, -1);
  public static final ObservedRule SAT_TO_PREV_WORKDAY =
      ObservedRule.of(SATURDAY, PREVIOUS_WORKDAY);
  public static final ObservedRule SAT_TO_NEXT_MON = ObservedRule.of(SATURDAY, +2);
  public static final ObservedRule SAT_TO_NEXT_TUE = ObservedRule.of(SATURDAY, +3);
  public static final ObservedRule SAT_TO_NEXT_SUN = ObservedRule.of(SATURDAY, +1);
  public static final ObservedRule SAT_TO_NEXT_WORKDAY = ObservedRule.of(SATURDAY, NEXT_WORKDAY);
  public static final ObservedRule SUN_TO_NEXT_MON = ObservedRule.of(SUNDAY, +1);
  public static final ObservedRule SUN_TO_NEXT_TUE = ObservedRule.of(SUNDAY, +2);
  public static final ObservedRule SUN_TO_NEXT_WED = ObservedRule.of(SUNDAY, +3);
  public static final ObservedRule SUN_TO_NEXT_WORKDAY = ObservedRule.of(SUNDAY, NEXT_WORKDAY);

  // Multiple days.
  public static final ObservedRule ALL_TO_NEAREST_MON =
      ObservedRule.of(
          Map.of(
              TUESDAY, -1,
              WEDNESDAY, -2,
              THURSDAY, -3,
              FRIDAY, +3,
              SATURDAY, +2,
              SUNDAY, +1));
  public static final ObservedRule ALL_TO_NEAREST_MON_LATAM =
      ObservedRule.of(
          Map.of(
              TUESDAY, -1,
              WEDNESDAY, -2,
              THURSDAY, +4,
              FRIDAY, +3,
              SATURDAY, +2,
              SUNDAY, +1));
  public static final ObservedRule ALL_TO_NEXT_MON =
      ObservedRule.of(
          Map.of(
              TUESDAY, +6,
              WEDNESDAY, +5,
              THURSDAY, +4,
              FRIDAY, +3,
              SATURDAY, +2,
              SUNDAY, +1));
  public static final ObservedRule ALL_TO_NEXT_SUN =
      ObservedRule.of(
          Map.of(
              MONDAY, +6,
              TUESDAY, +5,
              WEDNESDAY, +4,
              THURSDAY, +3,
              FRIDAY, +2,
              SATURDAY, +1));
  public static final ObservedRule WORKDAY_TO_NEAREST_MON =
      ObservedRule.of(Map.of(TUESDAY, -1, WEDNESDAY, -2, THURSDAY, -3, FRIDAY, +3));
  public static final ObservedRule WORKDAY_TO_NEXT_MON =
      ObservedRule.of(Map.of(TUESDAY, +6, WEDNESDAY, +5, THURSDAY, +4, FRIDAY, +3));
  public static final ObservedRule WORKDAY_TO_NEXT_WORKDAY =
      ObservedRule.of(
          Map.of(
              MONDAY, NEXT_WORKDAY,
              TUESDAY, NEXT_WORKDAY,
              WEDNESDAY, NEXT_WORKDAY,
              THURSDAY, NEXT_WORKDAY,
              FRIDAY, NEXT_WORKDAY));
  public static final ObservedRule TUE_WED_TO_PREV_MON =
      ObservedRule.of(TUESDAY, -1, WEDNESDAY, -2);
  public static final ObservedRule TUE_WED_THU_TO_PREV_MON =
      ObservedRule.of(Map.of(TUESDAY, -1, WEDNESDAY, -2, THURSDAY, -3));
  public static final ObservedRule WED_THU_TO_NEXT_FRI =
      ObservedRule.of(WEDNESDAY, +2, THURSDAY, +1);
  public static final ObservedRule THU_FRI_TO_NEXT_MON =
      ObservedRule.of(THURSDAY, +4, FRIDAY, +3);
  public static final ObservedRule THU_FRI_TO_NEXT_WORKDAY =
      ObservedRule.of(THURSDAY, NEXT_WORKDAY, FRIDAY, NEXT_WORKDAY);
  public static final ObservedRule THU_FRI_SUN_TO_NEXT_MON =
      ObservedRule.of(Map.of(THURSDAY, +4, FRIDAY, +3, SUNDAY, +1));
  public static final ObservedRule FRI_SAT_TO_NEXT_WORKDAY =
      ObservedRule.of(FRIDAY, NEXT_WORKDAY, SATURDAY, NEXT_WORKDAY);
  public static final ObservedRule FRI_SUN_TO_NEXT_MON =
      ObservedRule.of(FRIDAY, +3, SUNDAY, +1);
  public static final ObservedRule FRI_SUN_TO_NEXT_SAT_MON =
      ObservedRule.of(FRIDAY, +1, SUNDAY, +1);
  public static final ObservedRule SAT_SUN_TO_PREV_FRI =
      ObservedRule.of(SATURDAY, -1, SUNDAY, -2);
  public static final ObservedRule SAT_SUN_TO_NEXT_MON =
      ObservedRule.of(SATURDAY, +2, SUNDAY, +1);
  public static final ObservedRule SAT_SUN_TO_NEXT_TUE =
      ObservedRule.of(SATURDAY, +3, SUNDAY, +2);
  public static final ObservedRule SAT_SUN_TO_NEXT_WED =
      ObservedRule.of(SATURDAY, +4, SUNDAY, +3);
  public static final ObservedRule SAT_SUN_TO_NEXT_MON_TUE =
      ObservedRule.of(SATURDAY, +2, SUNDAY, +2);
  public static final ObservedRule SAT_SUN_TO_NEXT_WORKDAY =
      ObservedRule.of(SATURDAY, NEXT_WORKDAY, SUNDAY, NEXT_WORKDAY);

  private static final Map<String, ObservedRule> BY_NAME = new LinkedHashMap<>();

  static {
    BY_NAME.put("MON_TO_NEXT_TUE", MON_TO_NEXT_TUE);
    BY_NAME.put("TUE_TO_PREV_MON", TUE_TO_PREV_MON);
    BY_NAME.put("TUE_TO_PREV_FRI", TUE_TO_PREV_FRI);
    BY_NAME.put("WED_TO_PREV_MON", WED_TO_PREV_MON);
    BY_NAME.put("WED_TO_NEXT_FRI", WED_TO_NEXT_FRI);
    BY_NAME.put("THU_TO_PREV_MON", THU_TO_PREV_MON);
    BY_NAME.put("THU_TO_PREV_WED", THU_TO_PREV_WED);
    BY_NAME.put("THU_TO_NEXT_MON", THU_TO_NEXT_MON);
    BY_NAME.put("THU_TO_NEXT_FRI", THU_TO_NEXT_FRI);
    BY_NAME.put("FRI_TO_PREV_WED", FRI_TO_PREV_WED);
    BY_NAME.put("FRI_TO_PREV_THU", FRI_TO_PREV_THU);
    BY_NAME.put("FRI_TO_NEXT_MON", FRI_TO_NEXT_MON);
    BY_NAME.put("FRI_TO_NEXT_TUE", FRI_TO_NEXT_TUE);
    BY_NAME.put("FRI_TO_NEXT_SAT", FRI_TO_NEXT_SAT);
    BY_NAME.put("FRI_TO_NEXT_WORKDAY", FRI_TO_NEXT_WORKDAY);
    BY_NAME.put("SAT_TO_PREV_THU", SAT_TO_PREV_THU);
    BY_NAME.put("SAT_TO_PREV_FRI", SAT_TO_PREV_FRI);
    BY_NAME.put("SAT_TO_PREV_WORKDAY", SAT_TO_PREV_WORKDAY);
    BY_NAME.put("SAT_TO_NEXT_MON", SAT_TO_NEXT_MON);
    BY_NAME.put("SAT_TO_NEXT_TUE", SAT_TO_NEXT_TUE);
    BY_NAME.put("SAT_TO_NEXT_SUN", SAT_TO_NEXT_SUN);
    BY_NAME.put("SAT_TO_NEXT_WORKDAY", SAT_TO_NEXT_WORKDAY);
    BY_NAME.put("SUN_TO_NEXT_MON", SUN_TO_NEXT_MON);
    BY_NAME.put("SUN_TO_NEXT_TUE", SUN_TO_NEXT_TUE);
    BY_NAME.put("SUN_TO_NEXT_WED", SUN_TO_NEXT_WED);
    BY_NAME.put("SUN_TO_NEXT_WORKDAY", SUN_TO_NEXT_WORKDAY);
    BY_NAME.put("ALL_TO_NEAREST_MON", ALL_TO_NEAREST_MON);
    BY_NAME.put("ALL_TO_NEAREST_MON_LATAM", ALL_TO_NEAREST_MON_LATAM);
    BY_NAME.put("ALL_TO_NEXT_MON", ALL_TO_NEXT_MON);
    BY_NAME.put("ALL_TO_NEXT_SUN", ALL_TO_NEXT_SUN);
    BY_NAME.put("WORKDAY_TO_NEAREST_MON", WORKDAY_TO_NEAREST_MON);
    BY_NAME.put("WORKDAY_TO_NEXT_MON", WORKDAY_TO_NEXT_MON);
    BY_NAME.put("WORKDAY_TO_NEXT_WORKDAY", WORKDAY_TO_NEXT_WORKDAY);
    BY_NAME.put("TUE_WED_TO_PREV_MON", TUE_WED_TO_PREV_MON);
    BY_NAME.put("TUE_WED_THU_TO_PREV_MON", TUE_WED_THU_TO_PREV_MON);
    BY_NAME.put("WED_THU_TO_NEXT_FRI", WED_THU_TO_NEXT_FRI);
    BY_NAME.put("THU_FRI_TO_NEXT_MON", THU_FRI_TO_NEXT_MON);
    BY_NAME.put("THU_FRI_TO_NEXT_WORKDAY", THU_FRI_TO_NEXT_WORKDAY);
    BY_NAME.put("THU_FRI_SUN_TO_NEXT_MON", THU_FRI_SUN_TO_NEXT_MON);
    BY_NAME.put("FRI_SAT_TO_NEXT_WORKDAY", FRI_SAT_TO_NEXT_WORKDAY);
    BY_NAME.put("FRI_SUN_TO_NEXT_MON", FRI_SUN_TO_NEXT_MON);
    BY_NAME.put("FRI_SUN_TO_NEXT_SAT_MON", FRI_SUN_TO_NEXT_SAT_MON);
    BY_NAME.put("SAT_SUN_TO_PREV_FRI", SAT_SUN_TO_PREV_FRI);
    BY_NAME.put("SAT_SUN_TO_NEXT_MON", SAT_SUN_TO_NEXT_MON);
    BY_NAME.put("SAT_SUN_TO_NEXT_TUE", SAT_SUN_TO_NEXT_TUE);
    BY_NAME.put("SAT_SUN_TO_NEXT_WED", SAT_SUN_TO_NEXT_WED);
    BY_NAME.put("SAT_SUN_TO_NEXT_MON_TUE", SAT_SUN_TO_NEXT_MON_TUE);
    BY_NAME.put("SAT_SUN_TO_NEXT_WORKDAY", SAT_SUN_TO_NEXT_WORKDAY);
  }

  /**
   * Looks up a table by its catalog name (case insensitive).
   *
   * @param name the catalog name, e.g. {@code "SAT_SUN_TO_NEXT_MON"}
   * @return the table if the name is known
   */
  public static Optional<ObservedRule> byName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name.toUpperCase()));
  }

  /**
   * Returns all catalog names in declaration order.
   *
   * @return the catalog names
   */
  public static Set<String> names() {
    return Collections.unmodifiableSet(BY_NAME.keySet());
  }
}
