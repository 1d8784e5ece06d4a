package io.holidays.display;

import io.holidays.rule.ObservedRule;
import java.time.DayOfWeek;
import java.util.Map;
import java.util.StringJoiner;

/** Renders transition tables as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a transition table as a canonical string, Monday first, e.g. {@code "sat -1, sun
   * next workday"}. The empty table renders as {@code "none"}.
   *
   * @param rule the table to render
   * @return the canonical string representation
   */
  public static String render(ObservedRule rule) {
    if (rule.isEmpty()) {
      return "none";
    }

    StringJoiner joiner = new StringJoiner(", ");
    for (Map.Entry<DayOfWeek, Integer> entry : rule.deltas().entrySet()) {
      joiner.add(renderDay(entry.getKey()) + " " + renderDelta(entry.getValue()));
    }
    return joiner.toString();
  }

  private static String renderDay(DayOfWeek day) {
    return switch (day) {
      case MONDAY -> "mon";
      case TUESDAY -> "tue";
      case WEDNESDAY -> "wed";
      case THURSDAY -> "thu";
      case FRIDAY -> "fri";
      case SATURDAY -> "sat";
      case SUNDAY -> "sun";
    };
  }

  private static String renderDelta(int delta) {
    if (delta == ObservedRule.NEXT_WORKDAY) {
      return "next workday";
    }
    if (delta == ObservedRule.PREVIOUS_WORKDAY) {
      return "prev workday";
    }
    return delta > 0 ? "+" + delta : String.valueOf(delta);
  }
}
