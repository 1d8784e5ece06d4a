package io.holidays.observed;

import java.util.IllegalFormatException;

/**
 * Name templates for observed and estimated holiday entries. Every template contains one
 * {@code %s}, replaced by the holiday name.
 *
 * @param observed the template for observed dates, e.g. {@code "%s (observed)"}
 * @param observedBefore the template used when the observed date precedes the nominal date (may
 *     be null to use {@code observed})
 * @param estimated the template marking estimated dates, e.g. {@code "%s (estimated)"} (may be
 *     null if the jurisdiction has no estimated dates)
 * @param observedEstimated the template for observed entries of estimated holidays (may be null
 *     to use {@code observed})
 */
public record ObservedLabels(
    String observed, String observedBefore, String estimated, String observedEstimated) {
  /** English labels: "(observed)", "(estimated)" and "(observed, estimated)". */
  public static final ObservedLabels DEFAULT =
      new ObservedLabels("%s (observed)", null, "%s (estimated)", "%s (observed, estimated)");

  /** Creates a new ObservedLabels, validating the templates. */
  public ObservedLabels {
    if (observed == null) {
      throw new IllegalArgumentException("observed label must not be null");
    }
    requireTemplate("observed", observed);
    requireTemplate("observedBefore", observedBefore);
    requireTemplate("estimated", estimated);
    requireTemplate("observedEstimated", observedEstimated);
  }

  /**
   * Creates labels with a single observed template and no estimated labels.
   *
   * @param observed the template for observed dates
   * @return new labels
   */
  public static ObservedLabels of(String observed) {
    return new ObservedLabels(observed, null, null, null);
  }

  /**
   * Returns a copy with the specified observed template.
   *
   * @param observed the template
   * @return new labels with the updated template
   */
  public ObservedLabels withObserved(String observed) {
    return new ObservedLabels(observed, observedBefore, estimated, observedEstimated);
  }

  /**
   * Returns a copy with the specified template for observed dates preceding the holiday.
   *
   * @param observedBefore the template, or null
   * @return new labels with the updated template
   */
  public ObservedLabels withObservedBefore(String observedBefore) {
    return new ObservedLabels(observed, observedBefore, estimated, observedEstimated);
  }

  /**
   * Returns a copy with the specified estimated templates.
   *
   * @param estimated the estimated template, or null
   * @param observedEstimated the observed estimated template, or null
   * @return new labels with the updated templates
   */
  public ObservedLabels withEstimated(String estimated, String observedEstimated) {
    return new ObservedLabels(observed, observedBefore, estimated, observedEstimated);
  }

  /**
   * Returns the name of an observed entry.
   *
   * <p>A name carrying the estimated marker (e.g. "Eid al-Fitr (estimated)") loses the marker and
   * is formatted with {@code observedEstimated}.
   *
   * @param name the holiday name at the nominal date
   * @param before true if the observed date precedes the nominal date
   * @return the observed entry name
   */
  public String observedName(String name, boolean before) {
    String template = before && observedBefore != null ? observedBefore : observed;

    String marker = estimatedMarker();
    if (marker != null && name.contains(marker)) {
      name = name.replace("(" + marker + ")", "").strip();
      if (observedEstimated != null) {
        template = observedEstimated;
      }
    }

    return String.format(template, name);
  }

  /**
   * Returns the name of a holiday on an estimated date.
   *
   * @param name the holiday name
   * @return the name formatted with {@code estimated}, or unchanged if there is no such template
   */
  public String estimatedName(String name) {
    return estimated == null ? name : String.format(estimated, name);
  }

  /** The bare estimated marker text, e.g. "estimated" for "%s (estimated)". */
  private String estimatedMarker() {
    if (estimated == null) {
      return null;
    }
    String text = estimated.replace("%s", "");
    int start = 0;
    int end = text.length();
    while (start < end && isMarkerPadding(text.charAt(start))) {
      start++;
    }
    while (end > start && isMarkerPadding(text.charAt(end - 1))) {
      end--;
    }
    return start < end ? text.substring(start, end) : null;
  }

  private static boolean isMarkerPadding(char c) {
    return c == ' ' || c == '(' || c == ')';
  }

  private static void requireTemplate(String field, String template) {
    if (template == null) {
      return;
    }
    if (!template.contains("%s")) {
      throw new IllegalArgumentException(field + " label must contain %s: '" + template + "'");
    }
    try {
      String.format(template, "Holiday");
    } catch (IllegalFormatException e) {
      throw new IllegalArgumentException(
          field + " label is not a valid template: '" + template + "'", e);
    }
  }
}
