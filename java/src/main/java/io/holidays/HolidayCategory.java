package io.holidays;

/** A category of holidays a jurisdiction may define. Categories are computed in this order. */
public enum HolidayCategory {
  /** Public holidays, observed by the general population. */
  PUBLIC,
  /** Bank holidays. */
  BANK,
  /** School holidays. */
  SCHOOL,
  /** Working days that are nevertheless commemorated. */
  WORKDAY,
  /** Optional holidays, taken at the employee's choice. */
  OPTIONAL,
  /** Government office closures. */
  GOVERNMENT
}
