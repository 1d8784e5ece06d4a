package io.holidays.calendar;

/** The computus used to date Easter Sunday. */
public enum EasterMethod {
  /** Gregorian computus, used by Western churches. */
  WESTERN,
  /** Julian computus converted to the Gregorian calendar, used by Orthodox churches. */
  ORTHODOX
}
