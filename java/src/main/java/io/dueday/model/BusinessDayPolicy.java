package io.dueday.model;

/** How the raw, schedule-aligned date of an occurrence is moved onto a business day. */
public enum BusinessDayPolicy {
  /** Occurrences fall on their aligned dates, weekends included. */
  NONE,
  /** Saturday moves back to Friday, Sunday moves forward to Monday. */
  NEAREST_WEEKDAY,
  /**
   * Every occurrence is the last Monday-Friday of its month. The start date's day of month is
   * ignored. Month-stepped frequencies only.
   */
  LAST_BUSINESS_DAY_OF_MONTH;

  /**
   * Maps the two stored flags onto a policy. The month-end flag wins when both are set.
   *
   * @param businessDaysOnly the nearest-weekday flag
   * @param lastBusinessDayOfMonth the month-end flag
   * @return the policy
   */
  public static BusinessDayPolicy fromFlags(
      boolean businessDaysOnly, boolean lastBusinessDayOfMonth) {
    if (lastBusinessDayOfMonth) {
      return LAST_BUSINESS_DAY_OF_MONTH;
    }
    return businessDaysOnly ? NEAREST_WEEKDAY : NONE;
  }
}
