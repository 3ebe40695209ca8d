package io.dueday.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * The recurrence of a payment: when it starts, how often it repeats, how it treats weekends, and
 * when it ends.
 *
 * @param startDate the first aligned date
 * @param frequency the step between occurrences
 * @param policy the business-day policy
 * @param endDate the last date an occurrence may fall on (may be null)
 */
public record ScheduleSpec(
    LocalDate startDate, Frequency frequency, BusinessDayPolicy policy, LocalDate endDate) {
  /** Validates the combination of options. */
  public ScheduleSpec {
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(frequency, "frequency");
    Objects.requireNonNull(policy, "policy");
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new IllegalArgumentException(
          "endDate " + endDate + " is before startDate " + startDate);
    }
    if (policy == BusinessDayPolicy.LAST_BUSINESS_DAY_OF_MONTH && !frequency.isMonthStepped()) {
      throw new IllegalArgumentException(
          "last business day of month requires a monthly, quarterly or yearly frequency, got "
              + frequency);
    }
  }

  /**
   * Creates an open-ended schedule with no business-day policy.
   *
   * @param startDate the first aligned date
   * @param frequency the step between occurrences
   * @return a new ScheduleSpec
   */
  public static ScheduleSpec of(LocalDate startDate, Frequency frequency) {
    return new ScheduleSpec(startDate, frequency, BusinessDayPolicy.NONE, null);
  }

  /**
   * Returns a copy with the specified policy.
   *
   * @param policy the business-day policy
   * @return a new ScheduleSpec with the updated policy
   */
  public ScheduleSpec withPolicy(BusinessDayPolicy policy) {
    return new ScheduleSpec(startDate, frequency, policy, endDate);
  }

  /**
   * Returns a copy with the specified end date.
   *
   * @param endDate the end date (null for none)
   * @return a new ScheduleSpec with the updated end date
   */
  public ScheduleSpec withEndDate(LocalDate endDate) {
    return new ScheduleSpec(startDate, frequency, policy, endDate);
  }

  /**
   * Returns the end date, if any.
   *
   * @return the end date, or empty for an open-ended schedule
   */
  public Optional<LocalDate> end() {
    return Optional.ofNullable(endDate);
  }
}
