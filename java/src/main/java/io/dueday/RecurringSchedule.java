package io.dueday;

import io.dueday.calendar.CalendarDates;
import io.dueday.display.Display;
import io.dueday.eval.Enumerator;
import io.dueday.eval.Resolver;
import io.dueday.model.BusinessDayPolicy;
import io.dueday.model.Frequency;
import io.dueday.model.ScheduleSpec;
import io.dueday.model.ScheduleState;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The main entry point for computing the occurrences of a recurring payment.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RecurringSchedule rent =
 *     RecurringSchedule.of(ScheduleSpec.of(LocalDate.of(2026, 1, 31), Frequency.MONTHLY));
 * Optional<LocalDate> next = rent.nextFrom(LocalDate.of(2026, 2, 1)); // 2026-02-28
 * List<LocalDate> q1 = rent.between(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 31));
 * }</pre>
 *
 * <p>Every method takes its reference date explicitly; nothing reads the system clock.
 */
public final class RecurringSchedule {
  private final ScheduleSpec spec;

  private RecurringSchedule(ScheduleSpec spec) {
    this.spec = spec;
  }

  /**
   * Wraps a schedule.
   *
   * @param spec the schedule
   * @return a new RecurringSchedule
   */
  public static RecurringSchedule of(ScheduleSpec spec) {
    return new RecurringSchedule(Objects.requireNonNull(spec, "spec"));
  }

  /**
   * Builds a schedule from loosely typed inputs, as stored alongside a recurring payment.
   *
   * @param startDate the start date, e.g. {@code "2026-01-02"}
   * @param frequency the frequency key, e.g. {@code "biweekly"}
   * @param endDate the end date, or null for none
   * @param businessDaysOnly move weekend occurrences to the nearest weekday
   * @param lastBusinessDayOfMonth fall on the last business day of each month
   * @return the parsed schedule
   * @throws DuedayException if a date or the frequency cannot be read, or the options conflict
   */
  public static RecurringSchedule parse(
      String startDate,
      String frequency,
      String endDate,
      boolean businessDaysOnly,
      boolean lastBusinessDayOfMonth)
      throws DuedayException {
    LocalDate start;
    try {
      start = CalendarDates.normalize(startDate);
    } catch (DuedayException e) {
      throw e.inField("start_date");
    }
    LocalDate end = null;
    if (endDate != null && !endDate.isBlank()) {
      try {
        end = CalendarDates.normalize(endDate);
      } catch (DuedayException e) {
        throw e.inField("end_date");
      }
    }
    Frequency f =
        Frequency.parse(frequency).orElseThrow(() -> DuedayException.unknownFrequency(frequency));
    BusinessDayPolicy policy =
        BusinessDayPolicy.fromFlags(businessDaysOnly, lastBusinessDayOfMonth);
    try {
      return of(new ScheduleSpec(start, f, policy, end));
    } catch (IllegalArgumentException e) {
      throw DuedayException.invalidRecord("schedule", e.getMessage());
    }
  }

  /**
   * Validates schedule inputs without throwing.
   *
   * @param startDate the start date
   * @param frequency the frequency key
   * @param endDate the end date, or null for none
   * @param businessDaysOnly move weekend occurrences to the nearest weekday
   * @param lastBusinessDayOfMonth fall on the last business day of each month
   * @return true if {@link #parse} would succeed
   */
  public static boolean validate(
      String startDate,
      String frequency,
      String endDate,
      boolean businessDaysOnly,
      boolean lastBusinessDayOfMonth) {
    try {
      parse(startDate, frequency, endDate, businessDaysOnly, lastBusinessDayOfMonth);
      return true;
    } catch (DuedayException e) {
      return false;
    }
  }

  /**
   * Computes the next occurrence on or after the given date.
   *
   * @param from the reference date (inclusive)
   * @return the next occurrence, or empty if the schedule has ended
   */
  public Optional<LocalDate> nextFrom(LocalDate from) {
    return Resolver.nextOccurrence(spec, from);
  }

  /**
   * Computes every occurrence with {@code from <= date <= to}.
   *
   * @param from the first date of the range (inclusive)
   * @param to the last date of the range (inclusive)
   * @return the occurrences in increasing order
   */
  public List<LocalDate> between(LocalDate from, LocalDate to) {
    return Enumerator.occurrencesInRange(spec, from, to);
  }

  /**
   * Returns where the schedule stands on the given date.
   *
   * @param date the reference date
   * @return pending before the start, ended after the end date, otherwise active
   */
  public ScheduleState stateOn(LocalDate date) {
    if (date.isBefore(spec.startDate())) {
      return ScheduleState.PENDING;
    }
    if (spec.endDate() != null && date.isAfter(spec.endDate())) {
      return ScheduleState.ENDED;
    }
    return ScheduleState.ACTIVE;
  }

  /**
   * Returns the underlying schedule.
   *
   * @return the schedule
   */
  public ScheduleSpec spec() {
    return spec;
  }

  /**
   * Returns the canonical description of this schedule.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(spec);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RecurringSchedule other && spec.equals(other.spec);
  }

  @Override
  public int hashCode() {
    return spec.hashCode();
  }
}
