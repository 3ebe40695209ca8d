package io.dueday.eval;

import io.dueday.calendar.CalendarDates;
import io.dueday.model.BusinessDayPolicy;
import io.dueday.model.Frequency;
import io.dueday.model.ScheduleSpec;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Resolves the next occurrence of a schedule on or after a reference date.
 *
 * <h2>Alignment</h2>
 *
 * <p>Aligned dates are computed directly from the start date, never by chaining steps from a
 * previous occurrence:
 *
 * <ul>
 *   <li>Day steps: {@code start + k * step} days, with {@code k = floor(days(start, from) /
 *       step)}, plus one step if that is still before {@code from}.
 *   <li>Month steps: {@code start.plusMonths(k * step)}, with {@code k} from the month distance.
 *       {@link LocalDate#plusMonths} clamps to the end of shorter months, so a schedule starting
 *       on the 31st falls on Feb 28/29, then Mar 31, Apr 30.
 *   <li>Last business day of month: the last Monday-Friday of the aligned month. The start date's
 *       day of month plays no part.
 * </ul>
 *
 * <p>An aligned date is never earlier than the start date. An occurrence equal to {@code from}
 * counts as next.
 */
public final class Resolver {
  private Resolver() {}

  /**
   * Computes the next occurrence on or after {@code from}, with the schedule's business-day
   * policy applied.
   *
   * @param spec the schedule
   * @param from the reference date (inclusive)
   * @return the next occurrence, or empty if the schedule has ended
   */
  public static Optional<LocalDate> nextOccurrence(ScheduleSpec spec, LocalDate from) {
    LocalDate raw = aligned(spec, from);
    LocalDate next =
        spec.policy() == BusinessDayPolicy.NEAREST_WEEKDAY
            ? CalendarDates.businessDayAdjust(raw)
            : raw;
    return withinEnd(spec, next);
  }

  /**
   * Computes the next schedule-aligned date on or after {@code from}, without nearest-weekday
   * adjustment. Month-end schedules are already on a business day.
   *
   * @param spec the schedule
   * @param from the reference date (inclusive)
   * @return the next aligned date, or empty if it falls after the end date
   */
  public static Optional<LocalDate> nextAligned(ScheduleSpec spec, LocalDate from) {
    return withinEnd(spec, aligned(spec, from));
  }

  private static Optional<LocalDate> withinEnd(ScheduleSpec spec, LocalDate date) {
    if (spec.endDate() != null && date.isAfter(spec.endDate())) {
      return Optional.empty();
    }
    return Optional.of(date);
  }

  /** The next aligned date on or after {@code from}, ignoring the end date. */
  static LocalDate aligned(ScheduleSpec spec, LocalDate from) {
    if (spec.policy() == BusinessDayPolicy.LAST_BUSINESS_DAY_OF_MONTH) {
      return alignedMonthEnd(spec.startDate(), spec.frequency(), from);
    }
    LocalDate start = spec.startDate();
    if (!start.isBefore(from)) {
      return start;
    }
    Frequency f = spec.frequency();
    return f.isDayStepped()
        ? alignedByDays(start, f.dayStep(), from)
        : alignedByMonths(start, f.monthStep(), from);
  }

  private static LocalDate alignedByDays(LocalDate start, int step, LocalDate from) {
    long daysDiff = ChronoUnit.DAYS.between(start, from);
    long periods = Math.floorDiv(daysDiff, step);
    LocalDate next = start.plusDays(periods * step);
    if (next.isBefore(from)) {
      next = next.plusDays(step);
    }
    return next;
  }

  private static LocalDate alignedByMonths(LocalDate start, int step, LocalDate from) {
    long periods = Math.floorDiv(monthsBetween(start, from), step);
    LocalDate next = start.plusMonths(periods * step);
    if (next.isBefore(from)) {
      // From the start again, so a clamped day (Feb 28) does not stick for later months.
      next = start.plusMonths((periods + 1) * step);
    }
    return next;
  }

  private static LocalDate alignedMonthEnd(LocalDate start, Frequency f, LocalDate from) {
    int step = f.monthStep();
    long periods = Math.floorDiv(Math.max(0, monthsBetween(start, from)), step);
    YearMonth startMonth = YearMonth.from(start);
    LocalDate next = CalendarDates.lastBusinessDayOfMonth(startMonth.plusMonths(periods * step));
    if (next.isBefore(from) || next.isBefore(start)) {
      next = CalendarDates.lastBusinessDayOfMonth(startMonth.plusMonths((periods + 1) * step));
    }
    return next;
  }

  private static long monthsBetween(LocalDate start, LocalDate from) {
    return (from.getYear() - start.getYear()) * 12L
        + (from.getMonthValue() - start.getMonthValue());
  }
}
