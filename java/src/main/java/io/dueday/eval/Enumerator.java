package io.dueday.eval;

import io.dueday.calendar.CalendarDates;
import io.dueday.model.BusinessDayPolicy;
import io.dueday.model.ScheduleSpec;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates every occurrence of a schedule inside a date range.
 *
 * <h2>Raw dates first, adjustment last</h2>
 *
 * <p>The loop walks raw aligned dates only, each step asking the {@link Resolver} for the next
 * aligned date after the previous one. Adjusting inside the loop would move a Saturday back to
 * Friday, and resuming from Friday + 1 lands on the same Saturday again. Nearest-weekday schedules
 * are therefore adjusted once the raw dates are collected, then de-duplicated and clipped back to
 * the range and the end date. Their raw scan runs one day past each end of the range, and one day
 * past the end date, so that a Sunday just before the range (moving to Monday) and a Saturday just
 * after it (moving to Friday) are not lost.
 *
 * <h2>Iteration safety</h2>
 *
 * <p>Collection stops once {@link #MAX_OCCURRENCES} raw dates inside the range are held and
 * another is due, or as soon as a date comes back that was already visited. Both cases return the
 * dates collected so far and log a warning. The extra days scanned outside the range do not count
 * towards the limit.
 */
public final class Enumerator {
  private static final Logger log = LoggerFactory.getLogger(Enumerator.class);

  /** Maximum raw dates inside the range collected per query. */
  public static final int MAX_OCCURRENCES = 366;

  private Enumerator() {}

  /**
   * Returns the occurrences of {@code spec} with {@code rangeStart <= date <= rangeEnd}, in
   * increasing order.
   *
   * @param spec the schedule
   * @param rangeStart the first date of the range (inclusive)
   * @param rangeEnd the last date of the range (inclusive)
   * @return the occurrences, strictly increasing and without duplicates
   */
  public static List<LocalDate> occurrencesInRange(
      ScheduleSpec spec, LocalDate rangeStart, LocalDate rangeEnd) {
    if (rangeEnd.isBefore(rangeStart)) {
      return List.of();
    }
    if (spec.policy() != BusinessDayPolicy.NEAREST_WEEKDAY) {
      LocalDate scanEnd = earlier(rangeEnd, spec.endDate());
      return List.copyOf(collectAligned(spec, rangeStart, scanEnd, rangeStart, rangeEnd));
    }

    // A raw Saturday the day after the end date still pays on the Friday that ends the schedule.
    LocalDate scanEnd =
        earlier(rangeEnd.plusDays(1), spec.endDate() == null ? null : spec.endDate().plusDays(1));
    List<LocalDate> raw =
        collectAligned(spec, rangeStart.minusDays(1), scanEnd, rangeStart, rangeEnd);
    List<LocalDate> dates = new ArrayList<>(raw.size());
    for (LocalDate d : raw) {
      LocalDate adjusted = CalendarDates.businessDayAdjust(d);
      if (adjusted.isBefore(rangeStart) || adjusted.isAfter(rangeEnd)) {
        continue;
      }
      if (spec.endDate() != null && adjusted.isAfter(spec.endDate())) {
        continue;
      }
      // Raw dates increase, so an adjusted duplicate can only repeat the last one kept.
      if (!dates.isEmpty() && !adjusted.isAfter(dates.get(dates.size() - 1))) {
        continue;
      }
      dates.add(adjusted);
    }
    return List.copyOf(dates);
  }

  private static LocalDate earlier(LocalDate date, LocalDate other) {
    return other != null && other.isBefore(date) ? other : date;
  }

  /**
   * Walks raw aligned dates in {@code [from, to]}. Only dates inside {@code [rangeStart,
   * rangeEnd]} count towards {@link #MAX_OCCURRENCES}.
   */
  private static List<LocalDate> collectAligned(
      ScheduleSpec spec, LocalDate from, LocalDate to, LocalDate rangeStart, LocalDate rangeEnd) {
    List<LocalDate> dates = new ArrayList<>();
    Set<LocalDate> visited = new HashSet<>();
    int inRange = 0;

    LocalDate d = Resolver.aligned(spec, from);
    while (!d.isAfter(to)) {
      if (!visited.add(d)) {
        log.warn("Schedule {} returned {} twice; stopping at {} dates", spec, d, dates.size());
        break;
      }
      boolean counted = !d.isBefore(rangeStart) && !d.isAfter(rangeEnd);
      if (counted && inRange >= MAX_OCCURRENCES) {
        log.warn(
            "Schedule {} has more than {} occurrences between {} and {}; dropped from {}",
            spec,
            MAX_OCCURRENCES,
            rangeStart,
            rangeEnd,
            d);
        break;
      }
      dates.add(d);
      if (counted) {
        inRange++;
      }
      d = Resolver.aligned(spec, d.plusDays(1));
    }
    return dates;
  }
}
