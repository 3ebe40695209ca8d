package io.dueday.calendar;

import io.dueday.DuedayException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar-date primitives: normalization of date inputs and business-day arithmetic.
 *
 * <p>Dates are always handled as {@link LocalDate}. String inputs are split into their numeric
 * components rather than read as instants, so {@code "2026-01-02T23:30:00-08:00"} stays on
 * January 2 whatever the host timezone is.
 */
public final class CalendarDates {
  /** Leading {@code YYYY-MM-DD}; anything after it (time, offset, zone) is ignored. */
  private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");

  private CalendarDates() {}

  /**
   * Normalizes a string to a calendar date.
   *
   * <p>Accepts anything beginning with {@code YYYY-MM-DD}, or an RFC 1123 date such as {@code
   * "Fri, 2 Jan 2026 10:00:00 GMT"}.
   *
   * @param input the string to read
   * @return the calendar date as written
   * @throws DuedayException if the input is not a date
   */
  public static LocalDate normalize(String input) throws DuedayException {
    if (input == null) {
      throw DuedayException.invalidDate(null);
    }
    String s = input.trim();
    Matcher m = ISO_PREFIX.matcher(s);
    if (m.find()) {
      try {
        int year = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        int day = Integer.parseInt(m.group(3));
        return LocalDate.of(year, month, day);
      } catch (DateTimeException e) {
        throw DuedayException.invalidDate(input, e);
      }
    }
    try {
      return normalize(DateTimeFormatter.RFC_1123_DATE_TIME.parse(s));
    } catch (DateTimeParseException e) {
      throw DuedayException.invalidDate(input, e);
    }
  }

  /**
   * Normalizes a date-time value to its local calendar date, dropping any time of day.
   *
   * @param temporal a LocalDate, LocalDateTime, OffsetDateTime, ZonedDateTime or similar
   * @return the local calendar date
   * @throws DuedayException if the value carries no local date (e.g. an Instant)
   */
  public static LocalDate normalize(TemporalAccessor temporal) throws DuedayException {
    if (temporal == null) {
      throw DuedayException.invalidDate(null);
    }
    LocalDate date = temporal.query(TemporalQueries.localDate());
    if (date == null) {
      throw DuedayException.invalidDate(temporal.toString());
    }
    return date;
  }

  /**
   * Normalizes a string or date-time value to a calendar date.
   *
   * @param input the value to read
   * @return the calendar date
   * @throws DuedayException if the value is null, of another type, or not a date
   */
  public static LocalDate normalize(Object input) throws DuedayException {
    if (input instanceof String s) {
      return normalize(s);
    }
    if (input instanceof TemporalAccessor t) {
      return normalize(t);
    }
    throw DuedayException.invalidDate(input == null ? null : input.toString());
  }

  /**
   * Returns true for Monday through Friday.
   *
   * @param date the date
   * @return whether the date is a business day
   */
  public static boolean isBusinessDay(LocalDate date) {
    DayOfWeek dow = date.getDayOfWeek();
    return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
  }

  /**
   * Moves a weekend date to the nearest weekday: Saturday to the Friday before, Sunday to the
   * Monday after. Weekdays are returned unchanged.
   *
   * @param date the date
   * @return the adjusted date
   */
  public static LocalDate businessDayAdjust(LocalDate date) {
    return switch (date.getDayOfWeek()) {
      case SATURDAY -> date.minusDays(1);
      case SUNDAY -> date.plusDays(1);
      default -> date;
    };
  }

  /**
   * Returns the last calendar day of a month.
   *
   * @param month the month
   * @return the last day
   */
  public static LocalDate lastDayOfMonth(YearMonth month) {
    return month.atEndOfMonth();
  }

  /**
   * Returns the last Monday-Friday of a month. Always moves backwards, so the result never
   * leaves the month.
   *
   * @param month the month
   * @return the last business day
   */
  public static LocalDate lastBusinessDayOfMonth(YearMonth month) {
    LocalDate last = month.atEndOfMonth();
    return switch (last.getDayOfWeek()) {
      case SATURDAY -> last.minusDays(1);
      case SUNDAY -> last.minusDays(2);
      default -> last;
    };
  }

  /**
   * Returns the last Monday-Friday of a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the last business day
   */
  public static LocalDate lastBusinessDayOfMonth(int year, int month) {
    return lastBusinessDayOfMonth(YearMonth.of(year, month));
  }
}
