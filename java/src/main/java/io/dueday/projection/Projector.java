package io.dueday.projection;

import io.dueday.DuedayException;
import io.dueday.eval.Enumerator;
import io.dueday.model.MonthlyProjection;
import io.dueday.model.Occurrence;
import io.dueday.model.PaymentKind;
import io.dueday.model.RecurringPayment;
import io.dueday.model.UpcomingPayment;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds the occurrences of many recurring payments into upcoming-payment feeds and monthly
 * projections.
 *
 * <p>Inactive payments never contribute. Amounts are summed as {@link BigDecimal} with no
 * currency conversion.
 */
public final class Projector {
  /** Look-ahead used by {@link #upcoming(List, LocalDate)}. */
  public static final int DEFAULT_DAYS_AHEAD = 30;

  private static final Comparator<Occurrence> BY_DATE = Comparator.comparing(Occurrence::date);

  private Projector() {}

  /**
   * Lists the occurrences due in the next {@value #DEFAULT_DAYS_AHEAD} days.
   *
   * @param payments the payments
   * @param today the reference date
   * @return the upcoming payments, ordered by date
   */
  public static List<UpcomingPayment> upcoming(List<RecurringPayment> payments, LocalDate today) {
    return upcoming(payments, today, DEFAULT_DAYS_AHEAD);
  }

  /**
   * Lists the occurrences due in {@code [today, today + daysAhead]}. A payment due today is
   * included with {@code daysUntil == 0}.
   *
   * @param payments the payments
   * @param today the reference date
   * @param daysAhead how many days to look ahead (0 for today only)
   * @return the upcoming payments, ordered by date; payments due the same day keep input order
   */
  public static List<UpcomingPayment> upcoming(
      List<RecurringPayment> payments, LocalDate today, int daysAhead) {
    Objects.requireNonNull(today, "today");
    if (daysAhead < 0) {
      throw new IllegalArgumentException("daysAhead must not be negative: " + daysAhead);
    }
    List<Occurrence> occurrences = collect(payments, today, today.plusDays(daysAhead));

    List<UpcomingPayment> upcoming = new ArrayList<>(occurrences.size());
    for (Occurrence o : occurrences) {
      upcoming.add(new UpcomingPayment(o, ChronoUnit.DAYS.between(today, o.date())));
    }
    return upcoming;
  }

  /**
   * Projects recurring income and expenses for a month given as {@code YYYY-MM}.
   *
   * @param payments the payments
   * @param month the month, e.g. {@code "2026-02"}
   * @return the projection
   * @throws DuedayException if the month cannot be read
   */
  public static MonthlyProjection monthlyProjection(List<RecurringPayment> payments, String month)
      throws DuedayException {
    YearMonth ym;
    try {
      ym = YearMonth.parse(month == null ? "" : month.trim());
    } catch (DateTimeParseException e) {
      throw DuedayException.invalidDate(month, e);
    }
    return monthlyProjection(payments, ym);
  }

  /**
   * Projects recurring income and expenses for a month.
   *
   * @param payments the payments
   * @param month the month
   * @return totals by kind, the net, and every occurrence in the month ordered by date
   */
  public static MonthlyProjection monthlyProjection(
      List<RecurringPayment> payments, YearMonth month) {
    List<Occurrence> occurrences = collect(payments, month.atDay(1), month.atEndOfMonth());

    BigDecimal income = BigDecimal.ZERO;
    BigDecimal expenses = BigDecimal.ZERO;
    for (Occurrence o : occurrences) {
      BigDecimal amount = o.payment().amount();
      if (o.payment().kind() == PaymentKind.INCOME) {
        income = income.add(amount);
      } else {
        expenses = expenses.add(amount);
      }
    }
    return new MonthlyProjection(month, income, expenses, income.subtract(expenses), occurrences);
  }

  /**
   * Converts one payment to its average monthly amount (e.g. weekly x 4.33, yearly / 12),
   * rounded half-up to cents.
   *
   * @param payment the payment
   * @return the monthly equivalent
   */
  public static BigDecimal monthlyEquivalent(RecurringPayment payment) {
    return payment.schedule().frequency().monthlyEquivalent(payment.amount());
  }

  /**
   * Sums the monthly equivalents of active, categorized payments per category.
   *
   * @param payments the payments
   * @return category id to monthly amount, in order of first appearance
   */
  public static Map<String, BigDecimal> monthlyEquivalentByCategory(
      List<RecurringPayment> payments) {
    Map<String, BigDecimal> totals = new LinkedHashMap<>();
    for (RecurringPayment p : payments) {
      if (!p.active() || p.categoryId() == null) {
        continue;
      }
      totals.merge(p.categoryId(), monthlyEquivalent(p), BigDecimal::add);
    }
    return totals;
  }

  private static List<Occurrence> collect(
      List<RecurringPayment> payments, LocalDate from, LocalDate to) {
    List<Occurrence> occurrences = new ArrayList<>();
    for (RecurringPayment p : payments) {
      if (!p.active()) {
        continue;
      }
      for (LocalDate date : Enumerator.occurrencesInRange(p.schedule(), from, to)) {
        occurrences.add(new Occurrence(p, date));
      }
    }
    // List.sort is stable.
    occurrences.sort(BY_DATE);
    return occurrences;
  }
}
