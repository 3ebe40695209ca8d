package io.dueday.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Projected recurring income and expenses for one calendar month.
 *
 * @param month the month
 * @param income the sum of income occurrences
 * @param expenses the sum of expense occurrences
 * @param net income minus expenses
 * @param occurrences every occurrence in the month, ordered by date
 */
public record MonthlyProjection(
    YearMonth month,
    BigDecimal income,
    BigDecimal expenses,
    BigDecimal net,
    List<Occurrence> occurrences) {
  public MonthlyProjection {
    occurrences = List.copyOf(occurrences);
  }
}
