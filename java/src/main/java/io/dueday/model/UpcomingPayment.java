package io.dueday.model;

import java.time.LocalDate;

/**
 * An occurrence in an upcoming-payment feed.
 *
 * @param occurrence the occurrence
 * @param daysUntil whole days from the reference date to the due date
 */
public record UpcomingPayment(Occurrence occurrence, long daysUntil) {
  /** Returns the due date. */
  public LocalDate date() {
    return occurrence.date();
  }

  /** Returns the payment. */
  public RecurringPayment payment() {
    return occurrence.payment();
  }
}
