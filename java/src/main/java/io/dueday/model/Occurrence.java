package io.dueday.model;

import java.time.LocalDate;

/**
 * One date on which a recurring payment falls due.
 *
 * @param payment the payment
 * @param date the due date
 */
public record Occurrence(RecurringPayment payment, LocalDate date) {}
