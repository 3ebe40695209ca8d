package io.dueday.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A recurring income or expense as supplied by the caller.
 *
 * @param id the caller's identifier (may be null)
 * @param name the display name (may be null)
 * @param schedule when the payment falls due
 * @param amount the amount of each occurrence
 * @param kind income or expense
 * @param active whether the payment takes part in projections
 * @param categoryId the category the payment is filed under (may be null)
 */
public record RecurringPayment(
    String id,
    String name,
    ScheduleSpec schedule,
    BigDecimal amount,
    PaymentKind kind,
    boolean active,
    String categoryId) {
  public RecurringPayment {
    Objects.requireNonNull(schedule, "schedule");
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an active, uncategorized payment.
   *
   * @param name the display name
   * @param schedule when the payment falls due
   * @param amount the amount of each occurrence
   * @param kind income or expense
   * @return a new RecurringPayment
   */
  public static RecurringPayment of(
      String name, ScheduleSpec schedule, BigDecimal amount, PaymentKind kind) {
    return new RecurringPayment(null, name, schedule, amount, kind, true, null);
  }

  /**
   * Returns a copy with the specified active flag.
   *
   * @param active whether the payment takes part in projections
   * @return a new RecurringPayment with the updated flag
   */
  public RecurringPayment withActive(boolean active) {
    return new RecurringPayment(id, name, schedule, amount, kind, active, categoryId);
  }

  /**
   * Returns a copy filed under the specified category.
   *
   * @param categoryId the category identifier
   * @return a new RecurringPayment with the updated category
   */
  public RecurringPayment withCategory(String categoryId) {
    return new RecurringPayment(id, name, schedule, amount, kind, active, categoryId);
  }
}
