package io.dueday.model;

import java.util.Locale;
import java.util.Optional;

/** Whether a recurring payment brings money in or takes it out. */
public enum PaymentKind {
  INCOME("income"),
  EXPENSE("expense");

  private final String key;

  PaymentKind(String key) {
    this.key = key;
  }

  /**
   * Returns the storage key.
   *
   * @return {@code "income"} or {@code "expense"}
   */
  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return key;
  }

  /**
   * Parses a kind key (case insensitive).
   *
   * @param s the string to parse
   * @return the kind if valid
   */
  public static Optional<PaymentKind> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "income" -> Optional.of(INCOME);
      case "expense" -> Optional.of(EXPENSE);
      default -> Optional.empty();
    };
  }
}
