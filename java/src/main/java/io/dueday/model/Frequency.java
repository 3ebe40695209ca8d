package io.dueday.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * How often a recurring payment falls due.
 *
 * <p>Day-stepped frequencies advance by an exact number of days. Month-stepped frequencies
 * advance by calendar months from the start date.
 */
public enum Frequency {
  DAILY("daily", "Daily", 1, 0, new BigDecimal("30.42")),
  WEEKLY("weekly", "Weekly", 7, 0, new BigDecimal("4.33")),
  BIWEEKLY("biweekly", "Biweekly", 14, 0, new BigDecimal("2.17")),
  MONTHLY("monthly", "Monthly", 0, 1, null),
  QUARTERLY("quarterly", "Quarterly", 0, 3, null),
  YEARLY("yearly", "Yearly", 0, 12, null);

  private final String key;
  private final String label;
  private final int dayStep;
  private final int monthStep;
  private final BigDecimal paymentsPerMonth;

  Frequency(String key, String label, int dayStep, int monthStep, BigDecimal paymentsPerMonth) {
    this.key = key;
    this.label = label;
    this.dayStep = dayStep;
    this.monthStep = monthStep;
    this.paymentsPerMonth = paymentsPerMonth;
  }

  /**
   * Returns the storage key (e.g. {@code "biweekly"}).
   *
   * @return the key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the human-readable label (e.g. {@code "Biweekly"}).
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the number of days between occurrences, or 0 for month-stepped frequencies.
   *
   * @return the day step
   */
  public int dayStep() {
    return dayStep;
  }

  /**
   * Returns the number of months between occurrences, or 0 for day-stepped frequencies.
   *
   * @return the month step
   */
  public int monthStep() {
    return monthStep;
  }

  /** Returns true for daily, weekly and biweekly. */
  public boolean isDayStepped() {
    return dayStep > 0;
  }

  /** Returns true for monthly, quarterly and yearly. */
  public boolean isMonthStepped() {
    return monthStep > 0;
  }

  /**
   * Converts one payment at this frequency into an average monthly amount, rounded half up to
   * cents.
   *
   * <p>Day-stepped frequencies multiply by an average number of payments per month: daily 30.42
   * (365 / 12), weekly 4.33, biweekly 2.17. Month-stepped frequencies divide by their month step,
   * so the quotient is rounded once from its exact value.
   *
   * @param amount the amount of one payment
   * @return the monthly equivalent
   */
  public BigDecimal monthlyEquivalent(BigDecimal amount) {
    if (isMonthStepped()) {
      return amount.divide(BigDecimal.valueOf(monthStep), 2, RoundingMode.HALF_UP);
    }
    return amount.multiply(paymentsPerMonth).setScale(2, RoundingMode.HALF_UP);
  }

  @Override
  public String toString() {
    return key;
  }

  private static final Map<String, Frequency> PARSE_MAP =
      Map.of(
          "daily", DAILY,
          "weekly", WEEKLY,
          "biweekly", BIWEEKLY,
          "monthly", MONTHLY,
          "quarterly", QUARTERLY,
          "yearly", YEARLY,
          "annually", YEARLY);

  /**
   * Parses a frequency key (case insensitive, surrounding whitespace ignored).
   *
   * @param s the key to parse
   * @return the frequency if the key is recognized
   */
  public static Optional<Frequency> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase(Locale.ROOT)));
  }
}
