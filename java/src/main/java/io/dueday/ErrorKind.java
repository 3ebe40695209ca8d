package io.dueday;

/** The type of error raised while normalizing dates or reading recurring-payment records. */
public enum ErrorKind {
  /** The input cannot be read as a calendar date. */
  INVALID_DATE_FORMAT("invalid_date_format"),
  /** A frequency key outside daily, weekly, biweekly, monthly, quarterly, yearly. */
  UNKNOWN_FREQUENCY("unknown_frequency"),
  /** A record is missing a field, carries an invalid value, or combines incompatible options. */
  INVALID_RECORD("invalid_record");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value();
  }
}
