package io.dueday;

import java.util.Optional;

/** Exception thrown when a date or a recurring-payment record cannot be read. */
public final class DuedayException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input, if known. */
  private final String input;

  /** The record field the error refers to, if any. */
  private final String field;

  private DuedayException(
      ErrorKind kind, String message, String input, String field, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
    this.field = field;
  }

  /**
   * Creates an error for input that cannot be normalized to a calendar date.
   *
   * @param input the rejected input
   * @return a new DuedayException of kind {@link ErrorKind#INVALID_DATE_FORMAT}
   */
  public static DuedayException invalidDate(String input) {
    return new DuedayException(
        ErrorKind.INVALID_DATE_FORMAT, "cannot read a calendar date", input, null, null);
  }

  /**
   * Creates an error for input that looked like a date but names an impossible day.
   *
   * @param input the rejected input
   * @param cause the underlying date-time failure
   * @return a new DuedayException of kind {@link ErrorKind#INVALID_DATE_FORMAT}
   */
  public static DuedayException invalidDate(String input, Throwable cause) {
    return new DuedayException(
        ErrorKind.INVALID_DATE_FORMAT, "cannot read a calendar date", input, null, cause);
  }

  /**
   * Creates an error for a frequency key outside the supported set.
   *
   * @param key the rejected key
   * @return a new DuedayException of kind {@link ErrorKind#UNKNOWN_FREQUENCY}
   */
  public static DuedayException unknownFrequency(String key) {
    return new DuedayException(
        ErrorKind.UNKNOWN_FREQUENCY, "unknown frequency", key, "frequency", null);
  }

  /**
   * Creates an error for a record field that is missing or invalid.
   *
   * @param field the record field
   * @param message what is wrong with it
   * @return a new DuedayException of kind {@link ErrorKind#INVALID_RECORD}
   */
  public static DuedayException invalidRecord(String field, String message) {
    return new DuedayException(ErrorKind.INVALID_RECORD, message, null, field, null);
  }

  /**
   * Creates an error for a record that could not be read at all.
   *
   * @param message what went wrong
   * @param cause the underlying failure
   * @return a new DuedayException of kind {@link ErrorKind#INVALID_RECORD}
   */
  public static DuedayException invalidRecord(String message, Throwable cause) {
    return new DuedayException(ErrorKind.INVALID_RECORD, message, null, null, cause);
  }

  /**
   * Returns a copy of this error attributed to the given record field.
   *
   * @param field the record field
   * @return a new DuedayException with the same kind, message and input
   */
  public DuedayException inField(String field) {
    return new DuedayException(kind, getMessage(), input, field, getCause());
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the rejected input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the record field the error refers to, if available.
   *
   * @return the field name, or empty if not available
   */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }

  /**
   * Formats a one-line message naming the field and the rejected input.
   *
   * <p>For example: {@code error: unknown frequency (frequency: "fortnightly")}
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (field != null || input != null) {
      sb.append(" (");
      if (field != null) {
        sb.append(field);
        if (input != null) {
          sb.append(": ");
        }
      }
      if (input != null) {
        sb.append('"').append(input).append('"');
      }
      sb.append(')');
    }
    return sb.toString();
  }
}
