package io.dueday.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.dueday.DuedayException;
import io.dueday.RecurringSchedule;
import io.dueday.model.PaymentKind;
import io.dueday.model.RecurringPayment;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads stored recurring-payment rows into {@link RecurringPayment} values.
 *
 * <p>A row is a JSON object with snake_case keys:
 *
 * <pre>{@code
 * {
 *   "id": "7f3c...", "name": "Rent", "amount": 1200.00, "type": "expense",
 *   "frequency": "monthly", "start_date": "2026-01-01", "end_date": null,
 *   "is_active": true, "business_days_only": false, "last_business_day_of_month": false,
 *   "category_id": "c-42"
 * }
 * }</pre>
 *
 * <p>{@code is_active} defaults to true, the two flags to false. {@code amount} may be a number
 * or a numeric string.
 */
public final class RecordReader {
  private static final Logger log = LoggerFactory.getLogger(RecordReader.class);

  /** Amounts keep their written scale: 200.50 stays 200.50. */
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
          .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

  private RecordReader() {}

  /**
   * Reads one row from its JSON text.
   *
   * @param json the JSON object
   * @return the payment
   * @throws DuedayException if the JSON is malformed or the row is invalid
   */
  public static RecurringPayment read(String json) throws DuedayException {
    return read(readTree(json));
  }

  /**
   * Reads one row.
   *
   * @param row the JSON object
   * @return the payment
   * @throws DuedayException if a field is missing or invalid
   */
  public static RecurringPayment read(JsonNode row) throws DuedayException {
    if (row == null || !row.isObject()) {
      throw DuedayException.invalidRecord("row", "expected a JSON object");
    }

    RecurringSchedule schedule =
        RecurringSchedule.parse(
            requiredText(row, "start_date"),
            requiredText(row, "frequency"),
            optionalText(row, "end_date"),
            flag(row, "business_days_only", false),
            flag(row, "last_business_day_of_month", false));

    String type = requiredText(row, "type");
    PaymentKind kind =
        PaymentKind.parse(type)
            .orElseThrow(
                () ->
                    DuedayException.invalidRecord(
                        "type", "expected income or expense, got " + type));

    RecurringPayment payment =
        new RecurringPayment(
            optionalText(row, "id"),
            optionalText(row, "name"),
            schedule.spec(),
            amount(row),
            kind,
            flag(row, "is_active", true),
            optionalText(row, "category_id"));
    log.debug("Read recurring payment {} ({})", payment.id(), schedule);
    return payment;
  }

  /**
   * Reads a JSON array of rows, skipping rows that cannot be read.
   *
   * <p>A skipped row is logged and contributes nothing, so one malformed payment does not empty a
   * whole projection.
   *
   * @param json the JSON array
   * @return the payments that could be read, in input order
   * @throws DuedayException if the text is not a JSON array
   */
  public static List<RecurringPayment> readAll(String json) throws DuedayException {
    JsonNode root = readTree(json);
    if (!root.isArray()) {
      throw DuedayException.invalidRecord("rows", "expected a JSON array");
    }

    List<RecurringPayment> payments = new ArrayList<>(root.size());
    int index = 0;
    for (JsonNode row : root) {
      try {
        payments.add(read(row));
      } catch (DuedayException e) {
        log.warn(
            "Skipping recurring payment at index {} (id {}): {}",
            index,
            row.path("id").asText(null),
            e.displayRich());
      }
      index++;
    }
    return payments;
  }

  private static JsonNode readTree(String json) throws DuedayException {
    if (json == null) {
      throw DuedayException.invalidRecord("json", "no input");
    }
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw DuedayException.invalidRecord("malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static String requiredText(JsonNode row, String field) throws DuedayException {
    String value = optionalText(row, field);
    if (value == null || value.isBlank()) {
      throw DuedayException.invalidRecord(field, "missing " + field);
    }
    return value;
  }

  private static String optionalText(JsonNode row, String field) {
    JsonNode node = row.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return node.asText();
  }

  private static boolean flag(JsonNode row, String field, boolean defaultValue)
      throws DuedayException {
    JsonNode node = row.get(field);
    if (node == null || node.isNull()) {
      return defaultValue;
    }
    if (!node.isBoolean()) {
      throw DuedayException.invalidRecord(field, "expected true or false");
    }
    return node.booleanValue();
  }

  private static BigDecimal amount(JsonNode row) throws DuedayException {
    JsonNode node = row.get("amount");
    if (node == null || node.isNull()) {
      throw DuedayException.invalidRecord("amount", "missing amount");
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    try {
      return new BigDecimal(node.asText().trim());
    } catch (NumberFormatException e) {
      throw DuedayException.invalidRecord("amount", "not a number: " + node.asText());
    }
  }
}
