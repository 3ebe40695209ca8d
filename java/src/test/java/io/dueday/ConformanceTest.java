package io.dueday;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dueday.calendar.CalendarDates;
import io.dueday.model.MonthlyProjection;
import io.dueday.model.RecurringPayment;
import io.dueday.model.UpcomingPayment;
import io.dueday.parser.RecordReader;
import io.dueday.projection.Projector;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode SPEC;

  @BeforeAll
  static void loadSpec() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json not on the test classpath");
      SPEC = MAPPER.readTree(in);
    }
  }

  private static LocalDate date(JsonNode node) throws DuedayException {
    return CalendarDates.normalize(node.asText());
  }

  private static RecurringSchedule schedule(JsonNode s) throws DuedayException {
    return RecurringSchedule.parse(
        s.get("start_date").asText(),
        s.get("frequency").asText(),
        s.hasNonNull("end_date") ? s.get("end_date").asText() : null,
        s.path("business_days_only").asBoolean(false),
        s.path("last_business_day_of_month").asBoolean(false));
  }

  private static List<RecurringPayment> payments(JsonNode rows) throws DuedayException {
    return RecordReader.readAll(rows.toString());
  }

  private static void assertAmount(JsonNode expected, BigDecimal actual, String message) {
    assertEquals(0, new BigDecimal(expected.asText()).compareTo(actual), message);
  }

  // Next occurrence

  @TestFactory
  Stream<DynamicTest> nextTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("next").get("tests")) {
      tests.add(
          DynamicTest.dynamicTest(
              "next/" + tc.get("name").asText(),
              () -> {
                RecurringSchedule s = schedule(tc.get("schedule"));
                JsonNode e = tc.get("expected");
                Optional<LocalDate> expected =
                    e.isNull() ? Optional.empty() : Optional.of(date(e));
                assertEquals(expected, s.nextFrom(date(tc.get("from"))), s.toString());
              }));
    }
    return tests.stream();
  }

  // Range enumeration

  @TestFactory
  Stream<DynamicTest> rangeTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("range").get("tests")) {
      tests.add(
          DynamicTest.dynamicTest(
              "range/" + tc.get("name").asText(),
              () -> {
                RecurringSchedule s = schedule(tc.get("schedule"));
                List<LocalDate> expected = new ArrayList<>();
                for (JsonNode e : tc.get("expected")) {
                  expected.add(date(e));
                }
                assertEquals(
                    expected, s.between(date(tc.get("from")), date(tc.get("to"))), s.toString());
              }));
    }
    return tests.stream();
  }

  // Monthly projection

  @TestFactory
  Stream<DynamicTest> projectionTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("projection").get("tests")) {
      tests.add(
          DynamicTest.dynamicTest(
              "projection/" + tc.get("name").asText(),
              () -> {
                MonthlyProjection p =
                    Projector.monthlyProjection(
                        payments(tc.get("payments")), tc.get("month").asText());
                assertAmount(tc.get("income"), p.income(), "income");
                assertAmount(tc.get("expenses"), p.expenses(), "expenses");
                assertAmount(tc.get("net"), p.net(), "net");
                assertEquals(tc.get("count").asInt(), p.occurrences().size(), "count");
              }));
    }
    return tests.stream();
  }

  // Upcoming payments

  @TestFactory
  Stream<DynamicTest> upcomingTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("upcoming").get("tests")) {
      tests.add(
          DynamicTest.dynamicTest(
              "upcoming/" + tc.get("name").asText(),
              () -> {
                List<UpcomingPayment> upcoming =
                    Projector.upcoming(
                        payments(tc.get("payments")),
                        date(tc.get("today")),
                        tc.get("days_ahead").asInt());
                List<String> expected = new ArrayList<>();
                tc.get("expected").forEach(e -> expected.add(e.asText()));
                assertEquals(
                    expected,
                    upcoming.stream()
                        .map(u -> u.payment().name() + "@" + u.date())
                        .collect(Collectors.toList()));
              }));
    }
    return tests.stream();
  }
}
