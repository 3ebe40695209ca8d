package io.dueday.display;

import io.dueday.model.BusinessDayPolicy;
import io.dueday.model.Frequency;
import io.dueday.model.ScheduleSpec;

/** Renders frequencies and schedules as display strings. */
public final class Display {
  private Display() {}

  /**
   * Returns the label of a frequency, e.g. {@code "Biweekly"}.
   *
   * @param frequency the frequency
   * @return the label
   */
  public static String formatFrequency(Frequency frequency) {
    return frequency.label();
  }

  /**
   * Returns the label for a stored frequency key, or the key itself when it is not recognized.
   *
   * @param key the stored key
   * @return the label
   */
  public static String formatFrequency(String key) {
    return Frequency.parse(key).map(Frequency::label).orElse(key);
  }

  /**
   * Renders a schedule as a canonical one-line description.
   *
   * <p>Examples:
   *
   * <pre>
   * every 2 weeks from 2026-01-02
   * every month on the last business day from 2026-01-01 until 2026-12-31
   * every day from 2026-03-01 on business days
   * </pre>
   *
   * @param spec the schedule
   * @return the description
   */
  public static String render(ScheduleSpec spec) {
    StringBuilder sb = new StringBuilder();
    sb.append(renderFrequency(spec.frequency()));

    if (spec.policy() == BusinessDayPolicy.LAST_BUSINESS_DAY_OF_MONTH) {
      sb.append(" on the last business day");
    }

    sb.append(" from ").append(spec.startDate());

    if (spec.endDate() != null) {
      sb.append(" until ").append(spec.endDate());
    }

    if (spec.policy() == BusinessDayPolicy.NEAREST_WEEKDAY) {
      sb.append(" on business days");
    }

    return sb.toString();
  }

  private static String renderFrequency(Frequency f) {
    return switch (f) {
      case DAILY -> "every day";
      case WEEKLY -> "every week";
      case BIWEEKLY -> "every 2 weeks";
      case MONTHLY -> "every month";
      case QUARTERLY -> "every 3 months";
      case YEARLY -> "every year";
    };
  }
}
