package io.dueday.model;

/** Where a schedule stands relative to a reference date. */
public enum ScheduleState {
  /** The reference date is before the start date. */
  PENDING,
  /** Started and not yet past its end date. */
  ACTIVE,
  /** The reference date is after the end date. */
  ENDED
}
