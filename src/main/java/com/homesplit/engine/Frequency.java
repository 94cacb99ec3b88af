package com.homesplit.engine;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum Frequency {
  DAILY,
  WEEKLY,
  MONTHLY;

  /**
   * Date of the {@code index}-th occurrence counted from {@code start}. Monthly steps are
   * anchored on the start date, so a day-of-month missing from a shorter month is clamped to
   * that month's last day without drifting the following occurrences.
   */
  public LocalDate occurrence(LocalDate start, long index) {
    return switch (this) {
      case DAILY -> start.plusDays(index);
      case WEEKLY -> start.plusWeeks(index);
      case MONTHLY -> start.plusMonths(index);
    };
  }

  /** An occurrence index whose date is on or before {@code date}; never negative. */
  long indexNotAfter(LocalDate start, LocalDate date) {
    if (!date.isAfter(start)) {
      return 0;
    }
    long days = ChronoUnit.DAYS.between(start, date);
    return switch (this) {
      case DAILY -> days;
      case WEEKLY -> days / 7;
      case MONTHLY -> Math.max(0, ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(date)) - 1);
    };
  }

  public static Frequency parse(String value) {
    if (value == null || value.isBlank()) {
      throw new UnknownFrequencyException(String.valueOf(value));
    }
    try {
      return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new UnknownFrequencyException(value);
    }
  }
}
