package com.homesplit.engine;

import java.time.LocalDate;
import java.util.Objects;

public record RecurringTemplate(
    String id,
    String groupId,
    long amount,
    String category,
    String description,
    String payer,
    Frequency frequency,
    LocalDate startDate,
    LocalDate endDate) {

  public RecurringTemplate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payer, "payer");
    Objects.requireNonNull(frequency, "frequency");
    Objects.requireNonNull(startDate, "startDate");
    if (amount <= 0) {
      throw new IllegalArgumentException("Template amount must be positive");
    }
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("Template end date precedes its start date");
    }
  }
}
