package com.homesplit.engine;

import java.time.LocalDate;
import java.util.Objects;

/** A logged expense as the engine sees it: one payer, one amount in minor units, one date. */
public record SharedExpense(
    String id,
    String groupId,
    long amount,
    String category,
    String description,
    String payer,
    LocalDate date) {

  public SharedExpense {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(date, "date");
  }

  public String debtDescription() {
    String label = description == null || description.isBlank() ? "Shared expense" : description;
    return category == null || category.isBlank() ? label : category + " - " + label;
  }
}
