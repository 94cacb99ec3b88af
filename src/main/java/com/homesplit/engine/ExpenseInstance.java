package com.homesplit.engine;

import java.time.LocalDate;

public record ExpenseInstance(
    String id,
    String templateId,
    String groupId,
    long amount,
    String category,
    String description,
    String payer,
    LocalDate date) {

  public SharedExpense toExpense() {
    return new SharedExpense(id, groupId, amount, category, description, payer, date);
  }
}
