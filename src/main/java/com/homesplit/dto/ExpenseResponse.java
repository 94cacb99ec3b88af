package com.homesplit.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExpenseResponse {
  private UUID id;
  private UUID householdId;
  private BigDecimal amount;
  private String category;
  private String description;
  private UUID paidBy;
  private LocalDate date;
  private UUID recurringExpenseId;
  private String instanceKey;
  private Instant createdAt;
}
