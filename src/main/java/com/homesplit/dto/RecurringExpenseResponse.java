package com.homesplit.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RecurringExpenseResponse {
  private UUID id;
  private UUID householdId;
  private BigDecimal amount;
  private String category;
  private String description;
  private UUID paidBy;
  private String frequency;
  private LocalDate startDate;
  private LocalDate endDate;
  private String lastMaterializedMonth;
}
