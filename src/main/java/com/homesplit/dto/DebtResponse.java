package com.homesplit.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DebtResponse {
  private UUID id;
  private UUID householdId;
  private UUID expenseId;
  private UUID fromUserId;
  private UUID toUserId;
  private BigDecimal amount;
  private BigDecimal originalAmount;
  private BigDecimal paidAmount;
  private String description;
  private LocalDate expenseDate;
  private boolean paid;
  private Instant paidAt;
  private String settledBy;
  private Instant createdAt;
}
