package com.homesplit.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * Body for creating or replacing an expense. With {@code recurring} set the request describes a
 * template and {@code frequency} and {@code startDate} apply instead of {@code date}.
 */
@Getter
@Setter
public class ExpenseRequest {
  @NotNull
  @Positive
  @Digits(integer = 16, fraction = 2)
  private BigDecimal amount;

  @NotBlank
  private String category;

  private String description;
  private UUID paidBy;
  private LocalDate date;
  private boolean recurring;
  private String frequency;
  private LocalDate startDate;
  private LocalDate endDate;
}
