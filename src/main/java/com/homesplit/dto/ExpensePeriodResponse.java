package com.homesplit.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExpensePeriodResponse {
  private LocalDate from;
  private LocalDate to;
  private List<ExpenseResponse> expenses;
  private BigDecimal totalAmount;
  private long totalExpenses;
  private BigDecimal averagePerDay;
}
