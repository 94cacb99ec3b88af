package com.homesplit.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Spending statistics of one household; {@code from} and {@code to} are null when unbounded. */
@Getter
@AllArgsConstructor
public class ExpenseSummaryResponse {
  private LocalDate from;
  private LocalDate to;
  private String currency;
  private BigDecimal totalAmount;
  private long totalExpenses;
  private List<CategoryTotalResponse> byCategory;
  private List<PayerTotalResponse> byPayer;
  private List<MonthlyTotalResponse> monthlyTrend;
}
