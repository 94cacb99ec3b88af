package com.homesplit.dto;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MonthlyTotalResponse {
  /** {@code yyyy-MM}. */
  private String month;
  private BigDecimal total;
  private long count;
}
