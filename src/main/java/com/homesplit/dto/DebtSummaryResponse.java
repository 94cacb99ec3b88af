package com.homesplit.dto;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DebtSummaryResponse {
  private BigDecimal totalOwed;
  private BigDecimal totalOwedToMe;
  private BigDecimal totalUnpaid;
  private BigDecimal totalPaid;
}
