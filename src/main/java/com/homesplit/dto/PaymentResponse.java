package com.homesplit.dto;

import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PaymentResponse {
  private List<DebtResponse> closed;
  private List<DebtResponse> reduced;
  private BigDecimal applied;
  private BigDecimal unapplied;
  private boolean overpaid;
}
