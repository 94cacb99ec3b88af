package com.homesplit.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BalanceResponse {
  private UUID userId;
  private String currency;
  private BigDecimal owedToMe;
  private BigDecimal owedByMe;
  private BigDecimal net;
  private List<CounterpartyBalanceResponse> counterparties;
}
