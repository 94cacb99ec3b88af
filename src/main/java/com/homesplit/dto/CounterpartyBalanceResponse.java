package com.homesplit.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CounterpartyBalanceResponse {
  private UUID userId;
  private String displayName;
  private BigDecimal owedToMe;
  private BigDecimal owedByMe;
  private BigDecimal net;
}
