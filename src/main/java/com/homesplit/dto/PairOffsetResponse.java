package com.homesplit.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PairOffsetResponse {
  private UUID debtorId;
  private UUID creditorId;
  private BigDecimal offset;
  private BigDecimal residual;
}
