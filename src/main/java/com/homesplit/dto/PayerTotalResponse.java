package com.homesplit.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PayerTotalResponse {
  private UUID userId;
  /** Null when the payer has since left the household. */
  private String displayName;
  private BigDecimal total;
  private long count;
}
