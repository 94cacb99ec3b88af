package com.homesplit.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PaymentRequest {
  @NotNull
  @Digits(integer = 16, fraction = 2)
  private BigDecimal amount;

  /** Creditor the payment goes to; absent means any creditor, oldest debts first. */
  private UUID toUserId;
}
