package com.homesplit.engine;

public class NegativePaymentException extends SettlementException {
  public NegativePaymentException(long amount) {
    super("Payment amount must be positive, got " + MinorUnits.toDecimal(amount).toPlainString());
  }
}
