package com.homesplit.engine;

import java.util.List;

/**
 * Allocation of one payment. {@code applied + unapplied} always equals the payment amount; a
 * positive {@code unapplied} means the payment exceeded what was outstanding.
 */
public record PaymentResult(List<Debt> closed, List<Debt> reduced, long applied, long unapplied) {

  public PaymentResult {
    closed = List.copyOf(closed);
    reduced = List.copyOf(reduced);
  }

  public boolean overpaid() {
    return unapplied > 0;
  }
}
