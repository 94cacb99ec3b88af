package com.homesplit.engine;

import java.util.List;

/**
 * Outcome of a ledger mutation. {@code upserted} holds debts that are new or replaced;
 * {@code removed} holds debts that no longer exist after the mutation.
 */
public record LedgerChange(ChangeStatus status, List<Debt> upserted, List<Debt> removed) {

  public LedgerChange {
    upserted = List.copyOf(upserted);
    removed = List.copyOf(removed);
  }

  public static LedgerChange unknownReference() {
    return new LedgerChange(ChangeStatus.UNKNOWN_REFERENCE, List.of(), List.of());
  }

  public static LedgerChange of(List<Debt> upserted, List<Debt> removed) {
    ChangeStatus status = upserted.isEmpty() && removed.isEmpty() ? ChangeStatus.NO_CHANGE : ChangeStatus.APPLIED;
    return new LedgerChange(status, upserted, removed);
  }

  public boolean isUnknownReference() {
    return status == ChangeStatus.UNKNOWN_REFERENCE;
  }
}
