package com.homesplit.engine;

public record MarkPaidOutcome(Status status, Debt debt) {

  public enum Status {
    PAID,
    ALREADY_PAID,
    UNKNOWN_DEBT
  }

  public boolean changed() {
    return status == Status.PAID;
  }
}
