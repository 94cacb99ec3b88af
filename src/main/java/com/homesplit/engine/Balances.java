package com.homesplit.engine;

/** Outstanding totals for one user, in minor units. */
public record Balances(long owedToMe, long owedByMe) {

  public long net() {
    return owedToMe - owedByMe;
  }
}
