package com.homesplit.engine;

/** Net position against one other user; positive means the counterparty owes the user. */
public record CounterpartyBalance(String counterparty, long owedToMe, long owedByMe) {

  public long net() {
    return owedToMe - owedByMe;
  }
}
