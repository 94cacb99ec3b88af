package com.homesplit.engine;

/** How a debt came to be closed. */
public enum SettlementKind {
  MARKED_PAID,
  PAYMENT,
  OFFSET
}
