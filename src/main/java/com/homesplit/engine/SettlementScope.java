package com.homesplit.engine;

import java.util.Set;

/**
 * Restricts a settlement operation. An empty {@code groupIds} covers every group; a null
 * {@code counterparty} covers every other user.
 */
public record SettlementScope(String counterparty, Set<String> groupIds) {

  public SettlementScope {
    groupIds = groupIds == null ? Set.of() : Set.copyOf(groupIds);
  }

  public static SettlementScope all() {
    return new SettlementScope(null, Set.of());
  }

  public static SettlementScope group(String groupId) {
    return new SettlementScope(null, Set.of(groupId));
  }

  public SettlementScope withCounterparty(String user) {
    return new SettlementScope(user, groupIds);
  }

  boolean coversGroup(Debt debt) {
    return groupIds.isEmpty() || (debt.groupId() != null && groupIds.contains(debt.groupId()));
  }

  /** A payment from {@code payer} may settle {@code debt}. */
  boolean coversPayment(Debt debt, String payer) {
    return coversGroup(debt)
        && debt.fromUser().equals(payer)
        && (counterparty == null || debt.toUser().equals(counterparty));
  }

  boolean coversOffset(Debt debt) {
    return coversGroup(debt) && (counterparty == null || debt.involves(counterparty));
  }
}
