package com.homesplit.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Pure aggregation over a ledger snapshot. Nothing is cached between calls. */
public class BalanceAggregator {

  public long owedToMe(Collection<Debt> snapshot, String user) {
    long total = 0;
    for (Debt debt : snapshot) {
      if (debt.toUser().equals(user)) {
        total = Math.addExact(total, debt.remaining());
      }
    }
    return total;
  }

  public long owedByMe(Collection<Debt> snapshot, String user) {
    long total = 0;
    for (Debt debt : snapshot) {
      if (debt.fromUser().equals(user)) {
        total = Math.addExact(total, debt.remaining());
      }
    }
    return total;
  }

  public long netBalance(Collection<Debt> snapshot, String user) {
    return owedToMe(snapshot, user) - owedByMe(snapshot, user);
  }

  public Balances balances(Collection<Debt> snapshot, String user) {
    return new Balances(owedToMe(snapshot, user), owedByMe(snapshot, user));
  }

  /** Lifetime totals. Both directions count original amounts, so settled debts stay in the totals. */
  public DebtSummary summarize(Collection<Debt> snapshot, String user) {
    long owed = 0;
    long owedToMe = 0;
    long unpaid = 0;
    long paid = 0;
    for (Debt debt : snapshot) {
      if (debt.fromUser().equals(user)) {
        owed += debt.originalAmount();
        unpaid += debt.remaining();
        paid += debt.settledAmount();
      } else if (debt.toUser().equals(user)) {
        owedToMe += debt.originalAmount();
      }
    }
    return new DebtSummary(owed, owedToMe, unpaid, paid);
  }

  /** Per-counterparty positions for {@code user}, ordered by counterparty id; settled pairs are omitted. */
  public List<CounterpartyBalance> byCounterparty(Collection<Debt> snapshot, String user) {
    Map<String, long[]> totals = new TreeMap<>();
    for (Debt debt : snapshot) {
      if (debt.paid()) {
        continue;
      }
      if (debt.toUser().equals(user)) {
        totals.computeIfAbsent(debt.fromUser(), key -> new long[2])[0] += debt.remaining();
      } else if (debt.fromUser().equals(user)) {
        totals.computeIfAbsent(debt.toUser(), key -> new long[2])[1] += debt.remaining();
      }
    }
    List<CounterpartyBalance> balances = new ArrayList<>();
    totals.forEach((counterparty, pair) -> balances.add(new CounterpartyBalance(counterparty, pair[0], pair[1])));
    return balances;
  }
}
