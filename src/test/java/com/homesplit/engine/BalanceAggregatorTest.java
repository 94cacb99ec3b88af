package com.homesplit.engine;

import static com.homesplit.engine.DebtFixtures.open;
import static com.homesplit.engine.DebtFixtures.paid;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class BalanceAggregatorTest {
  private static final LocalDate DAY = LocalDate.of(2025, 1, 20);

  private final BalanceAggregator aggregator = new BalanceAggregator();

  private final List<Debt> snapshot = List.of(
      open("d1", "bob", "alice", 10000, DAY),
      open("d2", "carol", "alice", 2500, DAY),
      open("d3", "alice", "bob", 4000, DAY),
      paid("d4", "carol", "alice", 7000, DAY));

  @Test
  void totalsIgnorePaidDebts() {
    assertThat(aggregator.owedToMe(snapshot, "alice")).isEqualTo(12500);
    assertThat(aggregator.owedByMe(snapshot, "alice")).isEqualTo(4000);
    assertThat(aggregator.netBalance(snapshot, "alice")).isEqualTo(8500);
    assertThat(aggregator.balances(snapshot, "bob")).isEqualTo(new Balances(4000, 10000));
    assertThat(aggregator.balances(snapshot, "bob").net()).isEqualTo(-6000);
  }

  @Test
  void netBalancesSumToZeroAcrossTheGroup() {
    long total = 0;
    for (String user : List.of("alice", "bob", "carol")) {
      total += aggregator.netBalance(snapshot, user);
    }
    assertThat(total).isZero();
  }

  @Test
  void summary_tracksOriginalAndSettledAmounts() {
    Debt partlyPaid = open("d5", "carol", "bob", 3000, DAY).reduceBy(1000, DebtFixtures.NOW, SettlementKind.PAYMENT);
    List<Debt> debts = List.of(snapshot.get(1), snapshot.get(3), partlyPaid);

    DebtSummary summary = aggregator.summarize(debts, "carol");

    assertThat(summary.totalOwed()).isEqualTo(2500 + 7000 + 3000);
    assertThat(summary.totalUnpaid()).isEqualTo(2500 + 2000);
    assertThat(summary.totalPaid()).isEqualTo(7000 + 1000);
    assertThat(summary.totalOwedToMe()).isZero();
  }

  @Test
  void summary_countsSettledDebtsOwedToTheUserAtOriginalAmount() {
    Debt partlyPaid = open("d5", "carol", "bob", 3000, DAY).reduceBy(1000, DebtFixtures.NOW, SettlementKind.PAYMENT);
    List<Debt> debts = List.of(snapshot.get(0), snapshot.get(1), snapshot.get(2), snapshot.get(3), partlyPaid);

    DebtSummary alice = aggregator.summarize(debts, "alice");
    DebtSummary bob = aggregator.summarize(debts, "bob");

    assertThat(alice.totalOwedToMe()).isEqualTo(10000 + 2500 + 7000);
    assertThat(alice.totalOwed()).isEqualTo(4000);
    assertThat(bob.totalOwedToMe()).isEqualTo(4000 + 3000);
    assertThat(bob.totalOwed()).isEqualTo(10000);
  }

  @Test
  void byCounterparty_ordersByIdAndSkipsSettledPairs() {
    List<CounterpartyBalance> balances = aggregator.byCounterparty(snapshot, "alice");

    assertThat(balances).containsExactly(
        new CounterpartyBalance("bob", 10000, 4000),
        new CounterpartyBalance("carol", 2500, 0));
    assertThat(balances.get(0).net()).isEqualTo(6000);
    assertThat(aggregator.byCounterparty(snapshot, "dave")).isEmpty();
  }

  @Test
  void emptySnapshot_isAllZero() {
    assertThat(aggregator.balances(List.of(), "alice")).isEqualTo(new Balances(0, 0));
    assertThat(aggregator.summarize(List.of(), "alice")).isEqualTo(new DebtSummary(0, 0, 0, 0));
  }
}
