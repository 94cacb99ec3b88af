package com.homesplit.engine;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partial payments and pairwise offsetting over a {@link DebtLedger}. Each operation reads the
 * ledger, computes the updated debts and commits them while holding the ledger's monitor, so it is
 * atomic with respect to other ledger mutations.
 */
public class SettlementEngine {
  private final Clock clock;

  public SettlementEngine(Clock clock) {
    this.clock = clock;
  }

  /**
   * Allocates {@code amount} over the payer's open debts, oldest originating expense first. Debts the
   * remaining payment covers are closed; the first one it does not cover is reduced and allocation
   * stops there. Whatever exceeds the outstanding total is returned as unapplied.
   */
  public PaymentResult applyPayment(DebtLedger ledger, String fromUser, long amount, SettlementScope scope) {
    if (amount <= 0) {
      throw new NegativePaymentException(amount);
    }
    synchronized (ledger) {
      Instant now = Instant.now(clock);
      List<Debt> outstanding = ledger.snapshot().stream()
          .filter(debt -> !debt.paid() && scope.coversPayment(debt, fromUser))
          .sorted(Debt.OLDEST_FIRST)
          .toList();

      List<Debt> closed = new ArrayList<>();
      List<Debt> reduced = new ArrayList<>();
      long remaining = amount;
      for (Debt debt : outstanding) {
        if (remaining == 0) {
          break;
        }
        if (debt.amount() <= remaining) {
          remaining -= debt.amount();
          closed.add(debt.close(now, SettlementKind.PAYMENT));
        } else {
          reduced.add(debt.reduceBy(remaining, now, SettlementKind.PAYMENT));
          remaining = 0;
        }
      }
      List<Debt> changed = new ArrayList<>(closed);
      changed.addAll(reduced);
      ledger.commit(changed);
      return new PaymentResult(closed, reduced, amount - remaining, remaining);
    }
  }

  /**
   * Cancels mutual debts for every pair of users owing each other inside {@code scope}. The lighter
   * direction is closed entirely and the heavier direction's debts are reduced in proportion to
   * their size until they add up to the difference. Running it again without new debts changes
   * nothing, since no pair is left owing in both directions.
   */
  public OffsetResult autoOffset(DebtLedger ledger, SettlementScope scope) {
    synchronized (ledger) {
      Instant now = Instant.now(clock);
      Map<UserPair, List<Debt>> byPair = new TreeMap<>();
      for (Debt debt : ledger.snapshot()) {
        if (!debt.paid() && scope.coversOffset(debt)) {
          byPair.computeIfAbsent(UserPair.of(debt), key -> new ArrayList<>()).add(debt);
        }
      }

      List<PairOffset> pairs = new ArrayList<>();
      List<Debt> residualDebts = new ArrayList<>();
      List<Debt> closed = new ArrayList<>();
      List<Debt> reduced = new ArrayList<>();
      for (Map.Entry<UserPair, List<Debt>> entry : byPair.entrySet()) {
        UserPair pair = entry.getKey();
        List<Debt> forward = new ArrayList<>();
        List<Debt> backward = new ArrayList<>();
        for (Debt debt : entry.getValue()) {
          (debt.fromUser().equals(pair.first()) ? forward : backward).add(debt);
        }
        if (forward.isEmpty() || backward.isEmpty()) {
          continue;
        }
        forward.sort(Debt.OLDEST_FIRST);
        backward.sort(Debt.OLDEST_FIRST);
        long forwardTotal = total(forward);
        long backwardTotal = total(backward);
        List<Debt> heavy = forwardTotal >= backwardTotal ? forward : backward;
        List<Debt> light = heavy == forward ? backward : forward;
        long heavyTotal = Math.max(forwardTotal, backwardTotal);
        long offset = Math.min(forwardTotal, backwardTotal);
        long residual = heavyTotal - offset;

        for (Debt debt : light) {
          closed.add(debt.close(now, SettlementKind.OFFSET));
        }
        long[] kept = allocate(heavy, residual, heavyTotal);
        for (int i = 0; i < heavy.size(); i++) {
          Debt debt = heavy.get(i);
          Debt updated = debt.reduceBy(debt.amount() - kept[i], now, SettlementKind.OFFSET);
          if (updated.paid()) {
            closed.add(updated);
          } else {
            if (updated != debt) {
              reduced.add(updated);
            }
            residualDebts.add(updated);
          }
        }
        Debt sample = heavy.get(0);
        pairs.add(new PairOffset(sample.fromUser(), sample.toUser(), offset, residual));
      }

      List<Debt> changed = new ArrayList<>(closed);
      changed.addAll(reduced);
      ledger.commit(changed);
      return new OffsetResult(pairs, residualDebts, closed, reduced);
    }
  }

  /**
   * Splits {@code residual} across {@code debts} in proportion to their amounts, handing leftover
   * minor units to the largest remainders (earlier debts win ties).
   */
  static long[] allocate(List<Debt> debts, long residual, long total) {
    long[] kept = new long[debts.size()];
    long[] remainders = new long[debts.size()];
    if (residual == 0) {
      return kept;
    }
    BigInteger divisor = BigInteger.valueOf(total);
    long assigned = 0;
    for (int i = 0; i < debts.size(); i++) {
      BigInteger[] parts = BigInteger.valueOf(debts.get(i).amount())
          .multiply(BigInteger.valueOf(residual))
          .divideAndRemainder(divisor);
      kept[i] = parts[0].longValueExact();
      remainders[i] = parts[1].longValueExact();
      assigned += kept[i];
    }
    long leftover = residual - assigned;
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < debts.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingLong((Integer i) -> remainders[i]).reversed()
        .thenComparingInt(i -> i));
    for (int i = 0; i < leftover; i++) {
      kept[order.get(i)]++;
    }
    return kept;
  }

  private static long total(List<Debt> debts) {
    long total = 0;
    for (Debt debt : debts) {
      total = Math.addExact(total, debt.amount());
    }
    return total;
  }

  private record UserPair(String first, String second) implements Comparable<UserPair> {
    static UserPair of(Debt debt) {
      return debt.fromUser().compareTo(debt.toUser()) < 0
          ? new UserPair(debt.fromUser(), debt.toUser())
          : new UserPair(debt.toUser(), debt.fromUser());
    }

    @Override
    public int compareTo(UserPair other) {
      int result = first.compareTo(other.first);
      return result != 0 ? result : second.compareTo(other.second);
    }
  }
}
