package com.homesplit.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * A directional obligation from {@code fromUser} to {@code toUser} that originates from exactly one
 * expense. {@code amount} is the outstanding amount in minor units while the debt is open; once
 * {@code paid} it keeps the last outstanding value and {@link #remaining()} is zero.
 */
public record Debt(
    String id,
    String groupId,
    String expenseId,
    String fromUser,
    String toUser,
    long amount,
    long originalAmount,
    String description,
    LocalDate expenseDate,
    Instant createdAt,
    boolean paid,
    Instant paidAt,
    SettlementKind settledBy) {

  /** Oldest originating expense first, then creation time, then id. */
  public static final Comparator<Debt> OLDEST_FIRST = Comparator
      .comparing(Debt::expenseDate, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(Debt::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(Debt::id);

  public Debt {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(expenseId, "expenseId");
    Objects.requireNonNull(fromUser, "fromUser");
    Objects.requireNonNull(toUser, "toUser");
    if (fromUser.equals(toUser)) {
      throw new IllegalArgumentException("A debt cannot run from a user to themselves: " + fromUser);
    }
    if (amount < 0 || (!paid && amount == 0)) {
      throw new IllegalArgumentException("Open debt " + id + " must have a positive amount");
    }
    if (originalAmount < amount) {
      throw new IllegalArgumentException("Debt " + id + " exceeds its original amount");
    }
  }

  public static Debt open(String id, SharedExpense expense, Share share, Instant createdAt) {
    return new Debt(
        id,
        expense.groupId(),
        expense.id(),
        share.debtor(),
        expense.payer(),
        share.amount(),
        share.amount(),
        expense.debtDescription(),
        expense.date(),
        createdAt,
        false,
        null,
        null);
  }

  public long remaining() {
    return paid ? 0 : amount;
  }

  public long settledAmount() {
    return originalAmount - remaining();
  }

  public boolean involves(String user) {
    return fromUser.equals(user) || toUser.equals(user);
  }

  public Debt close(Instant at, SettlementKind kind) {
    if (paid) {
      return this;
    }
    return new Debt(id, groupId, expenseId, fromUser, toUser, amount, originalAmount, description,
        expenseDate, createdAt, true, at, kind);
  }

  /** Applies {@code units} against the outstanding amount, closing the debt when nothing remains. */
  public Debt reduceBy(long units, Instant at, SettlementKind kind) {
    if (units <= 0 || paid) {
      return this;
    }
    if (units >= amount) {
      return close(at, kind);
    }
    return new Debt(id, groupId, expenseId, fromUser, toUser, amount - units, originalAmount,
        description, expenseDate, createdAt, false, null, null);
  }
}
