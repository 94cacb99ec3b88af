package com.homesplit.engine;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The debts of a ledger, indexed by id and by originating expense.
 *
 * <p>State is an immutable snapshot swapped in whole by each mutation, so a reader sees either the
 * state before a mutation or the state after it, never a half-applied regeneration. Mutations are
 * serialized on the ledger's monitor.
 */
public class DebtLedger {
  private final SplitCalculator splitCalculator;
  private final Clock clock;
  private volatile State state = State.EMPTY;

  public DebtLedger(Clock clock) {
    this(new SplitCalculator(), clock);
  }

  public DebtLedger(SplitCalculator splitCalculator, Clock clock) {
    this.splitCalculator = splitCalculator;
    this.clock = clock;
  }

  /** Deterministic id of the debt {@code debtor} owes for {@code expenseId}. */
  public static String debtId(String expenseId, String debtor) {
    String key = expenseId + '\u0000' + debtor;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }

  /** Replaces the whole projection, e.g. after an authoritative reload. */
  public synchronized void reload(Collection<Debt> debts, Collection<String> knownExpenseIds) {
    Map<String, Debt> byId = new LinkedHashMap<>();
    Set<String> known = new HashSet<>(knownExpenseIds);
    for (Debt debt : debts) {
      byId.put(debt.id(), debt);
      known.add(debt.expenseId());
    }
    state = new State(byId, known);
  }

  public synchronized LedgerChange deriveAndAppend(SharedExpense expense, Collection<String> participants) {
    State current = state;
    if (!current.debtsForExpense(expense.id()).isEmpty()) {
      throw new IllegalStateException("Debts already derived for expense " + expense.id());
    }
    List<Debt> derived = derive(expense, participants, Map.of());
    Map<String, Debt> byId = new LinkedHashMap<>(current.byId());
    derived.forEach(debt -> byId.put(debt.id(), debt));
    Set<String> known = new HashSet<>(current.knownExpenses());
    known.add(expense.id());
    state = new State(byId, known);
    return LedgerChange.of(derived, List.of());
  }

  /** Drops every debt of {@code expenseId} and derives them again from {@code updated}. */
  public synchronized LedgerChange regenerate(String expenseId, SharedExpense updated, Collection<String> participants) {
    if (!expenseId.equals(updated.id())) {
      throw new IllegalArgumentException("Expense id mismatch: " + expenseId + " vs " + updated.id());
    }
    State current = state;
    if (!current.knownExpenses().contains(expenseId)) {
      return LedgerChange.unknownReference();
    }
    Map<String, Debt> previous = new LinkedHashMap<>();
    current.debtsForExpense(expenseId).forEach(debt -> previous.put(debt.id(), debt));
    List<Debt> derived = derive(updated, participants, previous);

    Map<String, Debt> byId = new LinkedHashMap<>(current.byId());
    previous.keySet().forEach(byId::remove);
    derived.forEach(debt -> byId.put(debt.id(), debt));

    List<Debt> removed = new ArrayList<>();
    Set<String> derivedIds = new HashSet<>();
    derived.forEach(debt -> derivedIds.add(debt.id()));
    for (Debt old : previous.values()) {
      if (!derivedIds.contains(old.id())) {
        removed.add(old);
      }
    }
    List<Debt> upserted = new ArrayList<>();
    for (Debt debt : derived) {
      if (!debt.equals(previous.get(debt.id()))) {
        upserted.add(debt);
      }
    }
    state = new State(byId, current.knownExpenses());
    return LedgerChange.of(upserted, removed);
  }

  public synchronized LedgerChange remove(String expenseId) {
    State current = state;
    if (!current.knownExpenses().contains(expenseId)) {
      return LedgerChange.unknownReference();
    }
    List<Debt> removed = current.debtsForExpense(expenseId);
    Map<String, Debt> byId = new LinkedHashMap<>(current.byId());
    removed.forEach(debt -> byId.remove(debt.id()));
    Set<String> known = new HashSet<>(current.knownExpenses());
    known.remove(expenseId);
    state = new State(byId, known);
    return new LedgerChange(ChangeStatus.APPLIED, List.of(), removed);
  }

  public synchronized MarkPaidOutcome markPaid(String debtId) {
    State current = state;
    Debt debt = current.byId().get(debtId);
    if (debt == null) {
      return new MarkPaidOutcome(MarkPaidOutcome.Status.UNKNOWN_DEBT, null);
    }
    if (debt.paid()) {
      return new MarkPaidOutcome(MarkPaidOutcome.Status.ALREADY_PAID, debt);
    }
    Debt closed = debt.close(Instant.now(clock), SettlementKind.MARKED_PAID);
    commit(List.of(closed));
    return new MarkPaidOutcome(MarkPaidOutcome.Status.PAID, closed);
  }

  /** Replaces existing debts by id in one step. */
  synchronized void commit(Collection<Debt> updated) {
    if (updated.isEmpty()) {
      return;
    }
    State current = state;
    Map<String, Debt> byId = new LinkedHashMap<>(current.byId());
    for (Debt debt : updated) {
      if (!byId.containsKey(debt.id())) {
        throw new IllegalStateException("Debt " + debt.id() + " is not part of this ledger");
      }
      byId.put(debt.id(), debt);
    }
    state = new State(byId, current.knownExpenses());
  }

  public List<Debt> snapshot() {
    return List.copyOf(state.byId().values());
  }

  public Optional<Debt> find(String debtId) {
    return Optional.ofNullable(state.byId().get(debtId));
  }

  public List<Debt> debtsForExpense(String expenseId) {
    return state.debtsForExpense(expenseId);
  }

  public boolean knowsExpense(String expenseId) {
    return state.knownExpenses().contains(expenseId);
  }

  public List<Debt> listForUser(String user) {
    return state.byId().values().stream()
        .filter(debt -> debt.involves(user))
        .toList();
  }


  private List<Debt> derive(SharedExpense expense, Collection<String> participants, Map<String, Debt> previous) {
    Instant now = Instant.now(clock);
    List<Debt> derived = new ArrayList<>();
    for (Share share : splitCalculator.split(expense.amount(), expense.payer(), participants)) {
      String id = debtId(expense.id(), share.debtor());
      Debt prior = previous.get(id);
      Instant createdAt = prior == null ? now : prior.createdAt();
      derived.add(Debt.open(id, expense, share, createdAt));
    }
    return derived;
  }

  private record State(Map<String, Debt> byId, Set<String> knownExpenses, Map<String, List<Debt>> byExpense) {
    static final State EMPTY = new State(Map.of(), Set.of());

    State(Map<String, Debt> byId, Set<String> knownExpenses) {
      this(Collections.unmodifiableMap(byId), Collections.unmodifiableSet(knownExpenses), index(byId));
    }

    List<Debt> debtsForExpense(String expenseId) {
      return byExpense.getOrDefault(expenseId, List.of());
    }

    private static Map<String, List<Debt>> index(Map<String, Debt> byId) {
      Map<String, List<Debt>> byExpense = new LinkedHashMap<>();
      for (Debt debt : byId.values()) {
        byExpense.computeIfAbsent(debt.expenseId(), key -> new ArrayList<>()).add(debt);
      }
      byExpense.replaceAll((key, debts) -> List.copyOf(debts));
      return Collections.unmodifiableMap(byExpense);
    }
  }
}
