package com.homesplit.service;

import com.homesplit.dto.DebtResponse;
import com.homesplit.engine.Debt;
import com.homesplit.engine.DebtLedger;
import com.homesplit.engine.LedgerChange;
import com.homesplit.engine.MinorUnits;
import com.homesplit.engine.SharedExpense;
import com.homesplit.engine.SplitCalculator;
import com.homesplit.model.DebtEntry;
import com.homesplit.model.Expense;
import com.homesplit.repository.DebtEntryRepository;
import com.homesplit.repository.ExpenseRepository;
import com.homesplit.repository.HouseholdRepository;
import com.homesplit.repository.UserRepository;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Bridges stored debts and the in-memory ledger. A household's ledger is always rebuilt from the
 * store as a whole, and engine results are written back as upserts and deletes by debt id.
 * Requests that write debts load through {@link #loadForUpdate}, which holds the household row lock
 * until the surrounding transaction ends, so their read-modify-write cycles run one at a time.
 */
@Service
public class LedgerProjectionService {
  private static final Logger log = LoggerFactory.getLogger(LedgerProjectionService.class);
  private static final int DESCRIPTION_LIMIT = 255;

  private final DebtEntryRepository debtRepository;
  private final ExpenseRepository expenseRepository;
  private final HouseholdRepository householdRepository;
  private final UserRepository userRepository;
  private final SplitCalculator splitCalculator;
  private final Clock clock;

  public LedgerProjectionService(DebtEntryRepository debtRepository,
                                 ExpenseRepository expenseRepository,
                                 HouseholdRepository householdRepository,
                                 UserRepository userRepository,
                                 SplitCalculator splitCalculator,
                                 Clock clock) {
    this.debtRepository = debtRepository;
    this.expenseRepository = expenseRepository;
    this.householdRepository = householdRepository;
    this.userRepository = userRepository;
    this.splitCalculator = splitCalculator;
    this.clock = clock;
  }

  /**
   * Locks the household row for the rest of the current transaction, then loads its ledger.
   * Must run inside a transaction.
   */
  public DebtLedger loadForUpdate(UUID householdId) {
    try {
      householdRepository.findByIdForUpdate(householdId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Household not found"));
    } catch (PessimisticLockingFailureException ex) {
      log.warn("Household {} is locked by another update: {}", householdId, ex.getMessage());
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Household is being updated, retry the request");
    }
    return load(householdId);
  }

  public DebtLedger load(UUID householdId) {
    List<Debt> debts = debtRepository.findByHouseholdId(householdId).stream()
        .map(LedgerProjectionService::toDebt)
        .toList();
    List<String> expenseIds = expenseRepository.findIdsByHouseholdId(householdId).stream()
        .map(UUID::toString)
        .toList();
    DebtLedger ledger = new DebtLedger(splitCalculator, clock);
    ledger.reload(debts, expenseIds);
    log.debug("Loaded {} debts over {} expenses for household {}", debts.size(), expenseIds.size(), householdId);
    return ledger;
  }

  public void persist(LedgerChange change) {
    if (!change.removed().isEmpty()) {
      debtRepository.deleteAllById(change.removed().stream().map(debt -> UUID.fromString(debt.id())).toList());
    }
    persist(change.upserted());
  }

  public void persist(Collection<Debt> debts) {
    if (debts.isEmpty()) {
      return;
    }
    debtRepository.saveAll(debts.stream().map(this::toEntry).toList());
  }

  public static SharedExpense toSharedExpense(Expense expense) {
    return new SharedExpense(
        expense.getId().toString(),
        expense.getHousehold().getId().toString(),
        MinorUnits.fromDecimal(expense.getAmount()),
        expense.getCategory(),
        expense.getDescription(),
        expense.getPaidBy().getId().toString(),
        expense.getExpenseDate());
  }

  public static Debt toDebt(DebtEntry entry) {
    return new Debt(
        entry.getId().toString(),
        entry.getHousehold().getId().toString(),
        entry.getExpenseId().toString(),
        entry.getFromUser().getId().toString(),
        entry.getToUser().getId().toString(),
        MinorUnits.fromDecimal(entry.getAmount()),
        MinorUnits.fromDecimal(entry.getOriginalAmount()),
        entry.getDescription(),
        entry.getExpenseDate(),
        entry.getCreatedAt(),
        entry.isPaid(),
        entry.getPaidAt(),
        entry.getSettledBy());
  }

  public static DebtResponse toResponse(Debt debt) {
    return new DebtResponse(
        UUID.fromString(debt.id()),
        debt.groupId() == null ? null : UUID.fromString(debt.groupId()),
        UUID.fromString(debt.expenseId()),
        UUID.fromString(debt.fromUser()),
        UUID.fromString(debt.toUser()),
        MinorUnits.toDecimal(debt.amount()),
        MinorUnits.toDecimal(debt.originalAmount()),
        MinorUnits.toDecimal(debt.settledAmount()),
        debt.description(),
        debt.expenseDate(),
        debt.paid(),
        debt.paidAt(),
        debt.settledBy() == null ? null : debt.settledBy().name(),
        debt.createdAt());
  }

  private DebtEntry toEntry(Debt debt) {
    DebtEntry entry = new DebtEntry();
    entry.setId(UUID.fromString(debt.id()));
    entry.setHousehold(householdRepository.getReferenceById(UUID.fromString(debt.groupId())));
    entry.setExpenseId(UUID.fromString(debt.expenseId()));
    entry.setFromUser(userRepository.getReferenceById(UUID.fromString(debt.fromUser())));
    entry.setToUser(userRepository.getReferenceById(UUID.fromString(debt.toUser())));
    entry.setAmount(MinorUnits.toDecimal(debt.amount()));
    entry.setOriginalAmount(MinorUnits.toDecimal(debt.originalAmount()));
    String description = debt.description();
    entry.setDescription(description != null && description.length() > DESCRIPTION_LIMIT
        ? description.substring(0, DESCRIPTION_LIMIT)
        : description);
    entry.setExpenseDate(debt.expenseDate());
    entry.setCreatedAt(debt.createdAt());
    entry.setPaid(debt.paid());
    entry.setPaidAt(debt.paidAt());
    entry.setSettledBy(debt.settledBy());
    return entry;
  }
}
