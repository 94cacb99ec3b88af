package com.homesplit.service;

import com.homesplit.dto.CategoryTotalResponse;
import com.homesplit.dto.ExpensePeriodResponse;
import com.homesplit.dto.ExpenseRequest;
import com.homesplit.dto.ExpenseResponse;
import com.homesplit.dto.ExpenseSummaryResponse;
import com.homesplit.dto.MonthlyTotalResponse;
import com.homesplit.dto.PayerTotalResponse;
import com.homesplit.engine.DebtLedger;
import com.homesplit.engine.LedgerChange;
import com.homesplit.engine.SettlementException;
import com.homesplit.model.Expense;
import com.homesplit.model.HouseholdMember;
import com.homesplit.model.User;
import com.homesplit.repository.ExpenseRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * One-off shared expenses. Every change to an expense re-derives its debts in the same transaction:
 * create appends them, update replaces them wholesale, delete drops them.
 */
@Service
public class ExpenseService {
  private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);
  // Stand-ins for an open range; both are valid PostgreSQL dates.
  private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
  private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

  private final ExpenseRepository expenseRepository;
  private final HouseholdService householdService;
  private final LedgerProjectionService projection;
  private final Clock clock;

  public ExpenseService(ExpenseRepository expenseRepository,
                        HouseholdService householdService,
                        LedgerProjectionService projection,
                        Clock clock) {
    this.expenseRepository = expenseRepository;
    this.householdService = householdService;
    this.projection = projection;
    this.clock = clock;
  }

  public List<ExpenseResponse> listExpenses(UUID userId, UUID householdId, YearMonth month) {
    householdService.requireMembership(userId, householdId);
    return expenseRepository.findHouseholdExpensesInRange(householdId, month.atDay(1), month.atEndOfMonth())
        .stream()
        .map(ExpenseService::toResponse)
        .toList();
  }

  /**
   * Spending statistics for the household: totals, per category, per payer and per month. Either
   * bound may be null for an open range.
   */
  public ExpenseSummaryResponse summary(UUID userId, UUID householdId, LocalDate from, LocalDate to) {
    HouseholdMember membership = householdService.requireMembership(userId, householdId);
    requireOrderedRange(from, to);
    LocalDate lower = from != null ? from : EARLIEST;
    LocalDate upper = to != null ? to : LATEST;

    List<CategoryTotalResponse> byCategory = expenseRepository.sumByCategory(householdId, lower, upper).stream()
        .map(row -> new CategoryTotalResponse((String) row[0], (BigDecimal) row[1], ((Number) row[2]).longValue()))
        .toList();
    BigDecimal totalAmount = byCategory.stream()
        .map(CategoryTotalResponse::getTotal)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
    long totalExpenses = byCategory.stream().mapToLong(CategoryTotalResponse::getCount).sum();

    Map<UUID, String> names = new HashMap<>();
    householdService.members(householdId).forEach(m -> names.put(m.getUser().getId(), m.getUser().label()));
    List<PayerTotalResponse> byPayer = expenseRepository.sumByPayer(householdId, lower, upper).stream()
        .map(row -> new PayerTotalResponse((UUID) row[0], names.get((UUID) row[0]),
            (BigDecimal) row[1], ((Number) row[2]).longValue()))
        .toList();

    List<MonthlyTotalResponse> monthlyTrend = expenseRepository.sumByMonth(householdId, lower, upper).stream()
        .map(row -> new MonthlyTotalResponse(
            YearMonth.of(((Number) row[0]).intValue(), ((Number) row[1]).intValue()).toString(),
            (BigDecimal) row[2],
            ((Number) row[3]).longValue()))
        .toList();

    return new ExpenseSummaryResponse(from, to, membership.getHousehold().getCurrency(),
        totalAmount, totalExpenses, byCategory, byPayer, monthlyTrend);
  }

  /** Every expense dated within {@code [from, to]}, with their total and the average spent per day. */
  public ExpensePeriodResponse byPeriod(UUID userId, UUID householdId, LocalDate from, LocalDate to) {
    householdService.requireMembership(userId, householdId);
    if (from == null || to == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Start date and end date are required");
    }
    requireOrderedRange(from, to);

    List<ExpenseResponse> expenses = expenseRepository.findHouseholdExpensesInRange(householdId, from, to).stream()
        .map(ExpenseService::toResponse)
        .toList();
    BigDecimal totalAmount = expenses.stream()
        .map(ExpenseResponse::getAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
    long days = ChronoUnit.DAYS.between(from, to) + 1;
    BigDecimal averagePerDay = totalAmount.divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
    return new ExpensePeriodResponse(from, to, expenses, totalAmount, expenses.size(), averagePerDay);
  }

  @Transactional
  public ExpenseResponse createExpense(UUID userId, UUID householdId, ExpenseRequest request) {
    if (request.isRecurring()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "Recurring expenses are created under /api/households/{id}/recurring");
    }
    HouseholdMember membership = householdService.requireMembership(userId, householdId);

    Expense expense = new Expense();
    expense.setHousehold(membership.getHousehold());
    expense.setCreatedBy(membership.getUser());
    apply(expense, request, householdId, membership.getUser());
    Expense saved = expenseRepository.save(expense);

    DebtLedger ledger = projection.loadForUpdate(householdId);
    LedgerChange change;
    try {
      change = ledger.deriveAndAppend(LedgerProjectionService.toSharedExpense(saved), householdService.roster(householdId));
    } catch (SettlementException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    projection.persist(change);
    log.info("Expense {} in household {} split into {} debts", saved.getId(), householdId, change.upserted().size());
    return toResponse(saved);
  }

  @Transactional
  public ExpenseResponse updateExpense(UUID userId, UUID householdId, UUID expenseId, ExpenseRequest request) {
    HouseholdMember membership = householdService.requireMembership(userId, householdId);
    Expense expense = requireExpense(householdId, expenseId);
    apply(expense, request, householdId, membership.getUser());
    Expense saved = expenseRepository.save(expense);

    DebtLedger ledger = projection.loadForUpdate(householdId);
    LedgerChange change;
    try {
      change = ledger.regenerate(saved.getId().toString(), LedgerProjectionService.toSharedExpense(saved),
          householdService.roster(householdId));
    } catch (SettlementException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    if (change.isUnknownReference()) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Expense not found");
    }
    projection.persist(change);
    log.info("Expense {} in household {} regenerated: {} debts written, {} removed",
        saved.getId(), householdId, change.upserted().size(), change.removed().size());
    return toResponse(saved);
  }

  @Transactional
  public void deleteExpense(UUID userId, UUID householdId, UUID expenseId) {
    householdService.requireMembership(userId, householdId);
    Expense expense = requireExpense(householdId, expenseId);

    DebtLedger ledger = projection.loadForUpdate(householdId);
    LedgerChange change = ledger.remove(expenseId.toString());
    if (change.isUnknownReference()) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Expense not found");
    }
    projection.persist(change);
    expenseRepository.delete(expense);
    log.info("Expense {} deleted from household {} with {} debts", expenseId, householdId, change.removed().size());
  }

  private static void requireOrderedRange(LocalDate from, LocalDate to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Start date must not be after end date");
    }
  }

  private Expense requireExpense(UUID householdId, UUID expenseId) {
    Expense expense = expenseRepository.findById(expenseId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Expense not found"));
    if (!expense.getHousehold().getId().equals(householdId)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Expense not found");
    }
    return expense;
  }

  private void apply(Expense expense, ExpenseRequest request, UUID householdId, User currentUser) {
    expense.setAmount(request.getAmount());
    expense.setCategory(request.getCategory().trim());
    expense.setDescription(request.getDescription() == null ? null : request.getDescription().trim());
    expense.setPaidBy(householdService.resolvePayer(householdId, request.getPaidBy(), currentUser));
    LocalDate date = request.getDate() != null ? request.getDate() : expense.getExpenseDate();
    expense.setExpenseDate(date != null ? date : LocalDate.now(clock));
  }

  static ExpenseResponse toResponse(Expense expense) {
    return new ExpenseResponse(
        expense.getId(),
        expense.getHousehold().getId(),
        expense.getAmount(),
        expense.getCategory(),
        expense.getDescription(),
        expense.getPaidBy().getId(),
        expense.getExpenseDate(),
        expense.getRecurringExpense() == null ? null : expense.getRecurringExpense().getId(),
        expense.getInstanceKey(),
        expense.getCreatedAt());
  }
}
