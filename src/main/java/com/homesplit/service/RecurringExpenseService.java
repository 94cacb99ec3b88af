package com.homesplit.service;

import com.homesplit.dto.ExpenseRequest;
import com.homesplit.dto.ExpenseResponse;
import com.homesplit.dto.MaterializeResponse;
import com.homesplit.dto.RecurringExpenseResponse;
import com.homesplit.engine.DebtLedger;
import com.homesplit.engine.ExpenseInstance;
import com.homesplit.engine.Frequency;
import com.homesplit.engine.LedgerChange;
import com.homesplit.engine.MinorUnits;
import com.homesplit.engine.RecurrenceExpander;
import com.homesplit.engine.RecurringTemplate;
import com.homesplit.engine.SettlementException;
import com.homesplit.model.Expense;
import com.homesplit.model.HouseholdMember;
import com.homesplit.model.RecurringExpense;
import com.homesplit.repository.ExpenseRepository;
import com.homesplit.repository.RecurringExpenseRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Recurring expense templates and their monthly materialization. An occurrence is stored as a
 * regular expense keyed by its instance id, so materializing a month twice creates nothing new.
 */
@Service
public class RecurringExpenseService {
  private static final Logger log = LoggerFactory.getLogger(RecurringExpenseService.class);

  private final RecurringExpenseRepository recurringRepository;
  private final ExpenseRepository expenseRepository;
  private final HouseholdService householdService;
  private final LedgerProjectionService projection;
  private final RecurrenceExpander expander;
  private final Clock clock;

  public RecurringExpenseService(RecurringExpenseRepository recurringRepository,
                                 ExpenseRepository expenseRepository,
                                 HouseholdService householdService,
                                 LedgerProjectionService projection,
                                 RecurrenceExpander expander,
                                 Clock clock) {
    this.recurringRepository = recurringRepository;
    this.expenseRepository = expenseRepository;
    this.householdService = householdService;
    this.projection = projection;
    this.expander = expander;
    this.clock = clock;
  }

  public List<RecurringExpenseResponse> listTemplates(UUID userId, UUID householdId) {
    householdService.requireMembership(userId, householdId);
    return recurringRepository.findByHouseholdId(householdId).stream()
        .map(RecurringExpenseService::toResponse)
        .toList();
  }

  public RecurringExpenseResponse createTemplate(UUID userId, UUID householdId, ExpenseRequest request) {
    HouseholdMember membership = householdService.requireMembership(userId, householdId);
    Frequency frequency;
    try {
      frequency = Frequency.parse(request.getFrequency() == null ? Frequency.MONTHLY.name() : request.getFrequency());
    } catch (SettlementException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    LocalDate startDate = request.getStartDate() != null ? request.getStartDate()
        : request.getDate() != null ? request.getDate() : LocalDate.now(clock);
    if (request.getEndDate() != null && request.getEndDate().isBefore(startDate)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate must not precede startDate");
    }

    RecurringExpense template = new RecurringExpense();
    template.setHousehold(membership.getHousehold());
    template.setPaidBy(householdService.resolvePayer(householdId, request.getPaidBy(), membership.getUser()));
    template.setAmount(request.getAmount());
    template.setCategory(request.getCategory().trim());
    template.setDescription(request.getDescription() == null ? null : request.getDescription().trim());
    template.setFrequency(frequency);
    template.setStartDate(startDate);
    template.setEndDate(request.getEndDate());
    RecurringExpense saved = recurringRepository.save(template);
    log.info("Recurring expense {} ({}) added to household {}", saved.getId(), frequency, householdId);
    return toResponse(saved);
  }

  /** Removes the template; occurrences already materialized stay as ordinary expenses. */
  @Transactional
  public void deleteTemplate(UUID userId, UUID householdId, UUID templateId) {
    householdService.requireMembership(userId, householdId);
    RecurringExpense template = recurringRepository.findById(templateId)
        .filter(found -> found.getHousehold().getId().equals(householdId))
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Recurring expense not found"));
    int detached = expenseRepository.detachFromRecurringExpense(templateId);
    recurringRepository.delete(template);
    log.info("Recurring expense {} removed from household {}, {} occurrences kept", templateId, householdId, detached);
  }

  public YearMonth currentMonth() {
    return YearMonth.now(clock);
  }

  @Transactional
  public MaterializeResponse materialize(UUID userId, UUID householdId, YearMonth month) {
    householdService.requireMembership(userId, householdId);
    return materializeHousehold(householdId, month == null ? currentMonth() : month);
  }

  @Transactional
  public MaterializeResponse materializeHousehold(UUID householdId, YearMonth month) {
    List<RecurringExpense> templates = recurringRepository.findByHouseholdId(householdId);
    Map<String, RecurringExpense> byId = templates.stream()
        .collect(Collectors.toMap(t -> t.getId().toString(), Function.identity()));
    List<ExpenseInstance> instances = expander.expand(
        templates.stream().map(RecurringExpenseService::toTemplate).toList(), month);
    if (instances.isEmpty()) {
      return new MaterializeResponse(month.toString(), List.of(), 0);
    }

    DebtLedger ledger = projection.loadForUpdate(householdId);
    Set<String> existing = new HashSet<>(expenseRepository.findExistingInstanceKeys(
        instances.stream().map(ExpenseInstance::id).toList()));
    List<String> roster = householdService.roster(householdId);
    List<ExpenseResponse> created = new ArrayList<>();
    for (ExpenseInstance instance : instances) {
      if (existing.contains(instance.id())) {
        continue;
      }
      RecurringExpense template = byId.get(instance.templateId());
      Expense expense = new Expense();
      expense.setHousehold(template.getHousehold());
      expense.setPaidBy(template.getPaidBy());
      expense.setAmount(MinorUnits.toDecimal(instance.amount()));
      expense.setCategory(instance.category());
      expense.setDescription(instance.description());
      expense.setExpenseDate(instance.date());
      expense.setRecurringExpense(template);
      expense.setInstanceKey(instance.id());
      Expense saved = expenseRepository.save(expense);
      LedgerChange change;
      try {
        change = ledger.deriveAndAppend(LedgerProjectionService.toSharedExpense(saved), roster);
      } catch (SettlementException ex) {
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
      }
      projection.persist(change);
      created.add(ExpenseService.toResponse(saved));
    }

    String monthKey = month.toString();
    for (RecurringExpense template : templates) {
      String last = template.getLastMaterializedMonth();
      if (last == null || last.compareTo(monthKey) < 0) {
        template.setLastMaterializedMonth(monthKey);
      }
    }
    recurringRepository.saveAll(templates);
    log.info("Materialized {} recurring occurrences for household {} in {} ({} already present)",
        created.size(), householdId, monthKey, existing.size());
    return new MaterializeResponse(monthKey, created, existing.size());
  }

  static RecurringTemplate toTemplate(RecurringExpense template) {
    return new RecurringTemplate(
        template.getId().toString(),
        template.getHousehold().getId().toString(),
        MinorUnits.fromDecimal(template.getAmount()),
        template.getCategory(),
        template.getDescription(),
        template.getPaidBy().getId().toString(),
        template.getFrequency(),
        template.getStartDate(),
        template.getEndDate());
  }


  private static RecurringExpenseResponse toResponse(RecurringExpense template) {
    return new RecurringExpenseResponse(
        template.getId(),
        template.getHousehold().getId(),
        template.getAmount(),
        template.getCategory(),
        template.getDescription(),
        template.getPaidBy().getId(),
        template.getFrequency().name(),
        template.getStartDate(),
        template.getEndDate(),
        template.getLastMaterializedMonth());
  }
}
