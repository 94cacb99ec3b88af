package com.homesplit.service;

import com.homesplit.config.LedgerProperties;
import com.homesplit.dto.BalanceResponse;
import com.homesplit.dto.CounterpartyBalanceResponse;
import com.homesplit.dto.DebtListResponse;
import com.homesplit.dto.DebtResponse;
import com.homesplit.dto.DebtSummaryResponse;
import com.homesplit.dto.OffsetResponse;
import com.homesplit.dto.PairOffsetResponse;
import com.homesplit.dto.PaymentRequest;
import com.homesplit.dto.PaymentResponse;
import com.homesplit.engine.BalanceAggregator;
import com.homesplit.engine.Balances;
import com.homesplit.engine.Debt;
import com.homesplit.engine.DebtLedger;
import com.homesplit.engine.DebtSummary;
import com.homesplit.engine.MarkPaidOutcome;
import com.homesplit.engine.MinorUnits;
import com.homesplit.engine.OffsetResult;
import com.homesplit.engine.PaymentResult;
import com.homesplit.engine.SettlementEngine;
import com.homesplit.engine.SettlementException;
import com.homesplit.engine.SettlementScope;
import com.homesplit.model.HouseholdMember;
import java.time.LocalDate;
import java.util.ArrayList;
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

@Service
public class DebtService {
  private static final Logger log = LoggerFactory.getLogger(DebtService.class);

  private final HouseholdService householdService;
  private final LedgerProjectionService projection;
  private final BalanceAggregator balanceAggregator;
  private final SettlementEngine settlementEngine;
  private final LedgerProperties ledgerProperties;

  public DebtService(HouseholdService householdService,
                     LedgerProjectionService projection,
                     BalanceAggregator balanceAggregator,
                     SettlementEngine settlementEngine,
                     LedgerProperties ledgerProperties) {
    this.householdService = householdService;
    this.projection = projection;
    this.balanceAggregator = balanceAggregator;
    this.settlementEngine = settlementEngine;
    this.ledgerProperties = ledgerProperties;
  }

  /**
   * The caller's debts in either direction, optionally narrowed by paid status and by the date of
   * the originating expense. The summary covers the same filtered debts.
   */
  public DebtListResponse listDebts(UUID userId, UUID householdId, Boolean paid, LocalDate from, LocalDate to) {
    householdService.requireMembership(userId, householdId);
    DebtLedger ledger = projection.load(householdId);
    List<Debt> debts = ledger.listForUser(userId.toString()).stream()
        .filter(debt -> paid == null || debt.paid() == paid)
        .filter(debt -> from == null || debt.expenseDate() == null || !debt.expenseDate().isBefore(from))
        .filter(debt -> to == null || debt.expenseDate() == null || !debt.expenseDate().isAfter(to))
        .sorted(Debt.OLDEST_FIRST)
        .toList();
    DebtSummary summary = balanceAggregator.summarize(debts, userId.toString());
    return new DebtListResponse(
        debts.stream().map(LedgerProjectionService::toResponse).toList(),
        new DebtSummaryResponse(
            MinorUnits.toDecimal(summary.totalOwed()),
            MinorUnits.toDecimal(summary.totalOwedToMe()),
            MinorUnits.toDecimal(summary.totalUnpaid()),
            MinorUnits.toDecimal(summary.totalPaid())));
  }

  @Transactional
  public DebtResponse markPaid(UUID userId, UUID householdId, UUID debtId) {
    householdService.requireMembership(userId, householdId);
    DebtLedger ledger = projection.loadForUpdate(householdId);
    MarkPaidOutcome outcome = ledger.markPaid(debtId.toString());
    if (outcome.status() == MarkPaidOutcome.Status.UNKNOWN_DEBT) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Debt not found");
    }
    if (outcome.changed()) {
      projection.persist(List.of(outcome.debt()));
      log.info("Debt {} in household {} marked paid by {}", debtId, householdId, userId);
    }
    return LedgerProjectionService.toResponse(outcome.debt());
  }

  public BalanceResponse balance(UUID userId, UUID householdId, UUID subjectId) {
    householdService.requireMembership(userId, householdId);
    UUID subject = subjectId == null ? userId : subjectId;
    List<HouseholdMember> members = householdService.members(householdId);
    Map<String, String> names = new HashMap<>();
    members.forEach(m -> names.put(m.getUser().getId().toString(), m.getUser().label()));
    if (!names.containsKey(subject.toString())) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Member not found");
    }

    List<Debt> snapshot = projection.load(householdId).snapshot();
    Balances balances = balanceAggregator.balances(snapshot, subject.toString());
    List<CounterpartyBalanceResponse> counterparties = new ArrayList<>();
    balanceAggregator.byCounterparty(snapshot, subject.toString()).forEach(c -> counterparties.add(
        new CounterpartyBalanceResponse(
            UUID.fromString(c.counterparty()),
            names.get(c.counterparty()),
            MinorUnits.toDecimal(c.owedToMe()),
            MinorUnits.toDecimal(c.owedByMe()),
            MinorUnits.toDecimal(c.net()))));
    String currency = members.isEmpty() ? ledgerProperties.currency() : members.get(0).getHousehold().getCurrency();
    return new BalanceResponse(
        subject,
        currency,
        MinorUnits.toDecimal(balances.owedToMe()),
        MinorUnits.toDecimal(balances.owedByMe()),
        MinorUnits.toDecimal(balances.net()),
        counterparties);
  }

  /** Pays down the caller's debts in this household, oldest first. */
  @Transactional
  public PaymentResponse applyPayment(UUID userId, UUID householdId, PaymentRequest request) {
    householdService.requireMembership(userId, householdId);
    SettlementScope scope = SettlementScope.group(householdId.toString());
    if (request.getToUserId() != null) {
      scope = scope.withCounterparty(request.getToUserId().toString());
    }
    DebtLedger ledger = projection.loadForUpdate(householdId);
    PaymentResult result;
    try {
      result = settlementEngine.applyPayment(ledger, userId.toString(), MinorUnits.fromDecimal(request.getAmount()), scope);
    } catch (SettlementException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    List<Debt> changed = new ArrayList<>(result.closed());
    changed.addAll(result.reduced());
    projection.persist(changed);
    log.info("Payment of {} by {} in household {}: {} closed, {} reduced, {} applied",
        request.getAmount(), userId, householdId, result.closed().size(), result.reduced().size(),
        MinorUnits.toDecimal(result.applied()));
    if (result.overpaid()) {
      log.info("Payment by {} in household {} exceeded outstanding debts by {}",
          userId, householdId, MinorUnits.toDecimal(result.unapplied()));
    }
    return new PaymentResponse(
        result.closed().stream().map(LedgerProjectionService::toResponse).toList(),
        result.reduced().stream().map(LedgerProjectionService::toResponse).toList(),
        MinorUnits.toDecimal(result.applied()),
        MinorUnits.toDecimal(result.unapplied()),
        result.overpaid());
  }

  @Transactional
  public OffsetResponse autoOffset(UUID userId, UUID householdId) {
    householdService.requireMembership(userId, householdId);
    DebtLedger ledger = projection.loadForUpdate(householdId);
    OffsetResult result = settlementEngine.autoOffset(ledger, SettlementScope.group(householdId.toString()));
    List<Debt> changed = new ArrayList<>(result.closed());
    changed.addAll(result.reduced());
    projection.persist(changed);
    if (result.changed()) {
      log.info("Auto-offset in household {} settled {} pairs: {} debts closed, {} reduced",
          householdId, result.pairsOffset().size(), result.closed().size(), result.reduced().size());
    }
    return new OffsetResponse(
        result.pairsOffset().stream()
            .map(pair -> new PairOffsetResponse(
                UUID.fromString(pair.debtor()),
                UUID.fromString(pair.creditor()),
                MinorUnits.toDecimal(pair.offset()),
                MinorUnits.toDecimal(pair.residual())))
            .toList(),
        result.residualDebts().stream().map(LedgerProjectionService::toResponse).toList(),
        result.closed().size(),
        result.reduced().size());
  }
}
