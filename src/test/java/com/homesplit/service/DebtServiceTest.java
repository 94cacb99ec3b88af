package com.homesplit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.homesplit.config.LedgerProperties;
import com.homesplit.dto.BalanceResponse;
import com.homesplit.dto.DebtListResponse;
import com.homesplit.dto.DebtResponse;
import com.homesplit.dto.OffsetResponse;
import com.homesplit.dto.PaymentRequest;
import com.homesplit.dto.PaymentResponse;
import com.homesplit.engine.BalanceAggregator;
import com.homesplit.engine.Debt;
import com.homesplit.engine.DebtLedger;
import com.homesplit.engine.SettlementEngine;
import com.homesplit.engine.SettlementKind;
import com.homesplit.model.Household;
import com.homesplit.model.HouseholdMember;
import com.homesplit.model.HouseholdRole;
import com.homesplit.model.User;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class DebtServiceTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T09:00:00Z"), ZoneOffset.UTC);
  private static final UUID HOUSEHOLD = UUID.randomUUID();
  private static final UUID ALICE = UUID.randomUUID();
  private static final UUID BOB = UUID.randomUUID();
  private static final UUID CAROL = UUID.randomUUID();

  @Mock
  private HouseholdService householdService;

  @Mock
  private LedgerProjectionService projection;

  @Captor
  private ArgumentCaptor<Collection<Debt>> persisted;

  private DebtService debtService;

  @BeforeEach
  void setUp() {
    debtService = new DebtService(householdService, projection, new BalanceAggregator(),
        new SettlementEngine(CLOCK), new LedgerProperties("UTC", "EUR", true));
  }

  private static Debt debt(UUID from, UUID to, long amount, LocalDate expenseDate) {
    return new Debt(UUID.randomUUID().toString(), HOUSEHOLD.toString(), UUID.randomUUID().toString(),
        from.toString(), to.toString(), amount, amount, "Groceries - Market", expenseDate,
        Instant.parse("2025-01-01T00:00:00Z"), false, null, null);
  }

  private DebtLedger ledgerWith(Debt... debts) {
    DebtLedger ledger = new DebtLedger(CLOCK);
    ledger.reload(List.of(debts), List.of());
    when(projection.load(HOUSEHOLD)).thenReturn(ledger);
    return ledger;
  }

  private DebtLedger lockedLedgerWith(Debt... debts) {
    DebtLedger ledger = new DebtLedger(CLOCK);
    ledger.reload(List.of(debts), List.of());
    when(projection.loadForUpdate(HOUSEHOLD)).thenReturn(ledger);
    return ledger;
  }

  @Test
  void listDebts_filtersByPaidStatusAndDateRange() {
    Debt january = debt(BOB, ALICE, 5000, LocalDate.of(2025, 1, 10));
    Debt february = debt(ALICE, BOB, 2000, LocalDate.of(2025, 2, 10));
    Debt settled = debt(BOB, ALICE, 700, LocalDate.of(2025, 2, 12)).close(CLOCK.instant(), SettlementKind.MARKED_PAID);
    Debt unrelated = debt(CAROL, ALICE, 900, LocalDate.of(2025, 2, 1));
    ledgerWith(january, february, settled, unrelated);

    DebtListResponse all = debtService.listDebts(BOB, HOUSEHOLD, null, null, null);
    DebtListResponse unpaidFebruary = debtService.listDebts(BOB, HOUSEHOLD, false,
        LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28));

    assertThat(all.getDebts()).extracting(DebtResponse::getId)
        .containsExactly(UUID.fromString(january.id()), UUID.fromString(february.id()), UUID.fromString(settled.id()));
    assertThat(all.getSummary().getTotalOwed()).isEqualByComparingTo("57.00");
    assertThat(all.getSummary().getTotalUnpaid()).isEqualByComparingTo("50.00");
    assertThat(all.getSummary().getTotalPaid()).isEqualByComparingTo("7.00");
    assertThat(all.getSummary().getTotalOwedToMe()).isEqualByComparingTo("20.00");
    assertThat(unpaidFebruary.getDebts()).extracting(DebtResponse::getId)
        .containsExactly(UUID.fromString(february.id()));
    verify(householdService, times(2)).requireMembership(BOB, HOUSEHOLD);
    verify(projection, never()).loadForUpdate(HOUSEHOLD);
  }

  @Test
  void listDebts_requiresMembership() {
    when(householdService.requireMembership(CAROL, HOUSEHOLD))
        .thenThrow(new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a household member"));

    assertThatThrownBy(() -> debtService.listDebts(CAROL, HOUSEHOLD, null, null, null))
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
  }

  @Test
  void markPaid_persistsOnlyTheFirstTime() {
    Debt open = debt(BOB, ALICE, 5000, LocalDate.of(2025, 1, 10));
    lockedLedgerWith(open);
    UUID debtId = UUID.fromString(open.id());

    DebtResponse first = debtService.markPaid(BOB, HOUSEHOLD, debtId);
    DebtResponse second = debtService.markPaid(BOB, HOUSEHOLD, debtId);

    assertThat(first.isPaid()).isTrue();
    assertThat(first.getSettledBy()).isEqualTo("MARKED_PAID");
    assertThat(first.getPaidAmount()).isEqualByComparingTo("50.00");
    assertThat(second.isPaid()).isTrue();
    verify(projection, times(1)).persist(anyCollection());
  }

  @Test
  void markPaid_unknownDebtIsNotFound() {
    lockedLedgerWith(debt(BOB, ALICE, 5000, LocalDate.of(2025, 1, 10)));

    assertThatThrownBy(() -> debtService.markPaid(BOB, HOUSEHOLD, UUID.randomUUID()))
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    verify(projection, never()).persist(anyCollection());
  }

  @Test
  void markPaid_conflictingUpdateIsRejectedWithoutWriting() {
    when(projection.loadForUpdate(HOUSEHOLD))
        .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "Household is being updated, retry the request"));

    assertThatThrownBy(() -> debtService.markPaid(BOB, HOUSEHOLD, UUID.randomUUID()))
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
    verify(projection, never()).load(HOUSEHOLD);
    verify(projection, never()).persist(anyCollection());
  }

  @Test
  void applyPayment_closesOldestAndReportsOverpayment() {
    Debt older = debt(BOB, ALICE, 3000, LocalDate.of(2025, 1, 5));
    Debt newer = debt(BOB, ALICE, 2000, LocalDate.of(2025, 2, 5));
    lockedLedgerWith(newer, older);
    PaymentRequest request = new PaymentRequest();
    request.setAmount(new BigDecimal("60.00"));

    PaymentResponse response = debtService.applyPayment(BOB, HOUSEHOLD, request);

    assertThat(response.getClosed()).extracting(DebtResponse::getId)
        .containsExactly(UUID.fromString(older.id()), UUID.fromString(newer.id()));
    assertThat(response.getApplied()).isEqualByComparingTo("50.00");
    assertThat(response.getUnapplied()).isEqualByComparingTo("10.00");
    assertThat(response.isOverpaid()).isTrue();
    verify(projection).persist(persisted.capture());
    assertThat(persisted.getValue()).hasSize(2).allSatisfy(debt -> assertThat(debt.paid()).isTrue());
  }

  @Test
  void applyPayment_limitedToCounterparty() {
    Debt toAlice = debt(BOB, ALICE, 3000, LocalDate.of(2025, 2, 5));
    Debt toCarol = debt(BOB, CAROL, 3000, LocalDate.of(2025, 1, 5));
    lockedLedgerWith(toAlice, toCarol);
    PaymentRequest request = new PaymentRequest();
    request.setAmount(new BigDecimal("10.00"));
    request.setToUserId(ALICE);

    PaymentResponse response = debtService.applyPayment(BOB, HOUSEHOLD, request);

    assertThat(response.getClosed()).isEmpty();
    assertThat(response.getReduced()).singleElement().satisfies(reduced -> {
      assertThat(reduced.getId()).isEqualTo(UUID.fromString(toAlice.id()));
      assertThat(reduced.getAmount()).isEqualByComparingTo("20.00");
      assertThat(reduced.getPaidAmount()).isEqualByComparingTo("10.00");
    });
    assertThat(response.isOverpaid()).isFalse();
  }

  @Test
  void applyPayment_rejectsNonPositiveAmounts() {
    lockedLedgerWith(debt(BOB, ALICE, 3000, LocalDate.of(2025, 1, 5)));
    PaymentRequest request = new PaymentRequest();
    request.setAmount(BigDecimal.ZERO);

    assertThatThrownBy(() -> debtService.applyPayment(BOB, HOUSEHOLD, request))
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    verify(projection, never()).persist(anyCollection());
  }

  @Test
  void autoOffset_cancelsMutualDebts() {
    Debt bobOwes = debt(BOB, ALICE, 10000, LocalDate.of(2025, 1, 5));
    Debt aliceOwes = debt(ALICE, BOB, 4000, LocalDate.of(2025, 2, 5));
    lockedLedgerWith(bobOwes, aliceOwes);

    OffsetResponse response = debtService.autoOffset(ALICE, HOUSEHOLD);

    assertThat(response.getPairsOffset()).singleElement().satisfies(pair -> {
      assertThat(pair.getDebtorId()).isEqualTo(BOB);
      assertThat(pair.getCreditorId()).isEqualTo(ALICE);
      assertThat(pair.getOffset()).isEqualByComparingTo("40.00");
      assertThat(pair.getResidual()).isEqualByComparingTo("60.00");
    });
    assertThat(response.getResidualDebts()).singleElement()
        .satisfies(residual -> assertThat(residual.getAmount()).isEqualByComparingTo("60.00"));
    assertThat(response.getClosedDebts()).isEqualTo(1);
    assertThat(response.getReducedDebts()).isEqualTo(1);
  }

  @Test
  void balance_includesCounterpartiesWithNames() {
    Household household = new Household();
    household.setId(HOUSEHOLD);
    household.setCurrency("CHF");
    when(householdService.members(HOUSEHOLD)).thenReturn(List.of(
        member(household, ALICE, "Alice"), member(household, BOB, "Bob"), member(household, CAROL, null)));
    ledgerWith(
        debt(BOB, ALICE, 10000, LocalDate.of(2025, 1, 5)),
        debt(ALICE, CAROL, 2500, LocalDate.of(2025, 1, 6)));

    BalanceResponse response = debtService.balance(BOB, HOUSEHOLD, ALICE);

    assertThat(response.getUserId()).isEqualTo(ALICE);
    assertThat(response.getCurrency()).isEqualTo("CHF");
    assertThat(response.getOwedToMe()).isEqualByComparingTo("100.00");
    assertThat(response.getOwedByMe()).isEqualByComparingTo("25.00");
    assertThat(response.getNet()).isEqualByComparingTo("75.00");
    assertThat(response.getCounterparties()).hasSize(2)
        .anySatisfy(c -> {
          assertThat(c.getUserId()).isEqualTo(BOB);
          assertThat(c.getDisplayName()).isEqualTo("Bob");
        })
        .anySatisfy(c -> {
          assertThat(c.getUserId()).isEqualTo(CAROL);
          assertThat(c.getDisplayName()).isEqualTo(CAROL + "@example.com");
          assertThat(c.getNet()).isEqualByComparingTo("-25.00");
        });
  }

  @Test
  void balance_forNonMemberIsNotFound() {
    Household household = new Household();
    household.setId(HOUSEHOLD);
    when(householdService.members(HOUSEHOLD)).thenReturn(List.of(member(household, ALICE, "Alice")));

    assertThatThrownBy(() -> debtService.balance(ALICE, HOUSEHOLD, UUID.randomUUID()))
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
  }

  private static HouseholdMember member(Household household, UUID userId, String displayName) {
    User user = new User();
    user.setId(userId);
    user.setEmail(userId + "@example.com");
    user.setDisplayName(displayName);
    HouseholdMember member = new HouseholdMember();
    member.setHousehold(household);
    member.setUser(user);
    member.setRole(HouseholdRole.MEMBER);
    return member;
  }
}
