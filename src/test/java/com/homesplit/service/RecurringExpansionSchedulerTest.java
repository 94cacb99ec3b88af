package com.homesplit.service;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.homesplit.config.LedgerProperties;
import com.homesplit.dto.MaterializeResponse;
import com.homesplit.repository.RecurringExpenseRepository;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecurringExpansionSchedulerTest {

  @Mock
  private RecurringExpenseRepository recurringRepository;

  @Mock
  private RecurringExpenseService recurringExpenseService;

  @Test
  void run_continuesPastAFailingHousehold() {
    UUID broken = UUID.randomUUID();
    UUID healthy = UUID.randomUUID();
    YearMonth month = YearMonth.of(2025, 3);
    when(recurringExpenseService.currentMonth()).thenReturn(month);
    when(recurringRepository.findHouseholdIdsWithTemplates()).thenReturn(List.of(broken, healthy));
    when(recurringExpenseService.materializeHousehold(broken, month)).thenThrow(new IllegalStateException("boom"));
    when(recurringExpenseService.materializeHousehold(healthy, month))
        .thenReturn(new MaterializeResponse("2025-03", List.of(), 0));

    scheduler(true).run();

    verify(recurringExpenseService).materializeHousehold(healthy, month);
  }

  @Test
  void run_doesNothingWhenDisabled() {
    scheduler(false).run();

    verifyNoInteractions(recurringRepository, recurringExpenseService);
  }

  private RecurringExpansionScheduler scheduler(boolean enabled) {
    return new RecurringExpansionScheduler(recurringRepository, recurringExpenseService,
        new LedgerProperties("UTC", "EUR", enabled));
  }
}
