package com.homesplit.service;

import com.homesplit.config.LedgerProperties;
import com.homesplit.dto.MaterializeResponse;
import com.homesplit.repository.RecurringExpenseRepository;
import java.time.YearMonth;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RecurringExpansionScheduler {
  private static final Logger log = LoggerFactory.getLogger(RecurringExpansionScheduler.class);

  private final RecurringExpenseRepository recurringRepository;
  private final RecurringExpenseService recurringExpenseService;
  private final LedgerProperties properties;

  public RecurringExpansionScheduler(RecurringExpenseRepository recurringRepository,
                                     RecurringExpenseService recurringExpenseService,
                                     LedgerProperties properties) {
    this.recurringRepository = recurringRepository;
    this.recurringExpenseService = recurringExpenseService;
    this.properties = properties;
  }

  @Scheduled(cron = "${homesplit.ledger.expansion-cron:0 15 0 * * *}")
  public void run() {
    if (!properties.recurringExpansionEnabled()) {
      return;
    }
    YearMonth month = recurringExpenseService.currentMonth();
    int created = 0;
    for (UUID householdId : recurringRepository.findHouseholdIdsWithTemplates()) {
      try {
        MaterializeResponse result = recurringExpenseService.materializeHousehold(householdId, month);
        created += result.getCreated().size();
      } catch (RuntimeException ex) {
        log.warn("Recurring expansion for household {} in {} failed: {}", householdId, month, ex.getMessage());
      }
    }
    if (created > 0) {
      log.info("Recurring expansion for {} created {} expenses", month, created);
    }
  }
}
