package com.homesplit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param zone time zone used to pick the current month and stamp payments
 * @param currency display currency of every household ledger
 * @param recurringExpansionEnabled whether the scheduler materializes recurring expenses
 */
@ConfigurationProperties(prefix = "homesplit.ledger")
public record LedgerProperties(String zone, String currency, boolean recurringExpansionEnabled) {}
