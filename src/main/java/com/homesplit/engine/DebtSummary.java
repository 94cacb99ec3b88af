package com.homesplit.engine;

/**
 * Lifetime totals for one user, in minor units.
 *
 * @param totalOwed original amount of every debt the user owes, settled or not
 * @param totalOwedToMe original amount of every debt owed to the user, settled or not
 * @param totalUnpaid outstanding amount the user still owes
 * @param totalPaid amount the user has settled so far, including partial payments and offsets
 */
public record DebtSummary(long totalOwed, long totalOwedToMe, long totalUnpaid, long totalPaid) {}
