package com.homesplit.engine;

/**
 * Mutual debts cancelled between two users. After the offset only {@code debtor} owes
 * {@code creditor}, and only {@code residual}; a zero residual leaves the pair fully settled.
 */
public record PairOffset(String debtor, String creditor, long offset, long residual) {}
