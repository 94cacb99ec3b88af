package com.homesplit.engine;

/** One participant's portion of an expense, owed to the payer. */
public record Share(String debtor, long amount) {}
