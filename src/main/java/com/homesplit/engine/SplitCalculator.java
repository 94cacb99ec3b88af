package com.homesplit.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Equal split of one expense across a participant roster. The payer is always counted as a
 * participant. Each share is {@code floor(amount / n)}; the {@code amount % n} leftover minor units
 * go one each to the non-payers in ascending id order, so the payer never absorbs a leftover unit.
 * A share that rounds down to zero produces no debt.
 */
public class SplitCalculator {

  public List<Share> split(long amount, String payer, Collection<String> participants) {
    if (amount <= 0) {
      throw new InvalidSplitException("Expense amount must be positive");
    }
    if (payer == null || payer.isBlank()) {
      throw new InvalidSplitException("Expense has no payer");
    }
    if (participants == null) {
      throw new InvalidSplitException("Participant roster is missing");
    }
    TreeSet<String> roster = new TreeSet<>();
    for (String participant : participants) {
      if (participant == null || participant.isBlank()) {
        throw new InvalidSplitException("Participant roster contains a blank id");
      }
      roster.add(participant);
    }
    roster.add(payer);
    int n = roster.size();
    if (n <= 1) {
      return List.of();
    }
    long base = amount / n;
    long leftover = amount % n;
    List<Share> shares = new ArrayList<>(n - 1);
    for (String participant : roster) {
      if (participant.equals(payer)) {
        continue;
      }
      long share = base;
      if (leftover > 0) {
        share++;
        leftover--;
      }
      if (share > 0) {
        shares.add(new Share(participant, share));
      }
    }
    return shares;
  }
}
