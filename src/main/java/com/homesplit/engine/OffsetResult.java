package com.homesplit.engine;

import java.util.List;

public record OffsetResult(List<PairOffset> pairsOffset, List<Debt> residualDebts, List<Debt> closed, List<Debt> reduced) {

  public OffsetResult {
    pairsOffset = List.copyOf(pairsOffset);
    residualDebts = List.copyOf(residualDebts);
    closed = List.copyOf(closed);
    reduced = List.copyOf(reduced);
  }

  public boolean changed() {
    return !closed.isEmpty() || !reduced.isEmpty();
  }
}
