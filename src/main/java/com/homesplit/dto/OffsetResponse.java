package com.homesplit.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OffsetResponse {
  private List<PairOffsetResponse> pairsOffset;
  private List<DebtResponse> residualDebts;
  private int closedDebts;
  private int reducedDebts;
}
