package com.homesplit.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DebtListResponse {
  private List<DebtResponse> debts;
  private DebtSummaryResponse summary;
}
