package com.homesplit.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MaterializeResponse {
  private String month;
  private List<ExpenseResponse> created;
  private int skipped;
}
