package com.homesplit.dto;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategoryTotalResponse {
  private String category;
  private BigDecimal total;
  private long count;
}
