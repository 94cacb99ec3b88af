package com.homesplit.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class HouseholdRequest {
  @NotBlank
  private String name;

  @Pattern(regexp = "[A-Z]{3}")
  private String currency;
}
