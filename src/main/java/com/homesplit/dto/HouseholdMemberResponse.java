package com.homesplit.dto;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HouseholdMemberResponse {
  private UUID userId;
  private String email;
  private String displayName;
  private String role;
  private Instant joinedAt;
}
