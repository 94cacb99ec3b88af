package com.homesplit.controller;

import com.homesplit.dto.HouseholdJoinRequest;
import com.homesplit.dto.HouseholdMemberResponse;
import com.homesplit.dto.HouseholdRequest;
import com.homesplit.dto.HouseholdResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.HouseholdService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/households")
public class HouseholdController {
  private final HouseholdService householdService;
  private final CurrentUserService currentUserService;

  public HouseholdController(HouseholdService householdService, CurrentUserService currentUserService) {
    this.householdService = householdService;
    this.currentUserService = currentUserService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public HouseholdResponse create(@Valid @RequestBody HouseholdRequest request) {
    UUID userId = currentUserService.requireUserId();
    return householdService.createHousehold(userId, request);
  }

  @PostMapping("/join")
  public HouseholdResponse join(@Valid @RequestBody HouseholdJoinRequest request) {
    UUID userId = currentUserService.requireUserId();
    return householdService.joinHousehold(userId, request);
  }

  @GetMapping
  public List<HouseholdResponse> list() {
    UUID userId = currentUserService.requireUserId();
    return householdService.listHouseholds(userId);
  }

  @GetMapping("/{householdId}/members")
  public List<HouseholdMemberResponse> members(@PathVariable UUID householdId) {
    UUID userId = currentUserService.requireUserId();
    return householdService.listMembers(userId, householdId);
  }
}
