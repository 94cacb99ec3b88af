package com.homesplit.controller;

import com.homesplit.dto.ExpenseRequest;
import com.homesplit.dto.MaterializeResponse;
import com.homesplit.dto.RecurringExpenseResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.RecurringExpenseService;
import jakarta.validation.Valid;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/households/{householdId}/recurring")
public class RecurringExpenseController {
  private final RecurringExpenseService recurringExpenseService;
  private final CurrentUserService currentUserService;

  public RecurringExpenseController(RecurringExpenseService recurringExpenseService,
                                    CurrentUserService currentUserService) {
    this.recurringExpenseService = recurringExpenseService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<RecurringExpenseResponse> list(@PathVariable UUID householdId) {
    UUID userId = currentUserService.requireUserId();
    return recurringExpenseService.listTemplates(userId, householdId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public RecurringExpenseResponse create(@PathVariable UUID householdId, @Valid @RequestBody ExpenseRequest request) {
    UUID userId = currentUserService.requireUserId();
    return recurringExpenseService.createTemplate(userId, householdId, request);
  }

  @DeleteMapping("/{templateId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID householdId, @PathVariable UUID templateId) {
    UUID userId = currentUserService.requireUserId();
    recurringExpenseService.deleteTemplate(userId, householdId, templateId);
  }

  @PostMapping("/materialize")
  public MaterializeResponse materialize(@PathVariable UUID householdId,
                                         @RequestParam(value = "month", required = false) String month) {
    UUID userId = currentUserService.requireUserId();
    return recurringExpenseService.materialize(userId, householdId, month == null ? null : YearMonth.parse(month));
  }
}
