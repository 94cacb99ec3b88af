package com.homesplit.controller;

import com.homesplit.dto.ExpensePeriodResponse;
import com.homesplit.dto.ExpenseRequest;
import com.homesplit.dto.ExpenseResponse;
import com.homesplit.dto.ExpenseSummaryResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.ExpenseService;
import com.homesplit.service.RecurringExpenseService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/households/{householdId}/expenses")
public class ExpenseController {
  private final ExpenseService expenseService;
  private final RecurringExpenseService recurringExpenseService;
  private final CurrentUserService currentUserService;

  public ExpenseController(ExpenseService expenseService,
                           RecurringExpenseService recurringExpenseService,
                           CurrentUserService currentUserService) {
    this.expenseService = expenseService;
    this.recurringExpenseService = recurringExpenseService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<ExpenseResponse> list(@PathVariable UUID householdId,
                                    @RequestParam(value = "month", required = false) String month) {
    UUID userId = currentUserService.requireUserId();
    YearMonth parsed = month == null ? recurringExpenseService.currentMonth() : YearMonth.parse(month);
    return expenseService.listExpenses(userId, householdId, parsed);
  }

  @GetMapping("/summary")
  public ExpenseSummaryResponse summary(
      @PathVariable UUID householdId,
      @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    UUID userId = currentUserService.requireUserId();
    return expenseService.summary(userId, householdId, from, to);
  }

  @GetMapping("/summary/by-period")
  public ExpensePeriodResponse byPeriod(
      @PathVariable UUID householdId,
      @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    UUID userId = currentUserService.requireUserId();
    return expenseService.byPeriod(userId, householdId, from, to);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ExpenseResponse create(@PathVariable UUID householdId, @Valid @RequestBody ExpenseRequest request) {
    UUID userId = currentUserService.requireUserId();
    return expenseService.createExpense(userId, householdId, request);
  }

  @PutMapping("/{expenseId}")
  public ExpenseResponse update(@PathVariable UUID householdId,
                                @PathVariable UUID expenseId,
                                @Valid @RequestBody ExpenseRequest request) {
    UUID userId = currentUserService.requireUserId();
    return expenseService.updateExpense(userId, householdId, expenseId, request);
  }

  @DeleteMapping("/{expenseId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID householdId, @PathVariable UUID expenseId) {
    UUID userId = currentUserService.requireUserId();
    expenseService.deleteExpense(userId, householdId, expenseId);
  }
}
