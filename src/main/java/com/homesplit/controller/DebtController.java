package com.homesplit.controller;

import com.homesplit.dto.BalanceResponse;
import com.homesplit.dto.DebtListResponse;
import com.homesplit.dto.DebtResponse;
import com.homesplit.dto.OffsetResponse;
import com.homesplit.dto.PaymentRequest;
import com.homesplit.dto.PaymentResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.DebtService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/households/{householdId}")
public class DebtController {
  private final DebtService debtService;
  private final CurrentUserService currentUserService;

  public DebtController(DebtService debtService, CurrentUserService currentUserService) {
    this.debtService = debtService;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/debts")
  public DebtListResponse list(@PathVariable UUID householdId,
                               @RequestParam(value = "paid", required = false) Boolean paid,
                               @RequestParam(value = "from", required = false)
                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                               @RequestParam(value = "to", required = false)
                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    UUID userId = currentUserService.requireUserId();
    return debtService.listDebts(userId, householdId, paid, from, to);
  }

  @PutMapping("/debts/{debtId}/paid")
  public DebtResponse markPaid(@PathVariable UUID householdId, @PathVariable UUID debtId) {
    UUID userId = currentUserService.requireUserId();
    return debtService.markPaid(userId, householdId, debtId);
  }

  @PostMapping("/debts/payments")
  public PaymentResponse pay(@PathVariable UUID householdId, @Valid @RequestBody PaymentRequest request) {
    UUID userId = currentUserService.requireUserId();
    return debtService.applyPayment(userId, householdId, request);
  }

  @PostMapping("/debts/offset")
  public OffsetResponse offset(@PathVariable UUID householdId) {
    UUID userId = currentUserService.requireUserId();
    return debtService.autoOffset(userId, householdId);
  }

  @GetMapping("/balance")
  public BalanceResponse balance(@PathVariable UUID householdId,
                                 @RequestParam(value = "userId", required = false) UUID subjectId) {
    UUID userId = currentUserService.requireUserId();
    return debtService.balance(userId, householdId, subjectId);
  }
}
