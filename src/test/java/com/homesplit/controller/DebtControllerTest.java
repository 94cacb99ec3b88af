package com.homesplit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.homesplit.config.SecurityConfig;
import com.homesplit.dto.DebtListResponse;
import com.homesplit.dto.DebtSummaryResponse;
import com.homesplit.dto.PaymentRequest;
import com.homesplit.dto.PaymentResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.DebtService;
import com.homesplit.service.JwtService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

@WebMvcTest(DebtController.class)
@Import(SecurityConfig.class)
class DebtControllerTest {
  private static final UUID HOUSEHOLD = UUID.randomUUID();
  private static final UUID USER = UUID.randomUUID();

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private DebtService debtService;

  @MockBean
  private CurrentUserService currentUserService;

  @MockBean
  private JwtService jwtService;

  @BeforeEach
  void setUp() {
    when(currentUserService.requireUserId()).thenReturn(USER);
  }

  @Test
  void unauthenticatedRequest_isRejected() throws Exception {
    mockMvc.perform(get("/api/households/{id}/balance", HOUSEHOLD))
        .andExpect(status().is4xxClientError());

    verifyNoInteractions(debtService);
  }

  @Test
  @WithMockUser
  void listDebts_passesFilters() throws Exception {
    DebtSummaryResponse summary = new DebtSummaryResponse(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    when(debtService.listDebts(USER, HOUSEHOLD, false, LocalDate.of(2025, 1, 1), null))
        .thenReturn(new DebtListResponse(List.of(), summary));

    mockMvc.perform(get("/api/households/{id}/debts", HOUSEHOLD)
            .param("paid", "false")
            .param("from", "2025-01-01"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.debts").isEmpty())
        .andExpect(jsonPath("$.summary.totalOwed").value(0));
  }

  @Test
  @WithMockUser
  void payment_returnsAllocation() throws Exception {
    when(debtService.applyPayment(eq(USER), eq(HOUSEHOLD), any(PaymentRequest.class)))
        .thenReturn(new PaymentResponse(List.of(), List.of(), new BigDecimal("50.00"), new BigDecimal("10.00"), true));

    mockMvc.perform(post("/api/households/{id}/debts/payments", HOUSEHOLD)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\": 60.00}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.applied").value(50.0))
        .andExpect(jsonPath("$.unapplied").value(10.0))
        .andExpect(jsonPath("$.overpaid").value(true));
  }

  @Test
  @WithMockUser
  void payment_withoutAmount_isBadRequest() throws Exception {
    mockMvc.perform(post("/api/households/{id}/debts/payments", HOUSEHOLD)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(debtService);
  }

  @Test
  @WithMockUser
  void payment_beyondMinorUnitRange_isBadRequest() throws Exception {
    mockMvc.perform(post("/api/households/{id}/debts/payments", HOUSEHOLD)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\": 123456789012345678.00}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(debtService);
  }

  @Test
  @WithMockUser
  void payment_withSubCentPrecision_isBadRequest() throws Exception {
    mockMvc.perform(post("/api/households/{id}/debts/payments", HOUSEHOLD)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\": 10.005}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(debtService);
  }

  @Test
  @WithMockUser
  void markPaid_unknownDebt_isNotFound() throws Exception {
    UUID debtId = UUID.randomUUID();
    when(debtService.markPaid(USER, HOUSEHOLD, debtId))
        .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Debt not found"));

    mockMvc.perform(put("/api/households/{id}/debts/{debtId}/paid", HOUSEHOLD, debtId))
        .andExpect(status().isNotFound());
  }

  @Test
  @WithMockUser
  void offset_delegatesToService() throws Exception {
    mockMvc.perform(post("/api/households/{id}/debts/offset", HOUSEHOLD))
        .andExpect(status().isOk());

    verify(debtService).autoOffset(USER, HOUSEHOLD);
  }
}
