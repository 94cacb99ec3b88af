package com.homesplit.controller;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.homesplit.config.SecurityConfig;
import com.homesplit.dto.CategoryTotalResponse;
import com.homesplit.dto.ExpensePeriodResponse;
import com.homesplit.dto.ExpenseSummaryResponse;
import com.homesplit.dto.MonthlyTotalResponse;
import com.homesplit.service.CurrentUserService;
import com.homesplit.service.ExpenseService;
import com.homesplit.service.JwtService;
import com.homesplit.service.RecurringExpenseService;
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
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ExpenseController.class)
@Import(SecurityConfig.class)
class ExpenseControllerTest {
  private static final UUID HOUSEHOLD = UUID.randomUUID();
  private static final UUID USER = UUID.randomUUID();

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private ExpenseService expenseService;

  @MockBean
  private RecurringExpenseService recurringExpenseService;

  @MockBean
  private CurrentUserService currentUserService;

  @MockBean
  private JwtService jwtService;

  @BeforeEach
  void setUp() {
    when(currentUserService.requireUserId()).thenReturn(USER);
  }

  @Test
  @WithMockUser
  void summary_returnsStatistics() throws Exception {
    LocalDate from = LocalDate.of(2025, 1, 1);
    when(expenseService.summary(USER, HOUSEHOLD, from, null)).thenReturn(new ExpenseSummaryResponse(
        from, null, "EUR", new BigDecimal("120.50"), 3,
        List.of(new CategoryTotalResponse("Groceries", new BigDecimal("120.50"), 3)),
        List.of(),
        List.of(new MonthlyTotalResponse("2025-01", new BigDecimal("120.50"), 3))));

    mockMvc.perform(get("/api/households/{id}/expenses/summary", HOUSEHOLD)
            .param("from", "2025-01-01"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalAmount").value(120.5))
        .andExpect(jsonPath("$.totalExpenses").value(3))
        .andExpect(jsonPath("$.byCategory[0].category").value("Groceries"))
        .andExpect(jsonPath("$.monthlyTrend[0].month").value("2025-01"));
  }

  @Test
  @WithMockUser
  void byPeriod_returnsExpensesWithAverage() throws Exception {
    LocalDate from = LocalDate.of(2025, 3, 1);
    LocalDate to = LocalDate.of(2025, 3, 10);
    when(expenseService.byPeriod(USER, HOUSEHOLD, from, to)).thenReturn(new ExpensePeriodResponse(
        from, to, List.of(), new BigDecimal("45.55"), 2, new BigDecimal("4.56")));

    mockMvc.perform(get("/api/households/{id}/expenses/summary/by-period", HOUSEHOLD)
            .param("from", "2025-03-01")
            .param("to", "2025-03-10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalExpenses").value(2))
        .andExpect(jsonPath("$.averagePerDay").value(4.56));
  }

  @Test
  @WithMockUser
  void create_amountBeyondMinorUnitRange_isBadRequest() throws Exception {
    mockMvc.perform(post("/api/households/{id}/expenses", HOUSEHOLD)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\": 123456789012345678.00, \"category\": \"Groceries\"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(expenseService);
  }
}
