package com.remindme.backend.guard.controller;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.remindme.backend.guard.config.BudgetProperties;
import com.remindme.backend.guard.domain.CircuitState;
import com.remindme.backend.guard.service.CostController;
import com.remindme.backend.guard.service.LedgerSnapshot;
import com.remindme.backend.guard.service.LlmCircuitBreaker;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(GuardStatusController.class)
@Import(GuardStatusControllerTest.BudgetTestConfig.class)
class GuardStatusControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private LlmCircuitBreaker circuitBreaker;
  @MockBean private CostController costController;

  @Test
  void reportsCircuitAndBudget() throws Exception {
    given(circuitBreaker.state()).willReturn(CircuitState.HALF_OPEN);
    given(costController.currentSnapshot())
        .willReturn(
            new LedgerSnapshot(
                "2025-03", new BigDecimal("8.50"), new BigDecimal("10.00"), List.of(50, 80), false));

    mockMvc
        .perform(get("/api/guard/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.circuit", equalTo("half_open")))
        .andExpect(jsonPath("$.budget.period", equalTo("2025-03")))
        .andExpect(jsonPath("$.budget.spent", equalTo(8.50)))
        .andExpect(jsonPath("$.budget.currency", equalTo("USD")))
        .andExpect(jsonPath("$.budget.firedThresholds", contains(50, 80)))
        .andExpect(jsonPath("$.budget.exhausted", equalTo(false)));
  }

  @TestConfiguration
  @EnableConfigurationProperties(BudgetProperties.class)
  static class BudgetTestConfig {}
}
