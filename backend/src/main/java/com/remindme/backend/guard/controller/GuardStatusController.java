package com.remindme.backend.guard.controller;

import com.remindme.backend.guard.api.GuardStatusResponse;
import com.remindme.backend.guard.config.BudgetProperties;
import com.remindme.backend.guard.service.CostController;
import com.remindme.backend.guard.service.LedgerSnapshot;
import com.remindme.backend.guard.service.LlmCircuitBreaker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guard")
public class GuardStatusController {

  private final LlmCircuitBreaker circuitBreaker;
  private final CostController costController;
  private final BudgetProperties budgetProperties;

  public GuardStatusController(
      LlmCircuitBreaker circuitBreaker,
      CostController costController,
      BudgetProperties budgetProperties) {
    this.circuitBreaker = circuitBreaker;
    this.costController = costController;
    this.budgetProperties = budgetProperties;
  }

  @GetMapping("/status")
  public GuardStatusResponse status() {
    LedgerSnapshot ledger = costController.currentSnapshot();
    return new GuardStatusResponse(
        circuitBreaker.state(),
        new GuardStatusResponse.Budget(
            ledger.periodKey(),
            ledger.spent(),
            ledger.limit(),
            budgetProperties.getCurrency(),
            ledger.firedThresholds(),
            ledger.exhausted()));
  }
}
