package com.remindme.backend.guard.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class BudgetAlertListener {

  private final GuardMetrics metrics;

  public BudgetAlertListener(GuardMetrics metrics) {
    this.metrics = metrics;
  }

  @EventListener
  public void onThresholdReached(BudgetThresholdReachedEvent event) {
    metrics.recordBudgetAlert(event.threshold());
    log.warn(
        "Model budget threshold {}% reached for {}: spent {} of {}",
        event.threshold(),
        event.periodKey(),
        event.spent(),
        event.limit());
  }
}
