package com.remindme.backend.guard.service;

import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class GuardMetrics {

  private final MeterRegistry meterRegistry;
  private final AtomicReference<BigDecimal> spent = new AtomicReference<>(BigDecimal.ZERO);

  public GuardMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("llm.cost.spent", spent, value -> value.get().doubleValue());
  }

  public void recordInvocation(String result, long durationNanos) {
    meterRegistry.counter("llm.invocation.count", "result", result).increment();
    meterRegistry
        .timer("llm.invocation.duration", "result", result)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  public void recordRetryableFailure() {
    meterRegistry.counter("llm.invocation.retry.count").increment();
  }

  public void recordDedup(String result) {
    meterRegistry.counter("webhook.dedup.count", "result", result).increment();
  }

  public void recordRateLimited() {
    meterRegistry.counter("chat.rate_limit.rejected").increment();
  }

  public void recordBudgetAlert(int threshold) {
    meterRegistry.counter("llm.budget.alert", "threshold", String.valueOf(threshold)).increment();
  }

  public void updateSpent(BigDecimal total) {
    spent.set(total);
  }
}
