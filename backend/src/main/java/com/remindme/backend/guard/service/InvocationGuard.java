package com.remindme.backend.guard.service;

import com.remindme.backend.guard.config.BudgetProperties;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.TransientUpstreamException;
import java.math.BigDecimal;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Wraps every model call: per-chat rate limit, budget check, circuit breaker, then bounded retry
 * of retryable transient failures. Quota errors are not retried but count toward the circuit.
 * The spend of a successful call is recorded against the monthly budget.
 */
@Service
public class InvocationGuard {

  private static final Logger log = LoggerFactory.getLogger(InvocationGuard.class);

  private final ChatRateLimiter rateLimiter;
  private final CostController costController;
  private final LlmCircuitBreaker circuitBreaker;
  private final RetryTemplate retryTemplate;
  private final BudgetProperties budgetProperties;
  private final GuardMetrics metrics;

  public InvocationGuard(
      ChatRateLimiter rateLimiter,
      CostController costController,
      LlmCircuitBreaker circuitBreaker,
      @Qualifier("llmRetryTemplate") RetryTemplate retryTemplate,
      BudgetProperties budgetProperties,
      GuardMetrics metrics) {
    this.rateLimiter = rateLimiter;
    this.costController = costController;
    this.circuitBreaker = circuitBreaker;
    this.retryTemplate = retryTemplate;
    this.budgetProperties = budgetProperties;
    this.metrics = metrics;
  }

  public <T> T execute(long chatId, Supplier<T> call, Function<T, BigDecimal> costOf) {
    rateLimiter.acquire(chatId);
    costController.checkBudget(budgetProperties.getEstimatedCallCost());
    circuitBreaker.acquire();

    long start = System.nanoTime();
    T result;
    try {
      result = retryTemplate.execute(context -> attempt(call));
    } catch (TransientUpstreamException ex) {
      long elapsed = System.nanoTime() - start;
      circuitBreaker.onFailure(elapsed, ex);
      metrics.recordInvocation(ex.getKind().name().toLowerCase(), elapsed);
      log.warn("Model call for chat {} failed: {}", chatId, ex.getMessage());
      throw ex;
    } catch (PermanentUpstreamException ex) {
      long elapsed = System.nanoTime() - start;
      circuitBreaker.onSuccess(elapsed);
      metrics.recordInvocation(ex.getKind().name().toLowerCase(), elapsed);
      throw ex;
    } catch (BackOffInterruptedException ex) {
      circuitBreaker.release();
      metrics.recordInvocation("cancelled", System.nanoTime() - start);
      Thread.currentThread().interrupt();
      throw new InvocationCancelledException("Model call for chat " + chatId + " cancelled", ex);
    } catch (InvocationCancelledException ex) {
      circuitBreaker.release();
      metrics.recordInvocation("cancelled", System.nanoTime() - start);
      throw ex;
    } catch (RuntimeException ex) {
      circuitBreaker.release();
      metrics.recordInvocation("error", System.nanoTime() - start);
      throw ex;
    }

    long elapsed = System.nanoTime() - start;
    circuitBreaker.onSuccess(elapsed);
    metrics.recordInvocation("success", elapsed);
    recordSpend(chatId, costOf.apply(result));
    return result;
  }

  private <T> T attempt(Supplier<T> call) {
    if (Thread.currentThread().isInterrupted()) {
      throw new InvocationCancelledException("Interrupted before model call", null);
    }
    return call.get();
  }

  // The call already happened; a refused spend only exhausts the budget for later calls.
  private void recordSpend(long chatId, BigDecimal cost) {
    try {
      costController.record(cost);
    } catch (BudgetExceededException ex) {
      log.warn(
          "Spend {} of chat {} pushed the budget over its limit: {}", cost, chatId, ex.getMessage());
    }
  }
}
