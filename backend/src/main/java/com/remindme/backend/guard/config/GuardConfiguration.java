package com.remindme.backend.guard.config;

import com.remindme.backend.guard.service.GuardMetrics;
import com.remindme.backend.llm.client.TransientUpstreamException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

@Configuration
@EnableConfigurationProperties({GuardProperties.class, BudgetProperties.class})
public class GuardConfiguration {

  private static final Logger log = LoggerFactory.getLogger(GuardConfiguration.class);

  /**
   * Circuit over the model endpoint: opens once the last {@code failureThreshold} recorded calls
   * all failed, and lets exactly one trial call through after the cooldown.
   */
  @Bean
  public CircuitBreakerRegistry llmCircuitBreakerRegistry(GuardProperties properties) {
    GuardProperties.Circuit circuit = properties.getCircuit();
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(circuit.getFailureThreshold())
            .minimumNumberOfCalls(circuit.getFailureThreshold())
            .failureRateThreshold(100.0f)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(circuit.getCooldown())
            .recordException(TransientUpstreamException.class::isInstance)
            .build();
    return CircuitBreakerRegistry.of(config);
  }

  @Bean
  public RetryTemplate llmRetryTemplate(GuardProperties properties, GuardMetrics metrics) {
    return buildRetryTemplate(properties.getRetry(), metrics);
  }

  /** Retries only transient, retryable upstream failures, bounded by attempts and elapsed time. */
  public static RetryTemplate buildRetryTemplate(GuardProperties.Retry retry, GuardMetrics metrics) {
    SimpleRetryPolicy attempts =
        new SimpleRetryPolicy(Math.max(1, retry.getAttempts()), new RetryableUpstreamClassifier());
    TimeoutRetryPolicy deadline = new TimeoutRetryPolicy();
    deadline.setTimeout(retry.getMaxElapsed().toMillis());
    CompositeRetryPolicy policy = new CompositeRetryPolicy();
    policy.setPolicies(new RetryPolicy[] {attempts, deadline});

    long initial = Math.max(1L, retry.getInitialDelay().toMillis());
    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(initial);
    backOff.setMultiplier(retry.getMultiplier());
    backOff.setMaxInterval(Math.max(initial, retry.getMaxDelay().toMillis()));

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(policy);
    template.setBackOffPolicy(backOff);
    template.registerListener(
        new RetryListener() {
          @Override
          public <T, E extends Throwable> void onError(
              RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            metrics.recordRetryableFailure();
            log.warn(
                "Model call attempt {} failed: {}",
                context.getRetryCount(),
                throwable.getMessage());
          }
        });
    return template;
  }

  static class RetryableUpstreamClassifier extends BinaryExceptionClassifier {

    RetryableUpstreamClassifier() {
      super(false);
    }

    @Override
    public Boolean classify(Throwable classifiable) {
      return classifiable instanceof TransientUpstreamException ex && ex.isRetryable();
    }
  }
}
