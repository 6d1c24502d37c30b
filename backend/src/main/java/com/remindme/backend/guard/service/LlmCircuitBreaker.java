package com.remindme.backend.guard.service;

import com.remindme.backend.guard.config.GuardProperties;
import com.remindme.backend.guard.domain.CircuitState;
import com.remindme.backend.guard.domain.CircuitStateSnapshot;
import com.remindme.backend.guard.persistence.CircuitStateRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Circuit breaker in front of the model. Every state transition is persisted so that an open
 * circuit survives a restart until its cooldown has passed.
 */
@Component
public class LlmCircuitBreaker {

  static final String NAME = "llm";

  private static final Logger log = LoggerFactory.getLogger(LlmCircuitBreaker.class);

  private final CircuitBreaker circuitBreaker;
  private final CircuitStateRepository repository;
  private final Duration cooldown;
  private final Clock clock;
  private volatile boolean restoring;

  public LlmCircuitBreaker(
      CircuitBreakerRegistry llmCircuitBreakerRegistry,
      CircuitStateRepository repository,
      GuardProperties properties,
      Clock clock) {
    this.circuitBreaker = llmCircuitBreakerRegistry.circuitBreaker(NAME);
    this.repository = repository;
    this.cooldown = properties.getCircuit().getCooldown();
    this.clock = clock;
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event -> {
              log.warn("Circuit [{}] state change: {}", NAME, event.getStateTransition());
              persist(toState(event.getStateTransition().getToState()));
            });
  }

  @PostConstruct
  void restore() {
    Optional<CircuitStateSnapshot> snapshot;
    try {
      snapshot = repository.findById(NAME);
    } catch (DataAccessException ex) {
      log.warn("Could not read persisted state of circuit [{}], starting closed", NAME, ex);
      return;
    }
    snapshot
        .filter(s -> s.getState() == CircuitState.OPEN)
        .filter(s -> s.getChangedAt().plus(cooldown).isAfter(clock.instant()))
        .ifPresent(
            s -> {
              restoring = true;
              try {
                circuitBreaker.transitionToOpenState();
              } finally {
                restoring = false;
              }
              log.warn("Circuit [{}] restored as open (opened at {})", NAME, s.getChangedAt());
            });
  }

  /** @throws CircuitOpenException if no call is permitted right now */
  public void acquire() {
    try {
      circuitBreaker.acquirePermission();
    } catch (CallNotPermittedException ex) {
      log.info("Circuit [{}] is {}, call rejected", NAME, circuitBreaker.getState());
      throw new CircuitOpenException(NAME, ex);
    }
  }

  public void onSuccess(long durationNanos) {
    circuitBreaker.onSuccess(durationNanos, TimeUnit.NANOSECONDS);
  }

  /** Records a failed call; only transient upstream failures count toward opening. */
  public void onFailure(long durationNanos, Throwable error) {
    circuitBreaker.onError(durationNanos, TimeUnit.NANOSECONDS, error);
  }

  /** Returns the permit of a call that was abandoned without an upstream outcome. */
  public void release() {
    circuitBreaker.releasePermission();
  }

  public CircuitState state() {
    return toState(circuitBreaker.getState());
  }

  private void persist(CircuitState state) {
    if (restoring) {
      return;
    }
    Instant now = clock.instant();
    try {
      CircuitStateSnapshot snapshot =
          repository
              .findById(NAME)
              .orElseGet(() -> new CircuitStateSnapshot(NAME, state, now));
      snapshot.update(state, now);
      repository.save(snapshot);
    } catch (DataAccessException ex) {
      log.error("Failed to persist state {} of circuit [{}]", state, NAME, ex);
    }
  }

  private static CircuitState toState(CircuitBreaker.State state) {
    switch (state) {
      case OPEN:
      case FORCED_OPEN:
        return CircuitState.OPEN;
      case HALF_OPEN:
        return CircuitState.HALF_OPEN;
      default:
        return CircuitState.CLOSED;
    }
  }
}
