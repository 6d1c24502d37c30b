package com.remindme.backend.guard.service;

import com.remindme.backend.guard.config.BudgetProperties;
import com.remindme.backend.guard.domain.CostLedger;
import com.remindme.backend.guard.persistence.CostLedgerRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tracks model spend against the monthly ceiling. Spend that would push the period over the
 * ceiling is refused and stops all further calls until the next period; each alert threshold
 * fires once per period, and the 100% alert always fires when the period stops.
 */
@Service
public class CostController {

  private static final Logger log = LoggerFactory.getLogger(CostController.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  static final int EXHAUSTED_THRESHOLD = 100;

  private final CostLedgerRepository repository;
  private final BudgetProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final GuardMetrics metrics;
  private final Clock clock;

  public CostController(
      CostLedgerRepository repository,
      BudgetProperties properties,
      ApplicationEventPublisher eventPublisher,
      GuardMetrics metrics,
      Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Adds {@code amount} to the current period.
   *
   * @throws BudgetExceededException if the period is exhausted or the amount would exceed the
   *     ceiling; nothing is added and the period is marked exhausted
   */
  @Transactional(noRollbackFor = BudgetExceededException.class)
  public LedgerSnapshot record(BigDecimal amount) {
    Objects.requireNonNull(amount, "amount");
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("Spend must not be negative: " + amount);
    }
    Instant now = clock.instant();
    CostLedger ledger = lockCurrentLedger(now);
    BigDecimal limit = properties.getMonthlyLimit();
    if (ledger.isExhausted()) {
      throw new BudgetExceededException(ledger.getPeriodKey(), ledger.getSpent(), limit);
    }

    BigDecimal total = ledger.getSpent().add(amount);
    if (total.compareTo(limit) > 0) {
      ledger.touch(now);
      exhaust(ledger, limit);
      log.warn(
          "Refused spend {} for {}: {} + {} exceeds limit {}",
          amount,
          ledger.getPeriodKey(),
          ledger.getSpent(),
          amount,
          limit);
      throw new BudgetExceededException(ledger.getPeriodKey(), ledger.getSpent(), limit);
    }

    ledger.add(amount);
    ledger.touch(now);
    for (int threshold : crossedThresholds(total, limit)) {
      if (ledger.fire(threshold)) {
        eventPublisher.publishEvent(
            new BudgetThresholdReachedEvent(ledger.getPeriodKey(), threshold, total, limit));
      }
    }
    if (total.compareTo(limit) >= 0) {
      exhaust(ledger, limit);
    }
    metrics.updateSpent(total);
    log.debug("Recorded spend {} for {}, total {}", amount, ledger.getPeriodKey(), total);
    return snapshot(ledger);
  }

  /**
   * @throws BudgetExceededException if the period is exhausted or cannot absorb {@code estimate}
   */
  @Transactional(readOnly = true)
  public void checkBudget(BigDecimal estimate) {
    String periodKey = currentPeriodKey();
    BigDecimal limit = properties.getMonthlyLimit();
    CostLedger ledger = repository.findByPeriodKey(periodKey).orElse(null);
    if (ledger == null) {
      if (estimate.compareTo(limit) > 0) {
        throw new BudgetExceededException(periodKey, BigDecimal.ZERO, limit);
      }
      return;
    }
    if (ledger.isExhausted() || ledger.getSpent().add(estimate).compareTo(limit) > 0) {
      throw new BudgetExceededException(periodKey, ledger.getSpent(), limit);
    }
  }

  @Transactional(readOnly = true)
  public LedgerSnapshot currentSnapshot() {
    String periodKey = currentPeriodKey();
    return repository
        .findByPeriodKey(periodKey)
        .map(this::snapshot)
        .orElseGet(
            () ->
                new LedgerSnapshot(
                    periodKey, BigDecimal.ZERO, properties.getMonthlyLimit(), List.of(), false));
  }

  String currentPeriodKey() {
    return YearMonth.now(clock.withZone(properties.getZone())).toString();
  }

  private CostLedger lockCurrentLedger(Instant now) {
    String periodKey = currentPeriodKey();
    repository.createIfMissing(periodKey, now);
    return repository
        .findByPeriodKeyForUpdate(periodKey)
        .orElseThrow(() -> new IllegalStateException("Ledger for " + periodKey + " is missing"));
  }

  /** Stops the period; the 100% alert fires here even when the stop comes from a refusal. */
  private void exhaust(CostLedger ledger, BigDecimal limit) {
    ledger.markExhausted();
    if (ledger.fire(EXHAUSTED_THRESHOLD)) {
      eventPublisher.publishEvent(
          new BudgetThresholdReachedEvent(
              ledger.getPeriodKey(), EXHAUSTED_THRESHOLD, ledger.getSpent(), limit));
    }
  }

  private List<Integer> crossedThresholds(BigDecimal total, BigDecimal limit) {
    BigDecimal percent = total.multiply(HUNDRED).divide(limit, 4, RoundingMode.HALF_UP);
    List<Integer> crossed = new ArrayList<>();
    properties.getAlertThresholds().stream()
        .sorted()
        .filter(threshold -> percent.compareTo(BigDecimal.valueOf(threshold)) >= 0)
        .forEach(crossed::add);
    return crossed;
  }

  private LedgerSnapshot snapshot(CostLedger ledger) {
    return new LedgerSnapshot(
        ledger.getPeriodKey(),
        ledger.getSpent(),
        properties.getMonthlyLimit(),
        new ArrayList<>(ledger.getFiredThresholds()),
        ledger.isExhausted());
  }
}
