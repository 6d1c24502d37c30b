package com.remindme.backend.guard.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/** Model spend of one billing period ({@code YYYY-MM}). */
@Entity
@Table(name = "cost_ledger")
public class CostLedger {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "period_key", nullable = false, unique = true, length = 7, updatable = false)
  private String periodKey;

  @Column(name = "spent", nullable = false, precision = 19, scale = 8)
  private BigDecimal spent;

  @Convert(converter = ThresholdSetConverter.class)
  @Column(name = "fired_thresholds", nullable = false, length = 64)
  private SortedSet<Integer> firedThresholds = new TreeSet<>();

  @Column(name = "exhausted", nullable = false)
  private boolean exhausted;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CostLedger() {}

  public CostLedger(String periodKey) {
    this.periodKey = periodKey;
    this.spent = BigDecimal.ZERO;
  }

  public void touch(Instant at) {
    updatedAt = at;
  }

  public void add(BigDecimal amount) {
    spent = spent.add(amount);
  }

  /** @return {@code true} only the first time the threshold is marked in this period */
  public boolean fire(int threshold) {
    // replace the set so the converter sees a changed value
    TreeSet<Integer> updated = new TreeSet<>(firedThresholds);
    boolean added = updated.add(threshold);
    firedThresholds = updated;
    return added;
  }

  public void markExhausted() {
    exhausted = true;
  }

  public Long getId() {
    return id;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public BigDecimal getSpent() {
    return spent;
  }

  public SortedSet<Integer> getFiredThresholds() {
    return Collections.unmodifiableSortedSet(firedThresholds);
  }

  public boolean isExhausted() {
    return exhausted;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
