package com.remindme.backend.guard.service;

import java.math.BigDecimal;
import java.util.List;

public record LedgerSnapshot(
    String periodKey,
    BigDecimal spent,
    BigDecimal limit,
    List<Integer> firedThresholds,
    boolean exhausted) {

  public LedgerSnapshot {
    firedThresholds = firedThresholds != null ? List.copyOf(firedThresholds) : List.of();
  }
}
