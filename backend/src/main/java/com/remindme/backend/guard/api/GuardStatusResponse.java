package com.remindme.backend.guard.api;

import com.remindme.backend.guard.domain.CircuitState;
import java.math.BigDecimal;
import java.util.List;

public record GuardStatusResponse(CircuitState circuit, Budget budget) {

  public record Budget(
      String period,
      BigDecimal spent,
      BigDecimal limit,
      String currency,
      List<Integer> firedThresholds,
      boolean exhausted) {}
}
