package com.remindme.backend.guard.service;

import java.math.BigDecimal;

/** The monthly model budget cannot absorb the requested spend. */
public class BudgetExceededException extends RuntimeException {

  private final String periodKey;
  private final BigDecimal spent;
  private final BigDecimal limit;

  public BudgetExceededException(String periodKey, BigDecimal spent, BigDecimal limit) {
    super("Monthly budget exhausted for " + periodKey + ": spent " + spent + " of " + limit);
    this.periodKey = periodKey;
    this.spent = spent;
    this.limit = limit;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public BigDecimal getSpent() {
    return spent;
  }

  public BigDecimal getLimit() {
    return limit;
  }
}
