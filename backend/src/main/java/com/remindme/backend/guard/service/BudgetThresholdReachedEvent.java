package com.remindme.backend.guard.service;

import java.math.BigDecimal;

/** Published once per billing period for every alert threshold the spend crosses. */
public record BudgetThresholdReachedEvent(
    String periodKey, int threshold, BigDecimal spent, BigDecimal limit) {}
