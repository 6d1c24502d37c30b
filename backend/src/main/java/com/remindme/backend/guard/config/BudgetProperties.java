package com.remindme.backend.guard.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.budget")
public class BudgetProperties {

  @NotNull
  @DecimalMin(value = "0.0", inclusive = false)
  private BigDecimal monthlyLimit = new BigDecimal("10.00");

  /** Zone in which billing months start. */
  @NotNull private ZoneId zone = ZoneId.of("UTC");

  /** Spend checked against the remaining budget before each model call. */
  @NotNull
  @DecimalMin("0.0")
  private BigDecimal estimatedCallCost = new BigDecimal("0.001");

  @NotEmpty private List<Integer> alertThresholds = new ArrayList<>(List.of(50, 80, 100));

  private String currency = "USD";

  public BigDecimal getMonthlyLimit() {
    return monthlyLimit;
  }

  public void setMonthlyLimit(BigDecimal monthlyLimit) {
    this.monthlyLimit = monthlyLimit;
  }

  public ZoneId getZone() {
    return zone;
  }

  public void setZone(ZoneId zone) {
    this.zone = zone;
  }

  public BigDecimal getEstimatedCallCost() {
    return estimatedCallCost;
  }

  public void setEstimatedCallCost(BigDecimal estimatedCallCost) {
    this.estimatedCallCost = estimatedCallCost;
  }

  public List<Integer> getAlertThresholds() {
    return alertThresholds;
  }

  public void setAlertThresholds(List<Integer> alertThresholds) {
    this.alertThresholds = alertThresholds;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }
}
