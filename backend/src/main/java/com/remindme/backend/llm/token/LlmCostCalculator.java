package com.remindme.backend.llm.token;

import com.remindme.backend.llm.client.LlmCompletion;
import com.remindme.backend.llm.config.LlmProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Prices a completion from its token usage and the configured per-1K rates. */
public class LlmCostCalculator {

  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
  private static final int SCALE = 8;

  private final LlmProperties.Pricing pricing;

  public LlmCostCalculator(LlmProperties.Pricing pricing) {
    this.pricing = pricing;
  }

  public BigDecimal cost(LlmCompletion completion) {
    BigDecimal input =
        BigDecimal.valueOf(completion.promptTokens()).multiply(pricing.getInputPer1kTokens());
    BigDecimal output =
        BigDecimal.valueOf(completion.completionTokens()).multiply(pricing.getOutputPer1kTokens());
    return input.add(output).divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
  }
}
