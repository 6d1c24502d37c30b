package com.remindme.backend.llm.token;

import static org.assertj.core.api.Assertions.assertThat;

import com.knuddels.jtokkit.Encodings;
import com.remindme.backend.llm.client.LlmCompletion;
import com.remindme.backend.llm.config.LlmProperties;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LlmCostCalculatorTest {

  @Test
  void pricesPromptAndCompletionTokensSeparately() {
    LlmProperties.Pricing pricing = new LlmProperties.Pricing();
    pricing.setInputPer1kTokens(new BigDecimal("0.0003"));
    pricing.setOutputPer1kTokens(new BigDecimal("0.0012"));

    BigDecimal cost =
        new LlmCostCalculator(pricing).cost(new LlmCompletion("{}", 1000, 500, false));

    assertThat(cost).isEqualByComparingTo("0.0009");
    assertThat(cost.scale()).isEqualTo(8);
  }

  @Test
  void jtokkitCountsTokensOfBothSides() {
    TokenUsageEstimator estimator =
        new JtokkitTokenUsageEstimator(Encodings.newLazyEncodingRegistry(), "o200k_base");

    TokenUsageEstimator.Estimate estimate =
        estimator.estimate("Напомни завтра купить молоко", "");

    assertThat(estimate.promptTokens()).isPositive();
    assertThat(estimate.completionTokens()).isZero();
    assertThat(estimate.totalTokens()).isEqualTo(estimate.promptTokens());
  }
}
