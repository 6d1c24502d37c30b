package com.remindme.backend.llm.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

  @NotBlank private String model = "gpt-4.1-mini";

  private double temperature = 0.0;

  /** jtokkit encoding used when the provider reports no token usage. */
  @NotBlank private String tokenizer = "o200k_base";

  @NotNull private final Pricing pricing = new Pricing();

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public String getTokenizer() {
    return tokenizer;
  }

  public void setTokenizer(String tokenizer) {
    this.tokenizer = tokenizer;
  }

  public Pricing getPricing() {
    return pricing;
  }

  public static class Pricing {

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal inputPer1kTokens = new BigDecimal("0.0003");

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal outputPer1kTokens = new BigDecimal("0.0012");

    public BigDecimal getInputPer1kTokens() {
      return inputPer1kTokens;
    }

    public void setInputPer1kTokens(BigDecimal inputPer1kTokens) {
      this.inputPer1kTokens = inputPer1kTokens;
    }

    public BigDecimal getOutputPer1kTokens() {
      return outputPer1kTokens;
    }

    public void setOutputPer1kTokens(BigDecimal outputPer1kTokens) {
      this.outputPer1kTokens = outputPer1kTokens;
    }
  }
}
