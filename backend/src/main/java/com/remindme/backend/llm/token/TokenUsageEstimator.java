package com.remindme.backend.llm.token;

public interface TokenUsageEstimator {

  Estimate estimate(String prompt, String completion);

  record Estimate(int promptTokens, int completionTokens) {

    public int totalTokens() {
      return promptTokens + completionTokens;
    }
  }
}
