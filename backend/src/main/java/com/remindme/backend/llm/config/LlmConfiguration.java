package com.remindme.backend.llm.config;

import com.knuddels.jtokkit.Encodings;
import com.remindme.backend.llm.client.LlmCommandClient;
import com.remindme.backend.llm.client.SpringAiLlmCommandClient;
import com.remindme.backend.llm.token.JtokkitTokenUsageEstimator;
import com.remindme.backend.llm.token.LlmCostCalculator;
import com.remindme.backend.llm.token.TokenUsageEstimator;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TokenUsageEstimator tokenUsageEstimator(LlmProperties properties) {
    return new JtokkitTokenUsageEstimator(
        Encodings.newLazyEncodingRegistry(), properties.getTokenizer());
  }

  @Bean
  public LlmCostCalculator llmCostCalculator(LlmProperties properties) {
    return new LlmCostCalculator(properties.getPricing());
  }

  @Bean
  @ConditionalOnMissingBean(LlmCommandClient.class)
  public LlmCommandClient llmCommandClient(
      ChatClient.Builder chatClientBuilder,
      LlmProperties properties,
      TokenUsageEstimator tokenUsageEstimator) {
    return new SpringAiLlmCommandClient(chatClientBuilder.build(), properties, tokenUsageEstimator);
  }
}
