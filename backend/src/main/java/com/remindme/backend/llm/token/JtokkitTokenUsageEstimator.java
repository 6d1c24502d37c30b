package com.remindme.backend.llm.token;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class JtokkitTokenUsageEstimator implements TokenUsageEstimator {

  private static final Logger log = LoggerFactory.getLogger(JtokkitTokenUsageEstimator.class);

  private final Encoding encoding;

  public JtokkitTokenUsageEstimator(EncodingRegistry encodingRegistry, String tokenizer) {
    this.encoding =
        EncodingType.fromName(tokenizer)
            .map(encodingRegistry::getEncoding)
            .orElseGet(
                () ->
                    encodingRegistry
                        .getEncoding(tokenizer)
                        .orElseThrow(
                            () ->
                                new IllegalArgumentException(
                                    "Unknown tokenizer '" + tokenizer + "'")));
  }

  @Override
  public Estimate estimate(String prompt, String completion) {
    return new Estimate(count(prompt), count(completion));
  }

  private int count(String text) {
    if (!StringUtils.hasText(text)) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      return encoding.countTokens(text);
    }
  }
}
