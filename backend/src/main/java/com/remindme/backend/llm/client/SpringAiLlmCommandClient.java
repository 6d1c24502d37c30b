package com.remindme.backend.llm.client;

import com.remindme.backend.llm.config.LlmProperties;
import com.remindme.backend.llm.prompt.ReminderCommandPrompts;
import com.remindme.backend.llm.token.TokenUsageEstimator;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

/**
 * {@link LlmCommandClient} over a Spring AI {@link ChatClient}. Provider failures are mapped to
 * {@link TransientUpstreamException} or {@link PermanentUpstreamException}; retries are left to
 * the invocation guard.
 */
public class SpringAiLlmCommandClient implements LlmCommandClient {

  private static final Logger log = LoggerFactory.getLogger(SpringAiLlmCommandClient.class);
  private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\b");

  private final ChatClient chatClient;
  private final LlmProperties properties;
  private final TokenUsageEstimator tokenUsageEstimator;

  public SpringAiLlmCommandClient(
      ChatClient chatClient, LlmProperties properties, TokenUsageEstimator tokenUsageEstimator) {
    this.chatClient = chatClient;
    this.properties = properties;
    this.tokenUsageEstimator = tokenUsageEstimator;
  }

  @Override
  public LlmCompletion complete(String userText, ZonedDateTime now) {
    String userPrompt = ReminderCommandPrompts.userPrompt(userText, now);
    ChatOptions options =
        ChatOptions.builder()
            .model(properties.getModel())
            .temperature(properties.getTemperature())
            .build();

    ChatResponse response;
    try {
      response =
          chatClient
              .prompt()
              .messages(
                  new SystemMessage(ReminderCommandPrompts.SYSTEM_PROMPT),
                  new UserMessage(userPrompt))
              .options(options)
              .call()
              .chatResponse();
    } catch (RuntimeException ex) {
      throw classify(ex);
    }

    String content = extractContent(response);
    if (!StringUtils.hasText(content)) {
      throw new PermanentUpstreamException(
          UpstreamFailureKind.MALFORMED_RESPONSE, "Model returned an empty response");
    }
    return withUsage(content, response, userPrompt);
  }

  private LlmCompletion withUsage(String content, ChatResponse response, String userPrompt) {
    Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
    if (usage != null
        && usage.getPromptTokens() != null
        && usage.getPromptTokens() > 0
        && usage.getCompletionTokens() != null) {
      return new LlmCompletion(content, usage.getPromptTokens(), usage.getCompletionTokens(), false);
    }
    TokenUsageEstimator.Estimate estimate =
        tokenUsageEstimator.estimate(
            ReminderCommandPrompts.SYSTEM_PROMPT + "\n" + userPrompt, content);
    log.debug(
        "Provider reported no usage, estimated prompt={} completion={}",
        estimate.promptTokens(),
        estimate.completionTokens());
    return new LlmCompletion(content, estimate.promptTokens(), estimate.completionTokens(), true);
  }

  static RuntimeException classify(RuntimeException ex) {
    if (ex instanceof TransientUpstreamException || ex instanceof PermanentUpstreamException) {
      return ex;
    }
    if (ex instanceof HttpStatusCodeException statusException) {
      return fromStatus(statusException.getStatusCode().value(), ex);
    }
    if (ex instanceof ResourceAccessException) {
      return hasTimeoutCause(ex)
          ? new TransientUpstreamException(UpstreamFailureKind.TIMEOUT, "Model call timed out", ex)
          : new TransientUpstreamException(
              UpstreamFailureKind.CONNECTION, "Model endpoint unreachable", ex);
    }
    if (ex instanceof TransientAiException) {
      Integer status = leadingStatus(ex.getMessage());
      if (status != null && status == 429) {
        return fromStatus(status, ex);
      }
      return new TransientUpstreamException(
          UpstreamFailureKind.CONNECTION, "Model provider is temporarily failing", ex);
    }
    if (ex instanceof NonTransientAiException) {
      Integer status = leadingStatus(ex.getMessage());
      return status != null
          ? fromStatus(status, ex)
          : new PermanentUpstreamException(
              UpstreamFailureKind.REJECTED, "Model provider rejected the request", ex);
    }
    if (hasTimeoutCause(ex)) {
      return new TransientUpstreamException(UpstreamFailureKind.TIMEOUT, "Model call timed out", ex);
    }
    return ex;
  }

  private static RuntimeException fromStatus(int status, RuntimeException cause) {
    if (status == 429) {
      return new TransientUpstreamException(
          UpstreamFailureKind.QUOTA, "Model provider quota or rate limit exceeded", cause);
    }
    if (status == 401 || status == 403) {
      return new PermanentUpstreamException(
          UpstreamFailureKind.AUTHENTICATION, "Model provider refused the credentials", cause);
    }
    if (status == 408 || status >= 500) {
      return new TransientUpstreamException(
          UpstreamFailureKind.CONNECTION, "Model provider failed with status " + status, cause);
    }
    return new PermanentUpstreamException(
        UpstreamFailureKind.REJECTED, "Model provider rejected the request: " + status, cause);
  }

  private static Integer leadingStatus(String message) {
    if (message == null) {
      return null;
    }
    Matcher matcher = LEADING_STATUS.matcher(message);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  private static boolean hasTimeoutCause(Throwable ex) {
    for (Throwable current = ex; current != null; current = current.getCause()) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
    }
    return false;
  }

  private String extractContent(ChatResponse response) {
    if (response == null) {
      return null;
    }
    List<Generation> generations = response.getResults();
    if (generations == null || generations.isEmpty()) {
      return null;
    }
    StringBuilder builder = new StringBuilder();
    for (Generation generation : generations) {
      if (generation == null || generation.getOutput() == null) {
        continue;
      }
      String text = generation.getOutput().getText();
      if (StringUtils.hasText(text)) {
        builder.append(text);
      }
    }
    return builder.toString().trim();
  }
}
