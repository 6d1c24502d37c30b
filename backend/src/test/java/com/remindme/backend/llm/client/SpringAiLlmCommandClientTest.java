package com.remindme.backend.llm.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.knuddels.jtokkit.Encodings;
import com.remindme.backend.llm.config.LlmProperties;
import com.remindme.backend.llm.prompt.ReminderCommandPrompts;
import com.remindme.backend.llm.token.JtokkitTokenUsageEstimator;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import reactor.core.publisher.Flux;

class SpringAiLlmCommandClientTest {

  private static final ZonedDateTime NOW =
      ZonedDateTime.of(2025, 3, 12, 14, 20, 0, 0, ZoneId.of("Europe/Moscow"));

  private StubChatModel chatModel;
  private SpringAiLlmCommandClient client;

  @BeforeEach
  void setUp() {
    chatModel = new StubChatModel();
    client =
        new SpringAiLlmCommandClient(
            ChatClient.builder(chatModel).build(),
            new LlmProperties(),
            new JtokkitTokenUsageEstimator(Encodings.newLazyEncodingRegistry(), "o200k_base"));
  }

  @Test
  void sendsSystemPromptAndCurrentTime() {
    chatModel.respond(
        new ChatResponse(
            List.of(new Generation(new AssistantMessage("{\"command\":\"list_reminders\"}"))),
            ChatResponseMetadata.builder().usage(new DefaultUsage(120, 30, 150)).build()));

    LlmCompletion completion = client.complete("что у меня сегодня?", NOW);

    assertThat(completion.content()).isEqualTo("{\"command\":\"list_reminders\"}");
    assertThat(completion.promptTokens()).isEqualTo(120);
    assertThat(completion.completionTokens()).isEqualTo(30);
    assertThat(completion.estimatedUsage()).isFalse();
    String contents = chatModel.lastPrompt().getContents();
    assertThat(contents).contains(ReminderCommandPrompts.SYSTEM_PROMPT.trim().substring(0, 20));
    assertThat(contents).contains("что у меня сегодня?").contains("2025-03-12T14:20");
  }

  @Test
  void estimatesUsageWhenProviderReportsNone() {
    chatModel.respond(
        new ChatResponse(List.of(new Generation(new AssistantMessage("{\"command\":\"x\"}")))));

    LlmCompletion completion = client.complete("привет", NOW);

    assertThat(completion.estimatedUsage()).isTrue();
    assertThat(completion.promptTokens()).isPositive();
    assertThat(completion.completionTokens()).isPositive();
  }

  @Test
  void blankOutputIsMalformed() {
    chatModel.respond(new ChatResponse(List.of(new Generation(new AssistantMessage("  ")))));

    assertThatThrownBy(() -> client.complete("привет", NOW))
        .isInstanceOf(PermanentUpstreamException.class)
        .satisfies(
            error ->
                assertThat(((PermanentUpstreamException) error).getKind())
                    .isEqualTo(UpstreamFailureKind.MALFORMED_RESPONSE));
  }

  @Test
  void providerFailuresAreClassified() {
    chatModel.fail(new TransientAiException("429 - Rate limit reached"));

    assertThatThrownBy(() -> client.complete("привет", NOW))
        .isInstanceOf(TransientUpstreamException.class)
        .satisfies(
            error ->
                assertThat(((TransientUpstreamException) error).getKind())
                    .isEqualTo(UpstreamFailureKind.QUOTA));
  }

  @Test
  void classifiesHttpStatuses() {
    assertThat(kindOf(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)))
        .isEqualTo(UpstreamFailureKind.QUOTA);
    assertThat(kindOf(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)))
        .isEqualTo(UpstreamFailureKind.AUTHENTICATION);
    assertThat(kindOf(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)))
        .isEqualTo(UpstreamFailureKind.CONNECTION);
    assertThat(kindOf(new HttpClientErrorException(HttpStatus.BAD_REQUEST)))
        .isEqualTo(UpstreamFailureKind.REJECTED);
  }

  @Test
  void classifiesNetworkFailures() {
    assertThat(
            kindOf(
                new ResourceAccessException(
                    "I/O error", new SocketTimeoutException("Read timed out"))))
        .isEqualTo(UpstreamFailureKind.TIMEOUT);
    assertThat(kindOf(new ResourceAccessException("I/O error", new IOException("refused"))))
        .isEqualTo(UpstreamFailureKind.CONNECTION);
  }

  @Test
  void classifiesSpringAiExceptions() {
    assertThat(kindOf(new TransientAiException("503 - overloaded")))
        .isEqualTo(UpstreamFailureKind.CONNECTION);
    assertThat(kindOf(new NonTransientAiException("401 - invalid api key")))
        .isEqualTo(UpstreamFailureKind.AUTHENTICATION);
    assertThat(kindOf(new NonTransientAiException("content policy")))
        .isEqualTo(UpstreamFailureKind.REJECTED);
  }

  @Test
  void leavesUnrelatedExceptionsUntouched() {
    IllegalStateException bug = new IllegalStateException("bug");

    assertThat(SpringAiLlmCommandClient.classify(bug)).isSameAs(bug);
  }

  private static UpstreamFailureKind kindOf(RuntimeException ex) {
    RuntimeException classified = SpringAiLlmCommandClient.classify(ex);
    if (classified instanceof TransientUpstreamException transientFailure) {
      return transientFailure.getKind();
    }
    if (classified instanceof PermanentUpstreamException permanentFailure) {
      return permanentFailure.getKind();
    }
    throw new AssertionError("Not classified: " + classified);
  }

  static class StubChatModel implements ChatModel {

    private final AtomicReference<Object> next = new AtomicReference<>();
    private final AtomicReference<Prompt> lastPrompt = new AtomicReference<>();

    void respond(ChatResponse response) {
      next.set(response);
    }

    void fail(RuntimeException failure) {
      next.set(failure);
    }

    Prompt lastPrompt() {
      return lastPrompt.get();
    }

    @Override
    public ChatResponse call(Prompt prompt) {
      lastPrompt.set(prompt);
      Object outcome = next.get();
      if (outcome instanceof RuntimeException failure) {
        throw failure;
      }
      return (ChatResponse) outcome;
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
      return Flux.error(new UnsupportedOperationException("streaming is not used"));
    }
  }
}
