package com.remindme.backend.conversation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DaySpec;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.ReminderFilter;
import com.remindme.backend.command.model.ReminderSpec;
import com.remindme.backend.command.service.CommandParser;
import com.remindme.backend.command.service.CommandValidationException;
import com.remindme.backend.conversation.model.ConversationReply;
import com.remindme.backend.conversation.model.InboundMessage;
import com.remindme.backend.guard.service.InvocationCancelledException;
import com.remindme.backend.guard.service.InvocationGuard;
import com.remindme.backend.guard.service.RateLimitedException;
import com.remindme.backend.guard.service.WebhookDeduplicator;
import com.remindme.backend.llm.client.LlmCommandClient;
import com.remindme.backend.llm.client.LlmCompletion;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.TransientUpstreamException;
import com.remindme.backend.llm.client.UpstreamFailureKind;
import com.remindme.backend.llm.config.LlmProperties;
import com.remindme.backend.llm.token.LlmCostCalculator;
import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.service.DeletionOutcome;
import com.remindme.backend.reminder.service.InvalidTimeSpecException;
import com.remindme.backend.reminder.service.ReminderService;
import com.remindme.backend.reminder.service.ReminderStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ReminderConversationServiceTest {

  private static final long CHAT_ID = 99L;
  private static final Instant NOW = Instant.parse("2025-03-12T11:20:00Z");
  private static final String RAW = "{\"command\":\"create_reminders\"}";

  @Mock private WebhookDeduplicator deduplicator;
  @Mock private InvocationGuard invocationGuard;
  @Mock private LlmCommandClient llmClient;
  @Mock private CommandParser commandParser;
  @Mock private ReminderService reminderService;

  private ReminderConversationService service;

  @BeforeEach
  void setUp() {
    ReminderProperties properties = new ReminderProperties();
    service =
        new ReminderConversationService(
            deduplicator,
            invocationGuard,
            llmClient,
            new LlmCostCalculator(new LlmProperties().getPricing()),
            commandParser,
            reminderService,
            new ReminderReplyFormatter(properties),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void duplicateUpdateIsIgnoredSilently() {
    given(deduplicator.admit(1L)).willReturn(false);

    ConversationReply reply = service.handle(message("напомни завтра"));

    assertThat(reply.isSilent()).isTrue();
    verifyNoInteractions(invocationGuard);
  }

  @Test
  void staleUpdateIsIgnoredSilently() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(deduplicator.isStale(any())).willReturn(true);

    assertThat(service.handle(message("напомни завтра")).isSilent()).isTrue();
    verifyNoInteractions(invocationGuard);
  }

  @Test
  void emptyTextNeverReachesModel() {
    given(deduplicator.admit(1L)).willReturn(true);

    ConversationReply reply = service.handle(message("   "));

    assertThat(reply.text()).isEqualTo(ReminderConversationService.EMPTY_TEXT);
    verifyNoInteractions(invocationGuard);
  }

  @Test
  void createsRemindersFromModelCommand() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(eq("напомни завтра купить хлеб"), any()))
        .willReturn(new LlmCompletion(RAW, 900, 40, false));
    CreateCommand command = CreateCommand.of(ReminderSpec.of("купить хлеб", DaySpec.tomorrow()));
    given(commandParser.parse(RAW)).willReturn(command);
    Reminder created =
        Reminder.pending(CHAT_ID, "купить хлеб", Instant.parse("2025-03-13T05:00:00Z"), null, NOW);
    ReflectionTestUtils.setField(created, "id", 5L);
    given(reminderService.create(CHAT_ID, command)).willReturn(List.of(created));

    ConversationReply reply = service.handle(message("  напомни завтра купить хлеб "));

    assertThat(reply.text())
        .startsWith("Напоминания созданы:")
        .contains("- #5: купить хлеб -> 13.03.2025 08:00");
  }

  @Test
  void reportsNothingDeleted() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(any(), any())).willReturn(new LlmCompletion(RAW, 10, 10, false));
    DeleteCommand command = DeleteCommand.lastN(ReminderFilter.all(), 5);
    given(commandParser.parse(RAW)).willReturn(command);
    given(reminderService.delete(CHAT_ID, command))
        .willReturn(DeletionOutcome.nothingToDelete(5, 3));

    ConversationReply reply = service.handle(message("удали последние 5"));

    assertThat(reply.text()).contains("Найдено только 3").contains("ничего не удалено");
  }

  @Test
  void rateLimitedChatGetsDedicatedMessage() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(invocationGuard.execute(anyLong(), any(), any()))
        .willThrow(new RateLimitedException(CHAT_ID, Duration.ofMinutes(1)));

    assertThat(service.handle(message("ещё")).text())
        .isEqualTo(ReminderConversationService.RATE_LIMITED);
  }

  @Test
  void quotaFailureIsReportedAsQuota() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(invocationGuard.execute(anyLong(), any(), any()))
        .willThrow(new TransientUpstreamException(UpstreamFailureKind.QUOTA, "429"));

    assertThat(service.handle(message("ещё")).text())
        .isEqualTo(ReminderConversationService.QUOTA);
  }

  @Test
  void connectionFailureIsReportedAsUnavailable() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(invocationGuard.execute(anyLong(), any(), any()))
        .willThrow(new TransientUpstreamException(UpstreamFailureKind.CONNECTION, "reset"));

    assertThat(service.handle(message("ещё")).text())
        .isEqualTo(ReminderConversationService.UPSTREAM_UNAVAILABLE);
  }

  @Test
  void malformedOutputAsksToRephrase() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(any(), any())).willReturn(new LlmCompletion("oops", 10, 1, false));
    given(commandParser.parse("oops"))
        .willThrow(
            new PermanentUpstreamException(UpstreamFailureKind.MALFORMED_RESPONSE, "not json"));

    assertThat(service.handle(message("что-то")).text())
        .isEqualTo(ReminderConversationService.NOT_UNDERSTOOD);
    verifyNoInteractions(reminderService);
  }

  @Test
  void deleteAllWithoutConfirmationExplainsHowToConfirm() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(any(), any())).willReturn(new LlmCompletion(RAW, 10, 10, false));
    given(commandParser.parse(RAW))
        .willThrow(
            new CommandValidationException("confirm_all", "ConfirmationRequired", "нужно"));

    assertThat(service.handle(message("удали всё")).text()).contains("подтвердите");
  }

  @Test
  void pastTimeIsExplained() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(any(), any())).willReturn(new LlmCompletion(RAW, 10, 10, false));
    CreateCommand command = CreateCommand.of(ReminderSpec.of("x", DaySpec.today()));
    given(commandParser.parse(RAW)).willReturn(command);
    given(reminderService.create(CHAT_ID, command))
        .willThrow(new InvalidTimeSpecException("time", "время 09:00 сегодня уже прошло"));

    assertThat(service.handle(message("в 9 утра")).text())
        .isEqualTo("Не удалось создать напоминание: время 09:00 сегодня уже прошло.");
  }

  @Test
  void storeFailureIsReported() {
    givenAdmittedAndGuardPassesThrough();
    given(llmClient.complete(any(), any())).willReturn(new LlmCompletion(RAW, 10, 10, false));
    CreateCommand command = CreateCommand.of(ReminderSpec.of("x", DaySpec.tomorrow()));
    given(commandParser.parse(RAW)).willReturn(command);
    given(reminderService.create(CHAT_ID, command))
        .willThrow(
            new ReminderStoreException(
                "create", new DataAccessResourceFailureException("connection refused")));

    assertThat(service.handle(message("завтра")).text())
        .isEqualTo(ReminderConversationService.STORE_FAILED);
  }

  @Test
  void cancelledProcessingSendsNothing() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(invocationGuard.execute(anyLong(), any(), any()))
        .willThrow(new InvocationCancelledException("shutdown", null));

    assertThat(service.handle(message("завтра")).isSilent()).isTrue();
    verify(commandParser, never()).parse(any());
  }

  private void givenAdmittedAndGuardPassesThrough() {
    given(deduplicator.admit(1L)).willReturn(true);
    given(invocationGuard.execute(anyLong(), any(), any()))
        .willAnswer(invocation -> invocation.<Supplier<?>>getArgument(1).get());
  }

  private static InboundMessage message(String text) {
    return new InboundMessage(1L, CHAT_ID, text, NOW.minusSeconds(2));
  }
}
