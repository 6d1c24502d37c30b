package com.remindme.backend.conversation.service;

import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.ListCommand;
import com.remindme.backend.command.model.ReminderCommand;
import com.remindme.backend.command.service.CommandParser;
import com.remindme.backend.command.service.CommandValidationException;
import com.remindme.backend.command.service.FieldViolation;
import com.remindme.backend.conversation.model.ConversationReply;
import com.remindme.backend.conversation.model.InboundMessage;
import com.remindme.backend.guard.service.BudgetExceededException;
import com.remindme.backend.guard.service.CircuitOpenException;
import com.remindme.backend.guard.service.InvocationCancelledException;
import com.remindme.backend.guard.service.InvocationGuard;
import com.remindme.backend.guard.service.RateLimitedException;
import com.remindme.backend.guard.service.WebhookDeduplicator;
import com.remindme.backend.llm.client.LlmCommandClient;
import com.remindme.backend.llm.client.LlmCompletion;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.TransientUpstreamException;
import com.remindme.backend.llm.client.UpstreamFailureKind;
import com.remindme.backend.llm.token.LlmCostCalculator;
import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.service.InvalidTimeSpecException;
import com.remindme.backend.reminder.service.ReminderService;
import com.remindme.backend.reminder.service.ReminderStoreException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

/**
 * Handles one chat message end to end: dedup, guarded model call, command parsing, execution and
 * the reply text. Every failure ends in exactly one user-facing message.
 */
@Service
public class ReminderConversationService {

  private static final Logger log = LoggerFactory.getLogger(ReminderConversationService.class);

  static final String EMPTY_TEXT = "Нужен текст запроса.";
  static final String RATE_LIMITED = "Слишком много запросов. Подождите немного и попробуйте снова.";
  static final String BUDGET_EXHAUSTED = "Лимит запросов к модели на текущий месяц исчерпан.";
  static final String CIRCUIT_OPEN = "Сервис модели временно перегружен. Попробуйте через минуту.";
  static final String QUOTA =
      "Сервис модели временно недоступен: превышен лимит или квота. Попробуйте позже.";
  static final String UPSTREAM_UNAVAILABLE =
      "Не удалось связаться с сервисом модели. Попробуйте еще раз.";
  static final String NOT_UNDERSTOOD = "Не удалось понять команду. Уточните текст запроса.";
  static final String STORE_FAILED = "Не удалось сохранить изменения. Попробуйте позже.";
  static final String UNEXPECTED = "Ошибка обработки запроса. Попробуйте еще раз.";

  private final WebhookDeduplicator deduplicator;
  private final InvocationGuard invocationGuard;
  private final LlmCommandClient llmClient;
  private final LlmCostCalculator costCalculator;
  private final CommandParser commandParser;
  private final ReminderService reminderService;
  private final ReminderReplyFormatter formatter;
  private final ZoneId zone;
  private final Clock clock;

  public ReminderConversationService(
      WebhookDeduplicator deduplicator,
      InvocationGuard invocationGuard,
      LlmCommandClient llmClient,
      LlmCostCalculator costCalculator,
      CommandParser commandParser,
      ReminderService reminderService,
      ReminderReplyFormatter formatter,
      ReminderProperties reminderProperties,
      Clock clock) {
    this.deduplicator = deduplicator;
    this.invocationGuard = invocationGuard;
    this.llmClient = llmClient;
    this.costCalculator = costCalculator;
    this.commandParser = commandParser;
    this.reminderService = reminderService;
    this.formatter = formatter;
    this.zone = reminderProperties.getZone();
    this.clock = clock;
  }

  public ConversationReply handle(InboundMessage message) {
    if (!deduplicator.admit(message.updateId())) {
      return ConversationReply.silent();
    }
    if (deduplicator.isStale(message.sentAt())) {
      log.info(
          "Skipping stale update {} of chat {} sent at {}",
          message.updateId(),
          message.chatId(),
          message.sentAt());
      return ConversationReply.silent();
    }
    if (!StringUtils.hasText(message.text())) {
      return ConversationReply.of(EMPTY_TEXT);
    }

    long chatId = message.chatId();
    try {
      ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
      LlmCompletion completion =
          invocationGuard.execute(
              chatId, () -> llmClient.complete(message.text().trim(), now), costCalculator::cost);
      ReminderCommand command = commandParser.parse(completion.content());
      log.info("Chat {} issued {} command", chatId, command.kind());
      return ConversationReply.of(execute(chatId, command));
    } catch (InvalidTimeSpecException ex) {
      log.info("Chat {} asked for a past time: {}", chatId, ex.getMessage());
      return ConversationReply.of(
          "Не удалось создать напоминание: " + ex.firstViolation().message() + ".");
    } catch (CommandValidationException ex) {
      log.info("Chat {} sent an invalid command: {}", chatId, ex.getMessage());
      return ConversationReply.of(describe(ex.firstViolation()));
    } catch (RateLimitedException ex) {
      return ConversationReply.of(RATE_LIMITED);
    } catch (BudgetExceededException ex) {
      log.warn("Refused chat {}: {}", chatId, ex.getMessage());
      return ConversationReply.of(BUDGET_EXHAUSTED);
    } catch (CircuitOpenException ex) {
      return ConversationReply.of(CIRCUIT_OPEN);
    } catch (TransientUpstreamException ex) {
      log.warn("Model unavailable for chat {}: {}", chatId, ex.getMessage());
      return ConversationReply.of(
          ex.getKind() == UpstreamFailureKind.QUOTA ? QUOTA : UPSTREAM_UNAVAILABLE);
    } catch (PermanentUpstreamException ex) {
      log.warn("Model call for chat {} failed: {}", chatId, ex.getMessage());
      return ConversationReply.of(
          ex.getKind() == UpstreamFailureKind.MALFORMED_RESPONSE
              ? NOT_UNDERSTOOD
              : UPSTREAM_UNAVAILABLE);
    } catch (ReminderStoreException ex) {
      return ConversationReply.of(STORE_FAILED);
    } catch (DataAccessException | TransactionException ex) {
      log.error("Reminder store failed for chat {}", chatId, ex);
      return ConversationReply.of(STORE_FAILED);
    } catch (InvocationCancelledException ex) {
      log.info("Processing for chat {} was cancelled", chatId);
      return ConversationReply.silent();
    } catch (RuntimeException ex) {
      log.error("Failed to process message of chat {}", chatId, ex);
      return ConversationReply.of(UNEXPECTED);
    }
  }

  private String execute(long chatId, ReminderCommand command) {
    if (command instanceof CreateCommand create) {
      return formatter.created(reminderService.create(chatId, create));
    }
    if (command instanceof ListCommand list) {
      return formatter.listed(reminderService.list(chatId, list.filter()));
    }
    if (command instanceof DeleteCommand delete) {
      return formatter.deleted(reminderService.delete(chatId, delete));
    }
    throw new IllegalStateException("Unsupported command " + command.kind());
  }

  private String describe(FieldViolation violation) {
    if ("confirm_all".equals(violation.field())) {
      return "Чтобы удалить все напоминания, подтвердите это явно: напишите «удали все напоминания».";
    }
    return "Не удалось выполнить команду: " + violation.message() + " (" + violation.field() + ").";
  }
}
