package com.remindme.backend.telegram.service;

import com.remindme.backend.conversation.model.ConversationReply;
import com.remindme.backend.conversation.model.InboundMessage;
import com.remindme.backend.conversation.service.ReminderConversationService;
import com.remindme.backend.telegram.bot.TelegramWebhookBotAdapter;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Accepts webhook updates and answers text messages on a worker pool, so the webhook request
 * returns before the model is called.
 */
public class TelegramReminderUpdateHandler implements TelegramUpdateHandler {

  private static final Logger log = LoggerFactory.getLogger(TelegramReminderUpdateHandler.class);

  static final String COMMAND_START = "/start";
  static final String COMMAND_HELP = "/help";

  static final String HELP_TEXT =
      "Я помогаю с напоминаниями. Пишите обычным текстом, например:\n"
          + "- «Напомни завтра в 10:30 позвонить маме»\n"
          + "- «Каждый понедельник в 9 планерка»\n"
          + "- «Покажи напоминания на сегодня»\n"
          + "- «Удали последние 3 напоминания»";

  private final ReminderConversationService conversationService;
  private final TelegramWebhookBotAdapter webhookBot;
  private final Executor executor;

  public TelegramReminderUpdateHandler(
      ReminderConversationService conversationService,
      TelegramWebhookBotAdapter webhookBot,
      Executor executor) {
    this.conversationService = conversationService;
    this.webhookBot = webhookBot;
    this.executor = executor;
  }

  @Override
  public void handle(Update update) {
    if (update == null || !update.hasMessage()) {
      log.debug("Ignoring unsupported update type: {}", update);
      return;
    }
    Message message = update.getMessage();
    if (message.getChatId() == null) {
      return;
    }
    long chatId = message.getChatId();

    if (!message.hasText()) {
      send(chatId, "Поддерживаются только текстовые сообщения.");
      return;
    }
    String command = message.getText().trim().toLowerCase();
    if (command.startsWith(COMMAND_START) || command.startsWith(COMMAND_HELP)) {
      send(chatId, HELP_TEXT);
      return;
    }

    InboundMessage inbound =
        new InboundMessage(
            update.getUpdateId(),
            chatId,
            message.getText(),
            message.getDate() != null ? Instant.ofEpochSecond(message.getDate()) : null);
    try {
      executor.execute(() -> process(inbound));
    } catch (RejectedExecutionException ex) {
      log.error("Worker pool rejected update {} of chat {}", inbound.updateId(), chatId, ex);
      send(chatId, "Бот перегружен. Попробуйте позже.");
    }
  }

  void process(InboundMessage inbound) {
    ConversationReply reply = conversationService.handle(inbound);
    if (!reply.isSilent()) {
      send(inbound.chatId(), reply.text());
    }
  }

  private void send(long chatId, String text) {
    try {
      webhookBot.sendText(chatId, text);
    } catch (TelegramApiException ex) {
      log.error("Failed to send Telegram message to chat {}", chatId, ex);
    }
  }
}
