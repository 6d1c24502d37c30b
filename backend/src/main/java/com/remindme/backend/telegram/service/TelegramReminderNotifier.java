package com.remindme.backend.telegram.service;

import com.remindme.backend.conversation.service.ReminderReplyFormatter;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.scheduler.ReminderDeliveryException;
import com.remindme.backend.reminder.scheduler.ReminderNotifier;
import com.remindme.backend.telegram.bot.TelegramWebhookBotAdapter;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

public class TelegramReminderNotifier implements ReminderNotifier {

  private final TelegramWebhookBotAdapter webhookBot;
  private final ReminderReplyFormatter formatter;

  public TelegramReminderNotifier(
      TelegramWebhookBotAdapter webhookBot, ReminderReplyFormatter formatter) {
    this.webhookBot = webhookBot;
    this.formatter = formatter;
  }

  @Override
  public void deliver(Reminder reminder) {
    send(reminder, formatter.due(reminder));
  }

  @Override
  public void deliverPreNotice(Reminder reminder) {
    send(reminder, formatter.preNotice(reminder));
  }

  private void send(Reminder reminder, String text) {
    try {
      webhookBot.sendText(reminder.getChatId(), text);
    } catch (TelegramApiException ex) {
      throw new ReminderDeliveryException(
          "Telegram rejected reminder " + reminder.getId() + ": " + ex.getMessage(), ex);
    }
  }
}
