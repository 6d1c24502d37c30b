package com.remindme.backend.telegram.bot;

import com.remindme.backend.telegram.config.TelegramBotProperties;
import com.remindme.backend.telegram.service.TelegramUpdateHandler;
import java.util.Objects;
import java.util.function.Supplier;
import org.telegram.telegrambots.bots.TelegramWebhookBot;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Webhook bot of the reminder service. Updates go to the {@link TelegramUpdateHandler}, which
 * answers out of band through {@link #sendText(long, String)}; the handler is looked up on first
 * use because it sends through this bot.
 */
public class TelegramWebhookBotAdapter extends TelegramWebhookBot {

  private final TelegramBotProperties properties;
  private final Supplier<TelegramUpdateHandler> updateHandler;

  public TelegramWebhookBotAdapter(
      TelegramBotProperties properties, Supplier<TelegramUpdateHandler> updateHandler) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.updateHandler = Objects.requireNonNull(updateHandler, "updateHandler");
  }

  @Override
  public String getBotToken() {
    return properties.getBot().getToken();
  }

  @Override
  public String getBotUsername() {
    return properties.getBot().getUsername();
  }

  @Override
  public String getBotPath() {
    return properties.getWebhook().getPath();
  }

  @Override
  public BotApiMethod<?> onWebhookUpdateReceived(Update update) {
    updateHandler.get().handle(update);
    return null;
  }

  public void sendText(long chatId, String text) throws TelegramApiException {
    execute(SendMessage.builder().chatId(String.valueOf(chatId)).text(text).build());
  }
}
