package com.remindme.backend.telegram.bot;

import com.remindme.backend.telegram.config.TelegramBotProperties;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.util.StringUtils;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/** Registers the webhook with Telegram on startup and removes it on shutdown. */
public class TelegramBotLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(TelegramBotLifecycle.class);

  private final TelegramBotProperties properties;
  private final TelegramWebhookBotAdapter webhookBot;

  private volatile boolean running;

  public TelegramBotLifecycle(
      TelegramBotProperties properties, TelegramWebhookBotAdapter webhookBot) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.webhookBot = Objects.requireNonNull(webhookBot, "webhookBot");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (!properties.getWebhook().isRegister()) {
      log.info("Telegram webhook registration disabled, expecting updates at {}", webhookPath());
      running = true;
      return;
    }
    String webhookUrl = webhookUrl();
    if (!StringUtils.hasText(webhookUrl)) {
      throw new IllegalStateException(
          "Webhook URL must be configured (app.telegram.webhook.external-url)");
    }
    try {
      webhookBot.setWebhook(buildSetWebhook(webhookUrl));
    } catch (TelegramApiException ex) {
      throw new IllegalStateException("Failed to register Telegram webhook", ex);
    }
    running = true;
    log.info("Telegram webhook registered at {}", webhookUrl);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    try {
      if (properties.getWebhook().isRegister()) {
        webhookBot.execute(new DeleteWebhook());
      }
    } catch (TelegramApiException ex) {
      log.warn("Failed to delete Telegram webhook: {}", ex.getMessage());
    } finally {
      running = false;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  SetWebhook buildSetWebhook(String webhookUrl) {
    SetWebhook.SetWebhookBuilder builder =
        SetWebhook.builder()
            .url(webhookUrl)
            .dropPendingUpdates(properties.getWebhook().isDropPendingUpdates());
    List<String> allowedUpdates = properties.getAllowedUpdates();
    if (!allowedUpdates.isEmpty()) {
      builder.allowedUpdates(List.copyOf(allowedUpdates));
    }
    String secretToken = properties.getWebhook().getSecretToken();
    if (StringUtils.hasText(secretToken)) {
      builder.secretToken(secretToken);
    }
    return builder.build();
  }

  String webhookUrl() {
    String externalUrl = properties.getWebhook().getExternalUrl();
    if (!StringUtils.hasText(externalUrl)) {
      return null;
    }
    String base =
        externalUrl.endsWith("/")
            ? externalUrl.substring(0, externalUrl.length() - 1)
            : externalUrl;
    return base + webhookPath();
  }

  private String webhookPath() {
    String path = properties.getWebhook().getPath();
    if (!StringUtils.hasText(path)) {
      return "";
    }
    return path.startsWith("/") ? path : "/" + path;
  }
}
