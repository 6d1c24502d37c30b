package com.remindme.backend.telegram.config;

import com.remindme.backend.conversation.service.ReminderConversationService;
import com.remindme.backend.conversation.service.ReminderReplyFormatter;
import com.remindme.backend.reminder.scheduler.ReminderNotifier;
import com.remindme.backend.telegram.bot.TelegramBotLifecycle;
import com.remindme.backend.telegram.bot.TelegramWebhookBotAdapter;
import com.remindme.backend.telegram.service.TelegramReminderNotifier;
import com.remindme.backend.telegram.service.TelegramReminderUpdateHandler;
import com.remindme.backend.telegram.service.TelegramUpdateHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(TelegramBotProperties.class)
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramBotConfiguration {

  private static final int UPDATE_QUEUE_CAPACITY = 200;

  @Bean(destroyMethod = "shutdown")
  public ExecutorService telegramUpdateExecutor(TelegramBotProperties properties) {
    int threads = properties.getWorkerThreads();
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(UPDATE_QUEUE_CAPACITY),
        new CustomizableThreadFactory("telegram-update-"));
  }

  @Bean
  @ConditionalOnMissingBean
  public TelegramWebhookBotAdapter telegramWebhookBotAdapter(
      TelegramBotProperties properties, ObjectProvider<TelegramUpdateHandler> updateHandler) {
    return new TelegramWebhookBotAdapter(properties, updateHandler::getObject);
  }

  @Bean
  @ConditionalOnMissingBean(TelegramUpdateHandler.class)
  public TelegramReminderUpdateHandler telegramReminderUpdateHandler(
      ReminderConversationService conversationService,
      TelegramWebhookBotAdapter webhookBot,
      @Qualifier("telegramUpdateExecutor") ExecutorService executor) {
    return new TelegramReminderUpdateHandler(conversationService, webhookBot, executor);
  }

  @Bean
  public ReminderNotifier telegramReminderNotifier(
      TelegramWebhookBotAdapter webhookBot, ReminderReplyFormatter formatter) {
    return new TelegramReminderNotifier(webhookBot, formatter);
  }

  @Bean
  @ConditionalOnMissingBean
  public TelegramBotLifecycle telegramBotLifecycle(
      TelegramBotProperties properties, TelegramWebhookBotAdapter webhookBot) {
    return new TelegramBotLifecycle(properties, webhookBot);
  }
}
