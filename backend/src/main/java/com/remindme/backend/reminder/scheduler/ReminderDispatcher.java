package com.remindme.backend.reminder.scheduler;

import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.service.ReminderService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "app.reminders.dispatch",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

  private final ReminderService reminderService;
  private final ObjectProvider<ReminderNotifier> notifier;
  private final ReminderProperties properties;
  private final MeterRegistry meterRegistry;

  public ReminderDispatcher(
      ReminderService reminderService,
      ObjectProvider<ReminderNotifier> notifier,
      ReminderProperties properties,
      MeterRegistry meterRegistry) {
    this.reminderService = reminderService;
    this.notifier = notifier;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  @Scheduled(fixedDelayString = "${app.reminders.dispatch.poll-delay:PT30S}")
  public void dispatchDue() {
    ReminderNotifier target = notifier.getIfAvailable();
    if (target == null) {
      log.trace("No reminder notifier configured, skipping dispatch");
      return;
    }
    dispatchPreNotices(target);
    List<Reminder> due;
    try {
      due = reminderService.findDue(properties.getDispatch().getBatchSize());
    } catch (Exception ex) {
      log.error("Failed to load due reminders", ex);
      meterRegistry.counter("reminder.dispatch.count", "result", "error").increment();
      return;
    }
    if (!due.isEmpty()) {
      log.debug("Dispatching {} due reminder(s)", due.size());
    }
    for (Reminder reminder : due) {
      dispatch(target, reminder);
    }
  }

  private void dispatchPreNotices(ReminderNotifier target) {
    List<Reminder> upcoming;
    try {
      upcoming = reminderService.findDuePreNotices(properties.getDispatch().getBatchSize());
    } catch (Exception ex) {
      log.error("Failed to load due advance notices", ex);
      meterRegistry.counter("reminder.pre_notice.count", "result", "error").increment();
      return;
    }
    for (Reminder reminder : upcoming) {
      dispatchPreNotice(target, reminder);
    }
  }

  void dispatchPreNotice(ReminderNotifier target, Reminder reminder) {
    String result = "sent";
    try {
      target.deliverPreNotice(reminder);
      if (!reminderService.markPreNotified(reminder.getChatId(), reminder.getId())) {
        result = "stale";
      }
    } catch (ReminderDeliveryException ex) {
      result = "undelivered";
      log.warn(
          "Advance notice of reminder {} of chat {} not delivered, will retry: {}",
          reminder.getId(),
          reminder.getChatId(),
          ex.getMessage());
    } catch (Exception ex) {
      result = "error";
      log.error(
          "Failed to send advance notice of reminder {} of chat {}",
          reminder.getId(),
          reminder.getChatId(),
          ex);
    } finally {
      meterRegistry.counter("reminder.pre_notice.count", "result", result).increment();
    }
  }

  void dispatch(ReminderNotifier target, Reminder reminder) {
    String result = "sent";
    try {
      target.deliver(reminder);
      reminderService
          .markSent(reminder.getChatId(), reminder.getId())
          .ifPresent(
              next ->
                  log.debug(
                      "Scheduled occurrence {} of series {} at {}",
                      next.getOccurrenceIndex(),
                      next.getSeriesId(),
                      next.getDueAt()));
    } catch (ReminderDeliveryException ex) {
      result = "undelivered";
      log.warn(
          "Reminder {} of chat {} not delivered, will retry: {}",
          reminder.getId(),
          reminder.getChatId(),
          ex.getMessage());
    } catch (Exception ex) {
      result = "error";
      log.error(
          "Failed to dispatch reminder {} of chat {}", reminder.getId(), reminder.getChatId(), ex);
    } finally {
      meterRegistry.counter("reminder.dispatch.count", "result", result).increment();
    }
  }
}
