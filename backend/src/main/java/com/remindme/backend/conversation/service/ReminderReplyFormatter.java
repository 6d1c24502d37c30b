package com.remindme.backend.conversation.service;

import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.service.DeletionOutcome;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/** Russian chat texts for command results. */
@Component
public class ReminderReplyFormatter {

  private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  private final ZoneId zone;

  public ReminderReplyFormatter(ReminderProperties properties) {
    this.zone = properties.getZone();
  }

  public String created(List<Reminder> reminders) {
    StringBuilder text = new StringBuilder("Напоминания созданы:");
    reminders.forEach(reminder -> text.append('\n').append(line(reminder, false)));
    return text.toString();
  }

  public String listed(List<Reminder> reminders) {
    if (reminders.isEmpty()) {
      return "Напоминания не найдены.";
    }
    StringBuilder text = new StringBuilder("Найденные напоминания:");
    reminders.forEach(reminder -> text.append('\n').append(line(reminder, true)));
    return text.toString();
  }

  public String deleted(DeletionOutcome outcome) {
    if (outcome.isNothingToDelete()) {
      if (outcome.requested() != null && outcome.available() > 0) {
        return "Найдено только "
            + outcome.available()
            + " подходящих напоминаний из "
            + outcome.requested()
            + ", ничего не удалено.";
      }
      return "Подходящие напоминания не найдены, ничего не удалено.";
    }
    StringBuilder text = new StringBuilder("Удалено напоминаний: ").append(outcome.deletedCount());
    outcome.deleted().forEach(reminder -> text.append('\n').append(line(reminder, false)));
    return text.toString();
  }

  public String due(Reminder reminder) {
    return "Напоминание: " + reminder.getTitle();
  }

  public String preNotice(Reminder reminder) {
    return "Скоро напоминание: "
        + reminder.getTitle()
        + " в "
        + TIME_FORMAT.format(reminder.getDueAt().atZone(zone));
  }

  private String line(Reminder reminder, boolean withStatus) {
    StringBuilder line = new StringBuilder("- #").append(reminder.getId()).append(": ");
    if (withStatus) {
      line.append('[').append(reminder.getStatus().value()).append("] ");
    }
    line.append(reminder.getTitle())
        .append(" -> ")
        .append(DUE_FORMAT.format(reminder.getDueAt().atZone(zone)));
    if (reminder.isRecurring()) {
      line.append(", повтор: ").append(reminder.getRecurrence().describe());
    }
    return line.toString();
  }
}
