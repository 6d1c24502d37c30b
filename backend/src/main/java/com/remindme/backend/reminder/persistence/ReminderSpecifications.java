package com.remindme.backend.reminder.persistence;

import com.remindme.backend.command.model.ReminderFilter;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.domain.ReminderStatus;
import java.time.Instant;
import java.util.Locale;
import org.springframework.data.jpa.domain.Specification;

public final class ReminderSpecifications {

  private ReminderSpecifications() {}

  /**
   * Reminders of {@code chatId} selected by {@code filter}. Cancelled reminders only match an
   * explicit {@code status=cancelled} filter; {@code today} is the range {@code [dayStart,
   * dayEnd)} computed by the caller in the chat's zone.
   */
  public static Specification<Reminder> matching(
      long chatId, ReminderFilter filter, Instant dayStart, Instant dayEnd) {
    Specification<Reminder> spec = Specification.where(ofChat(chatId));
    switch (filter.mode()) {
      case STATUS -> {
        return spec.and(withStatus(filter.status()));
      }
      case TODAY -> spec = spec.and(dueWithin(dayStart, dayEnd));
      case SEARCH -> spec = spec.and(titleContains(filter.search()));
      case INTERVAL -> spec = spec.and(dueWithin(filter.from(), filter.to()));
      case ID -> spec = spec.and(withId(filter.reminderId()));
      case ALL -> {
        // no extra predicate
      }
    }
    return spec.and(notCancelled());
  }

  public static Specification<Reminder> ofChat(long chatId) {
    return (root, query, cb) -> cb.equal(root.get("chatId"), chatId);
  }

  public static Specification<Reminder> withStatus(ReminderStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }

  static Specification<Reminder> notCancelled() {
    return (root, query, cb) -> cb.notEqual(root.get("status"), ReminderStatus.CANCELLED);
  }

  static Specification<Reminder> dueWithin(Instant from, Instant to) {
    return (root, query, cb) ->
        cb.and(
            cb.greaterThanOrEqualTo(root.<Instant>get("dueAt"), from),
            cb.lessThan(root.<Instant>get("dueAt"), to));
  }

  static Specification<Reminder> titleContains(String text) {
    String pattern = "%" + escapeLike(text.trim().toLowerCase(Locale.ROOT)) + "%";
    return (root, query, cb) -> cb.like(cb.lower(root.get("title")), pattern, '\\');
  }

  static Specification<Reminder> withId(Long id) {
    return (root, query, cb) -> cb.equal(root.get("id"), id);
  }

  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
