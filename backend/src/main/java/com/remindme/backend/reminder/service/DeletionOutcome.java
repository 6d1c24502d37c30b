package com.remindme.backend.reminder.service;

import com.remindme.backend.reminder.domain.Reminder;
import java.util.List;

/**
 * Result of a delete command. {@code NOTHING_TO_DELETE} is a normal outcome: either nothing
 * matched, or a {@code last_n} request asked for more reminders than {@code available}.
 */
public record DeletionOutcome(Status status, List<Reminder> deleted, Integer requested, int available) {

  public enum Status {
    DELETED,
    NOTHING_TO_DELETE
  }

  public DeletionOutcome {
    deleted = deleted != null ? List.copyOf(deleted) : List.of();
  }

  public static DeletionOutcome deleted(List<Reminder> reminders, Integer requested) {
    return new DeletionOutcome(Status.DELETED, reminders, requested, reminders.size());
  }

  public static DeletionOutcome nothingToDelete(Integer requested, int available) {
    return new DeletionOutcome(Status.NOTHING_TO_DELETE, List.of(), requested, available);
  }

  public boolean isNothingToDelete() {
    return status == Status.NOTHING_TO_DELETE;
  }

  public int deletedCount() {
    return deleted.size();
  }
}
