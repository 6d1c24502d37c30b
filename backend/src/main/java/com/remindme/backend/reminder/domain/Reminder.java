package com.remindme.backend.reminder.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(
    name = "reminder",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_reminder_series_occurrence",
            columnNames = {"series_id", "occurrence_index"}))
public class Reminder {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "chat_id", nullable = false, updatable = false)
  private long chatId;

  @Column(name = "title", nullable = false, length = 1000)
  private String title;

  @Column(name = "due_at", nullable = false)
  private Instant dueAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private ReminderStatus status;

  @Embedded private RecurrenceRule recurrence;

  @Column(name = "series_id", updatable = false)
  private UUID seriesId;

  @Column(name = "occurrence_index", nullable = false, updatable = false)
  private int occurrenceIndex;

  /** When the advance notice goes out; {@code null} when the reminder has none. */
  @Column(name = "pre_notify_at")
  private Instant preNotifyAt;

  @Column(name = "pre_notified_at")
  private Instant preNotifiedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Reminder() {}

  private Reminder(
      long chatId,
      String title,
      Instant dueAt,
      RecurrenceRule recurrence,
      UUID seriesId,
      int occurrenceIndex,
      Instant createdAt) {
    this.chatId = chatId;
    this.title = Objects.requireNonNull(title, "title");
    this.dueAt = Objects.requireNonNull(dueAt, "dueAt");
    this.recurrence = recurrence;
    this.seriesId = seriesId;
    this.occurrenceIndex = occurrenceIndex;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.updatedAt = createdAt;
    this.status = ReminderStatus.PENDING;
  }

  public static Reminder pending(
      long chatId, String title, Instant dueAt, RecurrenceRule recurrence, Instant createdAt) {
    UUID seriesId = recurrence != null ? UUID.randomUUID() : null;
    return new Reminder(chatId, title, dueAt, recurrence, seriesId, 1, createdAt);
  }

  /** Builds the pending row of the given later occurrence in this reminder's series. */
  public Reminder nextOccurrence(Instant nextDueAt, int nextIndex, Instant createdAt) {
    if (recurrence == null || seriesId == null) {
      throw new IllegalStateException("Reminder " + id + " is not recurring");
    }
    if (nextIndex <= occurrenceIndex) {
      throw new IllegalArgumentException(
          "Occurrence index must grow: " + nextIndex + " <= " + occurrenceIndex);
    }
    return new Reminder(chatId, title, nextDueAt, recurrence, seriesId, nextIndex, createdAt);
  }

  @PrePersist
  void onPersist() {
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  public void markSent(Instant at) {
    if (status != ReminderStatus.PENDING) {
      throw new IllegalStateException("Reminder " + id + " is " + status.value() + ", not pending");
    }
    status = ReminderStatus.SENT;
    updatedAt = Objects.requireNonNull(at, "at");
  }

  public void cancel(Instant at) {
    if (status == ReminderStatus.CANCELLED) {
      return;
    }
    status = ReminderStatus.CANCELLED;
    updatedAt = Objects.requireNonNull(at, "at");
  }

  /** Schedules the advance notice; it must go out before the reminder itself. */
  public void schedulePreNotice(Instant at) {
    if (!at.isBefore(dueAt)) {
      throw new IllegalArgumentException("Advance notice " + at + " is not before " + dueAt);
    }
    preNotifyAt = at;
  }

  public void markPreNotified(Instant at) {
    if (preNotifyAt == null) {
      throw new IllegalStateException("Reminder " + id + " has no advance notice");
    }
    preNotifiedAt = Objects.requireNonNull(at, "at");
    updatedAt = at;
  }

  /** Whether the advance notice still has to go out at {@code now}. */
  public boolean isPreNoticeDue(Instant now) {
    return status == ReminderStatus.PENDING
        && preNotifyAt != null
        && preNotifiedAt == null
        && !preNotifyAt.isAfter(now)
        && dueAt.isAfter(now);
  }

  public boolean isRecurring() {
    return recurrence != null;
  }

  public Long getId() {
    return id;
  }

  public long getChatId() {
    return chatId;
  }

  public String getTitle() {
    return title;
  }

  public Instant getDueAt() {
    return dueAt;
  }

  public ReminderStatus getStatus() {
    return status;
  }

  public RecurrenceRule getRecurrence() {
    return recurrence;
  }

  public UUID getSeriesId() {
    return seriesId;
  }

  public int getOccurrenceIndex() {
    return occurrenceIndex;
  }

  public Instant getPreNotifyAt() {
    return preNotifyAt;
  }

  public Instant getPreNotifiedAt() {
    return preNotifiedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
