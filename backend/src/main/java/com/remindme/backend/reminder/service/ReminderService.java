package com.remindme.backend.reminder.service;

import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.DeleteMode;
import com.remindme.backend.command.model.ReminderFilter;
import com.remindme.backend.command.model.ReminderSpec;
import com.remindme.backend.command.service.FieldViolation;
import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.domain.RecurrenceRule;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.domain.ReminderStatus;
import com.remindme.backend.reminder.persistence.ReminderRepository;
import com.remindme.backend.reminder.persistence.ReminderSpecifications;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Executes validated reminder commands against the store. Every command runs in one transaction
 * holding the chat's advisory lock, so a command either fully applies or has no effect.
 */
@Service
public class ReminderService {

  private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

  static final Sort DISPLAY_ORDER =
      Sort.by(Sort.Order.asc("dueAt"), Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
  static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

  private static final Comparator<Reminder> BY_DUE_TIME =
      Comparator.comparing(Reminder::getDueAt)
          .thenComparing(Reminder::getCreatedAt)
          .thenComparing(Reminder::getId, Comparator.nullsLast(Comparator.naturalOrder()));

  private final ReminderRepository repository;
  private final TimeResolver timeResolver;
  private final RecurrenceCalculator recurrenceCalculator;
  private final ZoneId zone;
  private final Duration preNoticeLead;
  private final Clock clock;

  public ReminderService(
      ReminderRepository repository,
      TimeResolver timeResolver,
      RecurrenceCalculator recurrenceCalculator,
      ReminderProperties properties,
      Clock clock) {
    this.repository = repository;
    this.timeResolver = timeResolver;
    this.recurrenceCalculator = recurrenceCalculator;
    this.zone = properties.getZone();
    this.preNoticeLead = properties.getPreNoticeLead();
    this.clock = clock;
  }

  /** Creates all reminders of the command or none of them. */
  @Transactional
  public List<Reminder> create(long chatId, CreateCommand command) {
    ZonedDateTime now = now();
    List<Reminder> drafts = new ArrayList<>();
    List<FieldViolation> violations = new ArrayList<>();

    List<ReminderSpec> specs = command.reminders();
    for (int i = 0; i < specs.size(); i++) {
      String prefix = "reminders[" + i + "]";
      ReminderSpec spec = specs.get(i);
      try {
        Instant dueAt = timeResolver.resolve(now, spec.day(), spec.time()).toInstant();
        RecurrenceRule rule = spec.recurrence();
        if (rule != null && rule.endsAt() != null && !rule.endsAt().isAfter(dueAt)) {
          violations.add(
              new FieldViolation(
                  prefix + ".recurrence.ends_at",
                  "AfterFirstOccurrence",
                  "дата окончания должна быть позже первого напоминания"));
          continue;
        }
        Reminder draft = Reminder.pending(chatId, spec.title(), dueAt, rule, now.toInstant());
        schedulePreNotice(draft, now);
        drafts.add(draft);
      } catch (InvalidTimeSpecException ex) {
        violations.addAll(ex.under(prefix).getViolations());
      }
    }
    if (!violations.isEmpty()) {
      throw new InvalidTimeSpecException(violations);
    }

    List<Reminder> created =
        withStore(
            chatId,
            "create",
            () -> {
              repository.lockChat(chatId);
              return repository.saveAllAndFlush(drafts);
            });
    log.info("Created {} reminder(s) for chat {}", created.size(), chatId);
    return created;
  }

  /** Matching reminders ordered by due time, then creation order. */
  @Transactional(readOnly = true)
  public List<Reminder> list(long chatId, ReminderFilter filter) {
    return withStore(
        chatId, "list", () -> repository.findAll(specification(chatId, filter), DISPLAY_ORDER));
  }

  /**
   * Cancels the pending reminders selected by the command. {@code last_n} picks the most recently
   * created matches and deletes nothing when fewer than {@code n} match.
   */
  @Transactional
  public DeletionOutcome delete(long chatId, DeleteCommand command) {
    return withStore(
        chatId,
        "delete",
        () -> {
          repository.lockChat(chatId);
          Specification<Reminder> spec =
              specification(chatId, command.filter())
                  .and(ReminderSpecifications.withStatus(ReminderStatus.PENDING));

          List<Reminder> targets;
          if (command.mode() == DeleteMode.LAST_N) {
            int requested = command.lastN();
            List<Reminder> candidates = repository.findAll(spec, NEWEST_FIRST);
            if (candidates.size() < requested) {
              log.info(
                  "Chat {} asked to delete last {} reminder(s) but only {} match",
                  chatId,
                  requested,
                  candidates.size());
              return DeletionOutcome.nothingToDelete(requested, candidates.size());
            }
            targets = new ArrayList<>(candidates.subList(0, requested));
          } else {
            targets = new ArrayList<>(repository.findAll(spec, DISPLAY_ORDER));
            if (targets.isEmpty()) {
              return DeletionOutcome.nothingToDelete(null, 0);
            }
          }

          List<Long> ids = targets.stream().map(Reminder::getId).toList();
          Instant cancelledAt = clock.instant();
          int updated =
              repository.transitionAll(
                  chatId, ids, ReminderStatus.PENDING, ReminderStatus.CANCELLED, cancelledAt);
          if (updated != ids.size()) {
            throw new IllegalStateException(
                "Cancelled " + updated + " of " + ids.size() + " reminders of chat " + chatId);
          }
          targets.forEach(reminder -> reminder.cancel(cancelledAt));
          targets.sort(BY_DUE_TIME);
          log.info("Cancelled {} reminder(s) of chat {}", updated, chatId);
          return DeletionOutcome.deleted(targets, command.lastN());
        });
  }

  @Transactional(readOnly = true)
  public List<Reminder> findDue(int limit) {
    return repository.findDue(ReminderStatus.PENDING, clock.instant(), PageRequest.of(0, limit));
  }

  /**
   * Marks a delivered reminder as sent and, for a recurring one, creates its next pending
   * occurrence. Repeated calls for the same reminder change nothing.
   *
   * @return the spawned occurrence, if any
   */
  @Transactional
  public Optional<Reminder> markSent(long chatId, long reminderId) {
    return withStore(
        chatId,
        "dispatch",
        () -> {
          repository.lockChat(chatId);
          Optional<Reminder> found = repository.findByIdForUpdate(reminderId);
          if (found.isEmpty() || found.get().getStatus() != ReminderStatus.PENDING) {
            log.debug("Reminder {} is no longer pending, skipping", reminderId);
            return Optional.<Reminder>empty();
          }
          Instant now = clock.instant();
          Reminder reminder = found.get();
          reminder.markSent(now);
          if (!reminder.isRecurring()) {
            return Optional.<Reminder>empty();
          }
          return spawnNext(reminder, now);
        });
  }

  /** Pending reminders whose advance notice is due and whose own time has not come yet. */
  @Transactional(readOnly = true)
  public List<Reminder> findDuePreNotices(int limit) {
    return repository.findDuePreNotices(
        ReminderStatus.PENDING, clock.instant(), PageRequest.of(0, limit));
  }

  /**
   * Records that the advance notice of a reminder went out.
   *
   * @return {@code false} if the reminder is no longer waiting for its notice
   */
  @Transactional
  public boolean markPreNotified(long chatId, long reminderId) {
    return withStore(
        chatId,
        "pre-notice",
        () -> {
          Instant now = clock.instant();
          Optional<Reminder> found = repository.findByIdForUpdate(reminderId);
          if (found.isEmpty() || !found.get().isPreNoticeDue(now)) {
            log.debug("Advance notice of reminder {} is no longer due, skipping", reminderId);
            return false;
          }
          found.get().markPreNotified(now);
          return true;
        });
  }

  private Optional<Reminder> spawnNext(Reminder reminder, Instant now) {
    if (repository.existsBySeriesIdAndOccurrenceIndexGreaterThan(
        reminder.getSeriesId(), reminder.getOccurrenceIndex())) {
      return Optional.empty();
    }
    Optional<Reminder> next =
        recurrenceCalculator
            .next(
                reminder.getRecurrence(),
                reminder.getDueAt(),
                reminder.getOccurrenceIndex(),
                now)
            .map(
                occurrence -> {
                  Reminder spawned =
                      reminder.nextOccurrence(occurrence.dueAt(), occurrence.index(), now);
                  schedulePreNotice(spawned, now.atZone(zone));
                  return repository.save(spawned);
                });
    if (next.isEmpty()) {
      log.info("Series {} of chat {} has ended", reminder.getSeriesId(), reminder.getChatId());
    }
    return next;
  }

  /** Reminders due tomorrow or later get a notice {@code preNoticeLead} ahead of time. */
  private void schedulePreNotice(Reminder reminder, ZonedDateTime now) {
    if (preNoticeLead.isZero() || preNoticeLead.isNegative()) {
      return;
    }
    LocalDate dueDate = reminder.getDueAt().atZone(zone).toLocalDate();
    if (dueDate.isAfter(now.withZoneSameInstant(zone).toLocalDate())) {
      reminder.schedulePreNotice(reminder.getDueAt().minus(preNoticeLead));
    }
  }

  private Specification<Reminder> specification(long chatId, ReminderFilter filter) {
    LocalDate today = now().toLocalDate();
    return ReminderSpecifications.matching(
        chatId,
        filter,
        today.atStartOfDay(zone).toInstant(),
        today.plusDays(1).atStartOfDay(zone).toInstant());
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock.withZone(zone));
  }

  private <T> T withStore(long chatId, String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      log.error(
          "Reminder store failed for chat {} during {}: {}", chatId, operation, ex.getMessage(), ex);
      throw new ReminderStoreException(operation, ex);
    }
  }
}
