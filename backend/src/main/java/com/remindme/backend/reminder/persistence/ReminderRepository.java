package com.remindme.backend.reminder.persistence;

import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.domain.ReminderStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReminderRepository
    extends JpaRepository<Reminder, Long>, JpaSpecificationExecutor<Reminder> {

  /** Serializes multi-row commands of one chat until the surrounding transaction ends. */
  @Query(value = "select 1 from pg_advisory_xact_lock(:chatId)", nativeQuery = true)
  Integer lockChat(@Param("chatId") long chatId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select r from Reminder r where r.id = :id")
  Optional<Reminder> findByIdForUpdate(@Param("id") Long id);

  @Query(
      "select r from Reminder r where r.status = :status and r.dueAt <= :now"
          + " order by r.dueAt asc, r.id asc")
  List<Reminder> findDue(
      @Param("status") ReminderStatus status, @Param("now") Instant now, Pageable pageable);

  @Query(
      "select r from Reminder r where r.status = :status and r.preNotifyAt <= :now"
          + " and r.preNotifiedAt is null and r.dueAt > :now"
          + " order by r.preNotifyAt asc, r.id asc")
  List<Reminder> findDuePreNotices(
      @Param("status") ReminderStatus status, @Param("now") Instant now, Pageable pageable);

  boolean existsBySeriesIdAndOccurrenceIndexGreaterThan(UUID seriesId, int occurrenceIndex);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Reminder r set r.status = :target, r.updatedAt = :now"
          + " where r.chatId = :chatId and r.id in :ids and r.status = :source")
  int transitionAll(
      @Param("chatId") long chatId,
      @Param("ids") Collection<Long> ids,
      @Param("source") ReminderStatus source,
      @Param("target") ReminderStatus target,
      @Param("now") Instant now);
}
