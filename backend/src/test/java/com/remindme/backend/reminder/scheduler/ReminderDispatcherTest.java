package com.remindme.backend.reminder.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.remindme.backend.reminder.config.ReminderProperties;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.service.ReminderService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ReminderDispatcherTest {

  @Mock private ReminderService reminderService;
  @Mock private ObjectProvider<ReminderNotifier> notifierProvider;
  @Mock private ReminderNotifier notifier;

  private SimpleMeterRegistry meterRegistry;
  private ReminderDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ReminderProperties properties = new ReminderProperties();
    properties.getDispatch().setBatchSize(50);
    dispatcher =
        new ReminderDispatcher(reminderService, notifierProvider, properties, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    meterRegistry.close();
  }

  @Test
  void deliversDueRemindersAndMarksThemSent() {
    Reminder first = reminder(1L);
    Reminder second = reminder(2L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDue(50)).willReturn(List.of(first, second));
    given(reminderService.markSent(anyLong(), anyLong())).willReturn(Optional.empty());

    dispatcher.dispatchDue();

    verify(notifier).deliver(first);
    verify(notifier).deliver(second);
    verify(reminderService).markSent(10L, 1L);
    verify(reminderService).markSent(10L, 2L);
    assertThat(meterRegistry.counter("reminder.dispatch.count", "result", "sent").count())
        .isEqualTo(2.0d);
  }

  @Test
  void undeliveredReminderStaysPending() {
    Reminder reminder = reminder(3L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDue(50)).willReturn(List.of(reminder));
    willThrow(new ReminderDeliveryException("blocked", null)).given(notifier).deliver(reminder);

    dispatcher.dispatchDue();

    verify(reminderService, never()).markSent(anyLong(), anyLong());
    assertThat(meterRegistry.counter("reminder.dispatch.count", "result", "undelivered").count())
        .isEqualTo(1.0d);
  }

  @Test
  void oneFailureDoesNotStopTheBatch() {
    Reminder broken = reminder(4L);
    Reminder healthy = reminder(5L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDue(50)).willReturn(List.of(broken, healthy));
    willThrow(new IllegalStateException("boom")).given(notifier).deliver(broken);
    given(reminderService.markSent(10L, 5L)).willReturn(Optional.empty());

    dispatcher.dispatchDue();

    verify(reminderService).markSent(10L, 5L);
    assertThat(meterRegistry.counter("reminder.dispatch.count", "result", "error").count())
        .isEqualTo(1.0d);
  }

  @Test
  void sendsAdvanceNoticesBeforeDueReminders() {
    Reminder upcoming = reminder(6L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDuePreNotices(50)).willReturn(List.of(upcoming));
    given(reminderService.markPreNotified(10L, 6L)).willReturn(true);

    dispatcher.dispatchDue();

    InOrder inOrder = inOrder(notifier, reminderService);
    inOrder.verify(notifier).deliverPreNotice(upcoming);
    inOrder.verify(reminderService).markPreNotified(10L, 6L);
    inOrder.verify(reminderService).findDue(50);
    verify(notifier, never()).deliver(upcoming);
    assertThat(meterRegistry.counter("reminder.pre_notice.count", "result", "sent").count())
        .isEqualTo(1.0d);
  }

  @Test
  void undeliveredAdvanceNoticeIsRetriedLater() {
    Reminder upcoming = reminder(7L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDuePreNotices(50)).willReturn(List.of(upcoming));
    willThrow(new ReminderDeliveryException("blocked", null))
        .given(notifier)
        .deliverPreNotice(upcoming);

    dispatcher.dispatchDue();

    verify(reminderService, never()).markPreNotified(anyLong(), anyLong());
    assertThat(
            meterRegistry.counter("reminder.pre_notice.count", "result", "undelivered").count())
        .isEqualTo(1.0d);
  }

  @Test
  void advanceNoticeOfCancelledReminderIsCountedAsStale() {
    Reminder cancelled = reminder(8L);
    given(reminderService.markPreNotified(10L, 8L)).willReturn(false);

    dispatcher.dispatchPreNotice(notifier, cancelled);

    assertThat(meterRegistry.counter("reminder.pre_notice.count", "result", "stale").count())
        .isEqualTo(1.0d);
  }

  @Test
  void failedAdvanceNoticeLookupStillDispatchesDueReminders() {
    Reminder due = reminder(9L);
    given(notifierProvider.getIfAvailable()).willReturn(notifier);
    given(reminderService.findDuePreNotices(50))
        .willThrow(new IllegalStateException("store down"));
    given(reminderService.findDue(50)).willReturn(List.of(due));
    given(reminderService.markSent(10L, 9L)).willReturn(Optional.empty());

    dispatcher.dispatchDue();

    verify(notifier).deliver(due);
    assertThat(meterRegistry.counter("reminder.pre_notice.count", "result", "error").count())
        .isEqualTo(1.0d);
  }

  @Test
  void skipsWithoutNotifier() {
    given(notifierProvider.getIfAvailable()).willReturn(null);

    dispatcher.dispatchDue();

    verify(reminderService, never()).findDuePreNotices(anyInt());
    verify(reminderService, never()).findDue(anyInt());
    verifyNoInteractions(notifier);
  }

  private static Reminder reminder(long id) {
    Reminder reminder =
        Reminder.pending(10L, "Напоминание " + id, Instant.parse("2025-03-12T10:00:00Z"), null,
            Instant.parse("2025-03-11T10:00:00Z"));
    ReflectionTestUtils.setField(reminder, "id", id);
    return reminder;
  }
}
