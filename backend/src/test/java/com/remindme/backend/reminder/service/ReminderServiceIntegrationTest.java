package com.remindme.backend.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DaySpec;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.ReminderFilter;
import com.remindme.backend.command.model.ReminderSpec;
import com.remindme.backend.reminder.domain.RecurrenceFrequency;
import com.remindme.backend.reminder.domain.RecurrenceRule;
import com.remindme.backend.reminder.domain.Reminder;
import com.remindme.backend.reminder.domain.ReminderStatus;
import com.remindme.backend.reminder.persistence.ReminderRepository;
import com.remindme.backend.support.PostgresTestContainer;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ReminderServiceIntegrationTest extends PostgresTestContainer {

  @Autowired private ReminderService reminderService;
  @Autowired private ReminderRepository reminderRepository;

  private long chatId;

  @BeforeEach
  void setUp() {
    chatId = ThreadLocalRandom.current().nextLong(1_000_000L, Long.MAX_VALUE);
  }

  @Test
  void createsAndListsInDueOrder() {
    reminderService.create(
        chatId,
        CreateCommand.of(
            ReminderSpec.at("второе", DaySpec.dayAfterTomorrow(), LocalTime.of(9, 0)),
            ReminderSpec.at("первое", DaySpec.tomorrow(), LocalTime.of(9, 0))));

    List<Reminder> listed = reminderService.list(chatId, ReminderFilter.all());

    assertThat(listed).extracting(Reminder::getTitle).containsExactly("первое", "второе");
    assertThat(listed).allMatch(reminder -> reminder.getId() != null);
  }

  @Test
  void searchIsCaseInsensitiveAndTreatsWildcardsLiterally() {
    reminderService.create(
        chatId,
        CreateCommand.of(
            ReminderSpec.of("Отчёт готов на 100%", DaySpec.tomorrow()),
            ReminderSpec.of("Отчёт 1000 строк", DaySpec.tomorrow())));

    assertThat(reminderService.list(chatId, ReminderFilter.search("отчёт")))
        .hasSize(2);
    assertThat(reminderService.list(chatId, ReminderFilter.search("100%")))
        .extracting(Reminder::getTitle)
        .containsExactly("Отчёт готов на 100%");
  }

  @Test
  void lastNCancelsNewestAndKeepsOthers() {
    for (String title : List.of("a", "b", "c")) {
      reminderService.create(chatId, CreateCommand.of(ReminderSpec.of(title, DaySpec.tomorrow())));
    }

    DeletionOutcome tooMany =
        reminderService.delete(chatId, DeleteCommand.lastN(ReminderFilter.all(), 5));
    DeletionOutcome outcome =
        reminderService.delete(chatId, DeleteCommand.lastN(ReminderFilter.all(), 2));

    assertThat(tooMany.isNothingToDelete()).isTrue();
    assertThat(tooMany.available()).isEqualTo(3);
    assertThat(outcome.deleted()).extracting(Reminder::getTitle).containsExactlyInAnyOrder("b", "c");
    assertThat(reminderService.list(chatId, ReminderFilter.withStatus(ReminderStatus.PENDING)))
        .extracting(Reminder::getTitle)
        .containsExactly("a");
    assertThat(reminderService.list(chatId, ReminderFilter.all()))
        .extracting(Reminder::getTitle)
        .containsExactly("a");
  }

  @Test
  void deliveredSeriesSpawnsNextOccurrenceOnce() {
    Reminder first =
        reminderService
            .create(
                chatId,
                CreateCommand.of(
                    ReminderSpec.of("Зарядка", DaySpec.tomorrow())
                        .repeating(
                            RecurrenceRule.every(RecurrenceFrequency.DAILY, 1)
                                .withMaxOccurrences(2))))
            .get(0);

    Optional<Reminder> next = reminderService.markSent(chatId, first.getId());
    Optional<Reminder> repeated = reminderService.markSent(chatId, first.getId());

    assertThat(next).isPresent();
    assertThat(next.get().getOccurrenceIndex()).isEqualTo(2);
    assertThat(repeated).isEmpty();
    assertThat(reminderRepository.findById(first.getId()))
        .map(Reminder::getStatus)
        .contains(ReminderStatus.SENT);

    Optional<Reminder> afterLast = reminderService.markSent(chatId, next.get().getId());
    assertThat(afterLast).isEmpty();
    assertThat(reminderService.list(chatId, ReminderFilter.withStatus(ReminderStatus.PENDING)))
        .isEmpty();
  }

  @Test
  void advanceNoticeIsStoredOnTheReminderRowAndStaysOutOfListings() {
    Reminder created =
        reminderService
            .create(
                chatId,
                CreateCommand.of(
                    ReminderSpec.at("Встреча", DaySpec.dayAfterTomorrow(), LocalTime.of(9, 0))))
            .get(0);

    Reminder stored = reminderRepository.findById(created.getId()).orElseThrow();
    assertThat(stored.getPreNotifyAt()).isEqualTo(stored.getDueAt().minus(Duration.ofHours(1)));
    assertThat(stored.getPreNotifiedAt()).isNull();
    assertThat(reminderService.list(chatId, ReminderFilter.all()))
        .extracting(Reminder::getId)
        .containsExactly(created.getId());
    // not due for another day
    assertThat(reminderService.findDuePreNotices(100))
        .extracting(Reminder::getId)
        .doesNotContain(created.getId());
  }
}
