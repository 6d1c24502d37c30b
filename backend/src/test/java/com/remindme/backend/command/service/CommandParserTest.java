package com.remindme.backend.command.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DayReference;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.DeleteMode;
import com.remindme.backend.command.model.FilterMode;
import com.remindme.backend.command.model.ListCommand;
import com.remindme.backend.command.model.ReminderCommand;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.UpstreamFailureKind;
import com.remindme.backend.reminder.domain.RecurrenceFrequency;
import com.remindme.backend.reminder.domain.ReminderStatus;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandParserTest {

  private ValidatorFactory validatorFactory;
  private CommandParser parser;

  @BeforeEach
  void setUp() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    parser =
        new CommandParser(
            new ObjectMapper().findAndRegisterModules(),
            new CommandValidator(validatorFactory.getValidator()));
  }

  @AfterEach
  void tearDown() {
    validatorFactory.close();
  }

  @Test
  void parsesCreateCommandWithRecurrence() {
    String json =
        """
        {"command":"create_reminders","reminders":[
          {"title":"Купить молоко","day":"specific_date","date":"2030-03-14","time":"9:30",
           "recurrence":{"frequency":"weekly","interval":2,"max_occurrences":4}}
        ]}
        """;

    ReminderCommand command = parser.parse(json);

    assertThat(command).isInstanceOf(CreateCommand.class);
    CreateCommand create = (CreateCommand) command;
    assertThat(create.reminders().get(0).day().reference()).isEqualTo(DayReference.SPECIFIC_DATE);
    assertThat(create.reminders().get(0).day().date()).isEqualTo(LocalDate.of(2030, 3, 14));
    assertThat(create.reminders().get(0).time()).isEqualTo(LocalTime.of(9, 30));
    assertThat(create.reminders().get(0).recurrence().frequency())
        .isEqualTo(RecurrenceFrequency.WEEKLY);
    assertThat(create.reminders().get(0).recurrence().interval()).isEqualTo(2);
    assertThat(create.reminders().get(0).recurrence().maxOccurrences()).isEqualTo(4);
  }

  @Test
  void unwrapsMarkdownCodeFence() {
    String json =
        """
        ```json
        {"command":"list_reminders","filter":{"mode":"status","status":"sent"}}
        ```
        """;

    ListCommand command = (ListCommand) parser.parse(json);

    assertThat(command.filter().mode()).isEqualTo(FilterMode.STATUS);
    assertThat(command.filter().status()).isEqualTo(ReminderStatus.SENT);
  }

  @Test
  void parsesDeleteLastN() {
    DeleteCommand command =
        (DeleteCommand)
            parser.parse(
                "{\"command\":\"delete_reminders\",\"mode\":\"last_n\",\"last_n\":3}");

    assertThat(command.mode()).isEqualTo(DeleteMode.LAST_N);
    assertThat(command.lastN()).isEqualTo(3);
  }

  @Test
  void plainTextIsMalformedResponse() {
    assertThatThrownBy(() -> parser.parse("Конечно! Напомню завтра."))
        .isInstanceOf(PermanentUpstreamException.class)
        .satisfies(
            error ->
                assertThat(((PermanentUpstreamException) error).getKind())
                    .isEqualTo(UpstreamFailureKind.MALFORMED_RESPONSE));
  }

  @Test
  void emptyOutputIsMalformedResponse() {
    assertThatThrownBy(() -> parser.parse("   "))
        .isInstanceOf(PermanentUpstreamException.class);
  }

  @Test
  void unknownCommandIsMalformedResponse() {
    assertThatThrownBy(() -> parser.parse("{\"command\":\"drop_database\"}"))
        .isInstanceOf(PermanentUpstreamException.class)
        .satisfies(
            error ->
                assertThat(((PermanentUpstreamException) error).getKind())
                    .isEqualTo(UpstreamFailureKind.MALFORMED_RESPONSE));
  }

  @Test
  void unknownFieldIsValidationFailure() {
    assertThatThrownBy(
            () -> parser.parse("{\"command\":\"list_reminders\",\"sql\":\"delete from reminder\"}"))
        .isInstanceOf(CommandValidationException.class)
        .satisfies(
            error ->
                assertThat(((CommandValidationException) error).firstViolation().field())
                    .isEqualTo("sql"));
  }

  @Test
  void unknownEnumValueIsValidationFailure() {
    assertThatThrownBy(
            () ->
                parser.parse(
                    "{\"command\":\"create_reminders\",\"reminders\":[{\"title\":\"x\",\"day\":\"yesterday\"}]}"))
        .isInstanceOf(CommandValidationException.class);
  }
}
