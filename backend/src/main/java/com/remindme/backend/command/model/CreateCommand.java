package com.remindme.backend.command.model;

import java.util.List;

public record CreateCommand(List<ReminderSpec> reminders) implements ReminderCommand {

  public CreateCommand {
    if (reminders == null || reminders.isEmpty()) {
      throw new IllegalArgumentException("reminders must not be empty");
    }
    reminders = List.copyOf(reminders);
  }

  public static CreateCommand of(ReminderSpec... reminders) {
    return new CreateCommand(List.of(reminders));
  }

  @Override
  public CommandKind kind() {
    return CommandKind.CREATE;
  }
}
