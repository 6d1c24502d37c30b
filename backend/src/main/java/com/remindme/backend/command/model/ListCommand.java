package com.remindme.backend.command.model;

import java.util.Objects;

public record ListCommand(ReminderFilter filter) implements ReminderCommand {

  public ListCommand {
    Objects.requireNonNull(filter, "filter");
  }

  @Override
  public CommandKind kind() {
    return CommandKind.LIST;
  }
}
