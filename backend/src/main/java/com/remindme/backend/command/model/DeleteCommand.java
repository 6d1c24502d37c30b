package com.remindme.backend.command.model;

import java.util.Objects;

public record DeleteCommand(ReminderFilter filter, DeleteMode mode, Integer lastN)
    implements ReminderCommand {

  public DeleteCommand {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(mode, "mode");
    if (mode == DeleteMode.LAST_N && (lastN == null || lastN < 1)) {
      throw new IllegalArgumentException("last_n mode requires a positive count");
    }
  }

  public static DeleteCommand matching(ReminderFilter filter) {
    return new DeleteCommand(filter, DeleteMode.BY_FILTER, null);
  }

  public static DeleteCommand lastN(ReminderFilter filter, int count) {
    return new DeleteCommand(filter, DeleteMode.LAST_N, count);
  }

  @Override
  public CommandKind kind() {
    return CommandKind.DELETE;
  }
}
