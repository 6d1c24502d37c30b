package com.remindme.backend.command.model;

/**
 * A validated command. Instances are only produced by the command validator and need no further
 * interpretation of user text; consumers switch over {@link #kind()}.
 */
public sealed interface ReminderCommand permits CreateCommand, ListCommand, DeleteCommand {

  CommandKind kind();
}
