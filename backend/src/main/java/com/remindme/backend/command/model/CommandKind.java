package com.remindme.backend.command.model;

public enum CommandKind {
  CREATE,
  LIST,
  DELETE
}
