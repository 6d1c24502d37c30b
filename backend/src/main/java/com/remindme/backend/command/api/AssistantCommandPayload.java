package com.remindme.backend.command.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Raw command emitted by the language model, discriminated by the {@code command} property. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "command")
@JsonSubTypes({
  @JsonSubTypes.Type(value = CreateRemindersPayload.class, name = "create_reminders"),
  @JsonSubTypes.Type(value = ListRemindersPayload.class, name = "list_reminders"),
  @JsonSubTypes.Type(value = DeleteRemindersPayload.class, name = "delete_reminders")
})
public sealed interface AssistantCommandPayload
    permits CreateRemindersPayload, ListRemindersPayload, DeleteRemindersPayload {}
