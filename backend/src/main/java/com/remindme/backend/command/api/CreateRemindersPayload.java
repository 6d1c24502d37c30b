package com.remindme.backend.command.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateRemindersPayload(
    @NotEmpty @Size(max = 30) List<@NotNull @Valid ReminderDraftPayload> reminders)
    implements AssistantCommandPayload {}
