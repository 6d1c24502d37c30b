package com.remindme.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.remindme.backend.command.model.FilterMode;
import com.remindme.backend.reminder.domain.ReminderStatus;
import jakarta.validation.constraints.Positive;
import java.time.OffsetDateTime;

public record FilterPayload(
    FilterMode mode,
    ReminderStatus status,
    String search,
    OffsetDateTime from,
    OffsetDateTime to,
    @JsonProperty("reminder_id") @Positive Long reminderId) {}
