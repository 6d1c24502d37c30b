package com.remindme.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.remindme.backend.reminder.domain.RecurrenceFrequency;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;

public record RecurrencePayload(
    @NotNull RecurrenceFrequency frequency,
    @Min(1) Integer interval,
    @JsonProperty("max_occurrences") @Min(1) Integer maxOccurrences,
    @JsonProperty("ends_at") OffsetDateTime endsAt) {}
