package com.remindme.backend.command.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.remindme.backend.command.model.DeleteMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

public record DeleteRemindersPayload(
    DeleteMode mode,
    @JsonProperty("last_n") @Positive @Max(100) Integer lastN,
    @JsonProperty("confirm_all") Boolean confirmAll,
    @Valid FilterPayload filter)
    implements AssistantCommandPayload {}
