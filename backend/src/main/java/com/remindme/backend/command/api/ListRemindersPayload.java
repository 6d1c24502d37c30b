package com.remindme.backend.command.api;

import jakarta.validation.Valid;

public record ListRemindersPayload(@Valid FilterPayload filter) implements AssistantCommandPayload {}
