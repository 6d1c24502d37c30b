package com.remindme.backend.command.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.remindme.backend.command.model.DayReference;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One reminder as produced by the model. {@code weekday} uses 0 for Monday through 6 for Sunday;
 * {@code time} is local wall-clock time in the chat's zone.
 */
public record ReminderDraftPayload(
    @NotBlank @Size(max = 1000) String title,
    @NotNull DayReference day,
    @Min(0) @Max(6) Integer weekday,
    LocalDate date,
    @JsonFormat(pattern = "H:mm") LocalTime time,
    @Valid RecurrencePayload recurrence) {}
