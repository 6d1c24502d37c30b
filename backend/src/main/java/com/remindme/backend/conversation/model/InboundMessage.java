package com.remindme.backend.conversation.model;

import java.time.Instant;

/** A text message received from a chat, with the id of the update that delivered it. */
public record InboundMessage(long updateId, long chatId, String text, Instant sentAt) {}
