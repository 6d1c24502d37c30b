package com.remindme.backend.conversation.model;

import java.util.Objects;

/** Text to send back to the chat; a silent reply sends nothing. */
public record ConversationReply(String text) {

  private static final ConversationReply SILENT = new ConversationReply(null);

  public static ConversationReply silent() {
    return SILENT;
  }

  public static ConversationReply of(String text) {
    return new ConversationReply(Objects.requireNonNull(text, "text"));
  }

  public boolean isSilent() {
    return text == null;
  }
}
