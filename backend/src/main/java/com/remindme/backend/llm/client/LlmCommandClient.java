package com.remindme.backend.llm.client;

import java.time.ZonedDateTime;

/** Turns a free-text chat message into the raw JSON text of one command. */
public interface LlmCommandClient {

  /**
   * @throws TransientUpstreamException on quota, connection or timeout failures
   * @throws PermanentUpstreamException when the provider rejects the request
   */
  LlmCompletion complete(String userText, ZonedDateTime now);
}
