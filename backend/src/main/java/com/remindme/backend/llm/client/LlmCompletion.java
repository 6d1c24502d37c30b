package com.remindme.backend.llm.client;

/**
 * Raw model output with its token usage. {@code estimatedUsage} is set when the provider reported
 * no usage and the counts were computed locally.
 */
public record LlmCompletion(
    String content, int promptTokens, int completionTokens, boolean estimatedUsage) {}
