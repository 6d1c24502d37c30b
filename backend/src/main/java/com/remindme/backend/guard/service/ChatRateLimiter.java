package com.remindme.backend.guard.service;

import com.remindme.backend.guard.config.GuardProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * One resilience4j limiter per chat. A request beyond the permits of the current window is
 * rejected immediately; limiters of chats idle longer than the eviction period are dropped.
 */
@Slf4j
@Component
public class ChatRateLimiter {

  private final Map<Long, Entry> limiters = new ConcurrentHashMap<>();
  private final RateLimiterConfig config;
  private final GuardProperties.RateLimit properties;
  private final GuardMetrics metrics;
  private final Clock clock;

  public ChatRateLimiter(GuardProperties properties, GuardMetrics metrics, Clock clock) {
    this.properties = properties.getRateLimit();
    this.metrics = metrics;
    this.clock = clock;
    this.config =
        RateLimiterConfig.custom()
            .limitForPeriod(this.properties.getMaxRequests())
            .limitRefreshPeriod(this.properties.getWindow())
            .timeoutDuration(Duration.ZERO)
            .build();
  }

  /** @throws RateLimitedException when the chat has no permit left in the current window */
  public void acquire(long chatId) {
    Entry entry =
        limiters.computeIfAbsent(
            chatId, id -> new Entry(RateLimiter.of("chat-" + id, config), clock.instant()));
    entry.lastUsed = clock.instant();
    if (!entry.limiter.acquirePermission()) {
      metrics.recordRateLimited();
      log.info("Rate limited chat {}", chatId);
      throw new RateLimitedException(chatId, properties.getWindow());
    }
  }

  @Scheduled(fixedDelayString = "${app.guard.rate-limit.idle-eviction:PT10M}")
  public void evictIdle() {
    Instant cutoff = clock.instant().minus(properties.getIdleEviction());
    limiters.entrySet().removeIf(e -> e.getValue().lastUsed.isBefore(cutoff));
  }

  int trackedChats() {
    return limiters.size();
  }

  private static final class Entry {

    private final RateLimiter limiter;
    private volatile Instant lastUsed;

    private Entry(RateLimiter limiter, Instant lastUsed) {
      this.limiter = limiter;
      this.lastUsed = lastUsed;
    }
  }
}
