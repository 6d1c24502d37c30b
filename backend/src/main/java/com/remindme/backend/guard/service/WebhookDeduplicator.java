package com.remindme.backend.guard.service;

import com.remindme.backend.guard.config.GuardProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Admits every webhook update id once within the dedup horizon. Concurrent deliveries of the same
 * id race on a single map entry, so exactly one of them is admitted.
 */
@Component
public class WebhookDeduplicator {

  private static final Logger log = LoggerFactory.getLogger(WebhookDeduplicator.class);

  private final Map<Long, Instant> admitted = new ConcurrentHashMap<>();
  private final GuardProperties.Dedup properties;
  private final GuardMetrics metrics;
  private final Clock clock;

  public WebhookDeduplicator(GuardProperties properties, GuardMetrics metrics, Clock clock) {
    this.properties = properties.getDedup();
    this.metrics = metrics;
    this.clock = clock;
  }

  public boolean admit(long updateId) {
    Instant now = clock.instant();
    Duration horizon = properties.getHorizon();
    AtomicBoolean fresh = new AtomicBoolean(false);
    admitted.compute(
        updateId,
        (id, seenAt) -> {
          if (seenAt == null || !seenAt.plus(horizon).isAfter(now)) {
            fresh.set(true);
            return now;
          }
          return seenAt;
        });
    if (fresh.get()) {
      metrics.recordDedup("admitted");
      return true;
    }
    metrics.recordDedup("duplicate");
    log.info("Skipping duplicate update {}", updateId);
    return false;
  }

  /** Whether a message sent at {@code sentAt} is too old to be answered. */
  public boolean isStale(Instant sentAt) {
    if (sentAt == null) {
      return false;
    }
    boolean stale = sentAt.plus(properties.getMaxUpdateAge()).isBefore(clock.instant());
    if (stale) {
      metrics.recordDedup("stale");
    }
    return stale;
  }

  @Scheduled(fixedDelayString = "${app.guard.dedup.purge-delay:PT10M}")
  public void purgeExpired() {
    Instant cutoff = clock.instant().minus(properties.getHorizon());
    int before = admitted.size();
    admitted.values().removeIf(seenAt -> !seenAt.isAfter(cutoff));
    int removed = before - admitted.size();
    if (removed > 0) {
      log.debug("Purged {} expired update id(s)", removed);
    }
  }

  int size() {
    return admitted.size();
  }
}
