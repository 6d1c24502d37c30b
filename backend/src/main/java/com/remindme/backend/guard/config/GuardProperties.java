package com.remindme.backend.guard.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.guard")
public class GuardProperties {

  @NotNull private final Dedup dedup = new Dedup();

  @NotNull private final RateLimit rateLimit = new RateLimit();

  @NotNull private final Circuit circuit = new Circuit();

  @NotNull private final Retry retry = new Retry();

  public Dedup getDedup() {
    return dedup;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public Circuit getCircuit() {
    return circuit;
  }

  public Retry getRetry() {
    return retry;
  }

  public static class Dedup {

    /** How long a processed update id is remembered. */
    @NotNull private Duration horizon = Duration.ofHours(24);

    /** Updates whose message is older than this are acknowledged and skipped. */
    @NotNull private Duration maxUpdateAge = Duration.ofMinutes(5);

    public Duration getHorizon() {
      return horizon;
    }

    public void setHorizon(Duration horizon) {
      this.horizon = horizon;
    }

    public Duration getMaxUpdateAge() {
      return maxUpdateAge;
    }

    public void setMaxUpdateAge(Duration maxUpdateAge) {
      this.maxUpdateAge = maxUpdateAge;
    }
  }

  public static class RateLimit {

    @Min(1) private int maxRequests = 5;

    @NotNull private Duration window = Duration.ofSeconds(60);

    @NotNull private Duration idleEviction = Duration.ofMinutes(10);

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public Duration getIdleEviction() {
      return idleEviction;
    }

    public void setIdleEviction(Duration idleEviction) {
      this.idleEviction = idleEviction;
    }
  }

  public static class Circuit {

    /** Consecutive failed invocations that open the circuit. */
    @Min(1) private int failureThreshold = 3;

    @NotNull private Duration cooldown = Duration.ofSeconds(60);

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }
  }

  public static class Retry {

    /** Total attempts including the first call. */
    @Min(1) private int attempts = 3;

    @NotNull private Duration initialDelay = Duration.ofMillis(250);

    @DecimalMin("1.0") private double multiplier = 2.0;

    @NotNull private Duration maxDelay = Duration.ofSeconds(2);

    @NotNull private Duration maxElapsed = Duration.ofSeconds(10);

    public int getAttempts() {
      return attempts;
    }

    public void setAttempts(int attempts) {
      this.attempts = attempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public Duration getMaxElapsed() {
      return maxElapsed;
    }

    public void setMaxElapsed(Duration maxElapsed) {
      this.maxElapsed = maxElapsed;
    }
  }
}
