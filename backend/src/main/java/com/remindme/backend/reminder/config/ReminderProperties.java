package com.remindme.backend.reminder.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.reminders")
public class ReminderProperties {

  /** Local zone of the chats; "today", default times and calendar recurrence use it. */
  @NotNull private ZoneId zone = ZoneId.of("Europe/Moscow");

  /** Time used when a future day is requested without an explicit time. */
  @NotNull private LocalTime defaultTime = LocalTime.of(8, 0);

  /**
   * Lead of the advance notice sent before reminders due tomorrow or later; zero turns it off.
   */
  @NotNull private Duration preNoticeLead = Duration.ofHours(1);

  @NotNull private final Dispatch dispatch = new Dispatch();

  public ZoneId getZone() {
    return zone;
  }

  public void setZone(ZoneId zone) {
    this.zone = zone;
  }

  public LocalTime getDefaultTime() {
    return defaultTime;
  }

  public void setDefaultTime(LocalTime defaultTime) {
    this.defaultTime = defaultTime;
  }

  public Duration getPreNoticeLead() {
    return preNoticeLead;
  }

  public void setPreNoticeLead(Duration preNoticeLead) {
    this.preNoticeLead = preNoticeLead;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public static class Dispatch {

    private boolean enabled = true;

    private Duration pollDelay = Duration.ofSeconds(30);

    @Min(1) private int batchSize = 100;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getPollDelay() {
      return pollDelay;
    }

    public void setPollDelay(Duration pollDelay) {
      this.pollDelay = pollDelay;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }
}
