package com.remindme.backend.reminder.config;

import com.remindme.backend.reminder.service.RecurrenceCalculator;
import com.remindme.backend.reminder.service.TimeResolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(ReminderProperties.class)
public class ReminderConfiguration {

  @Bean
  public TimeResolver timeResolver(ReminderProperties properties) {
    return new TimeResolver(properties.getDefaultTime());
  }

  @Bean
  public RecurrenceCalculator recurrenceCalculator(ReminderProperties properties) {
    return new RecurrenceCalculator(properties.getZone());
  }
}
