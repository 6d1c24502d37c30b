package com.remindme.backend.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Base class of tests that need the full context against a real PostgreSQL. */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresTestContainer {

  private static String jdbcUrlWithSslDisabled() {
    String url = SingletonPostgresContainer.getInstance().getJdbcUrl();
    if (url.contains("sslmode=")) {
      return url;
    }
    String separator = url.contains("?") ? "&" : "?";
    return url + separator + "sslmode=disable";
  }

  @DynamicPropertySource
  static void configure(DynamicPropertyRegistry registry) {
    SingletonPostgresContainer postgres = SingletonPostgresContainer.getInstance();
    registry.add("spring.datasource.url", PostgresTestContainer::jdbcUrlWithSslDisabled);
    registry.add("spring.datasource.username", postgres::getUsername);
    registry.add("spring.datasource.password", postgres::getPassword);
    registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "4");
    registry.add("spring.datasource.hikari.minimum-idle", () -> "1");
    registry.add("spring.ai.openai.api-key", () -> "test-key");
    registry.add("spring.ai.openai.base-url", () -> "https://example.invalid");
    registry.add("app.telegram.enabled", () -> "false");
    registry.add("app.reminders.dispatch.enabled", () -> "false");
  }
}
