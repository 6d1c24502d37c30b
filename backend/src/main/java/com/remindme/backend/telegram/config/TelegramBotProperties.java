package com.remindme.backend.telegram.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.telegram")
public class TelegramBotProperties {

  private boolean enabled;

  @NotNull private final Credentials bot = new Credentials();

  @NotNull private final Webhook webhook = new Webhook();

  /** Threads answering chat messages; webhook requests return before the model is called. */
  @Min(1) private int workerThreads = 4;

  private final List<String> allowedUpdates = new ArrayList<>(List.of("message"));

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Credentials getBot() {
    return bot;
  }

  public Webhook getWebhook() {
    return webhook;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public List<String> getAllowedUpdates() {
    return allowedUpdates;
  }

  public static class Credentials {

    @NotBlank private String token;

    @NotBlank private String username;

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }
  }

  public static class Webhook {

    private String externalUrl;

    private String path = "/telegram/update";

    private String secretToken;

    /** Register the webhook with Telegram on startup and remove it on shutdown. */
    private boolean register = true;

    private boolean dropPendingUpdates;

    public String getExternalUrl() {
      return externalUrl;
    }

    public void setExternalUrl(String externalUrl) {
      this.externalUrl = externalUrl;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public String getSecretToken() {
      return secretToken;
    }

    public void setSecretToken(String secretToken) {
      this.secretToken = secretToken;
    }

    public boolean isRegister() {
      return register;
    }

    public void setRegister(boolean register) {
      this.register = register;
    }

    public boolean isDropPendingUpdates() {
      return dropPendingUpdates;
    }

    public void setDropPendingUpdates(boolean dropPendingUpdates) {
      this.dropPendingUpdates = dropPendingUpdates;
    }
  }
}
