package io.github.themoah.feedist.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param checkpointIntervalMs period of the background checkpoint timer in milliseconds, 0 disables it
 */
public record AppConfig(
  int httpPort,
  long checkpointIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_CHECKPOINT_INTERVAL_MS = 3_600_000L;

  public boolean isSchedulerEnabled() {
    return checkpointIntervalMs > 0;
  }

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = getEnvLong("CHECKPOINT_INTERVAL_MS", DEFAULT_CHECKPOINT_INTERVAL_MS);

    if (interval < 0) {
      log.warn("CHECKPOINT_INTERVAL_MS must be >= 0, disabling scheduler");
      interval = 0;
    }

    log.info("AppConfig loaded: httpPort={}, checkpointIntervalMs={}", port, interval);
    return new AppConfig(port, interval);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
