package io.github.themoah.feedist.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether metrics are reported at all
 * @param reporterType registry backend: prometheus, datadog or otlp
 * @param jvmMetricsEnabled whether JVM binders are attached to the registry
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS = false;

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Enable/disable metrics (default: true)</li>
   *   <li>METRICS_REPORTER - prometheus, datadog or otlp (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = parseBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = parseBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS);

    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
