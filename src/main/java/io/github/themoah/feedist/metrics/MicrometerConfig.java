package io.github.themoah.feedist.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String SERVICE_NAME = "feedist";
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a Datadog meter registry from DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public Duration step() {
        return stepFromEnvironment();
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates a Prometheus meter registry, scraped through {@link PrometheusHandler}.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP (HTTP, cumulative) meter registry.
   * Reads OTLP_ENDPOINT, falling back to the standard OTEL_EXPORTER_OTLP_* variables.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    String url = otlpUrl();
    Map<String, String> headers = parseKeyValues(firstNonBlank(
      "OTLP_HEADERS", "OTEL_EXPORTER_OTLP_METRICS_HEADERS", "OTEL_EXPORTER_OTLP_HEADERS"));
    Map<String, String> attributes = resourceAttributes();

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return stepFromEnvironment();
      }

      @Override
      public Map<String, String> headers() {
        return headers;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    log.info("OTLP registry endpoint: {}", url);
    return new OtlpMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType the type of reporter ("prometheus", "datadog" or "otlp")
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "datadog" -> createDatadogRegistry();
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  private static String otlpUrl() {
    String url = firstNonBlank("OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    if (url != null) {
      return url;
    }
    String base = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
    if (base != null && !base.isBlank()) {
      return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
    }
    return DEFAULT_OTLP_URL;
  }

  private static Map<String, String> resourceAttributes() {
    Map<String, String> attributes = new HashMap<>(parseKeyValues(System.getenv("OTEL_RESOURCE_ATTRIBUTES")));
    String serviceName = System.getenv("OTEL_SERVICE_NAME");
    if (serviceName != null && !serviceName.isBlank()) {
      attributes.put("service.name", serviceName);
    }
    attributes.putIfAbsent("service.name", SERVICE_NAME);
    return attributes;
  }

  private static Duration stepFromEnvironment() {
    String stepMs = firstNonBlank("METRICS_STEP_MS", "OTEL_METRIC_EXPORT_INTERVAL");
    if (stepMs == null) {
      return DEFAULT_STEP;
    }
    try {
      return Duration.ofMillis(Long.parseLong(stepMs));
    } catch (NumberFormatException e) {
      log.warn("Invalid metrics step: {}, using default {}", stepMs, DEFAULT_STEP);
      return DEFAULT_STEP;
    }
  }

  private static String firstNonBlank(String... envVars) {
    for (String envVar : envVars) {
      String value = System.getenv(envVar);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Parses "key1=value1,key2=value2".
   */
  static Map<String, String> parseKeyValues(String raw) {
    Map<String, String> result = new HashMap<>();
    if (raw == null || raw.isBlank()) {
      return result;
    }
    for (String pair : raw.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        result.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Ignoring malformed key=value pair: {}", pair);
      }
    }
    return result;
  }
}
