package io.github.themoah.feedist.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration.
 * The distributor verticle is always deployed as a single instance: its event loop is the
 * only thread that touches the ledgers.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_PREFER_NATIVE_TRANSPORT = "VERTX_PREFER_NATIVE_TRANSPORT";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(isNativeTransportPreferred());
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    DeploymentOptions options = new DeploymentOptions();
    options.setInstances(1);
    log.info("Deploying a single distributor instance on one event loop");
    return options;
  }

  public static boolean isNativeTransportPreferred() {
    String value = System.getenv(ENV_PREFER_NATIVE_TRANSPORT);
    return value == null || !"false".equalsIgnoreCase(value);
  }
}
