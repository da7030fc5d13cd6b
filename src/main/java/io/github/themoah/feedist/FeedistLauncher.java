package io.github.themoah.feedist;

import io.github.themoah.feedist.config.AppConfig;
import io.github.themoah.feedist.config.DistributorConfig;
import io.github.themoah.feedist.config.VertxConfig;
import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.metrics.MetricsConfig;
import io.vertx.core.Vertx;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone fee distributor service.
 *
 * <p>Settings are read from the environment once, before Vert.x starts, so a bad value fails
 * the process instead of the deployment. The distributor start time defaults to the current
 * week when {@code DISTRIBUTOR_START_TIME} is not set.
 */
public class FeedistLauncher {

  private static final Logger log = LoggerFactory.getLogger(FeedistLauncher.class);

  public static void main(String[] args) {
    Clock clock = Clock.systemUTC();
    long now = clock.instant().getEpochSecond();

    AppConfig app = AppConfig.fromEnvironment();
    DistributorConfig distributor = DistributorConfig.fromEnvironment(now);
    MetricsConfig metrics = MetricsConfig.fromEnvironment();

    log.info("Starting feedist on port {}: distributor '{}' paying from epoch {} (current epoch {}), admin '{}'",
      app.httpPort(), distributor.address(), EpochClock.epochOf(distributor.startTime()),
      EpochClock.epochOf(now), distributor.admin());

    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    vertx.deployVerticle(new MainVerticle(clock, app, distributor, metrics), VertxConfig.createDeploymentOptions())
      .onSuccess(id -> log.info("Fee distributor deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Fee distributor failed to start, shutting down", err);
        vertx.close();
        System.exit(1);
      });
  }
}
