package io.github.themoah.feedist;

import io.github.themoah.feedist.config.AppConfig;
import io.github.themoah.feedist.config.DistributorConfig;
import io.github.themoah.feedist.distributor.CheckpointScheduler;
import io.github.themoah.feedist.distributor.FeeDistributor;
import io.github.themoah.feedist.escrow.InMemoryVotingEscrow;
import io.github.themoah.feedist.health.HealthCheckHandler;
import io.github.themoah.feedist.http.DistributorHandler;
import io.github.themoah.feedist.http.SandboxHandler;
import io.github.themoah.feedist.metrics.MetricsConfig;
import io.github.themoah.feedist.metrics.MetricsReporter;
import io.github.themoah.feedist.metrics.MicrometerConfig;
import io.github.themoah.feedist.metrics.MicrometerReporter;
import io.github.themoah.feedist.metrics.PrometheusHandler;
import io.github.themoah.feedist.token.InMemoryFeeToken;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for feedist - the voting-escrow fee distributor.
 * Owns the distributor and serves it over HTTP. Running as a single instance, its event loop
 * is the only thread touching the ledgers.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final Clock clock;
  private final AppConfig appConfig;
  private final DistributorConfig distributorConfig;
  private final MetricsConfig metricsConfig;

  private FeeDistributor distributor;
  private MetricsReporter reporter;
  private CheckpointScheduler scheduler;
  private HttpServer httpServer;

  public MainVerticle() {
    this(Clock.systemUTC(), null, null, null);
  }

  /**
   * Creates the verticle with explicit settings; null settings are loaded from the environment.
   */
  public MainVerticle(
    Clock clock,
    AppConfig appConfig,
    DistributorConfig distributorConfig,
    MetricsConfig metricsConfig
  ) {
    this.clock = clock;
    this.appConfig = appConfig;
    this.distributorConfig = distributorConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting feedist MainVerticle");

    AppConfig app = appConfig != null ? appConfig : AppConfig.fromEnvironment();
    DistributorConfig config = distributorConfig != null
      ? distributorConfig
      : DistributorConfig.fromEnvironment(clock.instant().getEpochSecond());
    MetricsConfig metrics = metricsConfig != null ? metricsConfig : MetricsConfig.fromEnvironment();

    InMemoryFeeToken token = new InMemoryFeeToken("FEE");
    InMemoryVotingEscrow escrow = new InMemoryVotingEscrow(clock);
    distributor = new FeeDistributor(config, escrow, token.accountOf(config.address()), clock);

    Router router = Router.router(vertx);
    router.route().handler(BodyHandler.create());

    reporter = createReporter(metrics, router);

    new HealthCheckHandler(distributor).registerRoutes(router);
    new DistributorHandler(vertx, distributor, reporter, clock, config.claimManyChunkSize()).registerRoutes(router);
    new SandboxHandler(distributor, token, escrow).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    if (app.isSchedulerEnabled()) {
      scheduler = new CheckpointScheduler(vertx, distributor, reporter, app.checkpointIntervalMs());
    } else {
      log.info("Checkpoint scheduler is disabled");
    }

    reporter.start()
      .compose(v -> scheduler != null ? scheduler.start() : Future.<Void>succeededFuture())
      .compose(v -> startHttpServer(router, app.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("feedist started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start feedist", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping feedist MainVerticle");

    Future<Void> stopScheduler = (scheduler != null)
      ? scheduler.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    Future<Void> closeReporter = (reporter != null)
      ? reporter.close()
      : Future.succeededFuture();

    stopScheduler
      .compose(v -> stopHttpServer)
      .compose(v -> closeReporter)
      .onSuccess(v -> {
        log.info("feedist stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during feedist shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Returns the port the HTTP server listens on, once started.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  FeeDistributor distributor() {
    return distributor;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private MetricsReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
