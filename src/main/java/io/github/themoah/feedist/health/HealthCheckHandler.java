package io.github.themoah.feedist.health;

import io.github.themoah.feedist.distributor.FeeDistributor;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final FeeDistributor distributor;

  public HealthCheckHandler(FeeDistributor distributor) {
    this.distributor = distributor;
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * Ready once the supply ledger covers the current epoch.
   */
  private void handleReadiness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.readiness(distributor.isSupplyCaughtUp()));
  }

  private void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatus())
      .end(response.toJson().encode());
  }
}
