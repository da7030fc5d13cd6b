package io.github.themoah.feedist.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param supplyLedger "current" or "behind" (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String supplyLedger
) {
  /**
   * Creates a liveness response (HTTP server only).
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response from the supply ledger's progress.
   * Claims can only pay settled epochs, so a ledger behind the current epoch is not ready.
   *
   * @param supplyCaughtUp true if every epoch up to the current one has a supply snapshot
   */
  public static HealthCheckResponse readiness(boolean supplyCaughtUp) {
    return new HealthCheckResponse(HealthStatus.of(supplyCaughtUp), supplyCaughtUp ? "current" : "behind");
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (supplyLedger != null) {
      json.put("supplyLedger", supplyLedger);
    }
    return json;
  }
}
