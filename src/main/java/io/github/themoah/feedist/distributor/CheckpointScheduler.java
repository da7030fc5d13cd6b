package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.metrics.MetricsReporter;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically checkpoints total supply and fee tokens. The token checkpoint is the
 * service's own and does not depend on who currently holds the admin role.
 * Supply is checkpointed until caught up, so a long idle period is recovered in one tick.
 */
public class CheckpointScheduler {

  private static final Logger log = LoggerFactory.getLogger(CheckpointScheduler.class);

  private static final int MAX_SUPPLY_ROUNDS = 100;

  private final Vertx vertx;
  private final FeeDistributor distributor;
  private final MetricsReporter reporter;
  private final long intervalMs;

  private Long timerId;

  public CheckpointScheduler(
    Vertx vertx,
    FeeDistributor distributor,
    MetricsReporter reporter,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.distributor = distributor;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs one checkpoint round immediately and then on every interval.
   */
  public Future<Void> start() {
    log.info("Starting checkpoint scheduler with interval: {}ms", intervalMs);

    return runOnce()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> runOnce());
        log.info("Checkpoint scheduler started, timer ID: {}", timerId);
      })
      .recover(err -> Future.succeededFuture())
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping checkpoint scheduler");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return Future.succeededFuture();
  }

  /**
   * Catches the supply ledger up, then reconciles the token balance.
   */
  Future<Void> runOnce() {
    log.debug("Running scheduled checkpoints");
    try {
      int rounds = 0;
      SupplyCheckpoint supply;
      do {
        supply = distributor.checkpointTotalSupply();
        reporter.reportSupplyCheckpoint(supply);
        rounds++;
      } while (!supply.caughtUp() && rounds < MAX_SUPPLY_ROUNDS);

      if (!supply.caughtUp()) {
        log.warn("Supply ledger still behind after {} rounds, cursor={}", rounds, supply.cursor());
      }

      TokenCheckpoint token = distributor.scheduledCheckpointToken();
      reporter.reportTokenCheckpoint(token);
      reporter.reportState(distributor.state());
      return Future.succeededFuture();
    } catch (DistributorException e) {
      log.error("Scheduled checkpoint failed: {} ({})", e.getMessage(), e.kind().getValue(), e);
      return Future.failedFuture(e);
    }
  }
}
