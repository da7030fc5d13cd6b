package io.github.themoah.feedist.metrics;

import io.github.themoah.feedist.model.ClaimResult;
import io.github.themoah.feedist.model.DistributorState;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.vertx.core.Future;

/**
 * Interface for reporting distributor activity to external systems.
 */
public interface MetricsReporter {

  /**
   * Reports a completed token checkpoint.
   *
   * @param checkpoint the checkpoint outcome
   */
  void reportTokenCheckpoint(TokenCheckpoint checkpoint);

  /**
   * Reports a completed supply checkpoint.
   *
   * @param checkpoint the checkpoint outcome
   */
  void reportSupplyCheckpoint(SupplyCheckpoint checkpoint);

  /**
   * Reports a completed claim, including zero-amount ones.
   *
   * @param result the claim outcome
   */
  void reportClaim(ClaimResult result);

  /**
   * Reports the distributor's cursors and totals.
   *
   * @param state current state snapshot
   */
  default void reportState(DistributorState state) {
    // Default no-op implementation for reporters without gauges
  }

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();

  /**
   * Returns a reporter that drops everything, used when metrics are disabled.
   */
  static MetricsReporter noop() {
    return new MetricsReporter() {
      @Override
      public void reportTokenCheckpoint(TokenCheckpoint checkpoint) {}

      @Override
      public void reportSupplyCheckpoint(SupplyCheckpoint checkpoint) {}

      @Override
      public void reportClaim(ClaimResult result) {}

      @Override
      public Future<Void> start() {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        return Future.succeededFuture();
      }
    };
  }
}
