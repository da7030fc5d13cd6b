package io.github.themoah.feedist.model;

/**
 * Outcome of one total-supply checkpoint.
 *
 * @param epochsWritten snapshots recorded by this call
 * @param cursor next epoch without a snapshot
 * @param caughtUp true when every epoch up to the current one has a snapshot
 */
public record SupplyCheckpoint(
  int epochsWritten,
  long cursor,
  boolean caughtUp
) {}
