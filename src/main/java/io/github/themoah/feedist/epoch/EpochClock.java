package io.github.themoah.feedist.epoch;

/**
 * Maps wall-clock seconds onto week-aligned epoch boundaries.
 * Every ledger in the distributor is keyed by the values returned here.
 */
public final class EpochClock {

  /** Length of one epoch in seconds (7 days). */
  public static final long EPOCH_LENGTH = 7L * 24 * 60 * 60;

  private EpochClock() {}

  /**
   * Returns the start of the epoch containing the given instant.
   *
   * @param timestamp seconds since the Unix epoch
   * @return the epoch boundary at or before {@code timestamp}
   */
  public static long epochOf(long timestamp) {
    return Math.floorDiv(timestamp, EPOCH_LENGTH) * EPOCH_LENGTH;
  }

  /**
   * Returns the boundary following the given epoch.
   */
  public static long nextEpoch(long epoch) {
    return epoch + EPOCH_LENGTH;
  }

  /**
   * Returns the first boundary at or after the given instant.
   */
  public static long ceilEpoch(long timestamp) {
    long floor = epochOf(timestamp);
    return floor == timestamp ? floor : floor + EPOCH_LENGTH;
  }

  public static boolean isBoundary(long timestamp) {
    return Math.floorMod(timestamp, EPOCH_LENGTH) == 0;
  }
}
