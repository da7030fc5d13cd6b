package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.escrow.VotingPowerOracle;
import io.github.themoah.feedist.ledger.EpochLedger;
import io.github.themoah.feedist.ledger.LedgerView;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshots total voting power at every epoch boundary.
 *
 * <p>The cursor is the next epoch without a snapshot. Each call writes at most
 * {@code maxEpochsPerCall} snapshots; callers catch up after long idle periods by calling again.
 */
public class SupplyCheckpointer {

  private static final Logger log = LoggerFactory.getLogger(SupplyCheckpointer.class);

  private final VotingPowerOracle oracle;
  private final EpochLedger supplyPerEpoch = new EpochLedger("supply_per_epoch");
  private final int maxEpochsPerCall;

  private long cursor;

  public SupplyCheckpointer(VotingPowerOracle oracle, long startEpoch, int maxEpochsPerCall) {
    this.oracle = oracle;
    this.cursor = EpochClock.epochOf(startEpoch);
    this.maxEpochsPerCall = maxEpochsPerCall;
  }

  /**
   * Records supply snapshots from the cursor up to and including the epoch containing {@code now}.
   * Nothing is written unless every oracle query succeeds.
   *
   * @param now current time in epoch seconds
   * @return what the call wrote
   */
  public SupplyCheckpoint checkpoint(long now) {
    long currentEpoch = EpochClock.epochOf(now);
    long epoch = cursor;
    Map<Long, BigInteger> staged = new LinkedHashMap<>();

    while (staged.size() < maxEpochsPerCall && epoch <= currentEpoch) {
      staged.put(epoch, oracle.totalSupply(epoch));
      epoch = EpochClock.nextEpoch(epoch);
    }

    staged.forEach(supplyPerEpoch::record);
    cursor = epoch;

    boolean caughtUp = cursor > currentEpoch;
    if (!staged.isEmpty()) {
      log.info("Supply checkpoint wrote {} epochs, cursor={}, caughtUp={}", staged.size(), cursor, caughtUp);
      if (log.isDebugEnabled()) {
        staged.forEach((e, supply) -> log.debug("Supply snapshot: epoch={}, supply={}", e, supply));
      }
    }
    return new SupplyCheckpoint(staged.size(), cursor, caughtUp);
  }

  /**
   * Returns the next epoch without a snapshot.
   */
  public long cursor() {
    return cursor;
  }

  public LedgerView ledger() {
    return supplyPerEpoch;
  }
}
