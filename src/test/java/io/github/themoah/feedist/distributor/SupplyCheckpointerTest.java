package io.github.themoah.feedist.distributor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.escrow.GuardedOracle;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SupplyCheckpointer.
 */
public class SupplyCheckpointerTest {

  private static final long WEEK = EpochClock.EPOCH_LENGTH;

  private StubOracle oracle;
  private SupplyCheckpointer checkpointer;

  @BeforeEach
  void setUp() {
    oracle = new StubOracle();
    oracle.supply = BigInteger.valueOf(500);
    checkpointer = new SupplyCheckpointer(new GuardedOracle(oracle), 10 * WEEK, 20);
  }

  @Test
  void checkpoint_writesEveryEpochUpToCurrent() {
    SupplyCheckpoint checkpoint = checkpointer.checkpoint(12 * WEEK + 5);

    assertEquals(3, checkpoint.epochsWritten());
    assertEquals(13 * WEEK, checkpoint.cursor());
    assertTrue(checkpoint.caughtUp());
    assertEquals(BigInteger.valueOf(500), checkpointer.ledger().get(10 * WEEK));
    assertEquals(BigInteger.valueOf(500), checkpointer.ledger().get(12 * WEEK));
    assertFalse(checkpointer.ledger().contains(13 * WEEK));
  }

  @Test
  void checkpoint_afterLongIdle_isBoundedPerCall() {
    SupplyCheckpoint first = checkpointer.checkpoint(40 * WEEK + 1);

    assertEquals(20, first.epochsWritten());
    assertEquals(30 * WEEK, first.cursor());
    assertFalse(first.caughtUp());

    SupplyCheckpoint second = checkpointer.checkpoint(40 * WEEK + 1);

    assertEquals(11, second.epochsWritten());
    assertEquals(41 * WEEK, second.cursor());
    assertTrue(second.caughtUp());
  }

  @Test
  void checkpoint_whenCaughtUp_writesNothing() {
    checkpointer.checkpoint(11 * WEEK);
    int queries = oracle.supplyQueries;

    SupplyCheckpoint again = checkpointer.checkpoint(11 * WEEK + 3600);

    assertEquals(0, again.epochsWritten());
    assertEquals(12 * WEEK, again.cursor());
    assertEquals(queries, oracle.supplyQueries);
  }

  @Test
  void checkpoint_oracleFailure_writesNothing() {
    oracle.failAt = 11 * WEEK;

    DistributorException error = assertThrows(DistributorException.class,
      () -> checkpointer.checkpoint(12 * WEEK));

    assertEquals(ErrorKind.ORACLE_UNAVAILABLE, error.kind());
    assertEquals(10 * WEEK, checkpointer.cursor());
    assertTrue(checkpointer.ledger().view().isEmpty());
  }

  @Test
  void checkpoint_snapshotsSupplyAtEpochBoundary() {
    StubOracle growing = new StubOracle() {
      @Override
      public BigInteger totalSupply(long timestamp) {
        return BigInteger.valueOf(timestamp / WEEK);
      }
    };
    SupplyCheckpointer byEpoch = new SupplyCheckpointer(growing, 10 * WEEK + 100, 20);

    byEpoch.checkpoint(11 * WEEK + 100);

    assertEquals(BigInteger.valueOf(10), byEpoch.ledger().get(10 * WEEK));
    assertEquals(BigInteger.valueOf(11), byEpoch.ledger().get(11 * WEEK));
  }
}
