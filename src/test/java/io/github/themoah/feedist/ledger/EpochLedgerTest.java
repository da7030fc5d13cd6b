package io.github.themoah.feedist.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedist.epoch.EpochClock;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EpochLedger.
 */
public class EpochLedgerTest {

  private static final long WEEK = EpochClock.EPOCH_LENGTH;

  @Test
  void get_returnsZeroForMissingEpoch() {
    EpochLedger ledger = new EpochLedger("tokens");

    assertEquals(BigInteger.ZERO, ledger.get(5 * WEEK));
    assertFalse(ledger.contains(5 * WEEK));
  }

  @Test
  void credit_accumulates() {
    EpochLedger ledger = new EpochLedger("tokens");

    ledger.credit(WEEK, BigInteger.valueOf(100));
    BigInteger value = ledger.credit(WEEK, BigInteger.valueOf(50));

    assertEquals(BigInteger.valueOf(150), value);
    assertEquals(BigInteger.valueOf(150), ledger.get(WEEK));
    assertTrue(ledger.contains(WEEK));
  }

  @Test
  void record_replacesValue() {
    EpochLedger ledger = new EpochLedger("supply");

    ledger.record(WEEK, BigInteger.valueOf(100));
    ledger.record(WEEK, BigInteger.valueOf(7));

    assertEquals(BigInteger.valueOf(7), ledger.get(WEEK));
    assertEquals(1, ledger.size());
  }

  @Test
  void total_sumsAllEpochs() {
    EpochLedger ledger = new EpochLedger("tokens");

    ledger.credit(WEEK, BigInteger.valueOf(3));
    ledger.credit(2 * WEEK, BigInteger.valueOf(4));
    ledger.credit(5 * WEEK, BigInteger.valueOf(5));

    assertEquals(BigInteger.valueOf(12), ledger.total());
  }

  @Test
  void view_isOrderedAndReadOnly() {
    EpochLedger ledger = new EpochLedger("tokens");
    ledger.credit(3 * WEEK, BigInteger.ONE);
    ledger.credit(WEEK, BigInteger.TEN);

    assertEquals(List.of(WEEK, 3 * WEEK), List.copyOf(ledger.view().keySet()));
    assertThrows(UnsupportedOperationException.class, () -> ledger.view().put(2 * WEEK, BigInteger.ONE));
  }

  @Test
  void rejectsNonBoundaryKeysAndNegativeAmounts() {
    EpochLedger ledger = new EpochLedger("tokens");

    assertThrows(IllegalArgumentException.class, () -> ledger.credit(WEEK + 1, BigInteger.ONE));
    assertThrows(IllegalArgumentException.class, () -> ledger.credit(WEEK, BigInteger.valueOf(-1)));
    assertThrows(IllegalArgumentException.class, () -> ledger.record(WEEK, BigInteger.valueOf(-1)));
    assertEquals(0, ledger.size());
  }
}
