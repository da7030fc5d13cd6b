package io.github.themoah.feedist.ledger;

import java.math.BigInteger;
import java.util.NavigableMap;

/**
 * Read-only access to an epoch ledger.
 */
public interface LedgerView {

  /**
   * Returns the amount held for an epoch, zero if nothing was written.
   */
  BigInteger get(long epoch);

  boolean contains(long epoch);

  BigInteger total();

  NavigableMap<Long, BigInteger> view();
}
