package io.github.themoah.feedist.ledger;

import io.github.themoah.feedist.epoch.EpochClock;
import java.math.BigInteger;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Epoch-indexed amount store.
 *
 * <p>Keys are epoch boundaries; missing epochs read as zero. Token ledgers only ever grow
 * through {@link #credit(long, BigInteger)}; supply ledgers are written through
 * {@link #record(long, BigInteger)}.
 */
public class EpochLedger implements LedgerView {

  private final String name;
  private final TreeMap<Long, BigInteger> entries = new TreeMap<>();

  public EpochLedger(String name) {
    this.name = name;
  }

  /**
   * Adds an amount to an epoch.
   *
   * @param epoch epoch boundary
   * @param amount non-negative amount to add
   * @return the new value held for the epoch
   */
  public BigInteger credit(long epoch, BigInteger amount) {
    checkEpoch(epoch);
    if (amount.signum() < 0) {
      throw new IllegalArgumentException(name + ": negative credit " + amount + " for epoch " + epoch);
    }
    return entries.merge(epoch, amount, BigInteger::add);
  }

  /**
   * Writes the value for an epoch, replacing any previous one.
   */
  public void record(long epoch, BigInteger amount) {
    checkEpoch(epoch);
    if (amount.signum() < 0) {
      throw new IllegalArgumentException(name + ": negative value " + amount + " for epoch " + epoch);
    }
    entries.put(epoch, amount);
  }

  @Override
  public BigInteger get(long epoch) {
    return entries.getOrDefault(epoch, BigInteger.ZERO);
  }

  @Override
  public boolean contains(long epoch) {
    return entries.containsKey(epoch);
  }

  /**
   * Returns the sum of every recorded amount.
   */
  @Override
  public BigInteger total() {
    BigInteger sum = BigInteger.ZERO;
    for (BigInteger value : entries.values()) {
      sum = sum.add(value);
    }
    return sum;
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns a read-only, epoch-ordered view.
   */
  @Override
  public NavigableMap<Long, BigInteger> view() {
    return Collections.unmodifiableNavigableMap(entries);
  }

  private void checkEpoch(long epoch) {
    if (!EpochClock.isBoundary(epoch)) {
      throw new IllegalArgumentException(name + ": " + epoch + " is not an epoch boundary");
    }
  }
}
