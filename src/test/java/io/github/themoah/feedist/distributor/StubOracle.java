package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.escrow.VotingPowerOracle;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Oracle with flat per-account balances and a fixed total supply, for unit tests.
 */
class StubOracle implements VotingPowerOracle {

  final Map<String, BigInteger> balances = new HashMap<>();
  final Map<String, Long> firstActivity = new HashMap<>();
  BigInteger supply = BigInteger.ZERO;
  long failAt = -1;
  int supplyQueries;

  StubOracle lock(String account, long since, long power) {
    balances.put(account, BigInteger.valueOf(power));
    firstActivity.put(account, since);
    return this;
  }

  @Override
  public BigInteger balanceOf(String account, long timestamp) {
    failIfDue(timestamp);
    Long since = firstActivity.get(account);
    if (since == null || timestamp < since) {
      return BigInteger.ZERO;
    }
    return balances.get(account);
  }

  @Override
  public BigInteger totalSupply(long timestamp) {
    supplyQueries++;
    failIfDue(timestamp);
    return supply;
  }

  @Override
  public OptionalLong firstActivity(String account) {
    Long since = firstActivity.get(account);
    return since == null ? OptionalLong.empty() : OptionalLong.of(since);
  }

  private void failIfDue(long timestamp) {
    if (timestamp == failAt) {
      throw new IllegalStateException("curve unavailable at " + timestamp);
    }
  }
}
