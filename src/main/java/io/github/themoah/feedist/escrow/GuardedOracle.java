package io.github.themoah.feedist.escrow;

import io.github.themoah.feedist.distributor.DistributorException;
import java.math.BigInteger;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Decorator that reports every collaborator failure as {@code ORACLE_UNAVAILABLE}
 * and rejects negative answers.
 */
public class GuardedOracle implements VotingPowerOracle {

  private final VotingPowerOracle delegate;

  public GuardedOracle(VotingPowerOracle delegate) {
    this.delegate = delegate;
  }

  @Override
  public BigInteger balanceOf(String account, long timestamp) {
    return checked(() -> delegate.balanceOf(account, timestamp),
      "balanceOf(" + account + ", " + timestamp + ")");
  }

  @Override
  public BigInteger totalSupply(long timestamp) {
    return checked(() -> delegate.totalSupply(timestamp), "totalSupply(" + timestamp + ")");
  }

  @Override
  public OptionalLong firstActivity(String account) {
    try {
      OptionalLong first = delegate.firstActivity(account);
      return first == null ? OptionalLong.empty() : first;
    } catch (DistributorException e) {
      throw e;
    } catch (RuntimeException e) {
      throw DistributorException.oracleUnavailable("firstActivity(" + account + ") failed", e);
    }
  }

  private static BigInteger checked(Supplier<BigInteger> call, String description) {
    BigInteger value;
    try {
      value = call.get();
    } catch (DistributorException e) {
      throw e;
    } catch (RuntimeException e) {
      throw DistributorException.oracleUnavailable(description + " failed", e);
    }
    if (value == null || value.signum() < 0) {
      throw DistributorException.oracleUnavailable(description + " returned " + value, null);
    }
    return value;
  }
}
