package io.github.themoah.feedist.escrow;

import java.math.BigInteger;
import java.util.OptionalLong;

/**
 * Read access to the voting-escrow lock engine's historical curve.
 * All answers must be deterministic for instants in the past.
 */
public interface VotingPowerOracle {

  /**
   * Returns the decayed voting power of an account at an instant.
   *
   * @param account the account identifier
   * @param timestamp seconds since the Unix epoch
   * @return voting power, zero when no lock was active
   * @throws io.github.themoah.feedist.distributor.DistributorException with kind
   *     {@code ORACLE_UNAVAILABLE} if the curve cannot be read
   */
  BigInteger balanceOf(String account, long timestamp);

  /**
   * Returns the sum of every account's voting power at an instant.
   *
   * @param timestamp seconds since the Unix epoch
   * @return total voting power, zero before the oracle's genesis
   */
  BigInteger totalSupply(long timestamp);

  /**
   * Returns when the account first locked tokens.
   *
   * @param account the account identifier
   * @return timestamp of the first lock activity, or empty if the account never locked
   */
  OptionalLong firstActivity(String account);
}
