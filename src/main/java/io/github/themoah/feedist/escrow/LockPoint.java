package io.github.themoah.feedist.escrow;

import java.math.BigInteger;

/**
 * One vertex of an account's voting-power curve.
 * Power at {@code t >= timestamp} is {@code max(bias - slope * (t - timestamp), 0)}.
 *
 * @param timestamp when the point was written
 * @param bias voting power at {@code timestamp}
 * @param slope decay per second
 */
public record LockPoint(
  long timestamp,
  BigInteger bias,
  BigInteger slope
) {

  /**
   * Evaluates the curve at a later instant.
   *
   * @param at instant to evaluate, not before {@code timestamp}
   * @return decayed voting power, never negative
   */
  public BigInteger powerAt(long at) {
    BigInteger decayed = bias.subtract(slope.multiply(BigInteger.valueOf(at - timestamp)));
    return decayed.signum() > 0 ? decayed : BigInteger.ZERO;
  }
}
