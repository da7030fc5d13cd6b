package io.github.themoah.feedist.token;

import java.math.BigInteger;

/**
 * The token being distributed, as seen from the distributor's own account.
 * Tokens can only leave that account; nothing can be pulled back from recipients.
 */
public interface FeeToken {

  /**
   * Returns the balance held by an account.
   */
  BigInteger balanceOf(String holder);

  /**
   * Sends tokens from the distributor's account.
   *
   * @param to recipient
   * @param amount tokens to send
   * @throws io.github.themoah.feedist.distributor.DistributorException with kind
   *     {@code TRANSFER_FAILED} if the transfer is rejected; no balance changes in that case
   */
  void transfer(String to, BigInteger amount);
}
