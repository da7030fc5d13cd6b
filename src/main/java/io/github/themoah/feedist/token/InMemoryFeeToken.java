package io.github.themoah.feedist.token;

import io.github.themoah.feedist.distributor.DistributorException;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balance table standing in for an on-chain token contract.
 * The distributor gets a handle bound to its own account through {@link #accountOf(String)}.
 */
public class InMemoryFeeToken {

  private static final Logger log = LoggerFactory.getLogger(InMemoryFeeToken.class);

  private final String symbol;
  private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

  public InMemoryFeeToken(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Creates new tokens for an account.
   */
  public void mint(String to, BigInteger amount) {
    if (amount.signum() < 0) {
      throw DistributorException.invalidArgument("Cannot mint negative amount " + amount);
    }
    balances.merge(to, amount, BigInteger::add);
    log.debug("Minted {} {} to {}", amount, symbol, to);
  }

  public BigInteger balanceOf(String holder) {
    return balances.getOrDefault(holder, BigInteger.ZERO);
  }

  /**
   * Moves tokens between any two accounts, as their owner would.
   */
  public void transfer(String from, String to, BigInteger amount) {
    if (amount.signum() < 0) {
      throw DistributorException.transferFailed("Negative transfer amount " + amount);
    }
    BigInteger available = balanceOf(from);
    if (available.compareTo(amount) < 0) {
      throw DistributorException.transferFailed(
        String.format("%s holds %s %s, cannot send %s", from, available, symbol, amount));
    }
    balances.put(from, available.subtract(amount));
    balances.merge(to, amount, BigInteger::add);
    log.debug("Transferred {} {} from {} to {}", amount, symbol, from, to);
  }

  /**
   * Returns a handle that can only spend from {@code owner}.
   */
  public FeeToken accountOf(String owner) {
    return new FeeToken() {
      @Override
      public BigInteger balanceOf(String holder) {
        return InMemoryFeeToken.this.balanceOf(holder);
      }

      @Override
      public void transfer(String to, BigInteger amount) {
        InMemoryFeeToken.this.transfer(owner, to, amount);
      }
    };
  }
}
