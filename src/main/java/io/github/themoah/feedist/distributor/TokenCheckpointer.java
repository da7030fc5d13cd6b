package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.ledger.EpochLedger;
import io.github.themoah.feedist.ledger.LedgerView;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.github.themoah.feedist.token.FeeToken;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credits newly arrived fee tokens to the epochs that elapsed since the previous checkpoint.
 *
 * <p>The balance delta is spread over {@code (lastTokenTime, now]} in proportion to the time
 * spent in each epoch. Shares are floored and the last piece takes the remainder, so the
 * credits always add up to the delta exactly.
 */
public class TokenCheckpointer {

  private static final Logger log = LoggerFactory.getLogger(TokenCheckpointer.class);

  private final FeeToken token;
  private final String holder;
  private final EpochLedger tokensPerEpoch = new EpochLedger("tokens_per_epoch");

  private long lastTokenTime;
  private BigInteger lastTokenBalance = BigInteger.ZERO;

  public TokenCheckpointer(FeeToken token, String holder, long startTime) {
    this.token = token;
    this.holder = holder;
    this.lastTokenTime = startTime;
  }

  /**
   * A share of a deposit assigned to one epoch.
   *
   * @param epoch epoch boundary
   * @param amount tokens credited
   */
  public record EpochCredit(long epoch, BigInteger amount) {}

  /**
   * Reconciles the holder's balance into the ledger.
   *
   * @param now current time in epoch seconds
   * @return what the call distributed
   */
  public TokenCheckpoint checkpoint(long now) {
    if (now < lastTokenTime) {
      log.debug("Token checkpoint skipped: now={} precedes cursor {}", now, lastTokenTime);
      return new TokenCheckpoint(lastTokenTime, lastTokenBalance, BigInteger.ZERO, 0);
    }

    BigInteger balance = token.balanceOf(holder);
    BigInteger delta = balance.subtract(lastTokenBalance);

    List<EpochCredit> credits = delta.signum() > 0
      ? spread(delta, lastTokenTime, now)
      : List.of();

    for (EpochCredit credit : credits) {
      tokensPerEpoch.credit(credit.epoch(), credit.amount());
    }

    if (delta.signum() < 0) {
      log.warn("Token balance dropped from {} to {} without a payout", lastTokenBalance, balance);
    }

    long since = lastTokenTime;
    lastTokenTime = now;
    lastTokenBalance = balance;

    BigInteger distributed = delta.signum() > 0 ? delta : BigInteger.ZERO;
    if (distributed.signum() > 0) {
      log.info("Token checkpoint distributed {} over ({}, {}] into {} epochs",
        distributed, since, now, credits.size());
    } else {
      log.debug("Token checkpoint at {} found no new tokens", now);
    }
    return new TokenCheckpoint(now, balance, distributed, credits.size());
  }

  /**
   * Splits an amount over {@code (from, to]} at every epoch boundary the interval crosses.
   * An interval ending exactly on a boundary does not cross it. A zero-length interval
   * credits the epoch containing {@code to}.
   *
   * @param amount tokens to spread, positive
   * @param from interval start, exclusive
   * @param to interval end, inclusive
   * @return credits in epoch order, summing to {@code amount}
   */
  static List<EpochCredit> spread(BigInteger amount, long from, long to) {
    List<EpochCredit> credits = new ArrayList<>();
    if (to == from) {
      credits.add(new EpochCredit(EpochClock.epochOf(to), amount));
      return credits;
    }

    BigInteger span = BigInteger.valueOf(to - from);
    BigInteger remaining = amount;
    long t = from;
    long epoch = EpochClock.epochOf(from);

    while (true) {
      long next = EpochClock.nextEpoch(epoch);
      if (to <= next) {
        credits.add(new EpochCredit(epoch, remaining));
        return credits;
      }
      BigInteger share = amount.multiply(BigInteger.valueOf(next - t)).divide(span);
      credits.add(new EpochCredit(epoch, share));
      remaining = remaining.subtract(share);
      t = next;
      epoch = next;
    }
  }

  /**
   * Lowers the tracked balance after tokens were paid out, so the next checkpoint does not
   * see the payout as a shortfall.
   */
  public void recordPayout(BigInteger amount) {
    lastTokenBalance = lastTokenBalance.subtract(amount);
  }

  public long lastTokenTime() {
    return lastTokenTime;
  }

  public BigInteger lastTokenBalance() {
    return lastTokenBalance;
  }

  public LedgerView ledger() {
    return tokensPerEpoch;
  }
}
