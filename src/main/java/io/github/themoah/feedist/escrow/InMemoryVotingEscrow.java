package io.github.themoah.feedist.escrow;

import io.github.themoah.feedist.distributor.DistributorException;
import io.github.themoah.feedist.epoch.EpochClock;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lock engine keeping a point history per account.
 *
 * <p>Voting power decays linearly from {@code amount * remaining / MAX_LOCK_TIME} to zero at the
 * unlock time. Unlock times are rounded down to epoch boundaries. Total supply is the sum of
 * account curves evaluated at the same instant.
 */
public class InMemoryVotingEscrow implements VotingPowerOracle {

  private static final Logger log = LoggerFactory.getLogger(InMemoryVotingEscrow.class);

  /** Longest allowed lock, 4 years. */
  public static final long MAX_LOCK_TIME = 4L * 365 * 86400;

  private static final BigInteger MAX_LOCK = BigInteger.valueOf(MAX_LOCK_TIME);

  private final Clock clock;
  private final Map<String, List<LockPoint>> history = new ConcurrentHashMap<>();
  private final Map<String, LockedBalance> locked = new ConcurrentHashMap<>();

  public InMemoryVotingEscrow(Clock clock) {
    this.clock = clock;
  }

  /**
   * Locked amount and unlock time of an account.
   *
   * @param amount tokens locked
   * @param end unlock time, an epoch boundary
   */
  public record LockedBalance(BigInteger amount, long end) {
    static final LockedBalance EMPTY = new LockedBalance(BigInteger.ZERO, 0);
  }

  /**
   * Opens a new lock.
   *
   * @param account the locking account
   * @param amount tokens to lock
   * @param unlockTime requested unlock time, rounded down to an epoch boundary
   */
  public void createLock(String account, BigInteger amount, long unlockTime) {
    long now = now();
    long end = EpochClock.epochOf(unlockTime);
    LockedBalance current = lockedOf(account);

    if (amount.signum() <= 0) {
      throw DistributorException.invalidArgument("Lock amount must be positive");
    }
    if (current.amount().signum() > 0) {
      throw DistributorException.invalidArgument("Withdraw old tokens first: " + account);
    }
    checkUnlockTime(now, end);

    writeLock(account, new LockedBalance(amount, end), now);
    log.info("Lock created: account={}, amount={}, end={}", account, amount, end);
  }

  /**
   * Adds tokens to an active lock without changing its unlock time.
   */
  public void increaseAmount(String account, BigInteger amount) {
    long now = now();
    LockedBalance current = requireActive(account, now);
    if (amount.signum() <= 0) {
      throw DistributorException.invalidArgument("Increase amount must be positive");
    }
    writeLock(account, new LockedBalance(current.amount().add(amount), current.end()), now);
    log.info("Lock amount increased: account={}, added={}", account, amount);
  }

  /**
   * Extends an active lock.
   */
  public void increaseUnlockTime(String account, long unlockTime) {
    long now = now();
    LockedBalance current = requireActive(account, now);
    long end = EpochClock.epochOf(unlockTime);
    if (end <= current.end()) {
      throw DistributorException.invalidArgument("Can only increase lock duration");
    }
    checkUnlockTime(now, end);
    writeLock(account, new LockedBalance(current.amount(), end), now);
    log.info("Lock extended: account={}, end={}", account, end);
  }

  /**
   * Releases an expired lock.
   *
   * @return the amount that was locked
   */
  public BigInteger withdraw(String account) {
    long now = now();
    LockedBalance current = lockedOf(account);
    if (current.amount().signum() == 0) {
      throw DistributorException.invalidArgument("Nothing locked for " + account);
    }
    if (now < current.end()) {
      throw DistributorException.invalidArgument("The lock didn't expire: ends at " + current.end());
    }
    writeLock(account, LockedBalance.EMPTY, now);
    log.info("Lock withdrawn: account={}, amount={}", account, current.amount());
    return current.amount();
  }

  public LockedBalance lockedOf(String account) {
    return locked.getOrDefault(account, LockedBalance.EMPTY);
  }

  @Override
  public BigInteger balanceOf(String account, long timestamp) {
    List<LockPoint> points = history.get(account);
    if (points == null) {
      return BigInteger.ZERO;
    }
    LockPoint point = lastPointAtOrBefore(points, timestamp);
    return point == null ? BigInteger.ZERO : point.powerAt(timestamp);
  }

  @Override
  public BigInteger totalSupply(long timestamp) {
    BigInteger total = BigInteger.ZERO;
    for (String account : history.keySet()) {
      total = total.add(balanceOf(account, timestamp));
    }
    return total;
  }

  @Override
  public OptionalLong firstActivity(String account) {
    List<LockPoint> points = history.get(account);
    if (points == null || points.isEmpty()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(points.get(0).timestamp());
  }

  private void writeLock(String account, LockedBalance balance, long now) {
    BigInteger slope = balance.amount().divide(MAX_LOCK);
    BigInteger bias = now < balance.end()
      ? slope.multiply(BigInteger.valueOf(balance.end() - now))
      : BigInteger.ZERO;
    if (bias.signum() == 0) {
      slope = BigInteger.ZERO;
    }
    locked.put(account, balance);
    history.computeIfAbsent(account, k -> new ArrayList<>()).add(new LockPoint(now, bias, slope));
  }

  private LockedBalance requireActive(String account, long now) {
    LockedBalance current = lockedOf(account);
    if (current.amount().signum() == 0) {
      throw DistributorException.invalidArgument("No existing lock found for " + account);
    }
    if (current.end() <= now) {
      throw DistributorException.invalidArgument("Cannot add to expired lock. Withdraw first");
    }
    return current;
  }

  private void checkUnlockTime(long now, long end) {
    if (end <= now) {
      throw DistributorException.invalidArgument("Can only lock until time in the future");
    }
    if (end > now + MAX_LOCK_TIME) {
      throw DistributorException.invalidArgument("Voting lock can be 4 years max");
    }
  }

  /**
   * Binary search for the newest point written at or before {@code timestamp}.
   */
  private static LockPoint lastPointAtOrBefore(List<LockPoint> points, long timestamp) {
    int lo = 0;
    int hi = points.size() - 1;
    int found = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (points.get(mid).timestamp() <= timestamp) {
        found = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    return found < 0 ? null : points.get(found);
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }
}
