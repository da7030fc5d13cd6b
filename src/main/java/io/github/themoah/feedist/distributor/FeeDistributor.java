package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.config.DistributorConfig;
import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.escrow.GuardedOracle;
import io.github.themoah.feedist.escrow.VotingPowerOracle;
import io.github.themoah.feedist.model.ClaimBatch;
import io.github.themoah.feedist.model.ClaimResult;
import io.github.themoah.feedist.model.DistributorState;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.github.themoah.feedist.token.FeeToken;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes fee tokens to voting-escrow lockers, week by week, in proportion to their share
 * of total voting power.
 *
 * <p>Every public operation is serialised and all-or-nothing: a call either completes or
 * throws {@link DistributorException} leaving the ledgers and cursors as they were.
 * {@link #claim(String)} and {@link #claimMany(List)} keep their leading supply and token
 * checkpoints even when the payout fails; they are the same transitions any caller could
 * have triggered on their own. {@link #claimMany(List)} is atomic per account.
 */
public class FeeDistributor {

  private static final Logger log = LoggerFactory.getLogger(FeeDistributor.class);

  private final Clock clock;
  private final FeeToken token;
  private final VotingPowerOracle oracle;
  private final String address;
  private final long startTime;

  private final SupplyCheckpointer supplyCheckpointer;
  private final TokenCheckpointer tokenCheckpointer;
  private final ClaimEngine claimEngine;
  private final AdminGate adminGate;

  public FeeDistributor(DistributorConfig config, VotingPowerOracle oracle, FeeToken token, Clock clock) {
    this.clock = clock;
    this.token = token;
    this.oracle = new GuardedOracle(oracle);
    this.address = config.address();
    this.startTime = EpochClock.epochOf(config.startTime());

    this.supplyCheckpointer = new SupplyCheckpointer(this.oracle, startTime, config.supplyCheckpointMaxEpochs());
    this.tokenCheckpointer = new TokenCheckpointer(token, address, startTime);
    this.claimEngine = new ClaimEngine(
      this.oracle,
      tokenCheckpointer.ledger(),
      supplyCheckpointer.ledger(),
      startTime,
      config.claimMaxEpochs()
    );
    this.adminGate = new AdminGate(
      config.admin(),
      config.allowPublicCheckpoint(),
      config.tokenCheckpointCooldownSeconds()
    );

    log.info("Fee distributor created: address={}, startTime={}, admin={}", address, startTime, config.admin());
    supplyCheckpointer.checkpoint(now());
  }

  /**
   * Reconciles newly received fee tokens into the weekly ledger.
   *
   * @param caller the calling account
   * @return what was distributed
   * @throws DistributorException {@code PERMISSION_DENIED} unless the caller is admin or public
   *     checkpoints are enabled and the cooldown elapsed
   */
  public synchronized TokenCheckpoint checkpointToken(String caller) {
    long now = now();
    if (!adminGate.mayCheckpointToken(caller, now, tokenCheckpointer.lastTokenTime())) {
      log.warn("Token checkpoint denied for {}", caller);
      throw DistributorException.permissionDenied(caller, "checkpointToken");
    }
    return tokenCheckpointer.checkpoint(now);
  }

  /**
   * Token checkpoint run by the service itself, not on behalf of any account.
   */
  synchronized TokenCheckpoint scheduledCheckpointToken() {
    return tokenCheckpointer.checkpoint(now());
  }

  /**
   * Records total voting power for elapsed epochs, up to 20 per call by default.
   */
  public synchronized SupplyCheckpoint checkpointTotalSupply() {
    return supplyCheckpointer.checkpoint(now());
  }

  /**
   * Pays the account its share of every settled epoch since its last claim.
   *
   * @param account the account to pay
   * @return the payout, possibly zero
   */
  public synchronized ClaimResult claim(String account) {
    requireAccount(account);
    long now = now();
    long payableLimit = refreshForClaim(now);

    ClaimResult prepared = claimEngine.prepare(account, payableLimit);
    pay(prepared);
    return prepared;
  }

  /**
   * Claims for several accounts at once. Blank entries are skipped and duplicates are paid once.
   *
   * <p>Nothing is paid unless the distributor holds enough tokens for the whole batch. Each
   * account's cursor is committed right after its own transfer, so a transfer that still
   * fails part way leaves the accounts before it fully paid and the rest untouched.
   *
   * @param accounts accounts to pay
   * @return the total paid and one result per distinct account, in input order
   * @throws PartialClaimException if a transfer fails after earlier accounts were paid
   */
  public synchronized ClaimBatch claimMany(List<String> accounts) {
    Set<String> distinct = new LinkedHashSet<>();
    for (String account : accounts) {
      if (account != null && !account.isBlank()) {
        distinct.add(account);
      }
    }
    if (distinct.isEmpty()) {
      return ClaimBatch.EMPTY;
    }

    long now = now();
    long payableLimit = refreshForClaim(now);

    List<ClaimResult> prepared = new ArrayList<>(distinct.size());
    BigInteger owed = BigInteger.ZERO;
    for (String account : distinct) {
      ClaimResult result = claimEngine.prepare(account, payableLimit);
      prepared.add(result);
      owed = owed.add(result.amount());
    }

    BigInteger available = token.balanceOf(address);
    if (available.compareTo(owed) < 0) {
      log.warn("Batch claim needs {} but the distributor holds {}", owed, available);
      throw DistributorException.transferFailed(
        "Distributor holds " + available + ", batch claim needs " + owed);
    }

    List<ClaimResult> paid = new ArrayList<>(prepared.size());
    BigInteger total = BigInteger.ZERO;
    for (ClaimResult result : prepared) {
      try {
        pay(result);
      } catch (DistributorException e) {
        log.warn("Batch claim stopped at {} after paying {} to {} accounts",
          result.account(), total, paid.size());
        throw new PartialClaimException(e, new ClaimBatch(total, List.copyOf(paid)));
      }
      paid.add(result);
      total = total.add(result.amount());
    }

    log.info("Batch claim paid {} to {} accounts", total, paid.size());
    return new ClaimBatch(total, List.copyOf(paid));
  }

  public synchronized BigInteger tokensPerEpoch(long epoch) {
    return tokenCheckpointer.ledger().get(EpochClock.epochOf(epoch));
  }

  public synchronized BigInteger supplyAt(long epoch) {
    return supplyCheckpointer.ledger().get(EpochClock.epochOf(epoch));
  }

  public synchronized OptionalLong timeCursorOf(String account) {
    return claimEngine.timeCursorOf(account);
  }

  /**
   * Returns an account's voting power at an instant, as reported by the oracle.
   */
  public synchronized BigInteger votingPowerAt(String account, long timestamp) {
    return oracle.balanceOf(account, timestamp);
  }

  public synchronized boolean toggleAllowCheckpointToken(String caller) {
    return adminGate.toggleAllowCheckpointToken(caller);
  }

  public synchronized void commitAdmin(String caller, String newAdmin) {
    adminGate.commitAdmin(caller, newAdmin);
  }

  public synchronized String applyAdmin(String caller) {
    return adminGate.applyAdmin(caller);
  }

  public synchronized boolean isAdmin(String account) {
    return adminGate.isAdmin(account);
  }

  /**
   * Returns true once the supply ledger covers the current epoch.
   */
  public synchronized boolean isSupplyCaughtUp() {
    return supplyCheckpointer.cursor() > EpochClock.epochOf(now());
  }

  public synchronized DistributorState state() {
    return new DistributorState(
      startTime,
      tokenCheckpointer.lastTokenTime(),
      tokenCheckpointer.lastTokenBalance(),
      supplyCheckpointer.cursor(),
      adminGate.admin(),
      adminGate.futureAdmin(),
      adminGate.canCheckpointToken(),
      tokenCheckpointer.ledger().total()
    );
  }

  public String address() {
    return address;
  }

  public long startTime() {
    return startTime;
  }

  /**
   * Brings both ledgers up to date as far as a claim is allowed to, and returns the first
   * epoch that may not be paid yet.
   */
  private long refreshForClaim(long now) {
    if (now >= supplyCheckpointer.cursor()) {
      supplyCheckpointer.checkpoint(now);
    }
    if (adminGate.publicCheckpointDue(now, tokenCheckpointer.lastTokenTime())) {
      tokenCheckpointer.checkpoint(now);
    }
    long tokenLimit = EpochClock.epochOf(tokenCheckpointer.lastTokenTime());
    return Math.min(tokenLimit, supplyCheckpointer.cursor());
  }

  /**
   * Transfers a prepared payout, then records it and commits the cursor.
   */
  private void pay(ClaimResult prepared) {
    BigInteger amount = prepared.amount();
    if (amount.signum() > 0) {
      try {
        token.transfer(prepared.account(), amount);
      } catch (DistributorException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new DistributorException(ErrorKind.TRANSFER_FAILED,
          "Transfer of " + amount + " to " + prepared.account() + " failed", e);
      }
      tokenCheckpointer.recordPayout(amount);
    }
    claimEngine.commit(prepared);
    logClaim(prepared);
  }

  private void logClaim(ClaimResult result) {
    if (result.amount().signum() > 0) {
      log.info("Claimed {} for {} over {} epochs, cursor={}",
        result.amount(), result.account(), result.epochsWalked(), result.cursor());
    } else {
      log.debug("Nothing to claim for {}, cursor={}", result.account(), result.cursor());
    }
  }

  private static void requireAccount(String account) {
    if (account == null || account.isBlank()) {
      throw DistributorException.invalidArgument("Account must not be blank");
    }
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }
}
