package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.escrow.VotingPowerOracle;
import io.github.themoah.feedist.ledger.LedgerView;
import io.github.themoah.feedist.model.ClaimResult;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes what each account is owed by replaying the epoch ledgers from its cursor.
 *
 * <p>Per epoch the account receives {@code tokens * balance / supply}, floored. Computing a
 * payout and committing the cursor are separate steps so the caller can move the tokens in
 * between and drop the result if the transfer fails.
 */
public class ClaimEngine {

  private static final Logger log = LoggerFactory.getLogger(ClaimEngine.class);

  private final VotingPowerOracle oracle;
  private final LedgerView tokensPerEpoch;
  private final LedgerView supplyPerEpoch;
  private final long startEpoch;
  private final int maxEpochsPerClaim;
  private final Map<String, Long> timeCursorOf = new HashMap<>();

  public ClaimEngine(
    VotingPowerOracle oracle,
    LedgerView tokensPerEpoch,
    LedgerView supplyPerEpoch,
    long startEpoch,
    int maxEpochsPerClaim
  ) {
    this.oracle = oracle;
    this.tokensPerEpoch = tokensPerEpoch;
    this.supplyPerEpoch = supplyPerEpoch;
    this.startEpoch = startEpoch;
    this.maxEpochsPerClaim = maxEpochsPerClaim;
  }

  /**
   * Computes the account's payout for epochs strictly before {@code payableLimit}
   * without changing any state.
   *
   * @param account the claiming account
   * @param payableLimit first epoch that may not be paid yet
   * @return the pending payout; its cursor is -1 if the account never locked
   */
  public ClaimResult prepare(String account, long payableLimit) {
    Long stored = timeCursorOf.get(account);
    long epoch;
    if (stored != null) {
      epoch = stored;
    } else {
      OptionalLong first = oracle.firstActivity(account);
      if (first.isEmpty()) {
        log.debug("Account {} has no lock history", account);
        return ClaimResult.nothing(account, -1);
      }
      epoch = Math.max(startEpoch, EpochClock.epochOf(first.getAsLong()));
    }

    BigInteger owed = BigInteger.ZERO;
    int walked = 0;
    while (walked < maxEpochsPerClaim && epoch < payableLimit) {
      BigInteger supply = supplyPerEpoch.get(epoch);
      if (supply.signum() > 0) {
        BigInteger balance = oracle.balanceOf(account, epoch);
        if (balance.signum() > 0) {
          BigInteger share = tokensPerEpoch.get(epoch).multiply(balance).divide(supply);
          owed = owed.add(share);
          log.debug("Epoch {} pays {} to {} (balance={}, supply={})", epoch, share, account, balance, supply);
        }
      }
      walked++;
      epoch = EpochClock.nextEpoch(epoch);
    }

    return new ClaimResult(account, owed, walked, epoch);
  }

  /**
   * Advances the account's cursor to the one carried by a prepared claim.
   */
  public void commit(ClaimResult prepared) {
    if (prepared.cursor() < 0) {
      return;
    }
    timeCursorOf.merge(prepared.account(), prepared.cursor(), Math::max);
  }

  /**
   * Returns the first epoch not yet paid to the account, if it ever claimed.
   */
  public OptionalLong timeCursorOf(String account) {
    Long cursor = timeCursorOf.get(account);
    return cursor == null ? OptionalLong.empty() : OptionalLong.of(cursor);
  }

  public int trackedAccountCount() {
    return timeCursorOf.size();
  }
}
