package io.github.themoah.feedist.escrow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.feedist.MutableClock;
import io.github.themoah.feedist.distributor.DistributorException;
import io.github.themoah.feedist.distributor.ErrorKind;
import io.github.themoah.feedist.epoch.EpochClock;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryVotingEscrow.
 */
public class InMemoryVotingEscrowTest {

  private static final long WEEK = EpochClock.EPOCH_LENGTH;
  private static final long START = 100 * WEEK;
  private static final BigInteger AMOUNT = BigInteger.valueOf(InMemoryVotingEscrow.MAX_LOCK_TIME * 1000);

  private MutableClock clock;
  private InMemoryVotingEscrow escrow;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    escrow = new InMemoryVotingEscrow(clock);
  }

  @Test
  void createLock_powerDecaysLinearlyToUnlock() {
    escrow.createLock("alice", AMOUNT, START + 10 * WEEK);

    assertEquals(BigInteger.valueOf(1000 * 10 * WEEK), escrow.balanceOf("alice", START));
    assertEquals(BigInteger.valueOf(1000 * 5 * WEEK), escrow.balanceOf("alice", START + 5 * WEEK));
    assertEquals(BigInteger.ZERO, escrow.balanceOf("alice", START + 10 * WEEK));
    assertEquals(BigInteger.ZERO, escrow.balanceOf("alice", START + 20 * WEEK));
  }

  @Test
  void createLock_roundsUnlockDownToEpoch() {
    escrow.createLock("alice", AMOUNT, START + 3 * WEEK + 86_400);

    assertEquals(START + 3 * WEEK, escrow.lockedOf("alice").end());
  }

  @Test
  void balanceOf_beforeLockIsZero() {
    clock.advance(WEEK);
    escrow.createLock("alice", AMOUNT, START + 10 * WEEK);

    assertEquals(BigInteger.ZERO, escrow.balanceOf("alice", START));
    assertEquals(START + WEEK, escrow.firstActivity("alice").getAsLong());
    assertTrue(escrow.firstActivity("bob").isEmpty());
  }

  @Test
  void totalSupply_sumsAccounts() {
    escrow.createLock("alice", AMOUNT, START + 10 * WEEK);
    escrow.createLock("bob", AMOUNT, START + 4 * WEEK);

    assertEquals(BigInteger.valueOf(1000 * 14 * WEEK), escrow.totalSupply(START));
    assertEquals(BigInteger.valueOf(1000 * 6 * WEEK), escrow.totalSupply(START + 4 * WEEK));
  }

  @Test
  void withdraw_onlyAfterExpiry() {
    escrow.createLock("alice", AMOUNT, START + 2 * WEEK);

    DistributorException early = assertThrows(DistributorException.class, () -> escrow.withdraw("alice"));
    assertEquals(ErrorKind.INVALID_ARGUMENT, early.kind());

    clock.advance(2 * WEEK);
    assertEquals(AMOUNT, escrow.withdraw("alice"));
    assertEquals(BigInteger.ZERO, escrow.lockedOf("alice").amount());
    assertEquals(BigInteger.valueOf(1000 * 2 * WEEK), escrow.balanceOf("alice", START));
  }

  @Test
  void relock_afterWithdrawStartsNewCurve() {
    escrow.createLock("alice", AMOUNT, START + 2 * WEEK);
    clock.advance(3 * WEEK);
    escrow.withdraw("alice");
    escrow.createLock("alice", AMOUNT, START + 7 * WEEK);

    assertEquals(BigInteger.ZERO, escrow.balanceOf("alice", START + 2 * WEEK));
    assertEquals(BigInteger.valueOf(1000 * 4 * WEEK), escrow.balanceOf("alice", START + 3 * WEEK));
    assertEquals(START, escrow.firstActivity("alice").getAsLong());
  }

  @Test
  void createLock_rejectsInvalidRequests() {
    assertThrows(DistributorException.class, () -> escrow.createLock("alice", BigInteger.ZERO, START + WEEK));
    assertThrows(DistributorException.class, () -> escrow.createLock("alice", AMOUNT, START));
    assertThrows(DistributorException.class,
      () -> escrow.createLock("alice", AMOUNT, START + InMemoryVotingEscrow.MAX_LOCK_TIME + 2 * WEEK));

    escrow.createLock("alice", AMOUNT, START + WEEK);
    assertThrows(DistributorException.class, () -> escrow.createLock("alice", AMOUNT, START + 2 * WEEK));
  }

  @Test
  void increaseAmountAndUnlockTime_raisePower() {
    escrow.createLock("alice", AMOUNT, START + 4 * WEEK);
    clock.advance(WEEK);

    escrow.increaseAmount("alice", AMOUNT);
    assertEquals(BigInteger.valueOf(2000 * 3 * WEEK), escrow.balanceOf("alice", START + WEEK));

    escrow.increaseUnlockTime("alice", START + 6 * WEEK);
    assertEquals(BigInteger.valueOf(2000 * 5 * WEEK), escrow.balanceOf("alice", START + WEEK));
    assertThrows(DistributorException.class, () -> escrow.increaseUnlockTime("alice", START + 5 * WEEK));
  }
}
