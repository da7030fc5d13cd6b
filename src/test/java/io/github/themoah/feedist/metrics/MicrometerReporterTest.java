package io.github.themoah.feedist.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.feedist.model.ClaimResult;
import io.github.themoah.feedist.model.DistributorState;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerReporter.
 */
public class MicrometerReporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerReporter reporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    reporter = new MicrometerReporter(registry);
  }

  @Test
  void reportTokenCheckpoint_countsAndTracksBalance() {
    reporter.reportTokenCheckpoint(new TokenCheckpoint(1000, BigInteger.valueOf(500), BigInteger.valueOf(200), 2));
    reporter.reportTokenCheckpoint(new TokenCheckpoint(2000, BigInteger.valueOf(500), BigInteger.ZERO, 0));

    assertEquals(2.0, registry.get("feedist.checkpoints").tag("kind", "token").counter().count());
    assertEquals(200.0, registry.get("feedist.tokens.distributed").counter().count());
    assertEquals(2000.0, registry.get("feedist.token.last_time").gauge().value());
    assertEquals(500.0, registry.get("feedist.token.balance").gauge().value());
  }

  @Test
  void reportSupplyCheckpoint_updatesCursorGauge() {
    reporter.reportSupplyCheckpoint(new SupplyCheckpoint(20, 604_800, false));
    assertEquals(0.0, registry.get("feedist.supply.caught_up").gauge().value());

    reporter.reportSupplyCheckpoint(new SupplyCheckpoint(3, 1_209_600, true));

    assertEquals(1_209_600.0, registry.get("feedist.supply.cursor").gauge().value());
    assertEquals(1.0, registry.get("feedist.supply.caught_up").gauge().value());
    assertEquals(2.0, registry.get("feedist.checkpoints").tag("kind", "supply").counter().count());
  }

  @Test
  void reportClaim_separatesPaidFromEmpty() {
    reporter.reportClaim(new ClaimResult("alice", BigInteger.valueOf(42), 3, 604_800));
    reporter.reportClaim(ClaimResult.nothing("bob", -1));

    assertEquals(1.0, registry.get("feedist.claims").tag("outcome", "paid").counter().count());
    assertEquals(1.0, registry.get("feedist.claims").tag("outcome", "empty").counter().count());
    assertEquals(42.0, registry.get("feedist.claimed.amount").counter().count());
  }

  @Test
  void reportState_exportsLedgerTotals() {
    reporter.reportState(new DistributorState(
      0, 100, BigInteger.valueOf(70), 604_800, "admin", null, true, BigInteger.valueOf(1000)));

    assertEquals(70.0, registry.get("feedist.token.last_balance").gauge().value());
    assertEquals(1000.0, registry.get("feedist.ledger.tokens_total").gauge().value());
    assertEquals(1.0, registry.get("feedist.public_checkpoint").gauge().value());
    assertNull(registry.find("feedist.claims").counter());
  }
}
