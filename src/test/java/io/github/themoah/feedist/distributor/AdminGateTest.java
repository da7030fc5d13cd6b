package io.github.themoah.feedist.distributor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for AdminGate.
 */
public class AdminGateTest {

  @Test
  void mayCheckpointToken_adminAlways() {
    AdminGate gate = new AdminGate("admin", false, 3600);

    assertTrue(gate.mayCheckpointToken("admin", 1000, 999));
    assertFalse(gate.mayCheckpointToken("bob", 100_000, 0));
  }

  @Test
  void mayCheckpointToken_publicOnlyAfterCooldown() {
    AdminGate gate = new AdminGate("admin", true, 3600);

    assertFalse(gate.mayCheckpointToken("bob", 3600, 0));
    assertTrue(gate.mayCheckpointToken("bob", 3601, 0));
  }

  @Test
  void toggle_flipsFlag() {
    AdminGate gate = new AdminGate("admin", false, 3600);

    assertTrue(gate.toggleAllowCheckpointToken("admin"));
    assertTrue(gate.canCheckpointToken());
    assertFalse(gate.toggleAllowCheckpointToken("admin"));
  }

  @Test
  void toggle_byNonAdmin_isDenied() {
    AdminGate gate = new AdminGate("admin", false, 3600);

    DistributorException error = assertThrows(DistributorException.class,
      () -> gate.toggleAllowCheckpointToken("bob"));

    assertEquals(ErrorKind.PERMISSION_DENIED, error.kind());
    assertFalse(gate.canCheckpointToken());
  }

  @Test
  void rotation_requiresCommitThenApply() {
    AdminGate gate = new AdminGate("admin", false, 3600);

    assertThrows(DistributorException.class, () -> gate.applyAdmin("admin"));

    gate.commitAdmin("admin", "carol");
    assertEquals("admin", gate.admin());
    assertEquals("carol", gate.futureAdmin());

    assertEquals("carol", gate.applyAdmin("admin"));
    assertNull(gate.futureAdmin());
    assertTrue(gate.isAdmin("carol"));
    assertThrows(DistributorException.class, () -> gate.commitAdmin("admin", "dave"));
  }

  @Test
  void commitAdmin_rejectsBlankAccount() {
    AdminGate gate = new AdminGate("admin", false, 3600);

    DistributorException error = assertThrows(DistributorException.class,
      () -> gate.commitAdmin("admin", " "));

    assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
    assertNull(gate.futureAdmin());
  }
}
