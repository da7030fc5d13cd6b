package io.github.themoah.feedist.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for DistributorConfig and AppConfig.
 */
public class DistributorConfigTest {

  @Test
  void of_usesDefaults() {
    DistributorConfig config = DistributorConfig.of(1_700_000_000L, "admin");

    assertEquals(DistributorConfig.DEFAULT_ADDRESS, config.address());
    assertEquals(3600, config.tokenCheckpointCooldownSeconds());
    assertFalse(config.allowPublicCheckpoint());
    assertEquals(20, config.supplyCheckpointMaxEpochs());
    assertEquals(50, config.claimMaxEpochs());
  }

  @Test
  void withers_replaceSingleSetting() {
    DistributorConfig config = DistributorConfig.of(0, "admin")
      .withAllowPublicCheckpoint(true)
      .withClaimMaxEpochs(5);

    assertTrue(config.allowPublicCheckpoint());
    assertEquals(5, config.claimMaxEpochs());
    assertEquals("admin", config.admin());
  }

  @Test
  void rejectsBlankAdminAndZeroBounds() {
    assertThrows(IllegalArgumentException.class, () -> DistributorConfig.of(0, " "));
    assertThrows(IllegalArgumentException.class, () -> DistributorConfig.of(0, "admin").withClaimMaxEpochs(0));
  }

  @Test
  void appConfig_schedulerDisabledAtZeroInterval() {
    assertFalse(new AppConfig(8888, 0).isSchedulerEnabled());
    assertTrue(new AppConfig(8888, 1000).isSchedulerEnabled());
  }
}
