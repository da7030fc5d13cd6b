package io.github.themoah.feedist.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a fee distributor instance.
 *
 * @param startTime earliest payable instant; rounded down to an epoch boundary by the distributor
 * @param admin initial admin account
 * @param address account that holds the distributor's fee tokens
 * @param tokenCheckpointCooldownSeconds minimum gap between public token checkpoints
 * @param allowPublicCheckpoint initial value of the public checkpoint flag
 * @param supplyCheckpointMaxEpochs supply snapshots written per call at most
 * @param claimMaxEpochs epochs walked per claim at most
 * @param claimManyChunkSize accounts processed per event-loop turn in batched claims
 */
public record DistributorConfig(
  long startTime,
  String admin,
  String address,
  long tokenCheckpointCooldownSeconds,
  boolean allowPublicCheckpoint,
  int supplyCheckpointMaxEpochs,
  int claimMaxEpochs,
  int claimManyChunkSize
) {

  private static final Logger log = LoggerFactory.getLogger(DistributorConfig.class);

  public static final String DEFAULT_ADMIN = "admin";
  public static final String DEFAULT_ADDRESS = "fee-distributor";
  public static final long DEFAULT_COOLDOWN_SECONDS = 3600;
  public static final int DEFAULT_SUPPLY_CHECKPOINT_MAX_EPOCHS = 20;
  public static final int DEFAULT_CLAIM_MAX_EPOCHS = 50;
  public static final int DEFAULT_CLAIM_MANY_CHUNK_SIZE = 20;

  public DistributorConfig {
    if (admin == null || admin.isBlank()) {
      throw new IllegalArgumentException("admin must not be blank");
    }
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    if (supplyCheckpointMaxEpochs < 1 || claimMaxEpochs < 1 || claimManyChunkSize < 1) {
      throw new IllegalArgumentException("iteration bounds must be >= 1");
    }
  }

  /**
   * Returns a configuration with default bounds and cooldown.
   *
   * @param startTime earliest payable instant
   * @param admin initial admin account
   */
  public static DistributorConfig of(long startTime, String admin) {
    return new DistributorConfig(
      startTime,
      admin,
      DEFAULT_ADDRESS,
      DEFAULT_COOLDOWN_SECONDS,
      false,
      DEFAULT_SUPPLY_CHECKPOINT_MAX_EPOCHS,
      DEFAULT_CLAIM_MAX_EPOCHS,
      DEFAULT_CLAIM_MANY_CHUNK_SIZE
    );
  }

  public DistributorConfig withAllowPublicCheckpoint(boolean allow) {
    return new DistributorConfig(startTime, admin, address, tokenCheckpointCooldownSeconds,
      allow, supplyCheckpointMaxEpochs, claimMaxEpochs, claimManyChunkSize);
  }

  public DistributorConfig withClaimMaxEpochs(int maxEpochs) {
    return new DistributorConfig(startTime, admin, address, tokenCheckpointCooldownSeconds,
      allowPublicCheckpoint, supplyCheckpointMaxEpochs, maxEpochs, claimManyChunkSize);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DISTRIBUTOR_START_TIME - Earliest payable time in epoch seconds (default: now)</li>
   *   <li>DISTRIBUTOR_ADMIN - Initial admin account (default: admin)</li>
   *   <li>DISTRIBUTOR_ADDRESS - Account holding distributed tokens (default: fee-distributor)</li>
   *   <li>TOKEN_CHECKPOINT_COOLDOWN_SECONDS - Gap between public token checkpoints (default: 3600)</li>
   *   <li>ALLOW_PUBLIC_CHECKPOINT - Whether anyone may checkpoint tokens (default: false)</li>
   *   <li>SUPPLY_CHECKPOINT_MAX_EPOCHS - Supply snapshots per call (default: 20)</li>
   *   <li>CLAIM_MAX_EPOCHS - Epochs walked per claim (default: 50)</li>
   *   <li>CLAIM_MANY_CHUNK_SIZE - Accounts per batched-claim chunk (default: 20)</li>
   * </ul>
   *
   * @param now current time in epoch seconds, used when no start time is configured
   */
  public static DistributorConfig fromEnvironment(long now) {
    long startTime = parseLong("DISTRIBUTOR_START_TIME", now);
    String admin = parseString("DISTRIBUTOR_ADMIN", DEFAULT_ADMIN);
    String address = parseString("DISTRIBUTOR_ADDRESS", DEFAULT_ADDRESS);
    long cooldown = parseLong("TOKEN_CHECKPOINT_COOLDOWN_SECONDS", DEFAULT_COOLDOWN_SECONDS);
    boolean allowPublic = parseBoolean("ALLOW_PUBLIC_CHECKPOINT", false);
    int supplyMax = parsePositiveInt("SUPPLY_CHECKPOINT_MAX_EPOCHS", DEFAULT_SUPPLY_CHECKPOINT_MAX_EPOCHS);
    int claimMax = parsePositiveInt("CLAIM_MAX_EPOCHS", DEFAULT_CLAIM_MAX_EPOCHS);
    int chunkSize = parsePositiveInt("CLAIM_MANY_CHUNK_SIZE", DEFAULT_CLAIM_MANY_CHUNK_SIZE);

    DistributorConfig config = new DistributorConfig(
      startTime, admin, address, cooldown, allowPublic, supplyMax, claimMax, chunkSize);
    log.info("Distributor config: startTime={}, admin={}, address={}, cooldownSeconds={}, "
        + "allowPublicCheckpoint={}, supplyMaxEpochs={}, claimMaxEpochs={}, claimManyChunkSize={}",
      startTime, admin, address, cooldown, allowPublic, supplyMax, claimMax, chunkSize);
    return config;
  }

  private static String parseString(String envVar, String defaultValue) {
    String value = System.getenv(envVar);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  private static int parsePositiveInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value);
      if (parsed >= 1) {
        return parsed;
      }
      log.warn("{} must be >= 1, using default: {}", envVar, defaultValue);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
    }
    return defaultValue;
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
