package io.github.themoah.feedist.distributor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the admin identity and decides who may checkpoint tokens, and when.
 */
public class AdminGate {

  private static final Logger log = LoggerFactory.getLogger(AdminGate.class);

  private final long cooldownSeconds;

  private String admin;
  private String futureAdmin;
  private boolean canCheckpointToken;

  public AdminGate(String admin, boolean canCheckpointToken, long cooldownSeconds) {
    this.admin = admin;
    this.canCheckpointToken = canCheckpointToken;
    this.cooldownSeconds = cooldownSeconds;
  }

  /**
   * Returns true if {@code caller} may run a token checkpoint now.
   * The admin always may; anyone else only when public checkpoints are due.
   */
  public boolean mayCheckpointToken(String caller, long now, long lastTokenTime) {
    return isAdmin(caller) || publicCheckpointDue(now, lastTokenTime);
  }

  /**
   * Returns true if public checkpoints are enabled and the cooldown since the last one elapsed.
   * Claims use this to decide whether to refresh the token ledger first.
   */
  public boolean publicCheckpointDue(long now, long lastTokenTime) {
    return canCheckpointToken && now > lastTokenTime + cooldownSeconds;
  }

  /**
   * Flips the public checkpoint flag.
   *
   * @return the new flag value
   */
  public boolean toggleAllowCheckpointToken(String caller) {
    requireAdmin(caller, "toggleAllowCheckpointToken");
    canCheckpointToken = !canCheckpointToken;
    log.info("Public token checkpoint {} by {}", canCheckpointToken ? "enabled" : "disabled", caller);
    return canCheckpointToken;
  }

  /**
   * First step of admin rotation.
   */
  public void commitAdmin(String caller, String newAdmin) {
    requireAdmin(caller, "commitAdmin");
    if (newAdmin == null || newAdmin.isBlank()) {
      throw DistributorException.invalidArgument("New admin must not be blank");
    }
    futureAdmin = newAdmin;
    log.info("Admin rotation committed: {} -> {}", admin, newAdmin);
  }

  /**
   * Second step of admin rotation.
   *
   * @return the new admin
   */
  public String applyAdmin(String caller) {
    requireAdmin(caller, "applyAdmin");
    if (futureAdmin == null) {
      throw DistributorException.invalidArgument("No admin rotation committed");
    }
    log.info("Admin rotation applied: {} -> {}", admin, futureAdmin);
    admin = futureAdmin;
    futureAdmin = null;
    return admin;
  }

  public void requireAdmin(String caller, String operation) {
    if (!isAdmin(caller)) {
      log.warn("Denied {} for non-admin caller {}", operation, caller);
      throw DistributorException.permissionDenied(caller, operation);
    }
  }

  public boolean isAdmin(String caller) {
    return admin.equals(caller);
  }

  public String admin() {
    return admin;
  }

  public String futureAdmin() {
    return futureAdmin;
  }

  public boolean canCheckpointToken() {
    return canCheckpointToken;
  }
}
