package io.github.themoah.feedist.model;

import io.vertx.core.json.JsonObject;
import java.math.BigInteger;

/**
 * Point-in-time view of the distributor's cursors and settings.
 *
 * @param startTime first payable epoch
 * @param lastTokenTime token-side cursor
 * @param lastTokenBalance balance seen by the last token checkpoint, net of payouts
 * @param supplyCursor next epoch without a supply snapshot
 * @param admin current admin account
 * @param futureAdmin admin committed but not yet applied, or null
 * @param canCheckpointToken whether non-admins may checkpoint tokens
 * @param tokensDistributed sum of the token ledger
 */
public record DistributorState(
  long startTime,
  long lastTokenTime,
  BigInteger lastTokenBalance,
  long supplyCursor,
  String admin,
  String futureAdmin,
  boolean canCheckpointToken,
  BigInteger tokensDistributed
) {

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("startTime", startTime)
      .put("lastTokenTime", lastTokenTime)
      .put("lastTokenBalance", lastTokenBalance.toString())
      .put("supplyCursor", supplyCursor)
      .put("admin", admin)
      .put("canCheckpointToken", canCheckpointToken)
      .put("tokensDistributed", tokensDistributed.toString());
    if (futureAdmin != null) {
      json.put("futureAdmin", futureAdmin);
    }
    return json;
  }
}
