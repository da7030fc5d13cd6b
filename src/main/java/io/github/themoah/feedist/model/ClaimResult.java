package io.github.themoah.feedist.model;

import io.vertx.core.json.JsonObject;
import java.math.BigInteger;

/**
 * Payout of a single claim.
 *
 * @param account the claiming account
 * @param amount tokens transferred, possibly zero
 * @param epochsWalked epochs examined by this call
 * @param cursor first epoch not yet paid to the account, or -1 if the account never locked
 */
public record ClaimResult(
  String account,
  BigInteger amount,
  int epochsWalked,
  long cursor
) {

  public static ClaimResult nothing(String account, long cursor) {
    return new ClaimResult(account, BigInteger.ZERO, 0, cursor);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("account", account)
      .put("amount", amount.toString())
      .put("epochsWalked", epochsWalked)
      .put("cursor", cursor);
  }
}
