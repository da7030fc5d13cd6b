package io.github.themoah.feedist.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batched claim.
 *
 * @param total tokens transferred across all accounts
 * @param claims one result per distinct account, in request order
 */
public record ClaimBatch(
  BigInteger total,
  List<ClaimResult> claims
) {

  public static final ClaimBatch EMPTY = new ClaimBatch(BigInteger.ZERO, List.of());

  /**
   * Concatenates batches processed one after another.
   */
  public static ClaimBatch merge(List<ClaimBatch> batches) {
    BigInteger total = BigInteger.ZERO;
    List<ClaimResult> claims = new ArrayList<>();
    for (ClaimBatch batch : batches) {
      total = total.add(batch.total());
      claims.addAll(batch.claims());
    }
    return new ClaimBatch(total, List.copyOf(claims));
  }

  public JsonObject toJson() {
    JsonArray array = new JsonArray();
    claims.forEach(claim -> array.add(claim.toJson()));
    return new JsonObject()
      .put("total", total.toString())
      .put("claims", array);
  }
}
