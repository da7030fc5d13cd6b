package io.github.themoah.feedist.http;

import io.github.themoah.feedist.batch.ChunkProcessor;
import io.github.themoah.feedist.distributor.DistributorException;
import io.github.themoah.feedist.distributor.FeeDistributor;
import io.github.themoah.feedist.distributor.PartialClaimException;
import io.github.themoah.feedist.epoch.EpochClock;
import io.github.themoah.feedist.metrics.MetricsReporter;
import io.github.themoah.feedist.model.ClaimBatch;
import io.github.themoah.feedist.model.ClaimResult;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP routes for checkpoints, claims, ledger reads and admin operations.
 * The calling account is taken from the {@code X-Account} header.
 */
public class DistributorHandler {

  private static final Logger log = LoggerFactory.getLogger(DistributorHandler.class);

  private final Vertx vertx;
  private final FeeDistributor distributor;
  private final MetricsReporter reporter;
  private final Clock clock;
  private final int claimManyChunkSize;

  public DistributorHandler(
    Vertx vertx,
    FeeDistributor distributor,
    MetricsReporter reporter,
    Clock clock,
    int claimManyChunkSize
  ) {
    this.vertx = vertx;
    this.distributor = distributor;
    this.reporter = reporter;
    this.clock = clock;
    this.claimManyChunkSize = claimManyChunkSize;
  }

  /**
   * Registers distributor routes on the router. A body handler must already be installed.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.post("/checkpoint/token").handler(this::handleCheckpointToken);
    router.post("/checkpoint/supply").handler(this::handleCheckpointSupply);
    router.post("/claim/:account").handler(this::handleClaim);
    router.post("/claim").handler(this::handleClaimMany);
    router.get("/epochs/:epoch").handler(this::handleEpoch);
    router.get("/accounts/:account").handler(this::handleAccount);
    router.get("/state").handler(this::handleState);
    router.post("/admin/toggle-checkpoint").handler(this::handleToggle);
    router.post("/admin/commit").handler(this::handleCommitAdmin);
    router.post("/admin/apply").handler(this::handleApplyAdmin);
    log.info("Distributor routes registered");
  }

  private void handleCheckpointToken(RoutingContext ctx) {
    guarded(ctx, () -> {
      TokenCheckpoint checkpoint = distributor.checkpointToken(HttpResponses.caller(ctx));
      reporter.reportTokenCheckpoint(checkpoint);
      HttpResponses.ok(ctx, new JsonObject()
        .put("timestamp", checkpoint.timestamp())
        .put("balance", checkpoint.balance().toString())
        .put("distributed", checkpoint.distributed().toString())
        .put("epochsCredited", checkpoint.epochsCredited()));
    });
  }

  private void handleCheckpointSupply(RoutingContext ctx) {
    guarded(ctx, () -> {
      SupplyCheckpoint checkpoint = distributor.checkpointTotalSupply();
      reporter.reportSupplyCheckpoint(checkpoint);
      HttpResponses.ok(ctx, new JsonObject()
        .put("epochsWritten", checkpoint.epochsWritten())
        .put("cursor", checkpoint.cursor())
        .put("caughtUp", checkpoint.caughtUp()));
    });
  }

  private void handleClaim(RoutingContext ctx) {
    guarded(ctx, () -> {
      ClaimResult result = distributor.claim(ctx.pathParam("account"));
      reporter.reportClaim(result);
      HttpResponses.ok(ctx, result.toJson());
    });
  }

  private void handleClaimMany(RoutingContext ctx) {
    List<String> accounts;
    try {
      accounts = accountsOf(HttpResponses.body(ctx));
    } catch (DistributorException e) {
      HttpResponses.error(ctx, e);
      return;
    }

    List<List<String>> chunks = ChunkProcessor.partition(accounts, claimManyChunkSize);
    List<ClaimBatch> completed = new ArrayList<>(chunks.size());
    ChunkProcessor.processSequentially(vertx, chunks, 0, chunk -> claimChunk(chunk, completed))
      .map(ClaimBatch::merge)
      .onSuccess(batch -> HttpResponses.ok(ctx, batch.toJson()))
      .onFailure(err -> {
        if (err instanceof DistributorException de) {
          ClaimBatch paid = ClaimBatch.merge(completed);
          log.warn("Batch claim failed after paying {} to {} accounts: {}",
            paid.total(), paid.claims().size(), de.getMessage());
          HttpResponses.error(ctx, de, new JsonObject().put("completed", paid.toJson()));
        } else {
          log.warn("Batch claim failed: {}", err.getMessage());
          ctx.fail(err);
        }
      });
  }

  /**
   * Claims one chunk and records whatever it paid in {@code completed}, including the
   * accounts paid before a transfer failure inside the chunk.
   */
  private Future<ClaimBatch> claimChunk(List<String> chunk, List<ClaimBatch> completed) {
    try {
      ClaimBatch batch = distributor.claimMany(chunk);
      batch.claims().forEach(reporter::reportClaim);
      completed.add(batch);
      return Future.succeededFuture(batch);
    } catch (PartialClaimException e) {
      e.completed().claims().forEach(reporter::reportClaim);
      completed.add(e.completed());
      return Future.failedFuture(e);
    } catch (DistributorException e) {
      return Future.failedFuture(e);
    }
  }

  private void handleEpoch(RoutingContext ctx) {
    guarded(ctx, () -> {
      long epoch = EpochClock.epochOf(HttpResponses.pathLong(ctx, "epoch"));
      HttpResponses.ok(ctx, new JsonObject()
        .put("epoch", epoch)
        .put("tokens", distributor.tokensPerEpoch(epoch).toString())
        .put("supply", distributor.supplyAt(epoch).toString()));
    });
  }

  private void handleAccount(RoutingContext ctx) {
    guarded(ctx, () -> {
      String account = ctx.pathParam("account");
      long now = clock.instant().getEpochSecond();
      OptionalLong cursor = distributor.timeCursorOf(account);
      JsonObject json = new JsonObject()
        .put("account", account)
        .put("votingPower", distributor.votingPowerAt(account, now).toString());
      cursor.ifPresent(c -> json.put("cursor", c));
      HttpResponses.ok(ctx, json);
    });
  }

  private void handleState(RoutingContext ctx) {
    guarded(ctx, () -> HttpResponses.ok(ctx, distributor.state().toJson()));
  }

  private void handleToggle(RoutingContext ctx) {
    guarded(ctx, () -> {
      boolean allowed = distributor.toggleAllowCheckpointToken(HttpResponses.caller(ctx));
      reporter.reportState(distributor.state());
      HttpResponses.ok(ctx, new JsonObject().put("canCheckpointToken", allowed));
    });
  }

  private void handleCommitAdmin(RoutingContext ctx) {
    guarded(ctx, () -> {
      String newAdmin = HttpResponses.requiredString(HttpResponses.body(ctx), "admin");
      distributor.commitAdmin(HttpResponses.caller(ctx), newAdmin);
      HttpResponses.ok(ctx, new JsonObject().put("futureAdmin", newAdmin));
    });
  }

  private void handleApplyAdmin(RoutingContext ctx) {
    guarded(ctx, () -> {
      String admin = distributor.applyAdmin(HttpResponses.caller(ctx));
      HttpResponses.ok(ctx, new JsonObject().put("admin", admin));
    });
  }

  /**
   * Reads the account list, dropping blanks and repeats so chunks never pay an account twice.
   */
  private static List<String> accountsOf(JsonObject body) {
    if (!(body.getValue("accounts") instanceof JsonArray array)) {
      throw DistributorException.invalidArgument("Field 'accounts' must be an array");
    }
    Set<String> accounts = new LinkedHashSet<>();
    for (Object entry : array) {
      if (entry instanceof String account && !account.isBlank()) {
        accounts.add(account);
      }
    }
    return new ArrayList<>(accounts);
  }

  private static void guarded(RoutingContext ctx, Runnable action) {
    try {
      action.run();
    } catch (DistributorException e) {
      log.debug("Request {} {} failed: {}", ctx.request().method(), ctx.request().path(), e.getMessage());
      HttpResponses.error(ctx, e);
    }
  }
}
