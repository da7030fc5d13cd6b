package io.github.themoah.feedist.http;

import io.github.themoah.feedist.distributor.FeeDistributor;
import io.github.themoah.feedist.distributor.DistributorException;
import io.github.themoah.feedist.escrow.InMemoryVotingEscrow;
import io.github.themoah.feedist.token.InMemoryFeeToken;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes that drive the in-memory token and lock engine when the service runs standalone.
 */
public class SandboxHandler {

  private static final Logger log = LoggerFactory.getLogger(SandboxHandler.class);

  private final FeeDistributor distributor;
  private final InMemoryFeeToken token;
  private final InMemoryVotingEscrow escrow;

  public SandboxHandler(FeeDistributor distributor, InMemoryFeeToken token, InMemoryVotingEscrow escrow) {
    this.distributor = distributor;
    this.token = token;
    this.escrow = escrow;
  }

  public void registerRoutes(Router router) {
    router.post("/sandbox/mint").handler(this::handleMint);
    router.post("/sandbox/deposit").handler(this::handleDeposit);
    router.post("/sandbox/locks").handler(this::handleCreateLock);
    router.post("/sandbox/withdraw").handler(this::handleWithdraw);
    log.info("Sandbox routes registered: /sandbox/mint, /sandbox/deposit, /sandbox/locks, /sandbox/withdraw");
  }

  private void handleMint(RoutingContext ctx) {
    try {
      JsonObject body = HttpResponses.body(ctx);
      String account = HttpResponses.requiredString(body, "account");
      BigInteger amount = HttpResponses.requiredAmount(body, "amount");
      token.mint(account, amount);
      HttpResponses.ok(ctx, new JsonObject()
        .put("account", account)
        .put("balance", token.balanceOf(account).toString()));
    } catch (DistributorException e) {
      HttpResponses.error(ctx, e);
    }
  }

  private void handleDeposit(RoutingContext ctx) {
    try {
      JsonObject body = HttpResponses.body(ctx);
      String account = HttpResponses.requiredString(body, "account");
      BigInteger amount = HttpResponses.requiredAmount(body, "amount");
      if (amount.signum() <= 0) {
        throw DistributorException.invalidArgument("Deposit amount must be positive");
      }
      token.transfer(account, distributor.address(), amount);
      HttpResponses.ok(ctx, new JsonObject()
        .put("distributorBalance", token.balanceOf(distributor.address()).toString()));
    } catch (DistributorException e) {
      HttpResponses.error(ctx, e);
    }
  }

  private void handleCreateLock(RoutingContext ctx) {
    try {
      JsonObject body = HttpResponses.body(ctx);
      String account = HttpResponses.requiredString(body, "account");
      BigInteger amount = HttpResponses.requiredAmount(body, "amount");
      long unlockTime = HttpResponses.requiredLong(body, "unlockTime");
      escrow.createLock(account, amount, unlockTime);
      InMemoryVotingEscrow.LockedBalance locked = escrow.lockedOf(account);
      HttpResponses.ok(ctx, new JsonObject()
        .put("account", account)
        .put("amount", locked.amount().toString())
        .put("end", locked.end()));
    } catch (DistributorException e) {
      HttpResponses.error(ctx, e);
    }
  }

  private void handleWithdraw(RoutingContext ctx) {
    try {
      String account = HttpResponses.requiredString(HttpResponses.body(ctx), "account");
      BigInteger amount = escrow.withdraw(account);
      HttpResponses.ok(ctx, new JsonObject()
        .put("account", account)
        .put("withdrawn", amount.toString()));
    } catch (DistributorException e) {
      HttpResponses.error(ctx, e);
    }
  }
}
