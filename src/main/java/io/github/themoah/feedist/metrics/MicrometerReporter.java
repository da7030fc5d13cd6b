package io.github.themoah.feedist.metrics;

import io.github.themoah.feedist.model.ClaimResult;
import io.github.themoah.feedist.model.DistributorState;
import io.github.themoah.feedist.model.SupplyCheckpoint;
import io.github.themoah.feedist.model.TokenCheckpoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports distributor metrics using a Micrometer MeterRegistry.
 * Token amounts are exported as doubles; exact values stay available through the HTTP API.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  private final Map<String, AtomicReference<BigInteger>> gaugeValues = new ConcurrentHashMap<>();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportTokenCheckpoint(TokenCheckpoint checkpoint) {
    checkpointCounter("token").increment();
    if (checkpoint.distributed().signum() > 0) {
      Counter.builder("feedist.tokens.distributed")
        .description("Fee tokens credited to the weekly ledger")
        .register(registry)
        .increment(checkpoint.distributed().doubleValue());
    }
    recordGauge("feedist.token.last_time", Tags.empty(), BigInteger.valueOf(checkpoint.timestamp()));
    recordGauge("feedist.token.balance", Tags.empty(), checkpoint.balance());
  }

  @Override
  public void reportSupplyCheckpoint(SupplyCheckpoint checkpoint) {
    checkpointCounter("supply").increment();
    recordGauge("feedist.supply.cursor", Tags.empty(), BigInteger.valueOf(checkpoint.cursor()));
    recordGauge("feedist.supply.caught_up", Tags.empty(),
      checkpoint.caughtUp() ? BigInteger.ONE : BigInteger.ZERO);
  }

  @Override
  public void reportClaim(ClaimResult result) {
    String outcome = result.amount().signum() > 0 ? "paid" : "empty";
    Counter.builder("feedist.claims")
      .tags("outcome", outcome)
      .register(registry)
      .increment();
    if (result.amount().signum() > 0) {
      Counter.builder("feedist.claimed.amount")
        .register(registry)
        .increment(result.amount().doubleValue());
    }
  }

  @Override
  public void reportState(DistributorState state) {
    recordGauge("feedist.token.last_balance", Tags.empty(), state.lastTokenBalance());
    recordGauge("feedist.ledger.tokens_total", Tags.empty(), state.tokensDistributed());
    recordGauge("feedist.supply.cursor", Tags.empty(), BigInteger.valueOf(state.supplyCursor()));
    recordGauge("feedist.public_checkpoint", Tags.empty(),
      state.canCheckpointToken() ? BigInteger.ONE : BigInteger.ZERO);
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private Counter checkpointCounter(String kind) {
    return Counter.builder("feedist.checkpoints")
      .tags("kind", kind)
      .register(registry);
  }

  private void recordGauge(String name, Tags tags, BigInteger value) {
    String key = name + tags.toString();
    AtomicReference<BigInteger> holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicReference<BigInteger> newValue = new AtomicReference<>(value);
      Gauge.builder(name, newValue, ref -> ref.get().doubleValue())
        .tags(tags)
        .register(registry);
      return newValue;
    });
    holder.set(value);
  }
}
