package io.github.themoah.feedist.batch;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Splits work into ordered chunks and runs them one after another on the event loop.
 * Batched claims use it so one large request cannot hold the loop for long.
 */
public final class ChunkProcessor {

  private ChunkProcessor() {}

  /**
   * Splits items into consecutive chunks of at most {@code chunkSize}, keeping their order.
   *
   * @param items the items to split
   * @param chunkSize maximum items per chunk
   * @return list of chunks
   */
  public static <T> List<List<T>> partition(List<T> items, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be >= 1");
    }
    if (items.isEmpty()) {
      return List.of();
    }

    List<List<T>> chunks = new ArrayList<>((items.size() + chunkSize - 1) / chunkSize);
    for (int from = 0; from < items.size(); from += chunkSize) {
      int to = Math.min(from + chunkSize, items.size());
      chunks.add(new ArrayList<>(items.subList(from, to)));
    }
    return chunks;
  }

  /**
   * Processes chunks sequentially. The first chunk runs immediately; each following one runs
   * on a later event-loop turn, after {@code delayMs} when positive.
   * Processing stops at the first failed chunk.
   *
   * @param vertx the Vert.x instance
   * @param chunks the chunks to process
   * @param delayMs delay in milliseconds between chunks (0 = next turn)
   * @param processor function that processes a chunk and returns a Future with the result
   * @return Future containing all chunk results in order
   */
  public static <T, R> Future<List<R>> processSequentially(
      Vertx vertx, List<List<T>> chunks, long delayMs, Function<List<T>, Future<R>> processor) {

    if (chunks.isEmpty()) {
      return Future.succeededFuture(List.of());
    }

    List<R> results = new ArrayList<>(chunks.size());
    Future<Void> chain = Future.succeededFuture();

    for (int i = 0; i < chunks.size(); i++) {
      final List<T> chunk = chunks.get(i);

      if (i == 0) {
        chain = chain.compose(v -> processor.apply(chunk).<Void>map(r -> {
          results.add(r);
          return null;
        }));
      } else {
        chain = chain.compose(v -> {
          Promise<Void> next = Promise.promise();
          Runnable run = () -> processor.apply(chunk).<Void>map(r -> {
            results.add(r);
            return null;
          }).onComplete(next);
          if (delayMs > 0) {
            vertx.setTimer(delayMs, timerId -> run.run());
          } else {
            vertx.runOnContext(ignored -> run.run());
          }
          return next.future();
        });
      }
    }

    return chain.map(v -> results);
  }
}
