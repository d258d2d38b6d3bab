package com.ospicorp.tumorgrowth.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a list into fixed-size chunks, runs every chunk on the executor and concatenates the
 * chunk results in the original order. Chunks must not share mutable state. At most
 * {@code maxInFlight} chunks are handed to the executor at a time, so a bounded pool queue
 * never overflows however many chunks a call produces.
 */
public class ChunkedExecutor {
  private static final Logger log = LoggerFactory.getLogger(ChunkedExecutor.class);

  private final Executor executor;
  private final Duration timeout;
  private final int maxInFlight;

  public ChunkedExecutor(Executor executor, Duration timeout, int maxInFlight) {
    if (maxInFlight < 1) {
      throw new IllegalArgumentException("maxInFlight must be positive");
    }
    this.executor = executor;
    this.timeout = timeout;
    this.maxInFlight = maxInFlight;
  }

  public static <T> List<List<T>> chunk(List<T> items, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunk size must be positive");
    }
    List<List<T>> chunks = new ArrayList<>();
    for (int i = 0; i < items.size(); i += chunkSize) {
      int end = Math.min(i + chunkSize, items.size());
      chunks.add(items.subList(i, end));
    }
    return chunks;
  }

  public <T, R> List<R> map(List<T> items, int chunkSize, ChunkTask<T, R> task) {
    List<List<T>> chunks = chunk(items, chunkSize);
    int total = chunks.size();
    long deadline = System.nanoTime() + timeout.toNanos();
    Semaphore slots = new Semaphore(maxInFlight);
    List<CompletableFuture<List<R>>> futures = new ArrayList<>(total);
    try {
      for (int i = 0; i < total; i++) {
        if (!slots.tryAcquire(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
          throw new TimeoutException();
        }
        final int index = i;
        final List<T> chunk = chunks.get(i);
        CompletableFuture<List<R>> future;
        try {
          future = CompletableFuture.supplyAsync(() -> task.apply(index, total, chunk), executor);
        } catch (RejectedExecutionException ex) {
          slots.release();
          throw ex;
        }
        future.whenComplete((result, error) -> slots.release());
        futures.add(future);
      }
      log.debug("Submitted {} chunk(s) of up to {} item(s), {} at a time", total, chunkSize, maxInFlight);
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
          .get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      futures.forEach(f -> f.cancel(true));
      throw new AnalysisTimeoutException("Analysis did not finish within " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new IllegalStateException("Interrupted while waiting for chunk results", ex);
    } catch (ExecutionException ex) {
      futures.forEach(f -> f.cancel(true));
      throw unwrap(ex.getCause());
    } catch (RejectedExecutionException ex) {
      futures.forEach(f -> f.cancel(true));
      throw new IllegalStateException("Analysis executor rejected a chunk", ex);
    }

    List<R> out = new ArrayList<>(items.size());
    for (CompletableFuture<List<R>> f : futures) {
      out.addAll(f.join());
    }
    return out;
  }

  private static long remainingNanos(long deadline) {
    return Math.max(0L, deadline - System.nanoTime());
  }

  private static RuntimeException unwrap(Throwable cause) {
    Throwable root = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
    if (root instanceof RuntimeException runtime) {
      return runtime;
    }
    return new IllegalStateException("Chunk processing failed", root);
  }
}
