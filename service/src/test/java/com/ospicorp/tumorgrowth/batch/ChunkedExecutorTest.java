package com.ospicorp.tumorgrowth.batch;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ChunkedExecutorTest {

  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void chunkSplitsIntoFixedSizeSlices() {
    var chunks = ChunkedExecutor.chunk(List.of(1, 2, 3, 4, 5), 2);
    assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), chunks);
    assertThrows(IllegalArgumentException.class, () -> ChunkedExecutor.chunk(List.of(1), 0));
  }

  @Test
  void mapPreservesOriginalOrder() {
    var executor = new ChunkedExecutor(pool, Duration.ofSeconds(5), 4);
    var items = IntStream.range(0, 100).boxed().toList();

    List<Integer> out = executor.map(items, 7, (index, total, chunk) -> {
      assertEquals(15, total);
      return chunk.stream().map(i -> i * 2).toList();
    });

    assertEquals(IntStream.range(0, 100).map(i -> i * 2).boxed().toList(), out);
  }

  @Test
  void failingChunkPropagatesItsException() {
    var executor = new ChunkedExecutor(pool, Duration.ofSeconds(5), 4);

    var ex = assertThrows(IllegalArgumentException.class, () -> executor.map(List.of(1, 2, 3), 1,
        (index, total, chunk) -> {
          if (chunk.get(0) == 2) {
            throw new IllegalArgumentException("bad item");
          }
          return chunk;
        }));
    assertEquals("bad item", ex.getMessage());
  }

  @Test
  void slowChunkTimesOut() {
    var executor = new ChunkedExecutor(pool, Duration.ofMillis(50), 4);
    var release = new CountDownLatch(1);

    assertThrows(AnalysisTimeoutException.class, () -> executor.map(List.of(1), 1, (index, total, chunk) -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return chunk;
    }));
    release.countDown();
  }

  @Test
  void moreChunksThanQueueCapacityAreAllProcessed() {
    var bounded = new ThreadPoolTaskExecutor();
    bounded.setCorePoolSize(2);
    bounded.setMaxPoolSize(2);
    bounded.setQueueCapacity(2);
    bounded.initialize();
    try {
      var executor = new ChunkedExecutor(bounded, Duration.ofSeconds(10), 2);
      var items = IntStream.range(0, 500).boxed().toList();

      List<Integer> out = executor.map(items, 1, (index, total, chunk) -> chunk.stream().map(i -> i + 1).toList());

      assertEquals(IntStream.rangeClosed(1, 500).boxed().toList(), out);
    } finally {
      bounded.shutdown();
    }
  }

  @Test
  void maxInFlightMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ChunkedExecutor(pool, Duration.ofSeconds(1), 0));
  }
}
