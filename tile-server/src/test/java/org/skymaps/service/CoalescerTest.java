package org.skymaps.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public class CoalescerTest {

  private final Coalescer<String> coalescer = new Coalescer<>("coalescer-test", 2);
  private final ExecutorService callers = Executors.newFixedThreadPool(16);

  @After
  public void tearDown() {
    callers.shutdownNow();
    coalescer.close();
  }

  @Test
  public void testConcurrentCallersShareOneComputation() throws Exception {
    int callerCount = 16;
    AtomicInteger computations = new AtomicInteger();
    CountDownLatch arrived = new CountDownLatch(callerCount);

    List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < callerCount; i++) {
      results.add(callers.submit(() -> {
        arrived.countDown();
        return coalescer.getOrCompute("key", () -> {
          computations.incrementAndGet();
          try {
            // hold the computation until every caller has had the chance to join
            arrived.await(5, TimeUnit.SECONDS);
            Thread.sleep(200);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return "value";
        });
      }));
    }

    for (Future<String> result : results) {
      assertEquals("value", result.get(10, TimeUnit.SECONDS));
    }
    assertEquals(1, computations.get());
    assertEquals(0, coalescer.inFlightCount());
  }

  @Test
  public void testDifferentKeysComputeIndependently() {
    AtomicInteger computations = new AtomicInteger();
    assertEquals("a", coalescer.getOrCompute("a", () -> {
      computations.incrementAndGet();
      return "a";
    }));
    assertEquals("b", coalescer.getOrCompute("b", () -> {
      computations.incrementAndGet();
      return "b";
    }));
    assertEquals(2, computations.get());
  }

  @Test
  public void testFailureDoesNotPoisonTheKey() {
    try {
      coalescer.getOrCompute("key", () -> {
        throw new IllegalStateException("boom");
      });
      fail("The failure should reach the caller");
    } catch (IllegalStateException e) {
      assertEquals("boom", e.getMessage());
    }
    assertEquals(0, coalescer.inFlightCount());
    assertEquals("recovered", coalescer.getOrCompute("key", () -> "recovered"));
  }

  @Test
  public void testFailureReachesEveryWaiter() throws Exception {
    int callerCount = 4;
    CountDownLatch arrived = new CountDownLatch(callerCount);
    List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < callerCount; i++) {
      results.add(callers.submit(() -> {
        arrived.countDown();
        return coalescer.getOrCompute("failing", () -> {
          try {
            arrived.await(5, TimeUnit.SECONDS);
            Thread.sleep(100);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          throw new IllegalArgumentException("bad");
        });
      }));
    }
    for (Future<String> result : results) {
      try {
        result.get(10, TimeUnit.SECONDS);
        fail("Every waiter should see the failure");
      } catch (java.util.concurrent.ExecutionException e) {
        assertTrue(e.getCause() instanceof IllegalArgumentException);
      }
    }
  }

  @Test
  public void testRejectedComputation() {
    Coalescer<String> rejecting = new Coalescer<>(command -> {
      throw new RejectedExecutionException("full");
    });
    try {
      rejecting.getOrCompute("key", () -> "never");
      fail("A rejected computation should fail");
    } catch (TileComputationException e) {
      assertTrue(e.getCause() instanceof RejectedExecutionException);
    }
    assertEquals(0, rejecting.inFlightCount());
  }
}
