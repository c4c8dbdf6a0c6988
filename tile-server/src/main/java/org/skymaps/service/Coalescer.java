/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.skymaps.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensures at most one computation per key is in flight in this process.
 * <p>
 * The first caller for a key starts the computation on the coalescer's own threads; callers arriving while it runs
 * wait for the same result.  A caller that gives up never cancels the computation for the others.  The key is released
 * before the result is published, so a failure is seen by the callers waiting at that time only and the next caller
 * starts afresh.
 * <p>
 * This class is threadsafe.
 *
 * @param <V> the type of the computed values
 */
public class Coalescer<V> implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Coalescer.class);

  private final ConcurrentMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  /**
   * Creates a coalescer computing on its own pool of daemon threads.
   */
  public Coalescer(String name, int threads) {
    this.ownedExecutor = Executors.newFixedThreadPool(
      threads, new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
    this.executor = ownedExecutor;
  }

  @VisibleForTesting
  Coalescer(Executor executor) {
    this.executor = executor;
    this.ownedExecutor = null;
  }

  /**
   * Returns the value for the key, computing it unless a computation for the key is already in flight.
   *
   * @throws RuntimeException thrown by the computation
   * @throws TileComputationException if the computation could not be run or the caller was interrupted while waiting
   */
  public V getOrCompute(String key, Supplier<V> computation) {
    CompletableFuture<V> created = new CompletableFuture<>();
    CompletableFuture<V> existing = inFlight.putIfAbsent(key, created);
    if (existing != null) {
      LOG.debug("Joining the computation in flight for {}", key);
      return await(key, existing);
    }

    try {
      executor.execute(() -> run(key, created, computation));
    } catch (RejectedExecutionException e) {
      inFlight.remove(key, created);
      created.completeExceptionally(new TileComputationException("Unable to schedule the computation of " + key, e));
    }
    return await(key, created);
  }

  private void run(String key, CompletableFuture<V> future, Supplier<V> computation) {
    V value;
    try {
      value = computation.get();
    } catch (RuntimeException | Error e) {
      inFlight.remove(key, future);
      future.completeExceptionally(e);
      return;
    }
    inFlight.remove(key, future);
    future.complete(value);
  }

  private V await(String key, CompletableFuture<V> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TileComputationException("Interrupted while waiting for " + key, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      } else if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new TileComputationException("Computation of " + key + " failed", cause);
    }
  }

  /**
   * @return the number of keys currently being computed
   */
  public int inFlightCount() {
    return inFlight.size();
  }

  @Override
  public void close() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
  }
}
