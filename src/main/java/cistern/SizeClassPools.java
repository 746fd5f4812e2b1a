/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
 *
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
package cistern;

import cistern.internal.NanoClock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.logging.Logger;

/**
 * A set of {@link Pool pools}, one per {@link SizeClass size class}, created on demand.
 * <p>
 * Resources that are built for a particular problem size, like matrix decompositions
 * or FFT plans, can only be shared between requests of compatible size. This class
 * rounds each requested size to its class, and serves the request from the pool of
 * that class. Every pool has its own capacity, so a burst of large requests cannot
 * starve the small ones.
 * <pre>{@code
 * SizeClassPools<FftProcessor> ffts = new SizeClassPools<>(
 *     SizeClass.powerOfTwo(), points -> () -> new FftProcessor(points), 3);
 * try (Lease<FftProcessor> lease = ffts.acquire(1000)) { // served by the 1024 pool
 *   lease.get().forward(signal);
 * }
 * }</pre>
 *
 * @param <T> The type of resource pooled.
 */
public final class SizeClassPools<T> {
  private static final Logger LOGGER = Logger.getLogger(SizeClassPools.class.getName());

  private final SizeClass sizeClass;
  private final LongFunction<Factory<T>> factories;
  private final Consumer<PoolBuilder<T>> configuration;
  private final Map<Long, Pool<T>> pools;
  private boolean shutdown;

  /**
   * Create a pool set where every size class gets a pool of the given capacity.
   *
   * @param sizeClass The rounding of requested sizes.
   * @param factories Gives the resource factory for a size class.
   * @param capacity The capacity of each pool.
   */
  public SizeClassPools(SizeClass sizeClass, LongFunction<Factory<T>> factories, int capacity) {
    this(sizeClass, factories, builder -> builder.setCapacity(capacity));
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1, but was " + capacity + ".");
    }
  }

  /**
   * Create a pool set where each pool is configured by the given callback.
   *
   * @param sizeClass The rounding of requested sizes.
   * @param factories Gives the resource factory for a size class.
   * @param configuration Configures the {@link PoolBuilder} of each new pool, before it
   * is built. The builder already has the factory of the size class set.
   */
  public SizeClassPools(
      SizeClass sizeClass,
      LongFunction<Factory<T>> factories,
      Consumer<PoolBuilder<T>> configuration) {
    this.sizeClass = Objects.requireNonNull(sizeClass, "SizeClass cannot be null.");
    this.factories = Objects.requireNonNull(factories, "Factory function cannot be null.");
    this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null.");
    pools = new ConcurrentHashMap<>();
  }

  /**
   * Round the given size to the size class that serves it.
   * @param size The requested size.
   * @return The size class.
   */
  public long classify(long size) {
    return sizeClass.classify(size);
  }

  /**
   * Get the pool serving the given size, creating it if this is the first request for
   * its size class.
   *
   * @param size The requested size.
   * @return The pool for the size class of the given size.
   * @throws IllegalStateException If this pool set has been shut down.
   */
  public Pool<T> getPool(long size) {
    long key = classify(size);
    Pool<T> pool = pools.get(key);
    if (pool == null) {
      pool = createPool(key);
    }
    return pool;
  }

  private synchronized Pool<T> createPool(long key) {
    if (shutdown) {
      throw new IllegalStateException("Size class pools have been shut down.");
    }
    Pool<T> pool = pools.get(key);
    if (pool == null) {
      PoolBuilder<T> builder = Pool.from(factories.apply(key));
      configuration.accept(builder);
      pool = builder.build();
      pools.put(key, pool);
      LOGGER.fine(() -> "Created pool for size class " + key + ".");
    }
    return pool;
  }

  /**
   * Acquire a resource for a problem of the given size.
   *
   * @param size The requested size.
   * @return A lease on a resource from the pool of the size class.
   * @throws InterruptedException If interrupted while waiting.
   * @see Pool#acquire()
   */
  public Lease<T> acquire(long size) throws InterruptedException {
    return getPool(size).acquire();
  }

  /**
   * Acquire a resource for a problem of the given size, waiting no longer than the
   * given timeout.
   *
   * @param size The requested size.
   * @param timeout The maximum time to wait.
   * @return A lease, or an empty optional if the timeout elapsed first.
   * @throws InterruptedException If interrupted while waiting.
   * @see Pool#tryAcquire(Timeout)
   */
  public Optional<Lease<T>> tryAcquire(long size, Timeout timeout) throws InterruptedException {
    return getPool(size).tryAcquire(timeout);
  }

  /**
   * Take a snapshot of the counters of every pool, ordered by size class.
   * @return The pool statistics, keyed by size class.
   */
  public SortedMap<Long, PoolStats> getStats() {
    SortedMap<Long, PoolStats> stats = new TreeMap<>();
    pools.forEach((key, pool) -> stats.put(key, pool.getStats()));
    return stats;
  }

  /**
   * Shut down every pool, and prevent new ones from being created.
   * @return A completion that finishes when all pools have finished shutting down.
   * @see Pool#shutdown()
   */
  public synchronized Completion shutdown() {
    shutdown = true;
    List<Completion> completions = new ArrayList<>(pools.size());
    for (Pool<T> pool : pools.values()) {
      completions.add(pool.shutdown());
    }
    return timeout -> {
      if (timeout == null) {
        throw new IllegalArgumentException("Timeout cannot be null.");
      }
      long startNanos = NanoClock.nanoTime();
      for (Completion completion : completions) {
        long nanosLeft = timeout.getTimeoutNanos() - NanoClock.elapsed(startNanos);
        if (!completion.await(new Timeout(nanosLeft, TimeUnit.NANOSECONDS))) {
          return false;
        }
      }
      return true;
    };
  }
}
