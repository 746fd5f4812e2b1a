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

import cistern.internal.PoolBuilderImpl;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A Pool is a bounded set of reusable resources, from which one can acquire
 * exclusive access to a resource, until it is released back into the pool.
 * <p>
 * Pools are thread-safe, and their acquire methods can be called concurrently
 * from multiple threads.
 * <p>
 * Resources are created lazily by the {@link Factory} the pool was built with, and
 * no more than {@linkplain #getCapacity() capacity} resources exist at any one time.
 * Released resources are {@linkplain ResetHook reset} and reused rather than
 * recreated. When all resources are leased out and the pool is at capacity, acquiring
 * threads wait in line, and are served strictly in the order they arrived.
 * <p>
 * When you acquire a resource, you also take upon yourself the responsibility of
 * eventually releasing its {@link Lease}. By far the most common idiom to achieve
 * this is with a try-with-resources statement:
 * <pre>{@code
 * Pool<GpuContext> pool = Pool.from(GpuContext::new)
 *     .setCapacity(2)
 *     .setResetHook(GpuContext::clearMemory)
 *     .build();
 * try (Lease<GpuContext> lease = pool.acquire()) {
 *   lease.get().matrixMultiply(1024);
 * }
 * }</pre>
 * <p>
 * Pools are not singletons. Construct one explicitly, and pass it to whoever needs it.
 *
 * <h2>Memory effects</h2>
 * <ul>
 * <li>The release of a lease happens-before any subsequent acquire or disposal of
 *   the same resource, and,</li>
 * <li>The creation of a resource happens-before any acquire of that resource.</li>
 * </ul>
 *
 * @author Chris Vest
 * @param <T> the type of resource contained in the pool, as determined by the
 *          {@linkplain #from(Factory) configured factory}.
 */
public interface Pool<T> {
  /**
   * Get a {@link PoolBuilder} based on the given {@link Factory}, which can then
   * in turn be used to {@linkplain PoolBuilder#build() build} a {@link Pool}
   * instance with the desired configuration.
   *
   * @param factory The factory we want our pools to use. This cannot be
   * {@code null}.
   * @param <T> The type of resource created by the factory, and the type of
   * objects that the configured pools will contain.
   * @return A {@link PoolBuilder} that admits additional configurations,
   * before the pool instance is {@linkplain PoolBuilder#build() built}.
   */
  static <T> PoolBuilder<T> from(Factory<T> factory) {
    return new PoolBuilderImpl<>(factory);
  }

  /**
   * Acquire the exclusive rights to a resource in the pool, until the returned lease
   * is released.
   * <p>
   * An available resource is reused if there is one. Otherwise, if the pool is below
   * its capacity, a new resource is created on the calling thread. Otherwise, the
   * calling thread waits until a resource is released. Waiting threads are served in
   * the order they started waiting.
   * <p>
   * If the current thread already has one or more resources leased, then a distinct
   * resource will be returned. This means that it is possible for a single thread to
   * deplete the pool, and then wait forever. Avoid holding more than one lease at a
   * time per thread, if at all possible.
   *
   * @return A lease on a resource. Never {@code null}.
   * @throws PoolException If a new resource was needed, and the factory failed
   * to create one.
   * @throws InterruptedException If the current thread is
   * {@link Thread#interrupt() interrupted} upon entry, or becomes interrupted
   * while waiting.
   * @throws IllegalStateException If the pool has been shut down, or is shut down
   * while we wait.
   */
  Lease<T> acquire() throws InterruptedException;

  /**
   * Acquire a resource like {@link #acquire()}, but give up once the given timeout
   * elapses.
   * <p>
   * A timeout of zero or less makes this a non-blocking poll: an empty result is
   * returned right away if no resource is available and the pool is at capacity.
   * Timing out is an expected outcome, and is not signalled with an exception.
   * <p>
   * Note that the timeout only bounds the time spent waiting in line. Creating a new
   * resource is not subject to the timeout.
   *
   * @param timeout The maximum amount of time to wait for a resource to become
   * available. Cannot be {@code null}.
   * @return A lease on a resource, or an empty optional if the timeout elapsed first.
   * @throws PoolException If a new resource was needed, and the factory failed
   * to create one.
   * @throws InterruptedException If the current thread is interrupted upon entry,
   * or becomes interrupted while waiting.
   * @throws IllegalStateException If the pool has been shut down.
   * @throws IllegalArgumentException If the timeout is {@code null}.
   */
  Optional<Lease<T>> tryAcquire(Timeout timeout) throws InterruptedException;

  /**
   * Acquire a resource if one can be had without waiting.
   * <p>
   * If the current thread is interrupted, the interrupt flag is left set, and an empty
   * result is returned.
   *
   * @return A lease on a resource, or an empty optional if the pool is depleted.
   * @throws PoolException If a new resource was needed, and the factory failed
   * to create one.
   * @throws IllegalStateException If the pool has been shut down.
   */
  default Optional<Lease<T>> tryAcquire() {
    try {
      return tryAcquire(Timeout.ZERO);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  /**
   * Acquire a resource and apply the given function to it, returning the result and
   * releasing the resource back to the pool.
   * <p>
   * If a resource cannot be acquired within the given timeout, then
   * {@link Optional#empty()} is returned instead. The {@code empty()} value is also
   * returned if the function returns {@code null}.
   *
   * @param timeout The maximum amount of time to wait for a resource.
   * @param function The function to apply to the acquired resource. The function
   * should avoid further acquires, since holding more than one lease at a time per
   * thread is inherently deadlock prone.
   * @param <R> The return type of the given function.
   * @return an {@link Optional} of either the return value of applying the
   * given function to an acquired resource, or empty if the timeout elapsed or
   * the function returned {@code null}.
   * @throws InterruptedException if the thread was interrupted.
   * @see #tryAcquire(Timeout) The {@code tryAcquire} method for more details on
   * failure modes.
   */
  default <R> Optional<R> apply(Timeout timeout, Function<T, R> function)
      throws InterruptedException {
    Objects.requireNonNull(function, "Function cannot be null.");
    Optional<Lease<T>> acquired = tryAcquire(timeout);
    if (acquired.isEmpty()) {
      return Optional.empty();
    }
    try (Lease<T> lease = acquired.get()) {
      return Optional.ofNullable(function.apply(lease.get()));
    }
  }

  /**
   * Acquire a resource and supply it to the given consumer, and then release it back
   * to the pool.
   *
   * @param timeout The maximum amount of time to wait for a resource.
   * @param consumer The consumer to pass the acquired resource to.
   * @return {@code true} if a resource could be acquired within the given timeout and
   * passed to the given consumer, or {@code false} otherwise.
   * @throws InterruptedException if the thread was interrupted.
   * @see #tryAcquire(Timeout) The {@code tryAcquire} method for more details on
   * failure modes.
   */
  default boolean supply(Timeout timeout, Consumer<T> consumer)
      throws InterruptedException {
    Objects.requireNonNull(consumer, "Consumer cannot be null.");
    Optional<Lease<T>> acquired = tryAcquire(timeout);
    if (acquired.isEmpty()) {
      return false;
    }
    try (Lease<T> lease = acquired.get()) {
      consumer.accept(lease.get());
      return true;
    }
  }

  /**
   * Get the maximum number of resources this pool will hold at any one time.
   * @return The capacity, which is always at least 1.
   */
  int getCapacity();

  /**
   * Get the number of created resources that are ready to be acquired.
   * <p>
   * This is a diagnostic reading. Checking it and then acquiring is not atomic.
   * @return The number of available resources.
   */
  int getAvailableCount();

  /**
   * Get the number of resources that are currently leased out.
   * @return The number of resources in use.
   */
  int getInUseCount();

  /**
   * Get the number of live resources created by this pool. This never exceeds the
   * capacity, and only goes down when a resource is discarded because its
   * {@link ResetHook} failed, or when the pool is shut down.
   * @return The number of live resources.
   */
  int getTotalCreated();

  /**
   * Read all counters of the pool at the same instant.
   * @return A consistent snapshot of the pool counters.
   */
  PoolStats getStats();

  /**
   * Get the {@link ManagedPool} instance that represents this pool.
   * @return The {@link ManagedPool} instance for this pool.
   */
  ManagedPool getManagedPool();

  /**
   * Initiate the shut down process on this pool, and return a
   * {@link Completion} instance representing the shut down procedure.
   * <p>
   * The shut down process is asynchronous, and the shutdown method is
   * guaranteed to not wait for any leased resources to be released.
   * <p>
   * Available resources are disposed right away. Threads waiting for a resource are
   * woken up with an {@link IllegalStateException}, and so are all later attempts to
   * acquire. Leased resources are disposed, rather than reset, when they are released.
   * The completion finishes once every resource has been disposed.
   * <p>
   * Calling this method more than once returns the same completion.
   *
   * @return A {@link Completion} instance that represents the shut down process.
   */
  Completion shutdown();
}
