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

/**
 * The {@code PoolBuilder} collects information about how big a pool should be,
 * and how it should create, reset and dispose of its resources.
 * <p>
 * The PoolBuilder class is made thread-safe by synchronizing all its public methods.
 * Builders are obtained from {@link Pool#from(Factory)}, and can be used to build any
 * number of pools. Changing the builder after a pool has been built has no effect on
 * that pool.
 *
 * @author Chris Vest
 * @param <T> The type of resources that the configured pools will contain.
 */
public interface PoolBuilder<T> extends Cloneable {
  /**
   * Set the capacity of the pool we are building.
   * <p>
   * The capacity is the maximum number of resources the pool will create and hold at
   * any one time. It is fixed once the pool has been built.
   *
   * @param capacity The pool capacity. Must be at least 1.
   * @return This {@code PoolBuilder} instance.
   * @throws IllegalArgumentException If the capacity is less than 1.
   */
  PoolBuilder<T> setCapacity(int capacity);

  /**
   * Get the currently configured capacity. The default is 10.
   * @return The configured pool capacity.
   */
  int getCapacity();

  /**
   * Set the {@link Factory} the pool uses to create resources.
   * <p>
   * The factory is initially specified by the {@link Pool#from(Factory)}
   * method, so there is usually no need to set it later.
   *
   * @param factory The factory to use. Cannot be {@code null}.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setFactory(Factory<T> factory);

  /**
   * Get the configured {@link Factory} instance.
   * @return The configured factory.
   */
  Factory<T> getFactory();

  /**
   * Set the {@link ResetHook} that restores released resources to a clean state.
   * The default hook does nothing.
   *
   * @param resetHook The reset hook to use. Cannot be {@code null}.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setResetHook(ResetHook<? super T> resetHook);

  /**
   * Get the configured {@link ResetHook}.
   * @return The configured reset hook.
   */
  ResetHook<? super T> getResetHook();

  /**
   * Set the {@link Disposer} that frees resources when the pool is shut down, or
   * when a resource is discarded. The default is {@link Disposer#closing()}.
   *
   * @param disposer The disposer to use. Cannot be {@code null}.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setDisposer(Disposer<? super T> disposer);

  /**
   * Get the configured {@link Disposer}.
   * @return The configured disposer.
   */
  Disposer<? super T> getDisposer();

  /**
   * Set the {@link MetricsRecorder} to use for the pools we want to configure.
   * @param metricsRecorder The MetricsRecorder to use, or {@code null} if we don't
   * want to use any.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setMetricsRecorder(MetricsRecorder metricsRecorder);

  /**
   * Get the configured {@link MetricsRecorder} instance, or {@code null} if none
   * has been configured.
   * @return The configured MetricsRecorder.
   */
  MetricsRecorder getMetricsRecorder();

  /**
   * Enable or disable leak detection.
   * <p>
   * With leak detection enabled, the pool notices when a lease is garbage collected
   * without having been released. Such leaks are counted in
   * {@link ManagedPool#getLeakedObjectsCount()}, logged, and the resource is reclaimed
   * into the pool as if the lease had been released.
   * <p>
   * Only the lease is tracked, not the resource. Code that drops its lease but keeps
   * using the object it got from {@link cistern.Lease#get()} will share that object
   * with the next acquirer once the leak is reclaimed. The reset hook runs on the
   * reclaimed resource in between, so such a leak corrupts the next owner's state
   * rather than merely wasting capacity. Keep resources reachable only through their
   * leases when leak detection is enabled.
   * <p>
   * Leak detection costs a little extra work for every acquire. It is disabled by
   * default.
   *
   * @param enabled {@code true} to enable leak detection.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setLeakDetectionEnabled(boolean enabled);

  /**
   * @return {@code true} if leak detection is enabled.
   */
  boolean isLeakDetectionEnabled();

  /**
   * Returns a shallow copy of this {@code PoolBuilder} object.
   * @return A new {@code PoolBuilder} object of the exact same type as this one, with
   * identical values in all its fields.
   */
  PoolBuilder<T> clone();

  /**
   * Build a {@link Pool} instance based on the collected configuration.
   * @return A {@link Pool} instance as configured by this builder.
   */
  Pool<T> build();
}
