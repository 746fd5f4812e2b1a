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

import javax.management.MXBean;

/**
 * This is the JMX management interface for Cistern object pools.
 * <p>
 * Using this interface, pools can be exposed to external management as an
 * MXBean. Once it has been registered as an MXBean, the pool can be monitored
 * with tools like JConsole.
 * <p>
 * All pools return an implementation of this interface from their
 * {@link Pool#getManagedPool()} method.
 * <p>
 * Here is an example of how to register a pool with the platform MBeanServer:
 * <pre>{@code
 * Pool<Connection> pool = Pool.from(factory).build();
 * MBeanServer server = ManagementFactory.getPlatformMBeanServer();
 * ObjectName name = new ObjectName("com.myapp:objectpool=connections");
 * server.registerMBean(pool.getManagedPool(), name);
 * }</pre>
 *
 * @author Chris Vest
 */
@MXBean
public interface ManagedPool {
  /**
   * Return the number of resources the pool has successfully created since it was
   * built. Unlike {@link #getTotalCreated()}, this number never decreases.
   *
   * @return The number of successful factory calls.
   */
  long getAllocationCount();

  /**
   * Return the number of resource creations that have failed, either because the
   * factory threw an exception or because it returned null, since the pool
   * was built.
   *
   * @return The number of failed factory calls.
   */
  long getFailedAllocationCount();

  /**
   * Return the number of resources that have been discarded because their
   * {@link ResetHook} failed.
   *
   * @return The number of discarded resources.
   */
  long getDiscardedCount();

  /**
   * Return the number of leases that were garbage collected without being
   * released, and whose resources were reclaimed by the pool.
   * <p>
   * Leaks are only detected when the pool has been built with
   * {@link PoolBuilder#setLeakDetectionEnabled(boolean) leak detection} enabled.
   * Otherwise this method returns {@code -1}.
   *
   * @return The number of leaked leases, or {@code -1} if leak detection is disabled.
   */
  long getLeakedObjectsCount();

  /**
   * @return The capacity of the pool.
   * @see Pool#getCapacity()
   */
  int getCapacity();

  /**
   * @return The number of resources ready to be acquired.
   * @see Pool#getAvailableCount()
   */
  int getAvailableCount();

  /**
   * @return The number of resources currently leased out.
   * @see Pool#getInUseCount()
   */
  int getInUseCount();

  /**
   * @return The number of live resources created by the pool.
   * @see Pool#getTotalCreated()
   */
  int getTotalCreated();

  /**
   * Returns 'true' if the shut down process has been started on this pool,
   * 'false' otherwise. This method does not reveal whether or not the shut
   * down process has completed.
   * @return 'true' if {@link Pool#shutdown()} has been called on this pool.
   */
  boolean isShutDown();

  /**
   * Get the approximate resource creation latency, in milliseconds, for the given
   * percentile/quantile.
   *
   * @see MetricsRecorder#getCreationLatencyPercentile(double)
   * @param percentile The percentile to get, as a decimal, e.g. a number
   *                   between 0.0 and 1.0.
   * @return The approximate latency in milliseconds, or Double.NaN if no
   * {@link MetricsRecorder} has been configured for the pool.
   */
  double getCreationLatencyPercentile(double percentile);

  /**
   * Get the approximate latency, in milliseconds, of failed resource creations for
   * the given percentile/quantile.
   *
   * @see MetricsRecorder#getCreationFailureLatencyPercentile(double)
   * @param percentile The percentile to get, as a decimal.
   * @return The approximate latency in milliseconds, or Double.NaN if no
   * {@link MetricsRecorder} has been configured for the pool.
   */
  double getCreationFailureLatencyPercentile(double percentile);

  /**
   * Get the approximate reset latency, in milliseconds, for the given percentile.
   *
   * @see MetricsRecorder#getResetLatencyPercentile(double)
   * @param percentile The percentile to get, as a decimal.
   * @return The approximate latency in milliseconds, or Double.NaN if no
   * {@link MetricsRecorder} has been configured for the pool.
   */
  double getResetLatencyPercentile(double percentile);

  /**
   * Get the approximate disposal latency, in milliseconds, for the given percentile.
   *
   * @see MetricsRecorder#getDisposalLatencyPercentile(double)
   * @param percentile The percentile to get, as a decimal.
   * @return The approximate latency in milliseconds, or Double.NaN if no
   * {@link MetricsRecorder} has been configured for the pool.
   */
  double getDisposalLatencyPercentile(double percentile);

  /**
   * Get the approximate acquire latency, in milliseconds, for the given percentile.
   *
   * @see MetricsRecorder#getAcquireLatencyPercentile(double)
   * @param percentile The percentile to get, as a decimal.
   * @return The approximate latency in milliseconds, or Double.NaN if no
   * {@link MetricsRecorder} has been configured for the pool.
   */
  double getAcquireLatencyPercentile(double percentile);
}
