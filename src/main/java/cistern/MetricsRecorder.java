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
 * A MetricsRecorder implementation supplies the pool with the ability to
 * record and report operational metrics. Many of the metrics that the
 * {@link ManagedPool} interface reports cannot be obtained if a pool has not
 * been configured with a MetricsRecorder.
 * <p>
 * This interface is intended to be implemented on top of a metrics library, such
 * as Dropwizard Metrics or Micrometer. Implementations must be thread-safe, since the
 * pool records samples from whichever thread happens to perform the operation.
 * <p>
 * The percentile getters return {@link Double#NaN} when no value is known.
 *
 * @author Chris Vest
 * @see PoolBuilder#setMetricsRecorder(MetricsRecorder)
 */
public interface MetricsRecorder {
  /**
   * Record the time a successful {@link Factory#create()} call took.
   * @param milliseconds How many milliseconds it took to create a resource.
   */
  void recordCreationLatencySampleMillis(long milliseconds);

  /**
   * Record the time that passed before a {@link Factory#create()} call threw, or
   * returned {@code null}.
   * @param milliseconds How many milliseconds transpired before the creation failed.
   */
  void recordCreationFailureLatencySampleMillis(long milliseconds);

  /**
   * Record the time a {@link ResetHook#reset(Object)} call took, whether it succeeded
   * or not.
   * @param milliseconds How many milliseconds the reset took.
   */
  void recordResetLatencySampleMillis(long milliseconds);

  /**
   * Record the time a {@link Disposer#dispose(Object)} call took.
   * @param milliseconds How many milliseconds the disposal took.
   */
  void recordDisposalLatencySampleMillis(long milliseconds);

  /**
   * Record how long an acquiring thread spent in the pool, from calling acquire until
   * it received a lease. Acquisitions that timed out are not recorded.
   * @param milliseconds How many milliseconds the acquisition took.
   */
  void recordAcquireLatencySampleMillis(long milliseconds);

  /**
   * Get the approximate resource creation latency value, in milliseconds, of the
   * given percentile/quantile of the values recorded so far.
   * @param percentile The percentile/quantile to get a value for, between 0.0 and 1.0.
   * @return The latency in milliseconds, or {@link Double#NaN} if unknown.
   */
  double getCreationLatencyPercentile(double percentile);

  /**
   * Get the approximate failed creation latency value, in milliseconds, of the
   * given percentile/quantile of the values recorded so far.
   * @param percentile The percentile/quantile to get a value for, between 0.0 and 1.0.
   * @return The latency in milliseconds, or {@link Double#NaN} if unknown.
   */
  double getCreationFailureLatencyPercentile(double percentile);

  /**
   * Get the approximate reset latency value, in milliseconds, of the given
   * percentile/quantile of the values recorded so far.
   * @param percentile The percentile/quantile to get a value for, between 0.0 and 1.0.
   * @return The latency in milliseconds, or {@link Double#NaN} if unknown.
   */
  double getResetLatencyPercentile(double percentile);

  /**
   * Get the approximate disposal latency value, in milliseconds, of the given
   * percentile/quantile of the values recorded so far.
   * @param percentile The percentile/quantile to get a value for, between 0.0 and 1.0.
   * @return The latency in milliseconds, or {@link Double#NaN} if unknown.
   */
  double getDisposalLatencyPercentile(double percentile);

  /**
   * Get the approximate acquire latency value, in milliseconds, of the given
   * percentile/quantile of the values recorded so far.
   * @param percentile The percentile/quantile to get a value for, between 0.0 and 1.0.
   * @return The latency in milliseconds, or {@link Double#NaN} if unknown.
   */
  double getAcquireLatencyPercentile(double percentile);
}
