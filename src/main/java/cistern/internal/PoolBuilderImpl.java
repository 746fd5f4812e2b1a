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
package cistern.internal;

import cistern.Disposer;
import cistern.Factory;
import cistern.MetricsRecorder;
import cistern.Pool;
import cistern.PoolBuilder;
import cistern.ResetHook;

import static java.util.Objects.requireNonNull;

/**
 * The {@link PoolBuilder} implementation.
 * @param <T> The concrete resource type.
 */
public final class PoolBuilderImpl<T> implements PoolBuilder<T> {
  static final int DEFAULT_CAPACITY = 10;

  private Factory<T> factory;
  private int capacity = DEFAULT_CAPACITY;
  private ResetHook<? super T> resetHook = ResetHook.none();
  private Disposer<? super T> disposer = Disposer.closing();
  private MetricsRecorder metricsRecorder;
  private boolean leakDetectionEnabled;

  /**
   * Build a new {@code PoolBuilder} object with default settings.
   * @param factory The factory instance to use.
   */
  public PoolBuilderImpl(Factory<T> factory) {
    requireNonNull(factory, "The Factory cannot be null.");
    this.factory = factory;
  }

  @Override
  public synchronized PoolBuilder<T> setCapacity(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException(
          "Capacity must be at least 1, but was " + capacity + ".");
    }
    this.capacity = capacity;
    return this;
  }

  @Override
  public synchronized int getCapacity() {
    return capacity;
  }

  @Override
  public synchronized PoolBuilder<T> setFactory(Factory<T> factory) {
    requireNonNull(factory, "The Factory cannot be null.");
    this.factory = factory;
    return this;
  }

  @Override
  public synchronized Factory<T> getFactory() {
    return factory;
  }

  @Override
  public synchronized PoolBuilder<T> setResetHook(ResetHook<? super T> resetHook) {
    requireNonNull(resetHook, "The ResetHook cannot be null.");
    this.resetHook = resetHook;
    return this;
  }

  @Override
  public synchronized ResetHook<? super T> getResetHook() {
    return resetHook;
  }

  @Override
  public synchronized PoolBuilder<T> setDisposer(Disposer<? super T> disposer) {
    requireNonNull(disposer, "The Disposer cannot be null.");
    this.disposer = disposer;
    return this;
  }

  @Override
  public synchronized Disposer<? super T> getDisposer() {
    return disposer;
  }

  @Override
  public synchronized PoolBuilder<T> setMetricsRecorder(MetricsRecorder metricsRecorder) {
    this.metricsRecorder = metricsRecorder;
    return this;
  }

  @Override
  public synchronized MetricsRecorder getMetricsRecorder() {
    return metricsRecorder;
  }

  @Override
  public synchronized PoolBuilder<T> setLeakDetectionEnabled(boolean enabled) {
    this.leakDetectionEnabled = enabled;
    return this;
  }

  @Override
  public synchronized boolean isLeakDetectionEnabled() {
    return leakDetectionEnabled;
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized PoolBuilderImpl<T> clone() {
    try {
      return (PoolBuilderImpl<T>) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized Pool<T> build() {
    return new BoundedPool<>(this);
  }
}
