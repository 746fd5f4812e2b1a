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

import java.lang.ref.Cleaner;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Leak detector, used to detect if leases handed out by the pool get garbage collected
 * without first being released.
 * <p>
 * Every registered lease is paired with a cleanup action. The action runs exactly once:
 * either explicitly, when the lease is released or transferred, or from the cleaner
 * thread, when the lease has become phantom reachable. In the latter case the lease was
 * leaked, and the action reclaims its resource.
 */
public final class LeakDetector {
  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
  private static final ThreadFactory THREAD_FACTORY = runnable -> {
    Thread thread = new Thread(runnable, "Cistern-LeakDetector-" + THREAD_COUNTER.incrementAndGet());
    thread.setDaemon(true);
    return thread;
  };

  private static final class CleanerHolder {
    static final Cleaner CLEANER = Cleaner.create(THREAD_FACTORY);
  }

  private final LongAdder leakedObjectCount;

  /**
   * Create a new instance.
   */
  public LeakDetector() {
    leakedObjectCount = new LongAdder();
  }

  /**
   * Register the given lease with the detector.
   * <p>
   * The cleanup action must not reference the lease, or the lease will never become
   * unreachable.
   *
   * @param lease The lease about to be handed over to user code.
   * @param action The action that returns the resource of the lease to its pool.
   * @return The {@link Cleaner.Cleanable} that runs the action at most once.
   */
  Cleaner.Cleanable register(Object lease, Runnable action) {
    return CleanerHolder.CLEANER.register(lease, action);
  }

  /**
   * Count one leaked lease.
   */
  void recordLeak() {
    leakedObjectCount.increment();
  }

  /**
   * Compute a count of the leaked leases that this detector has detected.
   * @return The number of lease leaks observed.
   */
  public long countLeakedObjects() {
    return leakedObjectCount.sum();
  }
}
