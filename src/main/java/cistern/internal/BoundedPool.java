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

import cistern.Completion;
import cistern.Disposer;
import cistern.Factory;
import cistern.Lease;
import cistern.ManagedPool;
import cistern.MetricsRecorder;
import cistern.Pool;
import cistern.PoolException;
import cistern.PoolStats;
import cistern.ResetHook;
import cistern.Timeout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The {@link Pool} implementation.
 * <p>
 * All bookkeeping is guarded by a single lock: the stack of available resources, the
 * in-use and created counters, the number of creations in flight, and the queue of
 * waiting acquirers. Factory, reset and dispose calls all run outside of the lock.
 * <p>
 * Waiting acquirers each hold a {@link Ticket} with their own {@link Condition}. A freed
 * resource is handed directly to the ticket at the head of the queue, so a thread that
 * arrives later can never take it first. When capacity frees up without a resource to
 * go with it, because a creation failed or a resource was discarded, the head ticket is
 * granted a permit to create a new one instead. Either way, exactly one waiter is woken.
 *
 * @param <T> The resource type.
 */
public final class BoundedPool<T> implements Pool<T>, ManagedPool {
  private static final Logger LOGGER = Logger.getLogger(BoundedPool.class.getName());
  private static final String SHUT_DOWN = "Pool has been shut down.";

  private final Factory<T> factory;
  private final ResetHook<? super T> resetHook;
  private final Disposer<? super T> disposer;
  private final MetricsRecorder metricsRecorder;
  private final LeakDetector leakDetector;
  private final int capacity;

  private final ReentrantLock lock;
  private final ArrayDeque<ResourceSlot<T>> available;
  private final ArrayDeque<Ticket<T>> waiters;
  private int inUse;
  private int totalCreated;
  private int pendingCreations;
  private long lastId;
  private volatile boolean shutdown;

  private final CountDownLatch shutdownLatch;
  private final Completion shutdownCompletion;
  private final LongAdder allocationCount;
  private final LongAdder failedAllocationCount;
  private final LongAdder discardedCount;

  /**
   * Construct a new pool instance based on the given {@link PoolBuilderImpl}.
   * @param builder The pool configuration to use.
   */
  BoundedPool(PoolBuilderImpl<T> builder) {
    factory = builder.getFactory();
    resetHook = builder.getResetHook();
    disposer = builder.getDisposer();
    metricsRecorder = builder.getMetricsRecorder();
    leakDetector = builder.isLeakDetectionEnabled() ? new LeakDetector() : null;
    capacity = builder.getCapacity();
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1, but was " + capacity + ".");
    }
    lock = new ReentrantLock();
    available = new ArrayDeque<>(capacity);
    waiters = new ArrayDeque<>();
    shutdownLatch = new CountDownLatch(1);
    shutdownCompletion = new LatchCompletion(shutdownLatch);
    allocationCount = new LongAdder();
    failedAllocationCount = new LongAdder();
    discardedCount = new LongAdder();
  }

  @Override
  public Lease<T> acquire() throws InterruptedException {
    return acquire(false, 0);
  }

  @Override
  public Optional<Lease<T>> tryAcquire(Timeout timeout) throws InterruptedException {
    if (timeout == null) {
      throw new IllegalArgumentException("Timeout cannot be null.");
    }
    return Optional.ofNullable(acquire(true, timeout.getTimeoutNanos()));
  }

  private Lease<T> acquire(boolean timed, long timeoutNanos) throws InterruptedException {
    long startNanos = NanoClock.nanoTime();
    Ticket<T> ticket = awaitTicket(timed, timeoutNanos, startNanos);
    if (ticket == null) {
      return null;
    }
    ResourceSlot<T> slot = ticket.slot != null ? ticket.slot : create();
    if (metricsRecorder != null) {
      metricsRecorder.recordAcquireLatencySampleMillis(NanoClock.elapsedMillis(startNanos));
    }
    return newLease(slot);
  }

  /**
   * Get a ticket that is either holding a resource, or a permit to create one.
   * Returns {@code null} if the timeout elapsed first.
   */
  private Ticket<T> awaitTicket(boolean timed, long timeoutNanos, long startNanos)
      throws InterruptedException {
    InterruptedException interrupted = null;
    ResourceSlot<T> orphan = null;
    lock.lockInterruptibly();
    try {
      if (shutdown) {
        throw new IllegalStateException(SHUT_DOWN);
      }
      if (waiters.isEmpty()) {
        ResourceSlot<T> slot = available.pollFirst();
        if (slot != null) {
          inUse++;
          return Ticket.holding(slot);
        }
        if (hasHeadroomLocked()) {
          pendingCreations++;
          return Ticket.permitted();
        }
      }
      if (timed && timeoutNanos <= 0) {
        return null;
      }

      Ticket<T> ticket = new Ticket<>(lock.newCondition());
      waiters.addLast(ticket);
      try {
        while (!ticket.isGranted()) {
          if (timed) {
            long nanosLeft = NanoClock.timeoutLeft(startNanos, timeoutNanos);
            if (nanosLeft <= 0) {
              waiters.remove(ticket);
              return null;
            }
            ticket.condition.awaitNanos(nanosLeft);
          } else {
            ticket.condition.await();
          }
        }
        if (ticket.shutdown) {
          throw new IllegalStateException(SHUT_DOWN);
        }
        return ticket;
      } catch (InterruptedException e) {
        interrupted = e;
        orphan = abandonLocked(ticket);
      }
    } finally {
      lock.unlock();
    }
    if (orphan != null) {
      giveBack(orphan, false);
    }
    throw interrupted;
  }

  /**
   * Withdraw the ticket of an interrupted waiter. A resource that was already handed to
   * the ticket is returned, so the caller can pass it on outside the lock. A creation
   * permit is passed on to the next waiter right away.
   */
  private ResourceSlot<T> abandonLocked(Ticket<T> ticket) {
    if (ticket.slot != null) {
      return ticket.slot;
    }
    if (ticket.permit) {
      pendingCreations--;
      grantHeadroomLocked();
      completeShutdownIfDoneLocked();
    } else if (!ticket.shutdown) {
      waiters.remove(ticket);
    }
    return null;
  }

  private boolean hasHeadroomLocked() {
    return totalCreated + pendingCreations < capacity;
  }

  private ResourceSlot<T> create() {
    long startNanos = NanoClock.nanoTime();
    T resource = null;
    try {
      resource = factory.create();
      if (resource == null) {
        throw new PoolException("Factory returned null.");
      }
    } catch (PoolException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PoolException("Interrupted while creating a resource.", e);
    } catch (Exception e) {
      throw new PoolException("Failed to create a resource.", e);
    } finally {
      if (resource == null) {
        creationFailed(startNanos);
      }
    }
    return created(resource, startNanos);
  }

  private void creationFailed(long startNanos) {
    failedAllocationCount.increment();
    if (metricsRecorder != null) {
      metricsRecorder.recordCreationFailureLatencySampleMillis(NanoClock.elapsedMillis(startNanos));
    }
    lock.lock();
    try {
      pendingCreations--;
      grantHeadroomLocked();
      completeShutdownIfDoneLocked();
    } finally {
      lock.unlock();
    }
  }

  private ResourceSlot<T> created(T resource, long startNanos) {
    allocationCount.increment();
    if (metricsRecorder != null) {
      metricsRecorder.recordCreationLatencySampleMillis(NanoClock.elapsedMillis(startNanos));
    }
    ResourceSlot<T> slot;
    lock.lock();
    try {
      pendingCreations--;
      totalCreated++;
      inUse++;
      slot = new ResourceSlot<>(resource, ++lastId);
      if (!shutdown) {
        LOGGER.fine(() -> "Created resource #" + slot.id + ".");
        return slot;
      }
    } finally {
      lock.unlock();
    }
    retire(slot, false);
    throw new IllegalStateException(SHUT_DOWN);
  }

  Lease<T> newLease(ResourceSlot<T> slot) {
    return new PooledLease<>(this, slot, leakDetector);
  }

  /**
   * Return a leased resource to the pool. Called exactly once per lease.
   */
  void release(ResourceSlot<T> slot) {
    giveBack(slot, true);
  }

  void leaked(ResourceSlot<T> slot) {
    leakDetector.recordLeak();
    LOGGER.warning("Lease on resource #" + slot.id +
        " was garbage collected without being released. Reclaiming the resource.");
  }

  private void giveBack(ResourceSlot<T> slot, boolean reset) {
    if (!shutdown) {
      if (reset && !reset(slot)) {
        retire(slot, true);
        return;
      }
      lock.lock();
      try {
        if (!shutdown) {
          handOffLocked(slot);
          return;
        }
      } finally {
        lock.unlock();
      }
    }
    retire(slot, false);
  }

  private void handOffLocked(ResourceSlot<T> slot) {
    Ticket<T> next = waiters.pollFirst();
    if (next != null) {
      next.slot = slot;
      next.condition.signal();
    } else {
      inUse--;
      available.push(slot);
    }
  }

  private void grantHeadroomLocked() {
    if (!waiters.isEmpty() && hasHeadroomLocked()) {
      Ticket<T> next = waiters.pollFirst();
      pendingCreations++;
      next.permit = true;
      next.condition.signal();
    }
  }

  /**
   * Dispose of a leased resource for good, and free up its capacity.
   */
  private void retire(ResourceSlot<T> slot, boolean discarded) {
    dispose(slot);
    lock.lock();
    try {
      inUse--;
      totalCreated--;
      if (discarded) {
        discardedCount.increment();
        grantHeadroomLocked();
      }
      completeShutdownIfDoneLocked();
    } finally {
      lock.unlock();
    }
  }

  private boolean reset(ResourceSlot<T> slot) {
    long startNanos = NanoClock.nanoTime();
    try {
      resetHook.reset(slot.resource);
      return true;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      LOGGER.log(Level.WARNING, "Failed to reset resource #" + slot.id + ". Discarding it.", e);
      return false;
    } finally {
      if (metricsRecorder != null) {
        metricsRecorder.recordResetLatencySampleMillis(NanoClock.elapsedMillis(startNanos));
      }
    }
  }

  private void dispose(ResourceSlot<T> slot) {
    long startNanos = NanoClock.nanoTime();
    try {
      disposer.dispose(slot.resource);
      LOGGER.fine(() -> "Disposed resource #" + slot.id + " after " +
          NanoClock.elapsedMillis(slot.createdNanos) + " ms.");
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      LOGGER.log(Level.WARNING, "Failed to dispose resource #" + slot.id + ".", e);
    } finally {
      if (metricsRecorder != null) {
        metricsRecorder.recordDisposalLatencySampleMillis(NanoClock.elapsedMillis(startNanos));
      }
    }
  }

  @Override
  public Completion shutdown() {
    List<ResourceSlot<T>> drained;
    lock.lock();
    try {
      if (shutdown) {
        return shutdownCompletion;
      }
      shutdown = true;
      drained = new ArrayList<>(available);
      available.clear();
      for (Ticket<T> waiter : waiters) {
        waiter.shutdown = true;
        waiter.condition.signal();
      }
      waiters.clear();
      completeShutdownIfDoneLocked();
    } finally {
      lock.unlock();
    }
    LOGGER.fine(() -> "Shutting down pool, disposing " + drained.size() + " available resources.");
    for (ResourceSlot<T> slot : drained) {
      dispose(slot);
      lock.lock();
      try {
        totalCreated--;
        completeShutdownIfDoneLocked();
      } finally {
        lock.unlock();
      }
    }
    return shutdownCompletion;
  }

  private void completeShutdownIfDoneLocked() {
    if (shutdown && totalCreated == 0 && pendingCreations == 0) {
      shutdownLatch.countDown();
    }
  }

  @Override
  public int getCapacity() {
    return capacity;
  }

  @Override
  public int getAvailableCount() {
    lock.lock();
    try {
      return available.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getInUseCount() {
    lock.lock();
    try {
      return inUse;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getTotalCreated() {
    lock.lock();
    try {
      return totalCreated;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public PoolStats getStats() {
    lock.lock();
    try {
      return new PoolStats(capacity, available.size(), inUse, totalCreated);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ManagedPool getManagedPool() {
    return this;
  }

  @Override
  public long getAllocationCount() {
    return allocationCount.sum();
  }

  @Override
  public long getFailedAllocationCount() {
    return failedAllocationCount.sum();
  }

  @Override
  public long getDiscardedCount() {
    return discardedCount.sum();
  }

  @Override
  public long getLeakedObjectsCount() {
    return leakDetector == null ? -1 : leakDetector.countLeakedObjects();
  }

  @Override
  public boolean isShutDown() {
    return shutdown;
  }

  @Override
  public double getCreationLatencyPercentile(double percentile) {
    return metricsRecorder == null ? Double.NaN : metricsRecorder.getCreationLatencyPercentile(percentile);
  }

  @Override
  public double getCreationFailureLatencyPercentile(double percentile) {
    return metricsRecorder == null ? Double.NaN : metricsRecorder.getCreationFailureLatencyPercentile(percentile);
  }

  @Override
  public double getResetLatencyPercentile(double percentile) {
    return metricsRecorder == null ? Double.NaN : metricsRecorder.getResetLatencyPercentile(percentile);
  }

  @Override
  public double getDisposalLatencyPercentile(double percentile) {
    return metricsRecorder == null ? Double.NaN : metricsRecorder.getDisposalLatencyPercentile(percentile);
  }

  @Override
  public double getAcquireLatencyPercentile(double percentile) {
    return metricsRecorder == null ? Double.NaN : metricsRecorder.getAcquireLatencyPercentile(percentile);
  }

  @Override
  public String toString() {
    return "BoundedPool[" + getStats() + (shutdown ? ", shut down]" : "]");
  }

  /**
   * A place in line for an acquiring thread, and the grant it eventually receives:
   * a resource, a permit to create one, or notice of shut down.
   * All fields are guarded by the pool lock.
   */
  private static final class Ticket<T> {
    final Condition condition;
    ResourceSlot<T> slot;
    boolean permit;
    boolean shutdown;

    Ticket(Condition condition) {
      this.condition = condition;
    }

    static <T> Ticket<T> holding(ResourceSlot<T> slot) {
      Ticket<T> ticket = new Ticket<>(null);
      ticket.slot = slot;
      return ticket;
    }

    static <T> Ticket<T> permitted() {
      Ticket<T> ticket = new Ticket<>(null);
      ticket.permit = true;
      return ticket;
    }

    boolean isGranted() {
      return slot != null || permit || shutdown;
    }
  }
}
