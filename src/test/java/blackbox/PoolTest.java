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
package blackbox;

import cistern.Completion;
import cistern.Lease;
import cistern.Pool;
import cistern.PoolBuilder;
import cistern.PoolException;
import cistern.PoolStats;
import cistern.Timeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import testkits.GenericResource;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static testkits.FactoryKit.*;
import static testkits.UnitKit.*;

/**
 * The general contract of {@link Pool}: leases, reuse, capacity, failure handling
 * and shut down, as seen from the outside.
 *
 * @see Pool
 */
class PoolTest {
  private static final Timeout longTimeout = new Timeout(5, TimeUnit.MINUTES);
  private static final Timeout shortTimeout = new Timeout(10, TimeUnit.MILLISECONDS);

  private CountingFactory factory;
  private CountingResetHook resetHook;
  private CountingDisposer disposer;
  private PoolBuilder<GenericResource> builder;
  private Pool<GenericResource> pool;

  @BeforeEach
  void setUp() {
    factory = factory();
    resetHook = resetHook();
    disposer = disposer();
    builder = Pool.from(factory).setCapacity(1).setResetHook(resetHook).setDisposer(disposer);
  }

  @AfterEach
  void tearDown() throws Exception {
    if (pool != null) {
      assertThat(pool.shutdown().await(longTimeout)).as("pool shut down").isTrue();
    }
  }

  private Pool<GenericResource> createPool() {
    pool = builder.build();
    return pool;
  }

  private Pool<GenericResource> createPool(int capacity) {
    builder.setCapacity(capacity);
    return createPool();
  }

  @Test
  void mustGetResourcesFromFactory() throws Exception {
    createPool();
    try (Lease<GenericResource> lease = pool.acquire()) {
      assertThat(factory.getCreations()).containsExactly(lease.get());
    }
  }

  @Test
  void mustReuseReleasedResources() throws Exception {
    createPool();
    GenericResource first;
    try (Lease<GenericResource> lease = pool.acquire()) {
      first = lease.get();
    }
    try (Lease<GenericResource> lease = pool.acquire()) {
      assertSame(first, lease.get());
    }
    assertThat(factory.countCreations()).isOne();
    assertThat(pool.getTotalCreated()).isOne();
  }

  @Test
  void mustPreferReuseOverCreationBelowCapacity() throws Exception {
    createPool(5);
    acquireRelease(1, pool);
    acquireRelease(1, pool);
    acquireRelease(1, pool);
    assertThat(factory.countCreations()).isOne();
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void mustReuseMostRecentlyReleasedResourceFirst() throws Exception {
    createPool(2);
    Lease<GenericResource> a = pool.acquire();
    Lease<GenericResource> b = pool.acquire();
    a.release();
    b.release();
    try (Lease<GenericResource> lease = pool.acquire()) {
      assertThat(lease.getId()).isEqualTo(b.getId());
    }
  }

  @Test
  void mustNotCreateMoreResourcesThanCapacity() throws Exception {
    createPool(3);
    Lease<GenericResource> a = pool.acquire();
    Lease<GenericResource> b = pool.acquire();
    Lease<GenericResource> c = pool.acquire();
    assertThat(pool.tryAcquire()).isEmpty();
    assertThat(pool.tryAcquire(shortTimeout)).isEmpty();
    assertThat(factory.countAttempts()).isEqualTo(3);
    assertThat(pool.getInUseCount()).isEqualTo(3);
    a.release();
    b.release();
    c.release();
    assertThat(pool.getInUseCount()).isZero();
    assertThat(pool.getAvailableCount()).isEqualTo(3);
  }

  @Test
  void tryAcquireWithZeroTimeoutMustReturnEmptyWithoutBlockingWhenExhausted() throws Exception {
    createPool();
    try (Lease<GenericResource> ignored = pool.acquire()) {
      long start = System.nanoTime();
      assertThat(pool.tryAcquire(Timeout.ZERO)).isEmpty();
      assertThat(pool.tryAcquire(new Timeout(-1, TimeUnit.SECONDS))).isEmpty();
      assertThat(System.nanoTime() - start).isLessThan(TimeUnit.SECONDS.toNanos(1));
    }
  }

  @Test
  void tryAcquireWithZeroTimeoutMustCreateIfBelowCapacity() throws Exception {
    createPool();
    Optional<Lease<GenericResource>> acquired = pool.tryAcquire(Timeout.ZERO);
    assertThat(acquired).isPresent();
    acquired.get().release();
  }

  @Test
  void tryAcquireMustWaitForTheTimeoutBeforeGivingUp() throws Exception {
    createPool();
    try (Lease<GenericResource> ignored = pool.acquire()) {
      long start = System.nanoTime();
      assertThat(pool.tryAcquire(new Timeout(50, TimeUnit.MILLISECONDS))).isEmpty();
      assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(50));
    }
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void tryAcquireMustThrowOnNullTimeout() {
    createPool();
    assertThrows(IllegalArgumentException.class, () -> pool.tryAcquire(null));
  }

  @Test
  void releasedResourceMustBeHandedToBlockedAcquirerAfterReset() throws Exception {
    createPool(2);
    Lease<GenericResource> first = pool.acquire();
    Lease<GenericResource> second = pool.acquire();
    assertThat(first.getId()).isEqualTo(1);
    assertThat(second.getId()).isEqualTo(2);
    GenericResource resource = first.get();

    AtomicReference<Lease<GenericResource>> third = new AtomicReference<>();
    Thread thread = fork(capture($acquire(pool), third));
    waitForThreadState(thread, Thread.State.WAITING);
    first.release();
    join(thread);

    assertThat(third.get().getId()).isEqualTo(1);
    assertSame(resource, third.get().get());
    assertThat(resource.countResets()).isOne();
    assertThat(pool.getTotalCreated()).isEqualTo(2);
    third.get().release();
    second.release();
  }

  @Test
  void releaseMustApplyResetHook() throws Exception {
    createPool();
    acquireRelease(1, pool);
    acquireRelease(1, pool);
    assertThat(resetHook.countResets()).isEqualTo(2);
    assertThat(factory.getCreations().get(0).countResets()).isEqualTo(2);
  }

  @Test
  void mustPropagateFactoryExceptionsThroughAcquire() throws Exception {
    IOException failure = new IOException("boom");
    factory = factory(create($new, $throw(failure), $new));
    builder.setFactory(factory);
    createPool(2);
    Lease<GenericResource> first = pool.acquire();
    PoolException e = assertThrows(PoolException.class, pool::acquire);
    assertThat(e).hasCause(failure);
    assertThat(pool.getTotalCreated()).isOne();
    assertThat(pool.getInUseCount()).isOne();
    assertThat(pool.getAvailableCount()).isZero();
    assertThat(pool.getManagedPool().getFailedAllocationCount()).isOne();

    Lease<GenericResource> second = pool.acquire();
    assertThat(pool.getTotalCreated()).isEqualTo(2);
    first.release();
    second.release();
  }

  @Test
  void mustPropagateErrorsFromFactoryUnwrapped() {
    factory = factory(create($throw(new OutOfMemoryError("fake")), $new));
    builder.setFactory(factory);
    createPool();
    assertThrows(OutOfMemoryError.class, pool::acquire);
    assertThat(pool.getTotalCreated()).isZero();
    assertThat(pool.tryAcquire()).hasValueSatisfying(Lease::release);
  }

  @Test
  void factoryReturningNullMustBeReportedAsPoolException() throws Exception {
    factory = factory(create($null, $new));
    builder.setFactory(factory);
    createPool();
    PoolException e = assertThrows(PoolException.class, pool::acquire);
    assertThat(e).hasMessageContaining("null");
    acquireRelease(1, pool);
    assertThat(pool.getTotalCreated()).isOne();
  }

  @Test
  void failedCreationMustLetBlockedAcquirerCreateInstead() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    factory = factory(create($await(latch, $throw(new IOException("boom"))), $new));
    builder.setFactory(factory);
    createPool();

    AtomicReference<Object> caught = new AtomicReference<>();
    Thread failing = fork($catchFrom($acquire(pool), caught));
    waitForThreadState(failing, Thread.State.WAITING);
    AtomicReference<Lease<GenericResource>> acquired = new AtomicReference<>();
    Thread waiting = fork(capture($acquire(pool), acquired));
    waitForThreadState(waiting, Thread.State.WAITING);
    latch.countDown();
    join(failing);
    join(waiting);

    assertThat(caught.get()).isInstanceOf(PoolException.class);
    assertThat(acquired.get()).isNotNull();
    assertThat(factory.countAttempts()).isEqualTo(2);
    acquired.get().release();
  }

  @Test
  void resetFailureMustDiscardTheResource() throws Exception {
    resetHook = resetHook(reset($throw(new IOException("cannot reset")), $null));
    builder.setResetHook(resetHook);
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    GenericResource resource = lease.get();
    lease.release();

    assertThat(disposer.getDisposals()).containsExactly(resource);
    assertThat(resource.closed).isTrue();
    assertThat(pool.getTotalCreated()).isZero();
    assertThat(pool.getAvailableCount()).isZero();
    assertThat(pool.getManagedPool().getDiscardedCount()).isOne();
    assertThat(pool.getManagedPool().getAllocationCount()).isOne();

    try (Lease<GenericResource> replacement = pool.acquire()) {
      assertThat(replacement.get()).isNotSameAs(resource);
      assertThat(replacement.getId()).isEqualTo(2);
    }
  }

  @Test
  void resetFailureMustLetBlockedAcquirerCreateReplacement() throws Exception {
    resetHook = resetHook(reset($throw(new IOException("cannot reset")), $null));
    builder.setResetHook(resetHook);
    createPool();
    Lease<GenericResource> lease = pool.acquire();

    AtomicReference<Lease<GenericResource>> acquired = new AtomicReference<>();
    Thread thread = fork(capture($acquire(pool), acquired));
    waitForThreadState(thread, Thread.State.WAITING);
    lease.release();
    join(thread);

    assertThat(acquired.get().get()).isNotSameAs(factory.getCreations().get(0));
    assertThat(factory.countCreations()).isEqualTo(2);
    assertThat(pool.getTotalCreated()).isOne();
    acquired.get().release();
  }

  @Test
  void releaseMustBeIdempotent() throws Exception {
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    lease.release();
    lease.release();
    lease.close();
    assertThat(resetHook.countResets()).isOne();
    assertThat(pool.getAvailableCount()).isOne();
    assertThat(pool.getInUseCount()).isZero();
    assertThat(lease.isReleased()).isTrue();
  }

  @Test
  void getMustThrowAfterRelease() throws Exception {
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    lease.release();
    assertThrows(IllegalStateException.class, lease::get);
  }

  @Test
  void closingLeaseMustReleaseIt() throws Exception {
    createPool();
    try (Lease<GenericResource> lease = pool.acquire()) {
      assertThat(lease.isReleased()).isFalse();
      assertThat(pool.getInUseCount()).isOne();
    }
    assertThat(pool.getInUseCount()).isZero();
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void leaseMustBeReleasedWhenScopeExitsExceptionally() throws Exception {
    createPool();
    assertThrows(IllegalStateException.class, () -> {
      try (Lease<GenericResource> ignored = pool.acquire()) {
        throw new IllegalStateException("scope failed");
      }
    });
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void transferMustMoveOwnershipWithoutReturningTheResource() throws Exception {
    createPool();
    Lease<GenericResource> original = pool.acquire();
    GenericResource resource = original.get();
    Lease<GenericResource> moved = original.transfer();

    assertThat(original.isReleased()).isTrue();
    assertThrows(IllegalStateException.class, original::get);
    assertSame(resource, moved.get());
    assertThat(moved.getId()).isEqualTo(original.getId());
    assertThat(pool.getInUseCount()).isOne();
    assertThat(resetHook.countResets()).isZero();

    original.release();
    assertThat(pool.getInUseCount()).isOne();
    assertThrows(IllegalStateException.class, original::transfer);

    moved.release();
    assertThat(pool.getInUseCount()).isZero();
    assertThat(resetHook.countResets()).isOne();
  }

  @Test
  void transferredLeaseMayBeReleasedByAnotherThread() throws Exception {
    createPool();
    Lease<GenericResource> moved = pool.acquire().transfer();
    join(fork(() -> {
      moved.release();
      return null;
    }));
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void applyMustReleaseResourceAfterFunctionReturns() throws Exception {
    createPool();
    Optional<Long> serial = pool.apply(longTimeout, resource -> resource.serial);
    assertThat(serial).contains(factory.getCreations().get(0).serial);
    assertThat(pool.getAvailableCount()).isOne();
    assertThat(pool.apply(longTimeout, resource -> null)).isEmpty();
  }

  @Test
  void applyMustReleaseResourceWhenFunctionThrows() {
    createPool();
    assertThrows(IllegalStateException.class, () -> pool.apply(longTimeout, resource -> {
      throw new IllegalStateException("boom");
    }));
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void applyAndSupplyMustReturnEmptyWhenTimeoutElapses() throws Exception {
    createPool();
    try (Lease<GenericResource> ignored = pool.acquire()) {
      assertThat(pool.apply(shortTimeout, resource -> resource)).isEmpty();
      assertThat(pool.supply(shortTimeout, resource -> {
        throw new AssertionError("should not be called");
      })).isFalse();
    }
  }

  @Test
  void supplyMustPassResourceToConsumer() throws Exception {
    createPool();
    AtomicReference<GenericResource> seen = new AtomicReference<>();
    assertThat(pool.supply(longTimeout, seen::set)).isTrue();
    assertSame(factory.getCreations().get(0), seen.get());
    assertThat(pool.getAvailableCount()).isOne();
  }

  @Test
  void blockedAcquireMustThrowWhenInterrupted() throws Exception {
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    AtomicReference<Object> caught = new AtomicReference<>();
    Thread thread = fork(() -> {
      try {
        pool.acquire();
      } catch (InterruptedException e) {
        caught.set(e);
      }
      return null;
    });
    waitForThreadState(thread, Thread.State.WAITING);
    thread.interrupt();
    join(thread);
    assertThat(caught.get()).isInstanceOf(InterruptedException.class);

    lease.release();
    assertThat(pool.getAvailableCount()).isOne();
    assertThat(pool.tryAcquire()).hasValueSatisfying(Lease::release);
  }

  @Test
  void acquireMustThrowIfAlreadyInterrupted() {
    createPool();
    Thread.currentThread().interrupt();
    assertThrows(InterruptedException.class, pool::acquire);
    assertThat(Thread.interrupted()).isFalse();
  }

  @Test
  void tryAcquireWithoutTimeoutMustPreserveInterruptFlag() {
    createPool();
    Thread.currentThread().interrupt();
    assertThat(pool.tryAcquire()).isEmpty();
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  void statsMustReflectPoolState() throws Exception {
    createPool(4);
    Lease<GenericResource> a = pool.acquire();
    Lease<GenericResource> b = pool.acquire();
    b.release();
    PoolStats stats = pool.getStats();
    assertThat(stats).isEqualTo(new PoolStats(4, 1, 1, 2));
    assertThat(stats.headroom()).isEqualTo(2);
    assertThat(pool.getCapacity()).isEqualTo(4);
    a.release();
  }

  @Test
  void defaultDisposerMustCloseResources() throws Exception {
    pool = Pool.from(factory).build();
    acquireRelease(1, pool);
    assertThat(pool.shutdown().await(longTimeout)).isTrue();
    assertThat(factory.getCreations().get(0).closed).isTrue();
  }

  @Test
  void shutdownMustDisposeAvailableResources() throws Exception {
    createPool(3);
    acquireRelease(3, pool);
    Completion completion = pool.shutdown();
    assertThat(completion.await(longTimeout)).isTrue();
    assertThat(disposer.getDisposals()).containsExactlyInAnyOrderElementsOf(factory.getCreations());
    assertThat(pool.getTotalCreated()).isZero();
  }

  @Test
  void shutdownMustDisposeLeasedResourcesWhenReleasedWithoutReset() throws Exception {
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    Completion completion = pool.shutdown();
    assertThat(completion.await(shortTimeout)).isFalse();
    assertThat(disposer.countDisposals()).isZero();

    lease.release();
    assertThat(completion.await(longTimeout)).isTrue();
    assertThat(disposer.getDisposals()).containsExactly(factory.getCreations().get(0));
    assertThat(resetHook.countResets()).isZero();
  }

  @Test
  void shutdownMustBeIdempotent() throws Exception {
    createPool();
    acquireRelease(1, pool);
    Completion completion = pool.shutdown();
    assertSame(completion, pool.shutdown());
    assertThat(completion.await(longTimeout)).isTrue();
    assertThat(disposer.countDisposals()).isOne();
    assertThat(pool.getManagedPool().isShutDown()).isTrue();
  }

  @Test
  void acquireMustThrowAfterShutdown() {
    createPool();
    pool.shutdown();
    assertThrows(IllegalStateException.class, pool::acquire);
    assertThrows(IllegalStateException.class, () -> pool.tryAcquire(shortTimeout));
  }

  @Test
  void shutdownMustFailBlockedAcquirers() throws Exception {
    createPool();
    Lease<GenericResource> lease = pool.acquire();
    AtomicReference<Object> caught = new AtomicReference<>();
    Thread thread = fork($catchFrom($acquire(pool), caught));
    waitForThreadState(thread, Thread.State.WAITING);
    Completion completion = pool.shutdown();
    join(thread);
    assertThat(caught.get()).isInstanceOf(IllegalStateException.class);
    lease.release();
    assertThat(completion.await(longTimeout)).isTrue();
  }

  @Test
  void resourceCreatedDuringShutdownMustBeDisposed() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    factory = factory(create($await(latch, $new)));
    builder.setFactory(factory);
    createPool();
    AtomicReference<Object> caught = new AtomicReference<>();
    Thread thread = fork($catchFrom($acquire(pool), caught));
    waitForThreadState(thread, Thread.State.WAITING);
    Completion completion = pool.shutdown();
    assertThat(completion.isCompleted()).isFalse();
    latch.countDown();
    join(thread);

    assertThat(caught.get()).isInstanceOf(IllegalStateException.class);
    assertThat(completion.await(longTimeout)).isTrue();
    assertThat(disposer.getDisposals()).containsExactlyElementsOf(factory.getCreations());
  }

  @Test
  void disposerExceptionsMustNotPreventShutdown() throws Exception {
    disposer = disposer(dispose($throw(new IOException("cannot dispose"))));
    builder.setDisposer(disposer);
    createPool(2);
    acquireRelease(2, pool);
    assertThat(pool.shutdown().await(longTimeout)).isTrue();
    assertThat(disposer.countDisposals()).isEqualTo(2);
  }

  @Test
  void completionAwaitMustThrowOnNullTimeout() {
    createPool();
    Completion completion = pool.shutdown();
    assertThrows(IllegalArgumentException.class, () -> completion.await(null));
  }
}
