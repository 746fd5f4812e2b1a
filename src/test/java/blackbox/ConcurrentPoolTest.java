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

import cistern.Lease;
import cistern.Pool;
import cistern.PoolStats;
import cistern.ResetHook;
import cistern.Timeout;
import extensions.ExecutorExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import testkits.GenericResource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static testkits.FactoryKit.*;

/**
 * Many threads hammering a small pool. Whatever the interleaving, a resource is never
 * owned by two leases at once, the pool never grows past its capacity, and every
 * resource is accounted for once the dust settles.
 */
class ConcurrentPoolTest {
  private static final Timeout longTimeout = new Timeout(5, TimeUnit.MINUTES);
  private static final int THREADS = 8;
  private static final int ITERATIONS = 2_000;

  @RegisterExtension
  final ExecutorExtension executorExtension = new ExecutorExtension();

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 8})
  void mustNeverHandOutOneResourceTwiceOrExceedCapacity(int capacity) throws Exception {
    CountingFactory factory = factory();
    Pool<GenericResource> pool = Pool.from(factory).setCapacity(capacity).build();
    Set<GenericResource> owned = ConcurrentHashMap.newKeySet();
    AtomicInteger concurrentOwners = new AtomicInteger();
    AtomicInteger maxConcurrentOwners = new AtomicInteger();
    AtomicReference<Throwable> failure = new AtomicReference<>();

    runConcurrently(() -> {
      for (int i = 0; i < ITERATIONS; i++) {
        try (Lease<GenericResource> lease = pool.acquire()) {
          GenericResource resource = lease.get();
          if (!owned.add(resource)) {
            failure.compareAndSet(null, new AssertionError(resource + " leased twice"));
          }
          int owners = concurrentOwners.incrementAndGet();
          maxConcurrentOwners.accumulateAndGet(owners, Math::max);
          Thread.onSpinWait();
          concurrentOwners.decrementAndGet();
          owned.remove(resource);
        }
      }
      return null;
    });

    assertThat(failure.get()).isNull();
    assertThat(maxConcurrentOwners.get()).isLessThanOrEqualTo(capacity);
    assertThat(factory.countCreations()).isLessThanOrEqualTo(capacity);
    PoolStats stats = pool.getStats();
    assertThat(stats.inUse()).isZero();
    assertThat(stats.available()).isEqualTo(stats.totalCreated());
    assertThat(stats.totalCreated()).isEqualTo(factory.countCreations());

    assertThat(pool.shutdown().await(longTimeout)).isTrue();
    assertThat(factory.getCreations()).allSatisfy(resource -> assertThat(resource.closed).isTrue());
  }

  @Test
  void accountingMustStayConsistentWhenResetsFailAndAcquiresTimeOut() throws Exception {
    CountingFactory factory = factory();
    CountingDisposer disposer = disposer();
    ResetHook<GenericResource> flakyReset = resource -> {
      if (ThreadLocalRandom.current().nextInt(10) == 0) {
        throw new IOException("flaky reset");
      }
    };
    int capacity = 3;
    Pool<GenericResource> pool = Pool.from(factory)
        .setCapacity(capacity)
        .setResetHook(flakyReset)
        .setDisposer(disposer)
        .build();
    Timeout shortTimeout = new Timeout(100, TimeUnit.MICROSECONDS);

    runConcurrently(() -> {
      for (int i = 0; i < ITERATIONS; i++) {
        if ((i & 1) == 0) {
          pool.tryAcquire(shortTimeout).ifPresent(Lease::release);
        } else {
          pool.acquire().release();
        }
      }
      return null;
    });

    PoolStats stats = pool.getStats();
    assertThat(stats.inUse()).isZero();
    assertThat(stats.totalCreated()).isLessThanOrEqualTo(capacity);
    assertThat(stats.totalCreated())
        .isEqualTo(factory.countCreations() - disposer.countDisposals());
    assertThat(pool.getManagedPool().getDiscardedCount()).isEqualTo(disposer.countDisposals());

    assertThat(pool.shutdown().await(longTimeout)).isTrue();
    assertThat(disposer.countDisposals()).isEqualTo(factory.countCreations());
  }

  private void runConcurrently(Callable<Void> task) throws Exception {
    ExecutorService executor = executorExtension.getExecutorService();
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Void>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      Future<Void> future = executor.submit(() -> {
        start.await();
        return task.call();
      });
      executorExtension.printOnFailure(future);
      futures.add(future);
    }
    start.countDown();
    for (Future<Void> future : futures) {
      future.get(1, TimeUnit.MINUTES);
    }
  }
}
