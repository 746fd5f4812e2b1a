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

import cistern.Lease;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.ref.Cleaner;

/**
 * The {@link Lease} implementation of {@link BoundedPool}.
 * <p>
 * The owned/released/transferred state is changed with a compare-and-set, so that
 * exactly one of {@link #release()} and {@link #transfer()} wins, no matter how many
 * threads race on the same lease.
 *
 * @param <T> The resource type.
 */
final class PooledLease<T> implements Lease<T> {
  private static final int OWNED = 0;
  private static final int RELEASED = 1;
  private static final int TRANSFERRED = 2;
  private static final VarHandle STATE;
  static {
    try {
      STATE = MethodHandles.lookup().findVarHandle(PooledLease.class, "state", int.class);
    } catch (Exception e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final ResourceSlot<T> slot;
  private final Handback<T> handback;
  private final Cleaner.Cleanable cleanable;
  @SuppressWarnings("FieldMayBeFinal") // Accessed via VarHandle
  private volatile int state;

  PooledLease(BoundedPool<T> pool, ResourceSlot<T> slot, LeakDetector leakDetector) {
    this.slot = slot;
    this.handback = new Handback<>(pool, slot);
    this.cleanable = leakDetector == null ? null : leakDetector.register(this, handback);
  }

  @Override
  public T get() {
    int current = state;
    if (current != OWNED) {
      throw new IllegalStateException(current == RELEASED
          ? "Lease on resource #" + slot.id + " has been released."
          : "Lease on resource #" + slot.id + " has been transferred.");
    }
    return slot.resource;
  }

  @Override
  public long getId() {
    return slot.id;
  }

  @Override
  public void release() {
    if (STATE.compareAndSet(this, OWNED, RELEASED)) {
      handback.released = true;
      runHandback();
    }
  }

  @Override
  public Lease<T> transfer() {
    if (!STATE.compareAndSet(this, OWNED, TRANSFERRED)) {
      throw new IllegalStateException(
          "Cannot transfer lease on resource #" + slot.id + ", it no longer owns it.");
    }
    handback.transferred = true;
    runHandback();
    return handback.pool.newLease(slot);
  }

  @Override
  public boolean isReleased() {
    return state != OWNED;
  }

  private void runHandback() {
    if (cleanable == null) {
      handback.run();
    } else {
      cleanable.clean();
    }
  }

  @Override
  public String toString() {
    return "Lease[#" + slot.id + (isReleased() ? ", released]" : "]");
  }

  /**
   * Returns the resource to the pool. Runs at most once per lease: when the lease is
   * released or transferred, or when the lease is found to have leaked.
   */
  private static final class Handback<T> implements Runnable {
    private final BoundedPool<T> pool;
    private final ResourceSlot<T> slot;
    volatile boolean released;
    volatile boolean transferred;

    Handback(BoundedPool<T> pool, ResourceSlot<T> slot) {
      this.pool = pool;
      this.slot = slot;
    }

    @Override
    public void run() {
      if (transferred) {
        return;
      }
      if (!released) {
        pool.leaked(slot);
      }
      pool.release(slot);
    }
  }
}
