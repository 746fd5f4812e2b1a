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
 * A Lease is the exclusive right to use one resource from a {@link Pool}, until the
 * lease is released.
 * <p>
 * A lease has exactly one owner at a time. The resource goes back to the pool when the
 * owner calls {@link #release()} or {@link #close()}, which makes leases a natural fit
 * for the try-with-resources statement:
 * <pre>{@code
 * try (Lease<FftProcessor> lease = pool.acquire()) {
 *   lease.get().transform(signal);
 * }
 * }</pre>
 * Releasing is idempotent: only the first call has an effect, so an explicit
 * {@code release()} inside a try-with-resources block is harmless.
 * <p>
 * Ownership can be handed to another party with {@link #transfer()}. The lease it is
 * called on becomes a tombstone that can no longer reach or release the resource.
 * <p>
 * Pools never hand the same resource to two leases that are live at the same time.
 *
 * @param <T> The type of the leased resource.
 */
public interface Lease<T> extends AutoCloseable {
  /**
   * Get the leased resource.
   * @return The resource. Never {@code null}.
   * @throws IllegalStateException If this lease has been released or transferred.
   */
  T get();

  /**
   * Get the identity of the leased resource. Pools number their resources 1, 2, 3
   * and so on, in the order they were created.
   * <p>
   * The id remains readable after the lease has been released.
   * @return The creation id of the resource.
   */
  long getId();

  /**
   * Return the resource to the pool it came from, after running its
   * {@link ResetHook}.
   * <p>
   * Only the first call to this method, or to {@link #close()}, has any effect.
   * Calling it on a lease that has been {@linkplain #transfer() transferred} does
   * nothing.
   */
  void release();

  /**
   * Same as {@link #release()}, so leases can be used with try-with-resources.
   */
  @Override
  default void close() {
    release();
  }

  /**
   * Move the ownership of the resource to a new lease, and return it.
   * This lease can no longer be used to {@linkplain #get() get} or
   * {@linkplain #release() release} the resource afterwards.
   * @return A new lease that is now the sole owner of the resource.
   * @throws IllegalStateException If this lease has already been released or
   * transferred.
   */
  Lease<T> transfer();

  /**
   * Check if this lease has given up its resource, either by being released or
   * by being transferred.
   * @return {@code true} if this lease no longer owns a resource.
   */
  boolean isReleased();
}
