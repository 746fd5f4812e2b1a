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
 * A Factory creates the resources that a {@link Pool} manages.
 * <p>
 * The pool calls the factory at most {@linkplain PoolBuilder#setCapacity(int) capacity}
 * times over the life of the pool, plus once more for every resource that has been
 * discarded because its {@link ResetHook} failed. Resources are never freed early, so
 * expensive construction is paid for only once per resource.
 * <p>
 * The factory is called <em>outside</em> of the pools internal lock, so several threads
 * may be running the factory concurrently, if the capacity allows it. Factories must
 * therefore be thread-safe.
 *
 * @param <T> The type of resource created.
 * @see Pool#from(Factory)
 */
@FunctionalInterface
public interface Factory<T> {
  /**
   * Create a fresh resource.
   * <p>
   * Exceptions thrown by this method propagate out through
   * {@link Pool#acquire()} and {@link Pool#tryAcquire(Timeout)}, wrapped in a
   * {@link PoolException}. A failed creation does not consume any capacity, and the
   * pool remains usable once the factory stops throwing.
   *
   * @return A newly created resource. Never {@code null}.
   * @throws Exception If the resource could not be created.
   */
  T create() throws Exception;
}
