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
 * Frees whatever a resource holds on to, when the pool is done with it.
 * <p>
 * This happens in two situations: when the pool is {@linkplain Pool#shutdown() shut down},
 * and when a {@link ResetHook} fails and the resource is discarded.
 * <p>
 * Pools guarantee that the same resource is never disposed more than once. Exceptions
 * thrown by the disposer are logged, and otherwise ignored.
 *
 * @param <T> The type of resource being disposed.
 */
@FunctionalInterface
public interface Disposer<T> {
  /**
   * Get a disposer that does nothing.
   * @param <T> The type of resource.
   * @return A no-op disposer.
   */
  static <T> Disposer<T> none() {
    return resource -> {
    };
  }

  /**
   * Get a disposer that {@linkplain AutoCloseable#close() closes} resources that
   * implement {@link AutoCloseable}, and ignores all other resources.
   * This is the default disposer.
   * @param <T> The type of resource.
   * @return A disposer that closes closeable resources.
   */
  static <T> Disposer<T> closing() {
    return resource -> {
      if (resource instanceof AutoCloseable) {
        ((AutoCloseable) resource).close();
      }
    };
  }

  /**
   * Dispose of the given resource.
   * @param resource The resource to dispose. Never {@code null}.
   * @throws Exception If disposal fails.
   */
  void dispose(T resource) throws Exception;
}
