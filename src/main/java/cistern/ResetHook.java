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
 * Restores a released resource to a clean baseline, before it is handed to the next
 * acquirer.
 * <p>
 * The hook runs on the thread that releases the {@link Lease}, outside the pools
 * internal lock.
 * <p>
 * A reset hook should not throw under normal operation. If it does, the resource is
 * considered broken: it is {@linkplain Disposer disposed}, the failure is logged, and
 * its capacity slot is freed so that a later acquire can create a replacement. The
 * exception never reaches the code that released the lease.
 *
 * @param <T> The type of resource being reset.
 */
@FunctionalInterface
public interface ResetHook<T> {
  /**
   * Get a reset hook that does nothing.
   * @param <T> The type of resource.
   * @return A no-op reset hook.
   */
  static <T> ResetHook<T> none() {
    return resource -> {
    };
  }

  /**
   * Restore the given resource to a reusable state.
   * @param resource The resource that was just released. Never {@code null}.
   * @throws Exception If the resource cannot be reused.
   */
  void reset(T resource) throws Exception;
}
