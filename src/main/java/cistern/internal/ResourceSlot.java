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

/**
 * The place of one created resource in a {@link BoundedPool}.
 * <p>
 * A slot is either in the available stack of its pool, or owned by exactly one live
 * lease. The pool lock decides which.
 *
 * @param <T> The resource type.
 */
final class ResourceSlot<T> {
  final T resource;
  final long id;
  final long createdNanos;

  ResourceSlot(T resource, long id) {
    this.resource = resource;
    this.id = id;
    this.createdNanos = NanoClock.nanoTime();
  }

  @Override
  public String toString() {
    return "ResourceSlot[#" + id + ": " + resource + "]";
  }
}
