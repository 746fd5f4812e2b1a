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
 * A consistent snapshot of the counters of a {@link Pool}, all read at the same instant.
 * <p>
 * Snapshots are for diagnostics only. Reading a snapshot and then calling
 * {@link Pool#acquire()} is not atomic, and the numbers may have changed in between.
 *
 * @param capacity The maximum number of resources the pool will hold at any one time.
 * @param available The number of created resources that are ready to be acquired.
 * @param inUse The number of resources currently leased out.
 * @param totalCreated The number of live resources the pool has created.
 */
public record PoolStats(int capacity, int available, int inUse, int totalCreated) {
  /**
   * Get the number of resources that could still be created, before the pool reaches its
   * capacity. Creations that are in progress at the time of the snapshot are included in
   * this number.
   * @return The remaining headroom of the pool.
   */
  public int headroom() {
    return capacity - totalCreated;
  }

  @Override
  public String toString() {
    return "PoolStats[capacity=" + capacity + ", available=" + available +
        ", inUse=" + inUse + ", totalCreated=" + totalCreated + "]";
  }
}
