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
 * A SizeClass rounds a requested problem size to the size of the pool that serves it.
 * <p>
 * Rounding lets requests of similar size share resources: a 1000-point FFT and a
 * 1024-point FFT can both use a processor built for 1024 points.
 *
 * @see SizeClassPools
 */
@FunctionalInterface
public interface SizeClass {
  /**
   * Get a size class that rounds every size up to the nearest power of two.
   * Sizes of zero and one both map to one.
   * @return A power-of-two size class.
   */
  static SizeClass powerOfTwo() {
    return powerOfTwo(1, 1L << 62);
  }

  /**
   * Get a size class that rounds sizes up to the nearest power of two, but never below
   * {@code min} or above {@code max}. Sizes larger than {@code max} are served by the
   * {@code max} class.
   *
   * @param min The smallest size class. Must be a power of two.
   * @param max The largest size class. Must be a power of two, and at least {@code min}.
   * @return A bounded power-of-two size class.
   * @throws IllegalArgumentException If the bounds are not powers of two, or out of order.
   */
  static SizeClass powerOfTwo(long min, long max) {
    if (min < 1 || Long.bitCount(min) != 1) {
      throw new IllegalArgumentException("Minimum size class must be a power of two, but was " + min + ".");
    }
    if (max < min || Long.bitCount(max) != 1) {
      throw new IllegalArgumentException(
          "Maximum size class must be a power of two no smaller than " + min + ", but was " + max + ".");
    }
    return size -> {
      requireNonNegative(size);
      if (size <= min) {
        return min;
      }
      if (size >= max) {
        return max;
      }
      return Long.highestOneBit(size - 1) << 1;
    };
  }

  /**
   * Get a size class that gives every distinct size its own pool.
   * @return An identity size class.
   */
  static SizeClass exact() {
    return size -> {
      requireNonNegative(size);
      return size;
    };
  }

  private static void requireNonNegative(long size) {
    if (size < 0) {
      throw new IllegalArgumentException("Size cannot be negative, but was " + size + ".");
    }
  }

  /**
   * Round the given size to its size class.
   * @param size The requested size. Cannot be negative.
   * @return The size class that serves the request.
   * @throws IllegalArgumentException If the size is negative.
   */
  long classify(long size);
}
