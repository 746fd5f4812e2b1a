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

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A Timeout represents the maximum amount of time a caller is willing to wait for a
 * blocking operation to complete.
 * <p>
 * Timeouts are independent of their units, so two timeouts of equivalent
 * duration but constructed in different units, will be equal to each other.
 * <p>
 * Timeouts of zero or negative duration mean that the operation must not block at all.
 *
 * @see Pool#tryAcquire(Timeout)
 * @see Completion#await(Timeout)
 */
public final class Timeout {
  /**
   * A timeout of zero, used for non-blocking polls.
   */
  public static final Timeout ZERO = new Timeout(0, TimeUnit.NANOSECONDS);

  private final long timeout;
  private final TimeUnit unit;
  private final long timeoutNanos;

  /**
   * Construct a new timeout with the given value and unit. The unit cannot be
   * {@code null}, but the timeout value is unrestricted. Zero or negative values
   * mean that no waiting is tolerated.
   * @param timeout A numerical value for the timeout.
   * @param unit The unit of the timeout value. Never {@code null}.
   * @throws IllegalArgumentException If the unit is {@code null}.
   */
  public Timeout(long timeout, TimeUnit unit) {
    if (unit == null) {
      throw new IllegalArgumentException("The TimeUnit cannot be null.");
    }
    this.timeout = timeout;
    this.unit = unit;
    this.timeoutNanos = unit.toNanos(timeout);
  }

  /**
   * Construct a new timeout from the given duration.
   * @param duration The duration of the timeout. Never {@code null}.
   * @throws IllegalArgumentException If the duration is {@code null}.
   */
  public Timeout(Duration duration) {
    this(requireDuration(duration).toNanos(), TimeUnit.NANOSECONDS);
  }

  private static Duration requireDuration(Duration duration) {
    if (duration == null) {
      throw new IllegalArgumentException("The Duration cannot be null.");
    }
    return duration;
  }

  /**
   * Get the timeout value in terms of the {@link #getUnit() unit}.
   * @return A numerical value of the timeout. Possibly zero or negative.
   */
  public long getTimeout() {
    return timeout;
  }

  /**
   * Get the unit for the {@link #getTimeout() timeout value}.
   * @return The {@link TimeUnit} of the timeout value. Never {@code null}.
   */
  public TimeUnit getUnit() {
    return unit;
  }

  /**
   * Get the timeout in nanoseconds. Values that overflow are saturated to
   * {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}.
   * @return The timeout in nanoseconds.
   */
  public long getTimeoutNanos() {
    return timeoutNanos;
  }

  /**
   * Check if this timeout permits any waiting at all.
   * @return {@code true} if the timeout is zero or negative.
   */
  public boolean isNonBlocking() {
    return timeoutNanos <= 0;
  }

  @Override
  public int hashCode() {
    return 31 * (1 + Long.hashCode(timeoutNanos));
  }

  /**
   * Timeouts of equivalent duration are equal, even if they were constructed
   * with different units.
   * @return {@code true} if this Timeout value is equal to the given
   * Timeout value, {@code false} otherwise.
   */
  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Timeout)) {
      return false;
    }
    Timeout that = (Timeout) obj;
    return this.timeoutNanos == that.timeoutNanos;
  }

  @Override
  public String toString() {
    return "Timeout(" + timeout + " " + unit + ")";
  }
}
