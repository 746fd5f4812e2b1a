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

import cistern.Completion;
import cistern.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Completion} that finishes when its latch counts down to zero.
 */
public final class LatchCompletion implements Completion {
  private final CountDownLatch completionLatch;

  /**
   * Create a completion that finishes once the given latch reaches zero.
   * @param completionLatch The latch to wait on.
   */
  public LatchCompletion(CountDownLatch completionLatch) {
    this.completionLatch = completionLatch;
  }

  @Override
  public boolean await(Timeout timeout) throws InterruptedException {
    if (timeout == null) {
      throw new IllegalArgumentException("Timeout cannot be null.");
    }
    return completionLatch.await(timeout.getTimeoutNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public String toString() {
    return "LatchCompletion[" + (completionLatch.getCount() == 0 ? "completed]" : "pending]");
  }
}
