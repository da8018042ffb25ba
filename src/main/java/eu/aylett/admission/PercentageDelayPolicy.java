/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.admission;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Delays proportionally to how far the load has got between the throttle start
 * and full throttle thresholds, and waits for the window to drain beyond that.
 * <ul>
 * <li>Below {@link LimitState#throttleStartPercentage()}: no delay.</li>
 * <li>Between the two thresholds: a linear fraction of
 * {@link LimitState#softCeiling()}, jittered by up to {@code jitter} either
 * way.</li>
 * <li>At or above {@link LimitState#fullThrottlePercentage()}: until the load
 * would drop below the budget, plus up to
 * {@link LimitState#fullThrottleBuffer()} of that again. Never shorter than
 * the time until the oldest entry expires.</li>
 * </ul>
 */
public final class PercentageDelayPolicy implements DelayPolicy {
  public static final double DEFAULT_JITTER = 0.10;

  private final DoubleSupplier randomSource;
  private final double jitter;

  /**
   * @param randomSource
   *          uniform samples in [0, 1) (mainly for testing)
   * @param jitter
   *          the largest fractional perturbation of a proactive delay, in [0, 1)
   */
  public PercentageDelayPolicy(DoubleSupplier randomSource, double jitter) {
    if (!(jitter >= 0.0 && jitter < 1.0)) {
      throw new IllegalArgumentException("jitter must be in [0, 1), was " + jitter);
    }
    this.randomSource = randomSource;
    this.jitter = jitter;
  }

  public PercentageDelayPolicy(DoubleSupplier randomSource) {
    this(randomSource, DEFAULT_JITTER);
  }

  public PercentageDelayPolicy() {
    this(new SecureRandom()::nextDouble);
  }

  @Override
  public Duration delayFor(WindowCounter.Snapshot window, LimitState limits) {
    var ratio = limits.ratio(window.load());
    if (ratio < limits.throttleStartPercentage()) {
      return Duration.ZERO;
    }
    if (ratio < limits.fullThrottlePercentage()) {
      var progress = (ratio - limits.throttleStartPercentage())
          / (limits.fullThrottlePercentage() - limits.throttleStartPercentage());
      var delay = Durations.scale(limits.softCeiling(), progress);
      return Durations.scale(delay, 1.0 + jitter * (2.0 * randomSource.getAsDouble() - 1.0));
    }
    // Only ever lengthen a hard stop, so the limit can't be exceeded.
    return Durations.scale(window.untilBelowCapacity(),
        1.0 + limits.fullThrottleBuffer() * randomSource.getAsDouble());
  }
}
