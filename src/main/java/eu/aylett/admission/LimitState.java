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

import org.jetbrains.annotations.Contract;

import java.time.Duration;

/**
 * The throttling parameters for one budget: how many operations the provider
 * allows in a trailing window, and the fractions of that budget at which we
 * start spacing calls out and at which we stop until the window has room.
 * <p>
 * Instances are immutable. The live parameters change by replacing the
 * instance with the result of {@link #apply(LimitUpdate)}, which the executor
 * does under its lock when a {@link LimitFeedbackHook} reports new limits.
 * </p>
 *
 * @param maxOperationsInWindow
 *          the provider's budget per window, greater than zero
 * @param rateLimitWindow
 *          the length of the trailing window, greater than zero
 * @param throttleStartPercentage
 *          the fraction of the budget at which proactive delays begin, in (0, 1)
 * @param fullThrottlePercentage
 *          the fraction of the budget at which we wait for the window to drain,
 *          in (throttleStartPercentage, 1]
 * @param fullThrottleBuffer
 *          the extra fraction of a hard-stop wait used as a cushion and jitter
 *          band, zero or more
 */
public record LimitState(int maxOperationsInWindow, Duration rateLimitWindow, double throttleStartPercentage,
    double fullThrottlePercentage, double fullThrottleBuffer) {

  /**
   * Ten operations a second, throttling from 75% and stopping at 90%.
   */
  public static final LimitState DEFAULT = new LimitState(10, Duration.ofSeconds(1), 0.75, 0.90);

  public static final double DEFAULT_FULL_THROTTLE_BUFFER = 0.10;

  public LimitState {
    if (maxOperationsInWindow <= 0) {
      throw new IllegalArgumentException("maxOperationsInWindow must be greater than 0, was " + maxOperationsInWindow);
    }
    if (rateLimitWindow.isZero() || rateLimitWindow.isNegative()) {
      throw new IllegalArgumentException("rateLimitWindow must be greater than 0, was " + rateLimitWindow);
    }
    if (!(throttleStartPercentage > 0.0 && throttleStartPercentage < 1.0)) {
      throw new IllegalArgumentException(
          "throttleStartPercentage must be between 0 and 1 exclusive, was " + throttleStartPercentage);
    }
    if (!(fullThrottlePercentage > throttleStartPercentage && fullThrottlePercentage <= 1.0)) {
      throw new IllegalArgumentException("fullThrottlePercentage must be greater than throttleStartPercentage ("
          + throttleStartPercentage + ") and at most 1, was " + fullThrottlePercentage);
    }
    if (!(fullThrottleBuffer >= 0.0)) {
      throw new IllegalArgumentException("fullThrottleBuffer must be 0 or more, was " + fullThrottleBuffer);
    }
  }

  public LimitState(int maxOperationsInWindow, Duration rateLimitWindow, double throttleStartPercentage,
      double fullThrottlePercentage) {
    this(maxOperationsInWindow, rateLimitWindow, throttleStartPercentage, fullThrottlePercentage,
        DEFAULT_FULL_THROTTLE_BUFFER);
  }

  /**
   * Load as a fraction of the budget.
   */
  @Contract(pure = true)
  public double ratio(int load) {
    return (double) load / maxOperationsInWindow;
  }

  /**
   * The longest proactive delay, reached just below the full throttle
   * threshold: the average spacing that would exactly use the budget.
   */
  @Contract(pure = true)
  public Duration softCeiling() {
    return rateLimitWindow.dividedBy(maxOperationsInWindow);
  }

  /**
   * The limits after applying a provider's report. Fields the update doesn't
   * mention are kept, so applying the same update twice gives the same result.
   */
  @Contract(pure = true)
  public LimitState apply(LimitUpdate update) {
    var max = update.maxOperationsInWindow();
    var window = update.rateLimitWindow();
    if (max == null && window == null) {
      return this;
    }
    return new LimitState(max != null ? max : maxOperationsInWindow, window != null ? window : rateLimitWindow,
        throttleStartPercentage, fullThrottlePercentage, fullThrottleBuffer);
  }

  @Contract(pure = true)
  public LimitState withMaxOperationsInWindow(int max) {
    return new LimitState(max, rateLimitWindow, throttleStartPercentage, fullThrottlePercentage, fullThrottleBuffer);
  }

  @Contract(pure = true)
  public LimitState withRateLimitWindow(Duration window) {
    return new LimitState(maxOperationsInWindow, window, throttleStartPercentage, fullThrottlePercentage,
        fullThrottleBuffer);
  }
}
