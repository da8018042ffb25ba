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

import java.security.SecureRandom;
import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with full jitter.
 * <p>
 * The delay before retry {@code k} is sampled uniformly from
 * {@code [0, base * factor^k]}, with the upper bound capped at
 * {@code maxDelay}. The controller doesn't count attempts against a limit:
 * deciding when to give up is the caller's business.
 * </p>
 */
public final class BackoffController {
  public static final double DEFAULT_FACTOR = 2.0;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofHours(1);

  private final double factor;
  private final Duration maxDelay;
  private final DoubleSupplier randomSource;

  /**
   * @param factor
   *          the growth of the delay bound per attempt, greater than 1
   * @param maxDelay
   *          the cap on the delay bound
   * @param randomSource
   *          uniform samples in [0, 1) (mainly for testing)
   */
  public BackoffController(double factor, Duration maxDelay, DoubleSupplier randomSource) {
    if (!(factor > 1.0)) {
      throw new IllegalArgumentException("factor must be greater than 1, was " + factor);
    }
    if (maxDelay.isZero() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be greater than 0, was " + maxDelay);
    }
    this.factor = factor;
    this.maxDelay = maxDelay;
    this.randomSource = randomSource;
  }

  public BackoffController() {
    this(DEFAULT_FACTOR, DEFAULT_MAX_DELAY, new SecureRandom()::nextDouble);
  }

  /**
   * The jittered delay before the next retry, and the state after taking it.
   */
  public Backoff nextDelay(BackoffState state) {
    var bound = ceiling(state);
    return new Backoff(Durations.scale(bound, randomSource.getAsDouble()), state.next());
  }

  /**
   * Use a wait the provider asked for instead of the computed one. The attempt
   * still counts, so a later computed delay carries on from where this one
   * would have been. The wait is capped at {@code maxDelay} like any other.
   */
  @Contract(pure = true)
  public Backoff explicitWait(BackoffState state, Duration requiredWait) {
    return new Backoff(cap(requiredWait), state.next());
  }

  /**
   * Bound a wait the provider asked for to {@code [0, maxDelay]}.
   */
  @Contract(pure = true)
  public Duration cap(Duration requiredWait) {
    if (requiredWait.isNegative()) {
      return Duration.ZERO;
    }
    return Durations.min(requiredWait, maxDelay);
  }

  /**
   * The un-jittered delay bound for the state's attempt:
   * {@code min(base * factor^attempt, maxDelay)}.
   */
  @Contract(pure = true)
  public Duration ceiling(BackoffState state) {
    var nanos = Durations.nanos(state.baseDelay()) * Math.pow(factor, state.attempt());
    if (nanos >= Durations.nanos(maxDelay)) {
      return maxDelay;
    }
    return Duration.ofNanos(Math.round(nanos));
  }

  /**
   * A delay to wait, and the state to use for the retry after this one.
   */
  public record Backoff(Duration delay, BackoffState next) {
  }
}
