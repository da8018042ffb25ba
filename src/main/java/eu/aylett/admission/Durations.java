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
import java.time.Instant;

final class Durations {
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private Durations() {
  }

  /**
   * Multiply a duration by a non-negative factor, rounding to the nearest
   * nanosecond and saturating rather than overflowing.
   */
  @Contract(pure = true)
  static Duration scale(Duration duration, double factor) {
    if (factor <= 0.0 || duration.isZero() || duration.isNegative()) {
      return Duration.ZERO;
    }
    var nanos = duration.toNanos() * factor;
    if (nanos >= Long.MAX_VALUE) {
      return Duration.ofNanos(Long.MAX_VALUE);
    }
    return Duration.ofNanos(Math.round(nanos));
  }

  /**
   * The time from {@code now} until {@code then}, or zero if it has passed.
   */
  @Contract(pure = true)
  static Duration until(Instant now, Instant then) {
    var remaining = Duration.between(now, then);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Nanoseconds in a duration, saturating at {@link Long#MAX_VALUE} and never
   * negative.
   */
  @Contract(pure = true)
  static long nanos(Duration duration) {
    if (duration.isNegative()) {
      return 0L;
    }
    if (duration.compareTo(MAX_NANOS) >= 0) {
      return Long.MAX_VALUE;
    }
    return duration.toNanos();
  }

  /**
   * {@code instant + duration}, saturating at {@link Instant#MAX}.
   */
  @Contract(pure = true)
  static Instant plus(Instant instant, Duration duration) {
    if (duration.compareTo(Duration.between(instant, Instant.MAX)) >= 0) {
      return Instant.MAX;
    }
    return instant.plus(duration);
  }

  @Contract(pure = true)
  static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  @Contract(pure = true)
  static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  /**
   * Seconds with millisecond precision, for log messages.
   */
  @Contract(pure = true)
  static String seconds(Duration duration) {
    return String.format("%.3fs", duration.toNanos() / 1e9);
  }
}
