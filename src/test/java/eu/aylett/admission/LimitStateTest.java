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

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LimitStateTest {
  private static final LimitState LIMITS = new LimitState(10, Duration.ofSeconds(10), 0.75, 0.90);

  @Test
  void defaultsMatchTheDocumentedValues() {
    Assertions.assertEquals(10, LimitState.DEFAULT.maxOperationsInWindow());
    Assertions.assertEquals(Duration.ofSeconds(1), LimitState.DEFAULT.rateLimitWindow());
    Assertions.assertEquals(0.75, LimitState.DEFAULT.throttleStartPercentage());
    Assertions.assertEquals(0.90, LimitState.DEFAULT.fullThrottlePercentage());
    Assertions.assertEquals(0.10, LimitState.DEFAULT.fullThrottleBuffer());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    var e = assertThrows(IllegalArgumentException.class,
        () -> new LimitState(0, Duration.ofSeconds(1), 0.75, 0.9));
    assertThat(e.getMessage(), containsString("maxOperationsInWindow"));
  }

  @Test
  void rejectsNonPositiveWindow() {
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ZERO, 0.75, 0.9));
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(-1), 0.75, 0.9));
  }

  @Test
  void rejectsThresholdsOutOfOrder() {
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), 0.9, 0.75));
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), 0.75, 0.75));
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), 0.0, 0.5));
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), 0.5, 1.1));
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), Double.NaN, 0.9));
  }

  @Test
  void fullThrottleMayBeTheWholeBudget() {
    var limits = new LimitState(10, Duration.ofSeconds(1), 0.5, 1.0);
    Assertions.assertEquals(1.0, limits.fullThrottlePercentage());
  }

  @Test
  void rejectsNegativeBuffer() {
    assertThrows(IllegalArgumentException.class, () -> new LimitState(10, Duration.ofSeconds(1), 0.75, 0.9, -0.1));
  }

  @Test
  void softCeilingIsTheAverageSpacing() {
    Assertions.assertEquals(Duration.ofSeconds(1), LIMITS.softCeiling());
    Assertions.assertEquals(Duration.ofMillis(100), LimitState.DEFAULT.softCeiling());
  }

  @Test
  void ratioIsLoadOverCapacity() {
    Assertions.assertEquals(0.7, LIMITS.ratio(7));
    Assertions.assertEquals(0.9, LIMITS.ratio(9));
  }

  @Test
  void applyKeepsWhatTheUpdateDoesNotMention() {
    var updated = LIMITS.apply(LimitUpdate.maxOperations(150));
    Assertions.assertEquals(150, updated.maxOperationsInWindow());
    Assertions.assertEquals(LIMITS.rateLimitWindow(), updated.rateLimitWindow());
    Assertions.assertEquals(LIMITS.throttleStartPercentage(), updated.throttleStartPercentage());

    var rewindowed = updated.apply(LimitUpdate.window(Duration.ofMillis(10_000)));
    Assertions.assertEquals(150, rewindowed.maxOperationsInWindow());
    Assertions.assertEquals(Duration.ofSeconds(10), rewindowed.rateLimitWindow());
  }

  @Test
  void applyingAnEmptyUpdateReturnsTheSameInstance() {
    assertThat(LIMITS.apply(LimitUpdate.none()), sameInstance(LIMITS));
    assertThat(LIMITS.apply(LimitUpdate.usage(4)), sameInstance(LIMITS));
  }

  @Test
  void applyingTheSameUpdateTwiceIsIdempotent() {
    var update = new LimitUpdate(160, Duration.ofSeconds(10), 12);
    var once = LIMITS.apply(update);
    var twice = once.apply(update);
    Assertions.assertEquals(once, twice);
  }

  @Test
  void invalidUpdatesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> LIMITS.apply(LimitUpdate.maxOperations(0)));
    assertThrows(IllegalArgumentException.class, () -> LimitUpdate.usage(-1));
  }

  @Test
  void equalityAndHashcodeTest() {
    new EqualsTester()
        .addEqualityGroup(LIMITS, new LimitState(10, Duration.ofMillis(10_000), 0.75, 0.90, 0.10),
            LIMITS.apply(LimitUpdate.none()))
        .addEqualityGroup(LIMITS.withMaxOperationsInWindow(11))
        .addEqualityGroup(LIMITS.withRateLimitWindow(Duration.ofSeconds(11)))
        .addEqualityGroup(new LimitState(10, Duration.ofSeconds(10), 0.5, 0.90))
        .addEqualityGroup(new LimitState(10, Duration.ofSeconds(10), 0.75, 0.95))
        .addEqualityGroup(new LimitState(10, Duration.ofSeconds(10), 0.75, 0.90, 0.0))
        .testEquals();
  }
}
