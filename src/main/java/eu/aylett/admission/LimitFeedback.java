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
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A provider's verdict on one dispatch, as interpreted by a
 * {@link LimitFeedbackHook}. Every verdict may carry new limits, which are
 * applied whatever else happens.
 */
public sealed interface LimitFeedback permits LimitFeedback.Ok, LimitFeedback.RateLimited, LimitFeedback.Transient {

  LimitUpdate update();

  /**
   * Nothing about this outcome calls for a retry. If the operation threw, the
   * executor still checks whether the exception is transient.
   */
  record Ok(LimitUpdate update) implements LimitFeedback {
  }

  /**
   * The active credential's budget is spent.
   *
   * @param requiredWait
   *          how long the provider asked us to leave that credential alone
   */
  record RateLimited(@Nullable Duration requiredWait, LimitUpdate update) implements LimitFeedback {
  }

  /**
   * The call failed in a way that's worth retrying on the same credential.
   *
   * @param requiredWait
   *          how long the provider asked us to wait, in place of the computed
   *          backoff
   */
  record Transient(@Nullable Duration requiredWait, LimitUpdate update) implements LimitFeedback {
  }

  @Contract(pure = true)
  static LimitFeedback ok() {
    return new Ok(LimitUpdate.none());
  }

  @Contract(pure = true)
  static LimitFeedback ok(LimitUpdate update) {
    return new Ok(update);
  }

  @Contract(pure = true)
  static LimitFeedback rateLimited() {
    return new RateLimited(null, LimitUpdate.none());
  }

  @Contract(pure = true)
  static LimitFeedback rateLimited(@Nullable Duration requiredWait) {
    return new RateLimited(requiredWait, LimitUpdate.none());
  }

  @Contract(pure = true)
  static LimitFeedback transientFailure() {
    return new Transient(null, LimitUpdate.none());
  }

  @Contract(pure = true)
  static LimitFeedback transientFailure(@Nullable Duration requiredWait) {
    return new Transient(requiredWait, LimitUpdate.none());
  }
}
