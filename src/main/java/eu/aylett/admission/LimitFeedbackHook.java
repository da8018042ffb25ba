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

/**
 * Reads a provider's response, or the exception a call threw, and reports what
 * it says about our limits.
 * <p>
 * Hooks are called outside the executor's lock and may be called concurrently.
 * They must not have side effects of their own: any change to the limits goes
 * through the returned {@link LimitUpdate}.
 * </p>
 *
 * @param <R>
 *          the type of result the hook understands
 */
@FunctionalInterface
public interface LimitFeedbackHook<R> {
  LimitFeedback inspect(CallOutcome<? extends R> outcome);

  /**
   * A hook for providers that tell us nothing: limits are fixed at
   * construction and only exceptions are classified.
   */
  static <R> LimitFeedbackHook<R> none() {
    return outcome -> LimitFeedback.ok();
  }
}
