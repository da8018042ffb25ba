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

import org.jspecify.annotations.Nullable;

/**
 * The provider kept reporting a transient failure through its responses, and
 * we ran out of attempts.
 * <p>
 * When the last attempt failed by throwing, that exception is rethrown instead.
 * </p>
 */
public class RetriesExhaustedException extends ThrottleException {
  /**
   * How many times the operation was dispatched.
   */
  public final int attempts;
  private final transient @Nullable Object lastResult;

  public RetriesExhaustedException(int attempts, @Nullable Object lastResult) {
    super("Gave up after " + attempts + " attempt(s); last result " + lastResult);
    this.attempts = attempts;
    this.lastResult = lastResult;
  }

  /**
   * The result of the final attempt, as returned by the operation.
   */
  public @Nullable Object lastResult() {
    return lastResult;
  }
}
