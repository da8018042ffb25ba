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
 * Where one logical call has got to in its retries. Created fresh for each
 * call and never shared.
 *
 * @param attempt
 *          how many backoff delays have been taken so far
 * @param baseDelay
 *          the delay before the first retry, before jitter
 */
public record BackoffState(int attempt, Duration baseDelay) {
  public BackoffState {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must not be negative, was " + attempt);
    }
    if (baseDelay.isZero() || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be greater than 0, was " + baseDelay);
    }
  }

  public static BackoffState initial(Duration baseDelay) {
    return new BackoffState(0, baseDelay);
  }

  @Contract(pure = true)
  public BackoffState next() {
    return new BackoffState(attempt + 1, baseDelay);
  }
}
