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

import java.time.Duration;

/**
 * Thrown by an operation to say the active credential's budget is spent. The
 * executor moves on to the next credential, if there is one.
 */
public class RateLimitedException extends ThrottleException {
  private final @Nullable Duration requiredWait;

  public RateLimitedException(String message) {
    this(message, null);
  }

  public RateLimitedException(String message, @Nullable Duration requiredWait) {
    super(message);
    this.requiredWait = requiredWait;
  }

  public @Nullable Duration requiredWait() {
    return requiredWait;
  }
}
