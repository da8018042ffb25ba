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
 * Thrown by an operation to say it failed in a way worth retrying, such as a
 * timeout or a server error, optionally with how long the provider asked us to
 * wait first.
 */
public class TransientFailureException extends ThrottleException {
  private final @Nullable Duration requiredWait;

  public TransientFailureException(String message) {
    this(message, null, null);
  }

  public TransientFailureException(String message, @Nullable Duration requiredWait) {
    this(message, requiredWait, null);
  }

  public TransientFailureException(String message, @Nullable Duration requiredWait, @Nullable Throwable cause) {
    super(message, cause);
    this.requiredWait = requiredWait;
  }

  public @Nullable Duration requiredWait() {
    return requiredWait;
  }
}
