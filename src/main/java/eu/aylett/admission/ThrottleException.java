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
 * Base class for the failures the throttle itself raises once it has run out
 * of ways to recover.
 * <p>
 * Failures of the underlying call that aren't recognised as transient or rate
 * limiting are never wrapped in one of these: they reach the caller unchanged.
 * </p>
 */
public class ThrottleException extends RuntimeException {
  public ThrottleException(String message) {
    super(message);
  }

  public ThrottleException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
