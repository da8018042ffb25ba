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

/**
 * How one dispatch of an operation ended: either with a value, or by throwing.
 *
 * @param value
 *          the operation's result, if it returned
 * @param failure
 *          what the operation threw, if it threw
 */
public record CallOutcome<T>(@Nullable T value, @Nullable Throwable failure) {
  public static <T> CallOutcome<T> success(@Nullable T value) {
    return new CallOutcome<>(value, null);
  }

  public static <T> CallOutcome<T> failure(Throwable failure) {
    return new CallOutcome<>(null, failure);
  }

  @Contract(pure = true)
  public boolean succeeded() {
    return failure == null;
  }
}
