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

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Predicates deciding which exceptions thrown by an operation are worth
 * retrying.
 */
public final class TransientFailures {
  private TransientFailures() {
  }

  /**
   * I/O failures, timeouts, and anything thrown as a
   * {@link TransientFailureException}.
   */
  public static Predicate<Throwable> defaults() {
    return anyOf(List.of(IOException.class, TimeoutException.class, TransientFailureException.class));
  }

  @SafeVarargs
  public static Predicate<Throwable> anyOf(Class<? extends Throwable>... types) {
    return anyOf(Arrays.asList(types));
  }

  public static Predicate<Throwable> anyOf(List<Class<? extends Throwable>> types) {
    var copy = List.copyOf(types);
    return ex -> copy.stream().anyMatch(c -> c.isInstance(ex));
  }

  /**
   * The defaults, plus the given types.
   */
  @SafeVarargs
  public static Predicate<Throwable> defaultsAnd(Class<? extends Throwable>... types) {
    return defaults().or(anyOf(types));
  }
}
