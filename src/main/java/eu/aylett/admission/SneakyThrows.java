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

final class SneakyThrows {
  private SneakyThrows() {
  }

  /**
   * Rethrow any throwable without wrapping it or declaring it.
   * <p>
   * Declared to return an exception so callers can write
   * {@code throw sneakyThrow(e)} and keep the compiler's flow analysis happy.
   * </p>
   */
  @Contract("_ -> fail")
  static RuntimeException sneakyThrow(Throwable t) {
    throw SneakyThrows.<RuntimeException>uncheckedThrow(t);
  }

  @SuppressWarnings("unchecked")
  private static <E extends Throwable> E uncheckedThrow(Throwable t) throws E {
    throw (E) t;
  }
}
