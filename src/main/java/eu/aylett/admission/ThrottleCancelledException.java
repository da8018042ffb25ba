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

import java.util.concurrent.CancellationException;

/**
 * The caller gave up while the operation was waiting to be dispatched. The
 * operation was not run for the attempt that was waiting.
 */
public class ThrottleCancelledException extends CancellationException {
  public ThrottleCancelledException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }
}
