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
 * Every configured credential has been reported as rate limited.
 */
public class CredentialsExhaustedException extends ThrottleException {
  /**
   * How many credentials the executor was configured with.
   */
  public final int credentials;

  public CredentialsExhaustedException(int credentials, @Nullable Throwable cause) {
    super("Rate limited on all " + credentials + " credential(s)", cause);
    this.credentials = credentials;
  }

  public CredentialsExhaustedException(int credentials) {
    this(credentials, null);
  }
}
