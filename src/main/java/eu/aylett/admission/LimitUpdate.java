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

import java.time.Duration;

/**
 * What a provider told us about its limits on one response. Every field is
 * absolute rather than a delta, and {@code null} means "not reported".
 *
 * @param maxOperationsInWindow
 *          the budget per window, if the provider reported one
 * @param rateLimitWindow
 *          the window length, if the provider reported one
 * @param reportedUsage
 *          how many operations the provider has already counted against us in
 *          the current window, if it reported that
 */
public record LimitUpdate(@Nullable Integer maxOperationsInWindow, @Nullable Duration rateLimitWindow,
    @Nullable Integer reportedUsage) {

  private static final LimitUpdate NONE = new LimitUpdate(null, null, null);

  public LimitUpdate {
    if (reportedUsage != null && reportedUsage < 0) {
      throw new IllegalArgumentException("reportedUsage must not be negative, was " + reportedUsage);
    }
  }

  public static LimitUpdate none() {
    return NONE;
  }

  public static LimitUpdate maxOperations(int maxOperationsInWindow) {
    return new LimitUpdate(maxOperationsInWindow, null, null);
  }

  public static LimitUpdate window(Duration rateLimitWindow) {
    return new LimitUpdate(null, rateLimitWindow, null);
  }

  public static LimitUpdate usage(int reportedUsage) {
    return new LimitUpdate(null, null, reportedUsage);
  }

  @Contract(pure = true)
  public LimitUpdate withMaxOperations(int max) {
    return new LimitUpdate(max, rateLimitWindow, reportedUsage);
  }

  @Contract(pure = true)
  public LimitUpdate withWindow(Duration window) {
    return new LimitUpdate(maxOperationsInWindow, window, reportedUsage);
  }

  @Contract(pure = true)
  public LimitUpdate withUsage(int usage) {
    return new LimitUpdate(maxOperationsInWindow, rateLimitWindow, usage);
  }

  @Contract(pure = true)
  public boolean isEmpty() {
    return maxOperationsInWindow == null && rateLimitWindow == null && reportedUsage == null;
  }
}
