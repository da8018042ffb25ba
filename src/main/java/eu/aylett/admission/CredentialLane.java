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
import java.time.Instant;
import java.time.InstantSource;

/**
 * The window and limits that apply to one credential (or to all of them, when
 * the window is shared). Guarded by the executor's lock.
 */
final class CredentialLane {
  final WindowCounter window;
  private LimitState limits;
  private @Nullable Instant pausedUntil;

  CredentialLane(InstantSource clock, LimitState limits) {
    this.window = new WindowCounter(clock);
    this.limits = limits;
  }

  LimitState limits() {
    return limits;
  }

  Duration admissionDelay(DelayPolicy policy, WindowCounter.Snapshot snapshot, Instant now) {
    var delay = policy.delayFor(snapshot, limits);
    if (pausedUntil != null) {
      if (pausedUntil.isAfter(now)) {
        delay = Durations.max(delay, Durations.until(now, pausedUntil));
      } else {
        pausedUntil = null;
      }
    }
    return delay;
  }

  /**
   * @return whether the limits changed
   */
  boolean apply(LimitUpdate update) {
    var usage = update.reportedUsage();
    if (usage != null) {
      window.reportUsage(usage);
    }
    var updated = limits.apply(update);
    if (updated.equals(limits)) {
      return false;
    }
    limits = updated;
    return true;
  }

  void pauseUntil(Instant until) {
    if (pausedUntil == null || until.isAfter(pausedUntil)) {
      pausedUntil = until;
    }
  }
}
