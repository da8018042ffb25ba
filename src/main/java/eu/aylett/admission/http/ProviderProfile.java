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

package eu.aylett.admission.http;

import eu.aylett.admission.LimitState;
import eu.aylett.admission.ThrottleExecutor;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.InstantSource;
import java.util.Locale;

/**
 * Published limits and feedback conventions of some providers.
 * <p>
 * These are starting points: header-derived profiles correct the limits from
 * the first response onwards.
 * </p>
 */
public enum ProviderProfile {
  GENERIC(LimitState.DEFAULT, HttpFeedback.fixedSchedule()),
  SLACK(LimitState.DEFAULT, HttpFeedback.fixedSchedule()),
  AIRTABLE(new LimitState(5, Duration.ofSeconds(1), 0.50, 0.70),
      HttpFeedback.fixedSchedule().withDefaultRateLimitWait(Duration.ofSeconds(30))),
  HUBSPOT(new LimitState(160, Duration.ofSeconds(10), 0.75, 0.90),
      HttpFeedback.headerDerived(HttpFeedback.RateLimitHeaders.HUBSPOT)),
  ASANA(new LimitState(1500, Duration.ofSeconds(60), 0.75, 0.90), HttpFeedback.retryAfterDerived()),
  ;

  private final LimitState limits;
  private final HttpFeedback feedback;

  ProviderProfile(LimitState limits, HttpFeedback feedback) {
    this.limits = limits;
    this.feedback = feedback;
  }

  public LimitState limits() {
    return limits;
  }

  public HttpFeedback feedback() {
    return feedback;
  }

  /**
   * Configure a builder with this provider's name, limits and feedback.
   */
  public <C> ThrottleExecutor.Builder<C, HttpResponse<?>> configure(ThrottleExecutor.Builder<C, ?> builder) {
    return builder.feedback(feedback).name(name().toLowerCase(Locale.ROOT)).limits(limits);
  }

  /**
   * As {@link #configure(ThrottleExecutor.Builder)}, resolving
   * {@code Retry-After} dates against the given clock.
   */
  public <C> ThrottleExecutor.Builder<C, HttpResponse<?>> configure(ThrottleExecutor.Builder<C, ?> builder,
      InstantSource clock) {
    return builder.<HttpResponse<?>>feedback(feedback.withClock(clock)).clock(clock)
        .name(name().toLowerCase(Locale.ROOT)).limits(limits);
  }
}
