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

import eu.aylett.admission.CallOutcome;
import eu.aylett.admission.LimitFeedback;
import eu.aylett.admission.LimitFeedbackHook;
import eu.aylett.admission.LimitUpdate;
import org.jspecify.annotations.Nullable;

import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.InstantSource;
import java.util.OptionalLong;

/**
 * Reads an HTTP response for what it says about the provider's limits.
 * <p>
 * There are three kinds, differing in how far they trust the provider:
 * </p>
 * <ul>
 * <li>{@link Kind#FIXED_SCHEDULE}: the limits we were configured with are all
 * there is. Throttling responses (429, 408, 5xx, and 403 with
 * {@code Retry-After}) are transient, honouring any {@code Retry-After}.</li>
 * <li>{@link Kind#RETRY_AFTER}: as above, but a 429 means the credential is
 * spent and we should rotate to the next.</li>
 * <li>{@link Kind#HEADERS}: as {@code RETRY_AFTER}, and every response's
 * rate-limit headers update the limits and the provider's count of our
 * usage.</li>
 * </ul>
 * <p>
 * Exceptions thrown by the client are left to the executor's transient
 * failure predicate.
 * </p>
 */
public final class HttpFeedback implements LimitFeedbackHook<HttpResponse<?>> {
  public static final int TOO_MANY_REQUESTS = 429;
  public static final int REQUEST_TIMEOUT = 408;
  public static final int FORBIDDEN = 403;

  /**
   * The three ways a provider can tell us about its limits.
   */
  public enum Kind {
    FIXED_SCHEDULE, RETRY_AFTER, HEADERS,
  }

  private final Kind kind;
  private final @Nullable RateLimitHeaders headers;
  private final @Nullable Duration defaultRateLimitWait;
  private final InstantSource clock;

  private HttpFeedback(Kind kind, @Nullable RateLimitHeaders headers, @Nullable Duration defaultRateLimitWait,
      InstantSource clock) {
    this.kind = kind;
    this.headers = headers;
    this.defaultRateLimitWait = defaultRateLimitWait;
    this.clock = clock;
  }

  public static HttpFeedback fixedSchedule() {
    return new HttpFeedback(Kind.FIXED_SCHEDULE, null, null, Clock.systemUTC());
  }

  public static HttpFeedback retryAfterDerived() {
    return new HttpFeedback(Kind.RETRY_AFTER, null, null, Clock.systemUTC());
  }

  public static HttpFeedback headerDerived(RateLimitHeaders headers) {
    return new HttpFeedback(Kind.HEADERS, headers, null, Clock.systemUTC());
  }

  /**
   * Wait this long after a 429 that doesn't say how long to wait.
   */
  public HttpFeedback withDefaultRateLimitWait(Duration wait) {
    return new HttpFeedback(kind, headers, wait, clock);
  }

  /**
   * The time source used to resolve {@code Retry-After} dates (mainly for
   * testing).
   */
  public HttpFeedback withClock(InstantSource clock) {
    return new HttpFeedback(kind, headers, defaultRateLimitWait, clock);
  }

  public Kind kind() {
    return kind;
  }

  @Override
  public LimitFeedback inspect(CallOutcome<? extends HttpResponse<?>> outcome) {
    var response = outcome.value();
    if (response == null) {
      return LimitFeedback.ok();
    }
    var status = response.statusCode();
    var responseHeaders = response.headers();
    var update = headers != null ? headers.read(responseHeaders) : LimitUpdate.none();
    var retryAfter = RetryAfter.from(responseHeaders, clock);

    if (status == TOO_MANY_REQUESTS) {
      var wait = retryAfter != null ? retryAfter : defaultRateLimitWait;
      if (kind == Kind.FIXED_SCHEDULE) {
        return new LimitFeedback.Transient(wait, update);
      }
      return new LimitFeedback.RateLimited(wait, update);
    }
    if (isTransient(status, responseHeaders)) {
      return new LimitFeedback.Transient(retryAfter, update);
    }
    return LimitFeedback.ok(update);
  }

  /**
   * Statuses other than 429 worth retrying: request timeouts, server errors,
   * and a 403 that tells us when to come back.
   */
  static boolean isTransient(int status, HttpHeaders headers) {
    if (status == REQUEST_TIMEOUT || (status >= 500 && status < 600)) {
      return true;
    }
    return status == FORBIDDEN && headers.firstValue(RetryAfter.HEADER).isPresent();
  }

  /**
   * The names of the headers a provider uses to report its limits.
   *
   * @param limit
   *          the budget per window
   * @param remaining
   *          how much of the budget is left
   * @param windowMillis
   *          the window length in milliseconds, if the provider reports it
   */
  public record RateLimitHeaders(String limit, String remaining, @Nullable String windowMillis) {
    public static final RateLimitHeaders HUBSPOT = new RateLimitHeaders("X-HubSpot-RateLimit-Max",
        "X-HubSpot-RateLimit-Remaining", "X-HubSpot-RateLimit-Interval-Milliseconds");
    public static final RateLimitHeaders CONVENTIONAL = new RateLimitHeaders("X-RateLimit-Limit",
        "X-RateLimit-Remaining", null);

    /**
     * The limits these headers report. The usage is only reported if both
     * the limit and what's remaining are.
     */
    LimitUpdate read(HttpHeaders headers) {
      var update = LimitUpdate.none();
      var max = number(headers, limit);
      var left = number(headers, remaining);
      if (max.isPresent() && max.getAsLong() > 0 && max.getAsLong() <= Integer.MAX_VALUE) {
        update = update.withMaxOperations((int) max.getAsLong());
        if (left.isPresent()) {
          update = update.withUsage((int) Math.max(0, max.getAsLong() - left.getAsLong()));
        }
      }
      if (windowMillis != null) {
        var millis = number(headers, windowMillis);
        if (millis.isPresent() && millis.getAsLong() > 0) {
          update = update.withWindow(Duration.ofMillis(millis.getAsLong()));
        }
      }
      return update;
    }

    private static OptionalLong number(HttpHeaders headers, String name) {
      var value = headers.firstValue(name).map(String::trim).orElse("");
      if (value.isEmpty() || !value.chars().allMatch(Character::isDigit) || value.length() > 18) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(Long.parseLong(value));
    }
  }

  @Override
  public String toString() {
    return "HttpFeedback[" + kind + (headers != null ? ", " + headers : "") + "]";
  }
}
