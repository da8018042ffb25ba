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
import eu.aylett.admission.LimitUpdate;
import eu.aylett.admission.ManualClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HttpFeedbackTest {
  private final ManualClock clock = new ManualClock();

  @SuppressWarnings("unchecked")
  private static CallOutcome<HttpResponse<String>> response(int status, Map<String, List<String>> headers) {
    HttpResponse<String> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
    return CallOutcome.success(response);
  }

  private static CallOutcome<HttpResponse<String>> response(int status) {
    return response(status, Map.of());
  }

  @Test
  void successIsOk() {
    var feedback = HttpFeedback.fixedSchedule().withClock(clock);
    Assertions.assertEquals(LimitFeedback.ok(), feedback.inspect(response(200)));
    Assertions.assertEquals(LimitFeedback.ok(), feedback.inspect(response(404)));
  }

  @Test
  void thrownFailuresAreLeftToTheExecutor() {
    var feedback = HttpFeedback.retryAfterDerived();
    Assertions.assertEquals(LimitFeedback.ok(), feedback.inspect(CallOutcome.failure(new IOException("reset"))));
  }

  @Test
  void fixedScheduleTreats429AsTransient() {
    var feedback = HttpFeedback.fixedSchedule().withClock(clock);
    var result = feedback.inspect(response(429, Map.of("Retry-After", List.of("3"))));
    Assertions.assertEquals(new LimitFeedback.Transient(Duration.ofSeconds(3), LimitUpdate.none()), result);
  }

  @Test
  void defaultWaitAppliesWithoutRetryAfter() {
    var feedback = HttpFeedback.fixedSchedule().withDefaultRateLimitWait(Duration.ofSeconds(30)).withClock(clock);
    Assertions.assertEquals(new LimitFeedback.Transient(Duration.ofSeconds(30), LimitUpdate.none()),
        feedback.inspect(response(429)));
    Assertions.assertEquals(new LimitFeedback.Transient(Duration.ofSeconds(2), LimitUpdate.none()),
        feedback.inspect(response(429, Map.of("Retry-After", List.of("2")))));
  }

  @Test
  void retryAfterDerivedTreats429AsRateLimited() {
    var feedback = HttpFeedback.retryAfterDerived().withClock(clock);
    var result = feedback.inspect(response(429, Map.of("Retry-After", List.of("Mon, 01 Jan 2024 00:00:10 GMT"))));
    Assertions.assertEquals(new LimitFeedback.RateLimited(Duration.ofSeconds(10), LimitUpdate.none()), result);
    Assertions.assertEquals(HttpFeedback.Kind.RETRY_AFTER, feedback.kind());
  }

  @Test
  void serverErrorsAndTimeoutsAreTransient() {
    var feedback = HttpFeedback.retryAfterDerived().withClock(clock);
    for (var status : List.of(408, 500, 502, 503, 504, 599)) {
      assertThat("status " + status, feedback.inspect(response(status)), instanceOf(LimitFeedback.Transient.class));
    }
    Assertions.assertEquals(new LimitFeedback.Transient(Duration.ofSeconds(4), LimitUpdate.none()),
        feedback.inspect(response(503, Map.of("Retry-After", List.of("4")))));
  }

  @Test
  void forbiddenIsOnlyTransientWithRetryAfter() {
    var feedback = HttpFeedback.retryAfterDerived().withClock(clock);
    Assertions.assertEquals(LimitFeedback.ok(), feedback.inspect(response(403)));
    assertThat(feedback.inspect(response(403, Map.of("Retry-After", List.of("1")))),
        instanceOf(LimitFeedback.Transient.class));
  }

  @Test
  void headerDerivedReportsLimitsAndUsage() {
    var feedback = HttpFeedback.headerDerived(HttpFeedback.RateLimitHeaders.HUBSPOT).withClock(clock);
    var headers = Map.of("X-HubSpot-RateLimit-Max", List.of("150"), "X-HubSpot-RateLimit-Remaining",
        List.of("140"), "X-HubSpot-RateLimit-Interval-Milliseconds", List.of("10000"));

    var result = feedback.inspect(response(200, headers));

    Assertions.assertEquals(LimitFeedback.ok(new LimitUpdate(150, Duration.ofSeconds(10), 10)), result);
    // Same response, same report.
    Assertions.assertEquals(result, feedback.inspect(response(200, headers)));
  }

  @Test
  void headerDerivedRateLimitCarriesTheUpdate() {
    var feedback = HttpFeedback.headerDerived(HttpFeedback.RateLimitHeaders.CONVENTIONAL).withClock(clock);
    var headers = Map.of("X-RateLimit-Limit", List.of("100"), "X-RateLimit-Remaining", List.of("0"),
        "Retry-After", List.of("6"));

    var result = feedback.inspect(response(429, headers));

    Assertions.assertEquals(new LimitFeedback.RateLimited(Duration.ofSeconds(6), new LimitUpdate(100, null, 100)),
        result);
  }

  @Test
  void malformedRateLimitHeadersAreIgnored() {
    var feedback = HttpFeedback.headerDerived(HttpFeedback.RateLimitHeaders.HUBSPOT).withClock(clock);
    var headers = Map.of("X-HubSpot-RateLimit-Max", List.of("lots"), "X-HubSpot-RateLimit-Remaining",
        List.of("3"), "X-HubSpot-RateLimit-Interval-Milliseconds", List.of("0"));

    Assertions.assertEquals(LimitFeedback.ok(), feedback.inspect(response(200, headers)));
  }
}
