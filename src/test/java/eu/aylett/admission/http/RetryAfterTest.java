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

import eu.aylett.admission.ManualClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

class RetryAfterTest {
  private final ManualClock clock = new ManualClock();

  @Test
  void secondsAreReadAsADelay() {
    Assertions.assertEquals(Duration.ofSeconds(30), RetryAfter.parse("30", clock));
    Assertions.assertEquals(Duration.ofSeconds(5), RetryAfter.parse(" 5 ", clock));
    Assertions.assertEquals(Duration.ZERO, RetryAfter.parse("0", clock));
  }

  @Test
  void imfFixdateIsRelativeToTheClock() {
    Assertions.assertEquals(Duration.ofSeconds(60), RetryAfter.parse("Mon, 01 Jan 2024 00:01:00 GMT", clock));
  }

  @Test
  void obsoleteDateFormatsAreAccepted() {
    Assertions.assertEquals(Duration.ofSeconds(30), RetryAfter.parse("Monday, 01-Jan-24 00:00:30 GMT", clock));
    Assertions.assertEquals(Duration.ofSeconds(45), RetryAfter.parse("Mon Jan  1 00:00:45 2024", clock));
  }

  @Test
  void twoDigitYearsMoreThanFiftyYearsAheadAreInThePast() {
    Assertions.assertNull(RetryAfter.parse("Sunday, 06-Nov-94 08:49:37 GMT", clock));

    var later = new ManualClock(Instant.parse("2070-01-01T00:00:00Z"));
    Assertions.assertEquals(Duration.between(later.instant(), Instant.parse("2119-03-03T00:00:00Z")),
        RetryAfter.parse("Friday, 03-Mar-19 00:00:00 GMT", later));
    Assertions.assertEquals(Duration.ofSeconds(30), RetryAfter.parse("Wednesday, 01-Jan-70 00:00:30 GMT", later));
  }

  @Test
  void datesInThePastGiveNoWait() {
    Assertions.assertNull(RetryAfter.parse("Sun, 31 Dec 2023 23:59:00 GMT", clock));
    Assertions.assertNull(RetryAfter.parse("Mon, 01 Jan 2024 00:00:00 GMT", clock));
  }

  @Test
  void unparsableValuesAreIgnored() {
    Assertions.assertNull(RetryAfter.parse("", clock));
    Assertions.assertNull(RetryAfter.parse("soon", clock));
    Assertions.assertNull(RetryAfter.parse("-5", clock));
    Assertions.assertNull(RetryAfter.parse("1.5", clock));
    Assertions.assertNull(RetryAfter.parse("99999999999999999999999", clock));
  }

  @Test
  void readsTheFirstHeaderValue() {
    var headers = HttpHeaders.of(Map.of("retry-after", List.of("12", "99")), (name, value) -> true);
    Assertions.assertEquals(Duration.ofSeconds(12), RetryAfter.from(headers, clock));
    Assertions.assertNull(RetryAfter.from(HttpHeaders.of(Map.of(), (name, value) -> true), clock));
  }
}
