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

import org.jspecify.annotations.Nullable;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

/**
 * Parses the {@code Retry-After} header: either a number of seconds, or an
 * HTTP date in any of the three formats RFC 9110 says a recipient must accept.
 */
public final class RetryAfter {
  public static final String HEADER = "Retry-After";

  private static final DateTimeFormatter ASCTIME = DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy",
      Locale.US);

  private RetryAfter() {
  }

  /**
   * The wait asked for by a response's headers.
   *
   * @return the wait, or {@code null} if there's no usable header
   */
  public static @Nullable Duration from(HttpHeaders headers, InstantSource clock) {
    return headers.firstValue(HEADER).map(value -> parse(value, clock)).orElse(null);
  }

  /**
   * The wait asked for by one header value.
   *
   * @return the wait, or {@code null} if the value can't be parsed or names a
   *         time that has already passed
   */
  public static @Nullable Duration parse(String value, InstantSource clock) {
    var trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    if (trimmed.chars().allMatch(Character::isDigit)) {
      try {
        return Duration.ofSeconds(Long.parseLong(trimmed));
      } catch (NumberFormatException e) {
        return null;
      }
    }
    var now = clock.instant();
    var date = parseDate(trimmed, now);
    if (date == null) {
      return null;
    }
    var remaining = Duration.between(now, date);
    return remaining.isNegative() || remaining.isZero() ? null : remaining;
  }

  private static @Nullable Instant parseDate(String value, Instant now) {
    for (var format : List.of(DateTimeFormatter.RFC_1123_DATE_TIME, rfc850(now))) {
      try {
        return ZonedDateTime.parse(value, format).toInstant();
      } catch (DateTimeParseException e) {
        // try the next format
      }
    }
    try {
      return LocalDateTime.parse(value, ASCTIME).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * RFC 850 dates have two-digit years. A year that would be more than 50
   * years ahead of {@code now} is taken to be in the past.
   */
  private static DateTimeFormatter rfc850(Instant now) {
    var baseYear = now.atZone(ZoneOffset.UTC).getYear() - 49;
    return new DateTimeFormatterBuilder().appendPattern("EEEE, dd-MMM-")
        .appendValueReduced(ChronoField.YEAR, 2, 2, LocalDate.of(baseYear, 1, 1))
        .appendPattern(" HH:mm:ss zzz")
        .toFormatter(Locale.US);
  }
}
