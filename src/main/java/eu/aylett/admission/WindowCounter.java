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
import java.util.ArrayList;
import java.util.PriorityQueue;

/**
 * Tracks when recent operations were dispatched and reports how many of them
 * fall within the trailing window.
 * <p>
 * Entries may be recorded in the future: the executor records a reservation at
 * the instant a waiting caller will dispatch, so that other callers see the
 * slot as taken while it sleeps. Entries are pruned lazily, on each query,
 * using whatever window length is current at the time.
 * </p>
 * <p>
 * Not thread-safe. Each instance belongs to one executor and is only touched
 * under that executor's lock.
 * </p>
 */
public final class WindowCounter {
  private final InstantSource clock;
  private final PriorityQueue<Instant> entries = new PriorityQueue<>();
  private int reportedUsage;
  private @Nullable Instant reportedAt;

  public WindowCounter(InstantSource clock) {
    this.clock = clock;
  }

  /**
   * Record an operation dispatched now.
   */
  public Instant record() {
    return record(clock.instant());
  }

  /**
   * Record an operation that will be dispatched at {@code at}.
   */
  public Instant record(Instant at) {
    entries.add(at);
    return at;
  }

  /**
   * Forget a reservation whose operation was abandoned before dispatch.
   *
   * @return whether the reservation was still held
   */
  public boolean release(Instant reservation) {
    return entries.remove(reservation);
  }

  /**
   * Note the number of operations the provider says it has already counted in
   * the current window. Until a whole window has passed, the load reported by
   * this counter is never less than this figure.
   */
  public void reportUsage(int usage) {
    reportedUsage = usage;
    reportedAt = clock.instant();
  }

  /**
   * The number of operations within {@code window} of now, pruning older ones.
   */
  public int load(Duration window) {
    var now = clock.instant();
    prune(now, window);
    return Math.max(entries.size(), activeReport(now, window));
  }

  /**
   * Load plus the waits the delay policy needs, computed against one reading
   * of the clock.
   */
  public Snapshot snapshot(LimitState limits) {
    var now = clock.instant();
    var window = limits.rateLimitWindow();
    prune(now, window);

    var local = entries.size();
    var reported = activeReport(now, window);
    var load = Math.max(local, reported);

    var untilOldestExpires = Duration.ZERO;
    var oldest = entries.peek();
    if (oldest != null) {
      untilOldestExpires = Durations.until(now, oldest.plus(window));
    } else if (reported > 0 && reportedAt != null) {
      untilOldestExpires = Durations.until(now, reportedAt.plus(window));
    }

    var untilBelowCapacity = untilOldestExpires;
    var capacity = limits.maxOperationsInWindow();
    if (local >= capacity) {
      // The (local - capacity)th entry has to leave before the load drops below
      // capacity.
      var sorted = new ArrayList<>(entries);
      sorted.sort(null);
      var blocking = sorted.get(local - capacity);
      untilBelowCapacity = Durations.max(untilBelowCapacity, Durations.until(now, blocking.plus(window)));
    }
    if (reported >= capacity && reportedAt != null) {
      untilBelowCapacity = Durations.max(untilBelowCapacity, Durations.until(now, reportedAt.plus(window)));
    }

    return new Snapshot(load, untilOldestExpires, untilBelowCapacity);
  }

  private void prune(Instant now, Duration window) {
    var threshold = now.minus(window);
    Instant head;
    while ((head = entries.peek()) != null && !head.isAfter(threshold)) {
      entries.poll();
    }
  }

  private int activeReport(Instant now, Duration window) {
    if (reportedAt == null) {
      return 0;
    }
    if (!reportedAt.plus(window).isAfter(now)) {
      reportedAt = null;
      reportedUsage = 0;
      return 0;
    }
    return reportedUsage;
  }

  /**
   * The state of a window at one instant.
   *
   * @param load
   *          operations counted in the window, including reservations and any
   *          usage the provider reported
   * @param untilOldestExpires
   *          how long until the oldest counted operation leaves the window
   * @param untilBelowCapacity
   *          how long until enough operations leave the window for the load to
   *          be below the budget; never less than {@code untilOldestExpires}
   */
  public record Snapshot(int load, Duration untilOldestExpires, Duration untilBelowCapacity) {
  }
}
