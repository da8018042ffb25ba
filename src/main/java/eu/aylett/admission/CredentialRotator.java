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

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An ordered list of credentials, primary first, and which one is in use.
 * <p>
 * Rotation only ever moves forward. Once the last credential has been rotated
 * away from, the rotator is exhausted for good and every further rotation
 * fails.
 * </p>
 * <p>
 * A backup may need a login exchange before it can be used. If a refresher is
 * given, it's applied to each backup when it first becomes active, so a
 * credential that's never needed is never refreshed.
 * </p>
 * <p>
 * Not thread-safe: the owning executor guards it with its lock.
 * </p>
 */
public final class CredentialRotator<C> {
  private final List<C> credentials;
  private final @Nullable UnaryOperator<C> refresher;
  private int activeIndex;
  private C active;
  private boolean exhausted;

  public CredentialRotator(List<? extends C> credentials, @Nullable UnaryOperator<C> refresher) {
    if (credentials.isEmpty()) {
      throw new IllegalArgumentException("At least one credential is required");
    }
    this.credentials = List.copyOf(credentials);
    this.refresher = refresher;
    this.active = this.credentials.get(0);
  }

  public CredentialRotator(C primary, List<? extends C> backups) {
    this(concat(primary, backups), null);
  }

  private static <C> List<C> concat(C primary, List<? extends C> backups) {
    var all = new ArrayList<C>(backups.size() + 1);
    all.add(primary);
    all.addAll(backups);
    return all;
  }

  /**
   * The credential to use for the next dispatch.
   */
  public C current() {
    return active;
  }

  public int activeIndex() {
    return activeIndex;
  }

  public int size() {
    return credentials.size();
  }

  public boolean isExhausted() {
    return exhausted;
  }

  /**
   * Move on to the next credential.
   *
   * @return the newly active credential
   * @throws CredentialsExhaustedException
   *           if there are no more credentials
   */
  public C rotate() {
    if (exhausted || activeIndex + 1 >= credentials.size()) {
      exhausted = true;
      throw new CredentialsExhaustedException(credentials.size());
    }
    var nextIndex = activeIndex + 1;
    var next = credentials.get(nextIndex);
    // A failed refresh leaves the rotator where it was.
    var refreshed = refresher != null ? refresher.apply(next) : next;
    activeIndex = nextIndex;
    active = refreshed;
    return active;
  }

  /**
   * Rotate only if the credential at {@code observedIndex} is still the active
   * one. Callers that saw the same exhausted credential concurrently rotate it
   * once between them.
   *
   * @return whether this call did the rotation
   * @throws CredentialsExhaustedException
   *           if a rotation was due and there are no more credentials
   */
  public boolean rotateFrom(int observedIndex) {
    if (exhausted) {
      throw new CredentialsExhaustedException(credentials.size());
    }
    if (observedIndex != activeIndex) {
      return false;
    }
    rotate();
    return true;
  }
}
