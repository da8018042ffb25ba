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

/**
 * Whether each credential gets its own window and limits, or they all share
 * one.
 */
public enum WindowScope {
  /**
   * One window and one set of limits, whichever credential is active. Use when
   * the provider limits the caller rather than the credential.
   */
  SHARED,
  /**
   * A fresh window and the configured limits for each credential. Most
   * providers count usage per credential.
   */
  PER_CREDENTIAL,
}
