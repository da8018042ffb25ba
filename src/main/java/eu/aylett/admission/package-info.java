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

/**
 * As a client of a rate-limited service, we know the budget we've been given,
 * so there's little point in spending it all in a burst and then waiting for
 * the service to turn us away.
 * <p>
 * A {@link eu.aylett.admission.ThrottleExecutor} keeps track of the calls made
 * over a trailing window and starts spacing them out once usage passes a
 * configurable fraction of the budget. Close to the limit it stops altogether
 * until enough of the window has expired. Transient failures are retried with
 * jittered exponential backoff, and when the service tells us a credential's
 * budget is spent we move on to the next one.
 * </p>
 * <p>
 * One instance of ThrottleExecutor should be used for each provider and set of
 * credentials. You <i>should</i> share the instance between every caller using
 * that provider, otherwise each of them will think it has the whole budget.
 * </p>
 * <p>
 * What the service tells us about its limits is provider-specific, and is
 * interpreted by a {@link eu.aylett.admission.LimitFeedbackHook}. Hooks for
 * plain HTTP responses live in {@code eu.aylett.admission.http}.
 * </p>
 */
@NullMarked
package eu.aylett.admission;

import org.jspecify.annotations.NullMarked;
