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
 * Throttling for services reached over {@link java.net.http.HttpClient}.
 * <p>
 * {@link eu.aylett.admission.http.HttpFeedback} reads what a provider says
 * about its limits from status codes, {@code Retry-After} and rate-limit
 * headers. {@link eu.aylett.admission.http.ProviderProfile} bundles that with
 * the published limits of a few well-known providers, and
 * {@link eu.aylett.admission.http.ThrottledHttpClient} puts a throttle in
 * front of an HTTP client.
 * </p>
 */
@NullMarked
package eu.aylett.admission.http;

import org.jspecify.annotations.NullMarked;
