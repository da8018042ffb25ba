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

import eu.aylett.admission.ThrottleExecutor;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.function.Function;

/**
 * An {@link HttpClient} behind a {@link ThrottleExecutor}.
 * <p>
 * Every attempt builds its request afresh, so a retry after rotation carries
 * the new credential. When an authorizer is given, its value for the active
 * credential is sent as the {@code Authorization} header.
 * </p>
 *
 * @param <C>
 *          the credential type
 */
public final class ThrottledHttpClient<C> {
  private static final String AUTHORIZATION = "Authorization";
  private static final String CONTENT_TYPE = "Content-Type";
  private static final String JSON = "application/json";

  private final HttpClient client;
  private final ThrottleExecutor<C, HttpResponse<?>> executor;
  private final @Nullable Function<? super C, String> authorizer;

  public ThrottledHttpClient(HttpClient client, ThrottleExecutor<C, HttpResponse<?>> executor,
      @Nullable Function<? super C, String> authorizer) {
    this.client = client;
    this.executor = executor;
    this.authorizer = authorizer;
  }

  /**
   * A client sending each credential as a bearer token.
   */
  public static <C> ThrottledHttpClient<C> bearer(HttpClient client, ThrottleExecutor<C, HttpResponse<?>> executor) {
    return new ThrottledHttpClient<>(client, executor, credential -> "Bearer " + credential);
  }

  public HttpResponse<String> get(URI uri) throws IOException, InterruptedException {
    return send(HttpRequest.newBuilder(uri).GET(), HttpResponse.BodyHandlers.ofString());
  }

  public HttpResponse<String> delete(URI uri) throws IOException, InterruptedException {
    return send(HttpRequest.newBuilder(uri).DELETE(), HttpResponse.BodyHandlers.ofString());
  }

  public HttpResponse<String> post(URI uri, String json) throws IOException, InterruptedException {
    return send(withJson(uri, "POST", json), HttpResponse.BodyHandlers.ofString());
  }

  public HttpResponse<String> put(URI uri, String json) throws IOException, InterruptedException {
    return send(withJson(uri, "PUT", json), HttpResponse.BodyHandlers.ofString());
  }

  public HttpResponse<String> patch(URI uri, String json) throws IOException, InterruptedException {
    return send(withJson(uri, "PATCH", json), HttpResponse.BodyHandlers.ofString());
  }

  /**
   * Send a request through the throttle. The builder is copied for each
   * attempt and not modified.
   */
  public <T> HttpResponse<T> send(HttpRequest.Builder request, HttpResponse.BodyHandler<T> handler)
      throws IOException, InterruptedException {
    try {
      return executor.run(credential -> client.send(authorize(request.copy(), credential).build(), handler));
    } catch (IOException | InterruptedException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IOException("Unexpected failure sending " + request.build().uri(), e);
    }
  }

  private HttpRequest.Builder authorize(HttpRequest.Builder request, C credential) {
    if (authorizer != null) {
      request.setHeader(AUTHORIZATION, authorizer.apply(credential));
    }
    return request;
  }

  private static HttpRequest.Builder withJson(URI uri, String method, String json) {
    return HttpRequest.newBuilder(uri).header(CONTENT_TYPE, JSON).method(method,
        HttpRequest.BodyPublishers.ofString(json));
  }
}
