/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.sling.auth.google_token.impl;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UserInfoVerifier} calling Google's OAuth2 userinfo endpoint without blocking the caller.
 *
 * <p>The token is passed as the {@code access_token} query parameter and a JSON response is requested.
 * Completions are delivered on the executor of the underlying {@link HttpClient}. Without a request timeout
 * the transport's defaults apply.</p>
 */
public class GoogleUserInfoVerifier implements UserInfoVerifier {

    private static final Logger logger = LoggerFactory.getLogger(GoogleUserInfoVerifier.class);

    public static final String DEFAULT_USER_INFO_ENDPOINT = "https://www.googleapis.com/oauth2/v3/userinfo";

    private final HttpClient httpClient;
    private final URI userInfoEndpoint;
    private final Duration requestTimeout;

    public GoogleUserInfoVerifier(@NotNull HttpClient httpClient) {
        this(httpClient, URI.create(DEFAULT_USER_INFO_ENDPOINT));
    }

    public GoogleUserInfoVerifier(@NotNull HttpClient httpClient, @NotNull URI userInfoEndpoint) {
        this(httpClient, userInfoEndpoint, null);
    }

    public GoogleUserInfoVerifier(
            @NotNull HttpClient httpClient, @NotNull URI userInfoEndpoint, @Nullable Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.userInfoEndpoint = Objects.requireNonNull(userInfoEndpoint, "userInfoEndpoint");
        if (userInfoEndpoint.getRawQuery() != null) {
            throw new IllegalArgumentException("User info endpoint must not contain a query: " + userInfoEndpoint);
        }
        if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
            throw new IllegalArgumentException("Request timeout must be positive, got " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
    }

    @Override
    @NotNull
    public CompletionStage<VerificationResult> verify(@NotNull String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(requestUri(token))
                .header("Accept", "application/json")
                .GET();
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        HttpRequest request = builder.build();

        logger.debug("Verifying token against {}", userInfoEndpoint);
        return httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = unwrap(throwable);
                        logger.debug("User info request to {} failed: {}", userInfoEndpoint, cause.toString());
                        return new VerificationResult.TransportFailure(cause);
                    }
                    String body = response.body() != null ? response.body() : "";
                    return new VerificationResult.Success(response.statusCode(), body);
                });
    }

    @NotNull
    URI requestUri(@NotNull String token) {
        return URI.create(userInfoEndpoint + "?access_token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }

    @NotNull
    public URI userInfoEndpoint() {
        return userInfoEndpoint;
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }
}
