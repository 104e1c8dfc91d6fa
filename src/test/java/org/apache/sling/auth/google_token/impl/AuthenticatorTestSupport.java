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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.servlet.http.HttpServletRequest;

import org.jetbrains.annotations.NotNull;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Shared test utilities for authenticator tests.
 */
class AuthenticatorTestSupport {

    static final String TOKEN = "abc123";
    static final String ALICE_JSON = "{\"sub\":\"123\",\"name\":\"Alice\",\"email\":\"alice@example.com\"}";

    /**
     * Creates a request mock with the given token type and access token headers, either may be null.
     */
    static HttpServletRequest request(String tokenType, String accessToken) {
        HttpServletRequest request = mock(HttpServletRequest.class);
        when(request.getHeader("X-token-type")).thenReturn(tokenType);
        when(request.getHeader("access_token")).thenReturn(accessToken);
        return request;
    }

    /**
     * A clock that only moves when told to.
     */
    static class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    /**
     * Verifier answering every call with a fixed result and recording the tokens it was called with.
     */
    static class RecordingVerifier implements UserInfoVerifier {

        private final List<String> tokens = new ArrayList<>();
        private VerificationResult result;

        RecordingVerifier(VerificationResult result) {
            this.result = result;
        }

        void respondWith(VerificationResult result) {
            this.result = result;
        }

        @Override
        public @NotNull CompletionStage<VerificationResult> verify(@NotNull String token) {
            synchronized (tokens) {
                tokens.add(token);
            }
            return CompletableFuture.completedFuture(result);
        }

        int calls() {
            synchronized (tokens) {
                return tokens.size();
            }
        }

        List<String> tokens() {
            synchronized (tokens) {
                return new ArrayList<>(tokens);
            }
        }
    }

    static VerificationResult ok(String body) {
        return new VerificationResult.Success(200, body);
    }
}
