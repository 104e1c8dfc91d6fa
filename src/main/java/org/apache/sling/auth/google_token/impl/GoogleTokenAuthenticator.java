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
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.servlet.http.HttpServletRequest;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import net.minidev.json.JSONObject;
import org.apache.sling.auth.google_token.AuthenticationOutcome;
import org.apache.sling.auth.google_token.GoogleTokenOptions;
import org.apache.sling.auth.google_token.TokenAuthenticator;
import org.apache.sling.auth.google_token.UserProfile;
import org.apache.sling.auth.google_token.spi.UserProfileDelegate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates requests carrying a Google OAuth access token.
 *
 * <p>A request is handled only if its {@value TokenAuthenticator#TOKEN_TYPE_HEADER} header equals
 * {@value #NAME}; otherwise the authenticator abstains. The token from the
 * {@value TokenAuthenticator#ACCESS_TOKEN_HEADER} header is looked up in the {@link ProfileCache} first.
 * A cached profile is used as long as it is younger than the configured time to live, or forever if no
 * time to live is set. Otherwise the token is verified against Google's userinfo endpoint and, on success,
 * the resolved profile replaces the cache entry.</p>
 *
 * <p>Concurrent calls for the same uncached token each verify the token on their own; the last
 * verification to complete wins the cache entry.</p>
 */
public class GoogleTokenAuthenticator implements TokenAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(GoogleTokenAuthenticator.class);

    public static final String NAME = "GoogleToken";

    private final ProfileCache cache;
    private final UserInfoVerifier verifier;
    private final Duration tokenTimeToLive;
    private final UserProfileDelegate userProfileDelegate;
    private final Clock clock;

    public GoogleTokenAuthenticator(
            @NotNull ProfileCache cache,
            @NotNull UserInfoVerifier verifier,
            @Nullable Duration tokenTimeToLive,
            @Nullable UserProfileDelegate userProfileDelegate) {
        this(cache, verifier, tokenTimeToLive, userProfileDelegate, Clock.systemUTC());
    }

    public GoogleTokenAuthenticator(
            @NotNull ProfileCache cache,
            @NotNull UserInfoVerifier verifier,
            @Nullable Duration tokenTimeToLive,
            @Nullable UserProfileDelegate userProfileDelegate,
            @NotNull Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (tokenTimeToLive != null && (tokenTimeToLive.isNegative() || tokenTimeToLive.isZero())) {
            throw new IllegalArgumentException("Token time to live must be positive, got " + tokenTimeToLive);
        }
        this.tokenTimeToLive = tokenTimeToLive;
        this.userProfileDelegate = userProfileDelegate;

        if (tokenTimeToLive == null) {
            logger.info("No token time to live set - cached profiles are used until evicted");
        } else {
            logger.debug("Token time to live: {}", tokenTimeToLive);
        }
    }

    @Override
    @NotNull
    public String name() {
        return NAME;
    }

    @Nullable
    public Duration tokenTimeToLive() {
        return tokenTimeToLive;
    }

    @Nullable
    public UserProfileDelegate userProfileDelegate() {
        return userProfileDelegate;
    }

    @Override
    @NotNull
    public CompletionStage<AuthenticationOutcome> authenticate(
            @NotNull HttpServletRequest request, @NotNull GoogleTokenOptions options) {
        String type = request.getHeader(TOKEN_TYPE_HEADER);
        if (type == null || !type.equals(NAME)) {
            logger.info("Google: No token type");
            return CompletableFuture.completedFuture(AuthenticationOutcome.abstain(null, null));
        }

        String token = request.getHeader(ACCESS_TOKEN_HEADER);
        if (token == null) {
            logger.error("Google: No access_token");
            return CompletableFuture.completedFuture(AuthenticationOutcome.reject(null, null));
        }

        CachedProfile cached = cache.get(token);
        if (cached != null) {
            if (tokenTimeToLive == null) {
                logger.debug("Using cached profile for subject: {}", cached.profile().id());
                return CompletableFuture.completedFuture(AuthenticationOutcome.accept(cached.profile()));
            }
            if (clock.instant().isBefore(cached.createdAt().plus(tokenTimeToLive))) {
                logger.debug("Using cached profile for subject: {}", cached.profile().id());
                return CompletableFuture.completedFuture(AuthenticationOutcome.accept(cached.profile()));
            }
            // stale entries stay in place until a successful verification replaces them
            logger.debug("Cached profile for subject {} expired", cached.profile().id());
        }

        CompletionStage<VerificationResult> verification;
        try {
            verification = verifier.verify(token);
        } catch (RuntimeException e) {
            logger.error("Google: Failed to send token verification request: {}", e.getMessage(), e);
            return CompletableFuture.completedFuture(AuthenticationOutcome.reject(null, null));
        }

        return verification.handle((result, throwable) -> {
            if (throwable != null) {
                logger.error("Google: Token verification failed: {}", throwable.getMessage(), throwable);
                return AuthenticationOutcome.reject(null, null);
            }
            try {
                return onVerified(token, result, options);
            } catch (RuntimeException e) {
                logger.error("Google: Error processing token verification result: {}", e.getMessage(), e);
                return AuthenticationOutcome.reject(null, null);
            }
        });
    }

    @NotNull
    private AuthenticationOutcome onVerified(
            @NotNull String token, @NotNull VerificationResult result, @NotNull GoogleTokenOptions options) {
        if (result instanceof VerificationResult.TransportFailure failure) {
            logger.error("Google response: none; transport failure: {}", failure.cause().toString());
            return AuthenticationOutcome.reject(null, null);
        }

        if (!(result instanceof VerificationResult.Success response)) {
            logger.error("Google: Unexpected verification result: {}", result);
            return AuthenticationOutcome.reject(null, null);
        }
        if (response.statusCode() != 200) {
            logger.error("Google response: {}; statusCode: {}", response.body(), response.statusCode());
            return AuthenticationOutcome.reject(null, null);
        }

        JSONObject userInfo;
        try {
            userInfo = JSONObjectUtils.parse(response.body());
        } catch (ParseException e) {
            logger.error("Failed to read Google response: {}", e.getMessage());
            return AuthenticationOutcome.reject(null, null);
        }

        UserProfile profile = GoogleUserProfileFactory.build(userInfo, NAME);
        if (profile == null) {
            logger.error("Google response has no subject; statusCode: {}", response.statusCode());
            return AuthenticationOutcome.reject(null, null);
        }

        UserProfileDelegate delegate =
                userProfileDelegate != null ? userProfileDelegate : options.userProfileDelegate();
        if (delegate != null) {
            profile = Objects.requireNonNull(
                    delegate.update(profile, Collections.unmodifiableMap(userInfo)),
                    "UserProfileDelegate returned no profile");
        }

        cache.put(token, new CachedProfile(profile, clock.instant()));
        logger.debug("Token verified for subject: {}", profile.id());
        return AuthenticationOutcome.accept(profile);
    }
}
