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
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.apache.sling.auth.core.spi.AuthenticationHandler;
import org.apache.sling.auth.core.spi.AuthenticationInfo;
import org.apache.sling.auth.core.spi.DefaultAuthenticationFeedbackHandler;
import org.apache.sling.auth.google_token.AuthenticationOutcome;
import org.apache.sling.auth.google_token.GoogleTokenOptions;
import org.apache.sling.auth.google_token.TokenAuthenticator;
import org.apache.sling.auth.google_token.spi.UserProfileDelegate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.component.annotations.ReferenceCardinality;
import org.osgi.service.component.annotations.ReferencePolicyOption;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication handler exposing the {@link GoogleTokenAuthenticator} to Sling.
 *
 * <p>Accepted tokens yield an {@link AuthenticationInfo} for the profile's identifier, carrying the profile
 * in the {@value #ATTR_USER_PROFILE} attribute. Rejected tokens yield {@link AuthenticationInfo#FAIL_AUTH}.
 * Requests not using the Google token scheme are left to other handlers.</p>
 */
@Component(service = AuthenticationHandler.class, immediate = true)
@Designate(ocd = GoogleTokenAuthenticationHandler.Config.class, factory = true)
public class GoogleTokenAuthenticationHandler extends DefaultAuthenticationFeedbackHandler
        implements AuthenticationHandler {

    private static final Logger logger = LoggerFactory.getLogger(GoogleTokenAuthenticationHandler.class);

    static final String AUTH_TYPE = "google-token";

    /**
     * Attribute of the returned {@link AuthenticationInfo} holding the resolved
     * {@link org.apache.sling.auth.google_token.UserProfile}.
     */
    public static final String ATTR_USER_PROFILE = "google-token.profile";

    @ObjectClassDefinition(
            name = "Apache Sling Google Token Authentication Handler",
            description = "Authentication handler validating Google OAuth access tokens against the userinfo endpoint")
    @interface Config {
        @AttributeDefinition(
                name = "Path",
                description =
                        "Repository path for which this authentication handler should be used by Sling. If this is "
                                + "empty, the authentication handler will be disabled. By default this is set to \"/\".")
        String[] path() default {"/"};

        @AttributeDefinition(
                name = "Token Time To Live (seconds)",
                description =
                        "Time in seconds a resolved profile is trusted before the token is verified again. "
                                + "0 or a negative value means cached profiles are used until evicted.")
        long tokenTimeToLiveSeconds() default 0;

        @AttributeDefinition(
                name = "Cache Max Size",
                description = "Maximum number of tokens to cache. Default is 1000.")
        int cacheMaxSize() default 1000;

        @AttributeDefinition(
                name = "User Info Endpoint",
                description = "URL of the Google OAuth2 userinfo endpoint used to verify tokens.")
        String userInfoEndpoint() default GoogleUserInfoVerifier.DEFAULT_USER_INFO_ENDPOINT;

        @AttributeDefinition(
                name = "Connect Timeout (seconds)",
                description = "Connect timeout of the HTTP client calling the userinfo endpoint.")
        long connectTimeoutSeconds() default 10;

        @AttributeDefinition(
                name = "Request Timeout (seconds)",
                description =
                        "Maximum time to wait for the userinfo endpoint to answer. Requests exceeding it fail "
                                + "authentication. Default is 10.")
        long requestTimeoutSeconds() default 10;

        @AttributeDefinition(name = "Service Ranking", description = "Service ranking for this authentication handler")
        int service_ranking() default 0;
    }

    private final TokenAuthenticator authenticator;
    private final ProfileCache cache;
    private final Duration requestTimeout;

    @Activate
    public GoogleTokenAuthenticationHandler(
            @NotNull Config config,
            @Reference(cardinality = ReferenceCardinality.OPTIONAL, policyOption = ReferencePolicyOption.GREEDY)
                    @Nullable UserProfileDelegate userProfileDelegate) {
        if (config.connectTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }
        if (config.requestTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        String endpoint = config.userInfoEndpoint();
        if (endpoint == null || endpoint.isEmpty()) {
            throw new IllegalArgumentException("User info endpoint not configured");
        }

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
                .build();
        Duration tokenTimeToLive =
                config.tokenTimeToLiveSeconds() > 0 ? Duration.ofSeconds(config.tokenTimeToLiveSeconds()) : null;

        this.requestTimeout = Duration.ofSeconds(config.requestTimeoutSeconds());
        this.cache = new InMemoryProfileCache(config.cacheMaxSize());
        this.authenticator = new GoogleTokenAuthenticator(
                cache,
                new GoogleUserInfoVerifier(httpClient, URI.create(endpoint), requestTimeout),
                tokenTimeToLive,
                userProfileDelegate);

        logger.info(
                "GoogleTokenAuthenticationHandler activated with endpoint: {}, request timeout: {}s, token TTL: {}s, "
                        + "max size: {}, delegate: {}",
                endpoint,
                config.requestTimeoutSeconds(),
                tokenTimeToLive != null ? tokenTimeToLive.getSeconds() : "none",
                config.cacheMaxSize(),
                userProfileDelegate != null ? userProfileDelegate.getClass().getName() : "none");
    }

    GoogleTokenAuthenticationHandler(
            @NotNull TokenAuthenticator authenticator, @NotNull ProfileCache cache, @NotNull Duration requestTimeout) {
        this.authenticator = authenticator;
        this.cache = cache;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public AuthenticationInfo extractCredentials(
            @NotNull HttpServletRequest request, @NotNull HttpServletResponse response) {
        AuthenticationOutcome outcome;
        try {
            outcome = authenticator
                    .authenticate(request, GoogleTokenOptions.empty())
                    .toCompletableFuture()
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.error("Google token was not verified within {}s", requestTimeout.getSeconds());
            return AuthenticationInfo.FAIL_AUTH;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while authenticating Google token");
            return AuthenticationInfo.FAIL_AUTH;
        } catch (ExecutionException e) {
            logger.error("Error authenticating Google token: {}", e.getMessage(), e);
            return AuthenticationInfo.FAIL_AUTH;
        }

        switch (outcome.kind()) {
            case ACCEPT:
                AuthenticationInfo authInfo = new AuthenticationInfo(AUTH_TYPE, outcome.profile().id());
                authInfo.put(ATTR_USER_PROFILE, outcome.profile());
                return authInfo;
            case REJECT:
                return AuthenticationInfo.FAIL_AUTH;
            default:
                return null;
        }
    }

    @Override
    public boolean requestCredentials(@NotNull HttpServletRequest request, @NotNull HttpServletResponse response) {
        // tokens are obtained by the client from Google, there is nothing to request here
        return false;
    }

    @Override
    public void dropCredentials(HttpServletRequest request, HttpServletResponse response) {
        logger.debug("dropCredentials called");
    }

    /**
     * Clears the profile cache.
     */
    public void clearCache() {
        cache.clear();
    }

    /**
     * Gets the current cache size.
     *
     * @return the number of tokens in the cache
     */
    public int getCacheSize() {
        return cache.size();
    }
}
