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
package org.apache.sling.auth.google_token;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.apache.sling.auth.google_token.spi.UserProfileDelegate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-call options passed to {@link TokenAuthenticator#authenticate}.
 */
public final class GoogleTokenOptions {

    private static final Logger logger = LoggerFactory.getLogger(GoogleTokenOptions.class);

    /**
     * Option key for a {@link UserProfileDelegate}. Ignored when the authenticator was constructed with one.
     */
    public static final String USER_PROFILE_DELEGATE = "userProfileDelegate";

    private static final GoogleTokenOptions EMPTY = new GoogleTokenOptions(Collections.emptyMap());

    private final Map<String, Object> options;

    private GoogleTokenOptions(@NotNull Map<String, Object> options) {
        this.options = options;
    }

    @NotNull
    public static GoogleTokenOptions empty() {
        return EMPTY;
    }

    @NotNull
    public static GoogleTokenOptions of(@Nullable Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return EMPTY;
        }
        return new GoogleTokenOptions(Collections.unmodifiableMap(new HashMap<>(options)));
    }

    @NotNull
    public static GoogleTokenOptions withUserProfileDelegate(@NotNull UserProfileDelegate delegate) {
        return of(Map.of(USER_PROFILE_DELEGATE, delegate));
    }

    @Nullable
    public UserProfileDelegate userProfileDelegate() {
        Object value = options.get(USER_PROFILE_DELEGATE);
        if (value == null) {
            return null;
        }
        if (value instanceof UserProfileDelegate delegate) {
            return delegate;
        }
        logger.debug(
                "Ignoring option '{}': expected a {} but got {}",
                USER_PROFILE_DELEGATE,
                UserProfileDelegate.class.getSimpleName(),
                value.getClass().getName());
        return null;
    }
}
