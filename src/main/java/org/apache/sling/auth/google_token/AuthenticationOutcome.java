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
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a single authentication attempt.
 *
 * <ul>
 *   <li>{@link Kind#ACCEPT} - the token is valid, {@link #profile()} holds the resolved user profile</li>
 *   <li>{@link Kind#REJECT} - the request selected this authentication scheme but the credential is invalid</li>
 *   <li>{@link Kind#ABSTAIN} - the request does not use this authentication scheme, another one may apply</li>
 * </ul>
 */
public final class AuthenticationOutcome {

    public enum Kind {
        ACCEPT,
        REJECT,
        ABSTAIN
    }

    private final Kind kind;
    private final UserProfile profile;
    private final Integer statusHint;
    private final Map<String, String> details;

    private AuthenticationOutcome(
            @NotNull Kind kind,
            @Nullable UserProfile profile,
            @Nullable Integer statusHint,
            @Nullable Map<String, String> details) {
        this.kind = kind;
        this.profile = profile;
        this.statusHint = statusHint;
        this.details = details != null ? Collections.unmodifiableMap(details) : Collections.emptyMap();
    }

    @NotNull
    public static AuthenticationOutcome accept(@NotNull UserProfile profile) {
        return new AuthenticationOutcome(Kind.ACCEPT, Objects.requireNonNull(profile, "profile"), null, null);
    }

    @NotNull
    public static AuthenticationOutcome reject(@Nullable Integer statusHint, @Nullable Map<String, String> details) {
        return new AuthenticationOutcome(Kind.REJECT, null, statusHint, details);
    }

    @NotNull
    public static AuthenticationOutcome abstain(@Nullable Integer statusHint, @Nullable Map<String, String> details) {
        return new AuthenticationOutcome(Kind.ABSTAIN, null, statusHint, details);
    }

    @NotNull
    public Kind kind() {
        return kind;
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPT;
    }

    public boolean isRejected() {
        return kind == Kind.REJECT;
    }

    public boolean isAbstained() {
        return kind == Kind.ABSTAIN;
    }

    /**
     * @return the resolved profile, or {@code null} unless the outcome is {@link Kind#ACCEPT}
     */
    @Nullable
    public UserProfile profile() {
        return profile;
    }

    /**
     * @return an HTTP status the host may use when answering the request, or {@code null} for its default
     */
    @Nullable
    public Integer statusHint() {
        return statusHint;
    }

    @NotNull
    public Map<String, String> details() {
        return details;
    }

    @Override
    public String toString() {
        return "AuthenticationOutcome[" + kind + (profile != null ? ", " + profile.id() : "") + "]";
    }
}
