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

import java.util.concurrent.CompletionStage;

import javax.servlet.http.HttpServletRequest;

import org.jetbrains.annotations.NotNull;

/**
 * Authentication strategy resolving a bearer token presented in request headers into a {@link UserProfile}.
 *
 * <p>Authentication may require a round trip to the identity provider, so the outcome is delivered
 * asynchronously. The returned stage never completes exceptionally; every failure is reported as
 * {@link AuthenticationOutcome.Kind#REJECT}.</p>
 */
public interface TokenAuthenticator {

    /**
     * Request header selecting the token scheme. Its value must equal {@link #name()}.
     */
    String TOKEN_TYPE_HEADER = "X-token-type";

    /**
     * Request header carrying the bearer token.
     */
    String ACCESS_TOKEN_HEADER = "access_token";

    /**
     * Returns the name of this authenticator, which is also the token scheme it handles.
     *
     * @return the authenticator name
     */
    @NotNull
    String name();

    /**
     * Authenticates the given request.
     *
     * @param request the incoming request
     * @param options per-call options
     * @return a stage completed with exactly one outcome
     */
    @NotNull
    CompletionStage<AuthenticationOutcome> authenticate(
            @NotNull HttpServletRequest request, @NotNull GoogleTokenOptions options);
}
