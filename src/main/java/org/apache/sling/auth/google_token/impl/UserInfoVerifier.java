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

import java.util.concurrent.CompletionStage;

import org.jetbrains.annotations.NotNull;

/**
 * Verifies a token against the identity provider.
 *
 * <p>Each call issues exactly one request; results are neither retried nor cached. The returned stage
 * always completes normally, transport errors are reported as {@link VerificationResult.TransportFailure}.</p>
 */
public interface UserInfoVerifier {

    @NotNull
    CompletionStage<VerificationResult> verify(@NotNull String token);
}
