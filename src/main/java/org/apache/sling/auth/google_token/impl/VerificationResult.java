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

import org.jetbrains.annotations.NotNull;

/**
 * Result of a call to the identity provider's userinfo endpoint.
 */
public interface VerificationResult {

    /**
     * The provider answered. The status code may still indicate a failure.
     */
    record Success(int statusCode, @NotNull String body) implements VerificationResult {}

    /**
     * The request could not be completed, for instance because of a DNS, connection or timeout error.
     */
    record TransportFailure(@NotNull Throwable cause) implements VerificationResult {}
}
