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
package org.apache.sling.auth.google_token.spi;

import java.util.Map;

import org.apache.sling.auth.google_token.UserProfile;
import org.jetbrains.annotations.NotNull;

/**
 * Extension point invoked after a token was verified, allowing callers to enrich or transform the
 * resolved profile using the raw payload returned by the identity provider.
 *
 * <p>The returned profile is the one cached and reported to the host. Implementations are called
 * concurrently and must be thread-safe.</p>
 */
@FunctionalInterface
public interface UserProfileDelegate {

    /**
     * @param profile the profile built from the provider response
     * @param userInfo the parsed provider response
     * @return the profile to use, the given one if nothing changes
     */
    @NotNull
    UserProfile update(@NotNull UserProfile profile, @NotNull Map<String, Object> userInfo);
}
