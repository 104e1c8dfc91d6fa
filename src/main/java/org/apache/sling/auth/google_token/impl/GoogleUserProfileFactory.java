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
import java.util.Map;

import com.nimbusds.openid.connect.sdk.claims.UserInfo;
import net.minidev.json.JSONObject;
import org.apache.sling.auth.google_token.UserProfile;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps a Google userinfo response to a {@link UserProfile}.
 *
 * <p>Only the {@code sub} claim is required. {@code name} becomes the display name, {@code email} the
 * single email address, {@code picture} the single photo and the {@code given_name}, {@code family_name}
 * and {@code middle_name} claims the structured name.</p>
 */
public final class GoogleUserProfileFactory {

    static final String SUBJECT_CLAIM = "sub";

    private GoogleUserProfileFactory() {}

    /**
     * @param userInfo the parsed provider response
     * @param providerName the name recorded as the profile's provider
     * @return the profile, or {@code null} if the response carries no subject
     */
    @Nullable
    public static UserProfile build(@NotNull Map<String, Object> userInfo, @NotNull String providerName) {
        Object subject = userInfo.get(SUBJECT_CLAIM);
        if (!(subject instanceof String) || ((String) subject).isEmpty()) {
            return null;
        }

        UserInfo claims = new UserInfo(new JSONObject(userInfo));
        UserProfile.Builder builder = UserProfile.builder(claims.getSubject().getValue(), providerName)
                .displayName(claims.getName());

        String familyName = claims.getFamilyName();
        String givenName = claims.getGivenName();
        String middleName = claims.getMiddleName();
        if (familyName != null || givenName != null || middleName != null) {
            builder.name(new UserProfile.Name(familyName, givenName, middleName));
        }

        String email = claims.getEmailAddress();
        if (email != null) {
            builder.addEmail(email, "");
        }

        URI picture = claims.getPicture();
        if (picture != null) {
            builder.addPhoto(picture.toString());
        }

        return builder.build();
    }
}
