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

import java.util.List;
import java.util.Map;

import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import org.apache.sling.auth.google_token.UserProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GoogleUserProfileFactoryTest {

    private static final String PROVIDER = "GoogleToken";

    @Test
    void testBuild_MinimalGoogleResponse() throws Exception {
        UserProfile profile =
                GoogleUserProfileFactory.build(JSONObjectUtils.parse(AuthenticatorTestSupport.ALICE_JSON), PROVIDER);

        assertNotNull(profile);
        assertEquals("123", profile.id());
        assertEquals("Alice", profile.displayName());
        assertEquals(PROVIDER, profile.provider());
        assertEquals(List.of(new UserProfile.Email("alice@example.com", "")), profile.emails());
        assertTrue(profile.photos().isEmpty());
        assertNull(profile.name());
        assertTrue(profile.extendedProperties().isEmpty());
    }

    @Test
    void testBuild_FullGoogleResponse() throws Exception {
        String json = "{"
                + "\"sub\": \"110169484474386276334\","
                + "\"name\": \"Alice Liddell\","
                + "\"given_name\": \"Alice\","
                + "\"family_name\": \"Liddell\","
                + "\"picture\": \"https://lh3.googleusercontent.com/a/photo.jpg\","
                + "\"email\": \"alice@example.com\","
                + "\"email_verified\": true,"
                + "\"locale\": \"en\""
                + "}";

        UserProfile profile = GoogleUserProfileFactory.build(JSONObjectUtils.parse(json), PROVIDER);

        assertNotNull(profile);
        assertEquals("110169484474386276334", profile.id());
        assertEquals("Alice Liddell", profile.displayName());
        assertEquals(new UserProfile.Name("Liddell", "Alice", null), profile.name());
        assertEquals(List.of("https://lh3.googleusercontent.com/a/photo.jpg"), profile.photos());
        assertEquals(1, profile.emails().size());
    }

    @Test
    void testBuild_SubjectOnly() {
        UserProfile profile = GoogleUserProfileFactory.build(Map.of("sub", "123"), PROVIDER);

        assertNotNull(profile);
        assertEquals("123", profile.id());
        assertEquals("", profile.displayName());
        assertTrue(profile.emails().isEmpty());
        assertTrue(profile.photos().isEmpty());
    }

    @Test
    void testBuild_MissingSubject_ReturnsNull() {
        assertNull(GoogleUserProfileFactory.build(Map.of("name", "Alice", "email", "alice@example.com"), PROVIDER));
    }

    @Test
    void testBuild_EmptySubject_ReturnsNull() {
        assertNull(GoogleUserProfileFactory.build(Map.of("sub", ""), PROVIDER));
    }

    @Test
    void testBuild_NonStringSubject_ReturnsNull() {
        assertNull(GoogleUserProfileFactory.build(Map.of("sub", 123), PROVIDER));
    }

    @Test
    void testBuild_ProfileSurvivesCacheRoundTrip() throws Exception {
        UserProfile profile =
                GoogleUserProfileFactory.build(JSONObjectUtils.parse(AuthenticatorTestSupport.ALICE_JSON), PROVIDER);
        InMemoryProfileCache cache = new InMemoryProfileCache(10);

        cache.put("abc123", new CachedProfile(profile, java.time.Instant.EPOCH));

        assertSame(profile, cache.get("abc123").profile());
    }
}
