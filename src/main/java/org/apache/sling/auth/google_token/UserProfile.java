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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Canonical identity record resolved from a validated token.
 *
 * <p>Instances are immutable. Use {@link #toBuilder()} to derive a modified copy.</p>
 */
public final class UserProfile {

    private final String id;
    private final String displayName;
    private final String provider;
    private final Name name;
    private final List<Email> emails;
    private final List<String> photos;
    private final Map<String, Object> extendedProperties;

    private UserProfile(Builder builder) {
        this.id = builder.id;
        this.displayName = builder.displayName;
        this.provider = builder.provider;
        this.name = builder.name;
        this.emails = Collections.unmodifiableList(new ArrayList<>(builder.emails));
        this.photos = Collections.unmodifiableList(new ArrayList<>(builder.photos));
        this.extendedProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extendedProperties));
    }

    @NotNull
    public static Builder builder(@NotNull String id, @NotNull String provider) {
        return new Builder(id, provider);
    }

    /**
     * The provider-scoped unique identifier of the user.
     */
    @NotNull
    public String id() {
        return id;
    }

    @NotNull
    public String displayName() {
        return displayName;
    }

    /**
     * The name of the authentication plugin which resolved this profile.
     */
    @NotNull
    public String provider() {
        return provider;
    }

    @Nullable
    public Name name() {
        return name;
    }

    @NotNull
    public List<Email> emails() {
        return emails;
    }

    @NotNull
    public List<String> photos() {
        return photos;
    }

    @NotNull
    public Map<String, Object> extendedProperties() {
        return extendedProperties;
    }

    @NotNull
    public Builder toBuilder() {
        Builder builder = new Builder(id, provider).displayName(displayName).name(name);
        builder.emails.addAll(emails);
        builder.photos.addAll(photos);
        builder.extendedProperties.putAll(extendedProperties);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserProfile)) {
            return false;
        }
        UserProfile that = (UserProfile) o;
        return id.equals(that.id)
                && displayName.equals(that.displayName)
                && provider.equals(that.provider)
                && Objects.equals(name, that.name)
                && emails.equals(that.emails)
                && photos.equals(that.photos)
                && extendedProperties.equals(that.extendedProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, provider, name, emails, photos, extendedProperties);
    }

    @Override
    public String toString() {
        return "UserProfile[id=" + id + ", displayName=" + displayName + ", provider=" + provider + "]";
    }

    /**
     * Structured name of the user, as far as the provider returned it.
     */
    public record Name(@Nullable String familyName, @Nullable String givenName, @Nullable String middleName) {}

    /**
     * An email address with an optional type qualifier, empty when the provider gives none.
     */
    public record Email(@NotNull String value, @NotNull String type) {}

    public static final class Builder {

        private final String id;
        private final String provider;
        private String displayName = "";
        private Name name;
        private final List<Email> emails = new ArrayList<>();
        private final List<String> photos = new ArrayList<>();
        private final Map<String, Object> extendedProperties = new LinkedHashMap<>();

        private Builder(@NotNull String id, @NotNull String provider) {
            this.id = Objects.requireNonNull(id, "id");
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        @NotNull
        public Builder displayName(@Nullable String displayName) {
            this.displayName = displayName != null ? displayName : "";
            return this;
        }

        @NotNull
        public Builder name(@Nullable Name name) {
            this.name = name;
            return this;
        }

        @NotNull
        public Builder addEmail(@NotNull String value, @NotNull String type) {
            emails.add(new Email(value, type));
            return this;
        }

        @NotNull
        public Builder addPhoto(@NotNull String url) {
            photos.add(url);
            return this;
        }

        @NotNull
        public Builder extendedProperty(@NotNull String key, @NotNull Object value) {
            extendedProperties.put(key, value);
            return this;
        }

        @NotNull
        public UserProfile build() {
            return new UserProfile(this);
        }
    }
}
