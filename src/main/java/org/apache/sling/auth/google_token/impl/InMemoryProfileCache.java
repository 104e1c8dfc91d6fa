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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory {@link ProfileCache}. When full, the entries with the oldest creation time are evicted.
 */
public class InMemoryProfileCache implements ProfileCache {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryProfileCache.class);

    private final Map<String, CachedProfile> entries = new ConcurrentHashMap<>();
    private final int maxSize;

    public InMemoryProfileCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache max size must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    @Override
    @Nullable
    public CachedProfile get(@NotNull String token) {
        return entries.get(token);
    }

    @Override
    public void put(@NotNull String token, @NotNull CachedProfile entry) {
        if (!entries.containsKey(token) && entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(token, entry);
        logger.debug("Cached profile for subject: {} (cache size: {})", entry.profile().id(), entries.size());
    }

    private void evictOldest() {
        List<String> oldest = entries.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getValue().createdAt()))
                .limit(Math.max(1, entries.size() - maxSize + 1))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        oldest.forEach(entries::remove);
        logger.debug("Evicted {} cached profile(s)", oldest.size());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
        logger.info("Profile cache cleared");
    }
}
