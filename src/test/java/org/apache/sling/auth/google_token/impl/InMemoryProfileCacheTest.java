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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.sling.auth.google_token.UserProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProfileCacheTest {

    private static CachedProfile entry(String id, long epochSecond) {
        return new CachedProfile(UserProfile.builder(id, "GoogleToken").build(), Instant.ofEpochSecond(epochSecond));
    }

    @Test
    void testGet_Missing_ReturnsNull() {
        assertNull(new InMemoryProfileCache(10).get("unknown"));
    }

    @Test
    void testPut_ReplacesEntryForSameToken() {
        InMemoryProfileCache cache = new InMemoryProfileCache(10);
        CachedProfile first = entry("1", 0);
        CachedProfile second = entry("1", 6);

        cache.put("token", first);
        cache.put("token", second);

        assertSame(second, cache.get("token"));
        assertEquals(1, cache.size());
    }

    @Test
    void testPut_FullCache_EvictsOldestEntry() {
        InMemoryProfileCache cache = new InMemoryProfileCache(2);
        cache.put("a", entry("a", 10));
        cache.put("b", entry("b", 5));

        cache.put("c", entry("c", 20));

        assertEquals(2, cache.size());
        assertNull(cache.get("b"));
        assertNotNull(cache.get("a"));
        assertNotNull(cache.get("c"));
    }

    @Test
    void testPut_FullCache_ReplacingExistingTokenDoesNotEvict() {
        InMemoryProfileCache cache = new InMemoryProfileCache(2);
        cache.put("a", entry("a", 1));
        cache.put("b", entry("b", 2));

        cache.put("a", entry("a", 3));

        assertEquals(2, cache.size());
        assertNotNull(cache.get("b"));
    }

    @Test
    void testClear() {
        InMemoryProfileCache cache = new InMemoryProfileCache(2);
        cache.put("a", entry("a", 1));

        cache.clear();

        assertEquals(0, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    void testConstructor_NonPositiveSize_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryProfileCache(0));
    }

    @Test
    void testConcurrentAccess() throws Exception {
        InMemoryProfileCache cache = new InMemoryProfileCache(10_000);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String token = "token-" + (i % 100);
                        cache.put(token, entry(token, thread * 1000L + i));
                        assertNotNull(cache.get(token));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(100, cache.size());
    }
}
