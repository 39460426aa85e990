/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.staleable.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

/**
 *
 * @author Haiyang Li
 */
public class DefaultCacheTest {

    static final class UserKey implements CacheKeyGenerator {
        private final long id;

        UserKey(final long id) {
            this.id = id;
        }

        @Override
        public String getCacheKey() {
            return "user-" + id;
        }
    }

    private final RecordingStore<String, String> store = new RecordingStore<>();

    @Test
    public void test_stringKeysPassThrough() {
        final DefaultCache<String, String> cache = new DefaultCache<>(store);

        cache.set("my-key", "my-value", SetOptions.of(1_000));

        assertTrue(store.entries.containsKey("my-key"));
        assertEquals("my-value", cache.get("my-key"));
        assertEquals(1_000, cache.getWithTtl("my-key").ttl());
    }

    @Test
    public void test_keyGenerator() {
        final DefaultCache<UserKey, String> cache = new DefaultCache<>(store);

        cache.set(new UserKey(7), "alice");

        assertTrue(store.entries.containsKey("user-7"));
        assertEquals("alice", cache.get(new UserKey(7)));
    }

    @Test
    public void test_otherKeysEncoded() {
        final DefaultCache<Long, String> cache = CacheFactory.createDefaultCache(store, "order:");

        cache.set(123L, "pending");

        final String expected = "order:" + Base64.getEncoder().encodeToString("java.lang.Long:123".getBytes(StandardCharsets.UTF_8));
        assertTrue(store.entries.containsKey(expected), store.entries.keySet().toString());
        assertEquals("pending", cache.get(123L));
    }

    @Test
    public void test_keysOfDifferentTypesKeptApart() {
        final DefaultCache<Object, String> cache = new DefaultCache<>(store);

        cache.set(Integer.valueOf(1), "int-one");
        cache.set(Long.valueOf(1), "long-one");

        assertEquals("int-one", cache.get(Integer.valueOf(1)));
        assertEquals("long-one", cache.get(Long.valueOf(1)));
        assertEquals(2, store.entries.size());
        // the bare encoding of "1" is not an alias for either
        assertThrows(NotFoundException.class, () -> cache.get("MQ=="));
    }

    @Test
    public void test_prefix() {
        final DefaultCache<String, String> cache = new DefaultCache<>(store, "tenant-1:");

        cache.set("a", "1");
        cache.delete("a");

        assertEquals("tenant-1:a", store.setCalls.get(0).key());
        assertEquals(1, store.deleteCount.get());
        assertThrows(NotFoundException.class, () -> cache.get("a"));
    }

    @Test
    public void test_delegation() {
        final DefaultCache<String, String> cache = CacheFactory.createDefaultCache(store);

        cache.invalidate(InvalidateOptions.of("group"));
        cache.clear();
        cache.close();

        assertEquals(1, store.invalidateCount.get());
        assertEquals(1, store.clearCount.get());
        assertTrue(cache.isClosed());
        assertSame(store, cache.getStore());
        assertEquals(CacheStore.CACHE, cache.getType());
    }

    @Test
    public void test_invalidArguments() {
        final DefaultCache<String, String> cache = new DefaultCache<>(store);

        assertThrows(IllegalArgumentException.class, () -> cache.get(null));
        assertThrows(IllegalArgumentException.class, () -> new DefaultCache<String, String>(null));
    }
}
