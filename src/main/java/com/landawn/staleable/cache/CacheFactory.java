/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.staleable.cache;

import java.util.function.BiPredicate;

/**
 * Factory class for creating stores and the decorators stacked on them.
 * This utility class cannot be instantiated.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // In-memory store with stale-while-revalidate reads
 * StaleableCache<String, User> cache = CacheFactory.createStaleableCache(
 *     CacheFactory.createCaffeineStore(10_000),
 *     60_000,     // ttl: 1 minute
 *     300_000,    // max stale margin: 5 minutes
 *     userRepository::findById);
 *
 * // Any key type over a string keyed store
 * DefaultCache<Long, Order> orders = CacheFactory.createDefaultCache(CacheFactory.createCaffeineStore(1_000), "order:");
 * }</pre>
 *
 * @see CacheStore
 * @see StaleableCache
 */
public final class CacheFactory {

    private CacheFactory() {
    }

    /**
     *
     * @param <K> the key type
     * @param <V> the value type
     * @param maximumSize the maximum number of entries
     * @return a new in-memory store
     */
    public static <K, V> CaffeineStore<K, V> createCaffeineStore(final long maximumSize) {
        return new CaffeineStore<>(maximumSize);
    }

    public static <K, V> DefaultCache<K, V> createDefaultCache(final CacheStore<String, V> store) {
        return new DefaultCache<>(store);
    }

    public static <K, V> DefaultCache<K, V> createDefaultCache(final CacheStore<String, V> store, final String keyPrefix) {
        return new DefaultCache<>(store, keyPrefix);
    }

    /**
     *
     * @param <K> the key type
     * @param <V> the value type
     * @param store the store to wrap
     * @param maxStaleMargin the margin in milliseconds added to every expiration
     * @return a new StaleCacheStore
     */
    public static <K, V> StaleCacheStore<K, V> createStaleCacheStore(final CacheStore<K, V> store, final long maxStaleMargin) {
        return new StaleCacheStore<>(store, maxStaleMargin);
    }

    public static <K, V> StaleableCache<K, V> createStaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin) {
        return new StaleableCache<>(store, ttl, maxStaleMargin);
    }

    /**
     * Creates a StaleableCache which loads missing and expired values with the given function.
     *
     * @param <K> the key type
     * @param <V> the value type
     * @param store the store to wrap
     * @param ttl the default expiration in milliseconds
     * @param maxStaleMargin how long in milliseconds an expired value may still be served
     * @param loadFunction produces values on misses and refreshes
     * @return a new StaleableCache
     */
    public static <K, V> StaleableCache<K, V> createStaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin,
            final LoadFunction<K, V> loadFunction) {
        return new StaleableCache<>(store, ttl, maxStaleMargin, loadFunction);
    }

    public static <K, V> StaleableCache<K, V> createStaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin,
            final LoadFunction<K, V> loadFunction, final BiPredicate<? super K, ? super V> shouldCache) {
        return new StaleableCache<>(store, ttl, maxStaleMargin, loadFunction, shouldCache, null);
    }
}
