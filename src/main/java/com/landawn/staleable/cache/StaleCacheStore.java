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

/**
 * A store decorator which extends the expiration of every stored entry by a fixed margin and
 * reports the time-to-live with that margin taken off again.
 * A negative {@link TtlValue#ttl()} returned by {@link #getWithTtl(Object)} therefore means the entry
 * is logically expired but may still be served while it is refreshed. Unlike {@link StaleableCache},
 * this decorator neither loads values nor coalesces reads; it leaves that to its caller.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * CacheStore<String, User> store = new StaleCacheStore<>(CacheFactory.createCaffeineStore(10_000), 300_000);
 *
 * store.set("user:123", user, SetOptions.of(60_000));   // kept for 6 minutes
 * TtlValue<User> cached = store.getWithTtl("user:123");
 *
 * if (cached.ttl() < 0) {
 *     refreshAsync("user:123");
 * }
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class StaleCacheStore<K, V> extends AbstractCacheStore<K, V> {

    private final CacheStore<K, V> store;

    private final long maxStaleMargin;

    /**
     *
     * @param store the wrapped store, must not be null
     * @param maxStaleMargin the margin in milliseconds added to every expiration, must not be negative
     * @throws IllegalArgumentException if store is null or maxStaleMargin is negative
     */
    public StaleCacheStore(final CacheStore<K, V> store, final long maxStaleMargin) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }

        if (maxStaleMargin < 0) {
            throw new IllegalArgumentException("Max stale margin cannot be negative: " + maxStaleMargin);
        }

        this.store = store;
        this.maxStaleMargin = maxStaleMargin;
    }

    @Override
    public V get(final K k) {
        return store.get(k);
    }

    @Override
    public TtlValue<V> getWithTtl(final K k) {
        final TtlValue<V> stored = store.getWithTtl(k);

        return TtlValue.of(stored.value(), stored.ttl() - maxStaleMargin);
    }

    /**
     * Stores the value with {@code maxStaleMargin} added to the requested expiration.
     * There is no default expiration: without one, the entry lives for the margin only.
     */
    @Override
    public void set(final K k, final V v, final SetOptions options) {
        final SetOptions opts = options == null ? SetOptions.create() : options;
        final long expiration = Math.max(opts.expiration(), 0);

        store.set(k, v, opts.withExpiration(expiration > Long.MAX_VALUE - maxStaleMargin ? Long.MAX_VALUE : maxStaleMargin + expiration));
    }

    @Override
    public void delete(final K k) {
        store.delete(k);
    }

    @Override
    public void invalidate(final InvalidateOptions options) {
        store.invalidate(options);
    }

    @Override
    public void clear() {
        store.clear();
    }

    @Override
    public String getType() {
        return STALE_CACHE_WRAPPER;
    }

    @Override
    public void close() {
        store.close();
    }

    @Override
    public boolean isClosed() {
        return store.isClosed();
    }
}
