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

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.Ticker;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Numbers;

/**
 * An in-memory {@link CacheStore} backed by <a href="https://github.com/ben-manes/caffeine">Caffeine</a>.
 * Each entry carries its own expiration, taken from {@link SetOptions#expiration()}; an expiration of
 * {@code 0} (or less) keeps the entry until it is evicted by size or removed. Remaining time-to-live is
 * read from Caffeine's variable expiration policy.
 *
 * <br><br>
 * Tags passed on {@code set} are kept with the entry and recorded in an index used by
 * {@link #invalidate(InvalidateOptions)}. A key leaves the index when its entry is deleted, replaced,
 * expired or evicted, and a tag leaves it with its last key.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * CaffeineStore<String, User> store = new CaffeineStore<>(10_000);
 * store.set("user:123", user, SetOptions.of(60_000));
 *
 * TtlValue<User> cached = store.getWithTtl("user:123");   // ttl() <= 60_000
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @see Caffeine
 */
public class CaffeineStore<K, V> extends AbstractCacheStore<K, V> {

    private final Cache<K, Entry<V>> cacheImpl;

    private final Policy.VarExpiration<K, Entry<V>> varExpiration;

    private final ConcurrentHashMap<String, Set<K>> tagIndex = new ConcurrentHashMap<>();

    private volatile boolean isClosed = false;

    /**
     *
     * @param maximumSize the maximum number of entries, must be positive
     * @throws IllegalArgumentException if maximumSize is not positive
     */
    public CaffeineStore(final long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    /**
     * Creates a CaffeineStore reading time from the given ticker.
     *
     * @param maximumSize the maximum number of entries, must be positive
     * @param ticker the nanosecond time source used for expiration
     * @throws IllegalArgumentException if maximumSize is not positive or ticker is null
     */
    public CaffeineStore(final long maximumSize, final Ticker ticker) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("Maximum size must be positive: " + maximumSize);
        }

        if (ticker == null) {
            throw new IllegalArgumentException("Ticker cannot be null");
        }

        final Expiry<K, Entry<V>> expiry = new EntryExpiry<>();
        // runs inside the atomic operation that expires or evicts the entry
        final RemovalListener<K, Entry<V>> evictionListener = (key, entry, cause) -> {
            if (key != null && entry != null) {
                untag(key, entry);
            }
        };

        final Cache<K, Entry<V>> cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(expiry)
                .evictionListener(evictionListener)
                .build();

        cacheImpl = cache;
        varExpiration = cache.policy().expireVariably().orElseThrow(() -> new IllegalStateException("Variable expiration is not enabled"));
    }

    @Override
    public V get(final K k) {
        assertNotClosed();

        return getEntry(k).value();
    }

    @Override
    public TtlValue<V> getWithTtl(final K k) {
        assertNotClosed();

        final Entry<V> entry = getEntry(k);
        final OptionalLong remaining = varExpiration.getExpiresAfter(k, TimeUnit.MILLISECONDS);

        if (remaining.isEmpty()) {
            throw new NotFoundException(k);
        }

        return TtlValue.of(entry.value(), remaining.getAsLong());
    }

    @Override
    public void set(final K k, final V v, final SetOptions options) {
        assertNotClosed();

        if (k == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }

        final SetOptions opts = options == null ? SetOptions.create() : options;
        final long expireAfterNanos = opts.expiration() > 0 ? TimeUnit.MILLISECONDS.toNanos(opts.expiration()) : Long.MAX_VALUE;
        final List<String> tags = N.isEmpty(opts.tags()) ? List.of() : List.copyOf(opts.tags());
        final Entry<V> entry = new Entry<>(v, expireAfterNanos, tags);

        cacheImpl.asMap().compute(k, (key, old) -> {
            if (old != null) {
                untag(key, old);
            }

            tag(key, entry);

            return entry;
        });
    }

    @Override
    public void delete(final K k) {
        assertNotClosed();

        cacheImpl.asMap().computeIfPresent(k, (key, old) -> {
            untag(key, old);
            return null;
        });
    }

    @Override
    public void invalidate(final InvalidateOptions options) {
        assertNotClosed();

        if (options == null || options.isEmpty()) {
            return;
        }

        for (final String tag : options.tags()) {
            final Set<K> keys = tagIndex.get(tag);

            if (keys == null) {
                continue;
            }

            for (final K k : new ArrayList<>(keys)) {
                cacheImpl.asMap().compute(k, (key, old) -> {
                    if (old == null || !old.tags().contains(tag)) {
                        unindex(tag, key);
                        return old;
                    }

                    untag(key, old);
                    return null;
                });
            }
        }
    }

    @Override
    public void clear() {
        assertNotClosed();

        cacheImpl.invalidateAll();
        tagIndex.clear();
    }

    @Override
    public String getType() {
        return CAFFEINE;
    }

    /**
     * Returns the approximate number of entries, expired ones not yet cleaned up included.
     *
     * @return the estimated number of entries
     */
    public int size() {
        assertNotClosed();

        return Numbers.toIntExact(cacheImpl.estimatedSize());
    }

    @Override
    public synchronized void close() {
        if (isClosed) {
            return;
        }

        cacheImpl.invalidateAll();
        tagIndex.clear();

        isClosed = true;
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Returns the number of tags currently indexed.
     *
     * @return the number of tags with at least one key
     */
    int tagCount() {
        return tagIndex.size();
    }

    private void tag(final K k, final Entry<V> entry) {
        for (final String tag : entry.tags()) {
            tagIndex.compute(tag, (t, keys) -> {
                final Set<K> result = keys == null ? ConcurrentHashMap.newKeySet() : keys;
                result.add(k);
                return result;
            });
        }
    }

    private void untag(final K k, final Entry<V> entry) {
        for (final String tag : entry.tags()) {
            unindex(tag, k);
        }
    }

    private void unindex(final String tag, final K k) {
        tagIndex.computeIfPresent(tag, (t, keys) -> {
            keys.remove(k);
            return keys.isEmpty() ? null : keys;
        });
    }

    private Entry<V> getEntry(final K k) {
        final Entry<V> entry = cacheImpl.getIfPresent(k);

        if (entry == null) {
            throw new NotFoundException(k);
        }

        return entry;
    }

    protected void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("This store has been closed");
        }
    }

    /**
     * Stored value with its requested lifetime and tags; Caffeine does not accept {@code null} values, this does.
     */
    record Entry<V>(V value, long expireAfterNanos, List<String> tags) {
    }

    static final class EntryExpiry<K, V> implements Expiry<K, Entry<V>> {

        @Override
        public long expireAfterCreate(final K key, final Entry<V> entry, final long currentTime) {
            return entry.expireAfterNanos();
        }

        @Override
        public long expireAfterUpdate(final K key, final Entry<V> entry, final long currentTime, final long currentDuration) {
            return entry.expireAfterNanos();
        }

        @Override
        public long expireAfterRead(final K key, final Entry<V> entry, final long currentTime, final long currentDuration) {
            return currentDuration;
        }
    }
}
