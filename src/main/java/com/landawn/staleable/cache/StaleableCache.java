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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.function.BiPredicate;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.AsyncExecutor;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * A stale-while-revalidate decorator over any {@link CacheStore}.
 * Every entry is stored with its requested expiration extended by {@code maxStaleMargin}, so it
 * stays physically present for a while after it is logically expired. Reads through
 * {@link #get(Object)} classify the entry by its logical remaining time-to-live
 * ({@code storedTtl - maxStaleMargin}):
 *
 * <ul>
 * <li><b>fresh</b> ({@code ttl >= 0}): the stored value is returned</li>
 * <li><b>stale</b> ({@code -maxStaleMargin <= ttl < 0}): the stored value is returned immediately and
 *     the value is reloaded in the background</li>
 * <li><b>expired or missing</b> ({@code ttl < -maxStaleMargin}, or {@link NotFoundException}): the value
 *     is reloaded before returning</li>
 * </ul>
 *
 * <br>
 * Concurrent reads of the same key are coalesced: the first caller (the leader) inserts an in-flight
 * record, performs the read and, if needed, the load; every other caller waits for that record and
 * receives the same value or the same exception. A background refresh keeps the record until it
 * finishes, so at most one load per key runs at any time, while readers arriving in the meantime get
 * the stale value without waiting.
 *
 * <br>
 * Background refreshes run on an {@link AsyncExecutor} and are not tied to the thread that
 * triggered them: interrupting that thread does not stop the refresh.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * StaleableCache<String, User> cache = StaleableCache.<String, User> builder()
 *     .store(CacheFactory.createCaffeineStore(10_000))
 *     .ttl(60_000)               // logically fresh for 1 minute
 *     .maxStaleMargin(300_000)   // then served stale for up to 5 more minutes
 *     .loadFunction(userRepository::findById)
 *     .shouldCache((id, user) -> user != null)
 *     .build();
 *
 * User user = cache.get("user:123");
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @see StaleCacheStore
 * @see CacheFactory#createStaleableCache(CacheStore, long, long, LoadFunction)
 */
public class StaleableCache<K, V> extends AbstractCacheStore<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(StaleableCache.class);

    private final CacheStore<K, V> store;

    private final long ttl;

    private final long maxStaleMargin;

    private final LoadFunction<K, V> loadFunction;

    private final BiPredicate<? super K, ? super V> shouldCache;

    private final AsyncExecutor refreshExecutor;

    private final ConcurrentHashMap<K, Flight<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Creates a StaleableCache without a load function. Misses then yield {@code null}.
     *
     * @param store the wrapped store
     * @param ttl the default expiration in milliseconds, used when {@code set} is called without one
     * @param maxStaleMargin how long in milliseconds an expired entry may still be served, {@code 0} disables staleness
     */
    public StaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin) {
        this(store, ttl, maxStaleMargin, null, null, null);
    }

    /**
     *
     * @param store the wrapped store
     * @param ttl the default expiration in milliseconds
     * @param maxStaleMargin how long in milliseconds an expired entry may still be served
     * @param loadFunction produces values on misses and refreshes, may be null
     */
    public StaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin, final LoadFunction<K, V> loadFunction) {
        this(store, ttl, maxStaleMargin, loadFunction, null, null);
    }

    /**
     *
     * @param store the wrapped store, must not be null
     * @param ttl the default expiration in milliseconds
     * @param maxStaleMargin how long in milliseconds an expired entry may still be served, must not be negative
     * @param loadFunction produces values on misses and refreshes, may be null
     * @param shouldCache decides whether a loaded value is written to the store, may be null (always write)
     * @param refreshExecutor runs background refreshes, may be null (the executor shared by all stores)
     * @throws IllegalArgumentException if store is null, or ttl or maxStaleMargin is negative
     */
    public StaleableCache(final CacheStore<K, V> store, final long ttl, final long maxStaleMargin, final LoadFunction<K, V> loadFunction,
            final BiPredicate<? super K, ? super V> shouldCache, final AsyncExecutor refreshExecutor) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }

        if (ttl < 0) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttl);
        }

        if (maxStaleMargin < 0) {
            throw new IllegalArgumentException("Max stale margin cannot be negative: " + maxStaleMargin);
        }

        this.store = store;
        this.ttl = ttl;
        this.maxStaleMargin = maxStaleMargin;
        this.loadFunction = loadFunction;
        this.shouldCache = shouldCache;
        this.refreshExecutor = refreshExecutor == null ? asyncExecutor : refreshExecutor;
    }

    /**
     * Returns the value for the given key, loading it if it is missing or expired and refreshing it in
     * the background if it is stale.
     *
     * <p>Only the first concurrent caller for a key reads the store; the others wait for its result.
     * A missing key with no load function configured yields {@code null}, not an exception.
     *
     * @param k the cache key, must not be null
     * @return the fresh, stale or freshly loaded value; {@code null} if nothing could be produced
     * @throws IllegalArgumentException if the key is null
     * @throws CacheException if the load function failed (checked exceptions are wrapped), or the
     *         waiting thread was interrupted
     * @throws RuntimeException any other exception of the store or the load function, unchanged
     */
    @Override
    public V get(final K k) {
        checkKey(k);

        final Flight<V> flight = new Flight<>();
        final Flight<V> existing = inFlight.putIfAbsent(k, flight);

        if (existing != null) {
            return existing.await();
        }

        boolean stale = false;

        try {
            stale = lead(k, flight);
        } catch (final RuntimeException e) {
            flight.fail(e);
        } finally {
            if (!flight.isSettled()) {
                flight.fail(new CacheException("Load aborted for key: " + k));
            }

            if (!stale) {
                inFlight.remove(k, flight);
            }

            flight.release();
        }

        if (stale) {
            refreshInBackground(k, flight);
        }

        return flight.result();
    }

    /**
     * Reads the store and settles the flight. Returns {@code true} if the value is stale and a
     * background refresh has to follow.
     */
    private boolean lead(final K k, final Flight<V> flight) {
        final TtlValue<V> cached;

        try {
            cached = getWithTtl(k);
        } catch (final NotFoundException e) {
            if (logger.isDebugEnabled()) {
                logger.debug("No value in store for key: " + k + ", loading it");
            }

            flight.succeed(reload(k));
            return false;
        }

        switch (classify(cached.ttl(), maxStaleMargin)) {
            case EXPIRED:
                // expired but not purged by the store yet
                if (logger.isDebugEnabled()) {
                    logger.debug("Value expired for key: " + k + " (ttl=" + cached.ttl() + "ms), loading it");
                }

                flight.succeed(reload(k));
                return false;

            case STALE:
                if (logger.isDebugEnabled()) {
                    logger.debug("Serving stale value for key: " + k + " (ttl=" + cached.ttl() + "ms), refreshing it in background");
                }

                flight.succeed(cached.value());
                return true;

            default:
                flight.succeed(cached.value());
                return false;
        }
    }

    private void refreshInBackground(final K k, final Flight<V> flight) {
        if (loadFunction == null) {
            inFlight.remove(k, flight);
            return;
        }

        try {
            refreshExecutor.execute(() -> {
                try {
                    reload(k);
                } catch (final RuntimeException e) {
                    if (logger.isWarnEnabled()) {
                        logger.warn("Background refresh failed for key: " + k, e);
                    }
                } finally {
                    inFlight.remove(k, flight);
                }
            });
        } catch (final RuntimeException e) {
            inFlight.remove(k, flight);

            if (logger.isWarnEnabled()) {
                logger.warn("Failed to submit background refresh for key: " + k, e);
            }
        }
    }

    /**
     * Loads the value and writes it through {@link #set(Object, Object)} unless the admission
     * predicate rejects it. Write failures are logged and swallowed.
     */
    private V reload(final K k) {
        if (loadFunction == null) {
            return null;
        }

        final V value;

        try {
            value = loadFunction.load(k);
        } catch (final RuntimeException e) {
            throw e;
        } catch (final Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }

            throw new CacheException("Failed to load value for key: " + k, e);
        }

        if (shouldCache != null && !shouldCache.test(k, value)) {
            return value;
        }

        try {
            set(k, value);
        } catch (final RuntimeException e) {
            if (logger.isWarnEnabled()) {
                logger.warn("Failed to store loaded value for key: " + k, e);
            }
        }

        return value;
    }

    /**
     * Returns the stored value with its logical remaining time-to-live, i.e. the stored one minus
     * {@code maxStaleMargin}. A negative result means the entry is logically expired. No loading and
     * no coalescing happen here.
     *
     * @param k the cache key
     * @return the stored value and its logical remaining time-to-live in milliseconds
     * @throws NotFoundException if the store has no entry for the key
     */
    @Override
    public TtlValue<V> getWithTtl(final K k) {
        final TtlValue<V> stored = store.getWithTtl(k);

        return TtlValue.of(stored.value(), stored.ttl() - maxStaleMargin);
    }

    /**
     * Stores the value with its expiration extended by {@code maxStaleMargin}. When the options carry
     * no expiration the configured {@code ttl} is used. Tags are passed on unchanged.
     *
     * @param k the cache key
     * @param v the value to store
     * @param options expiration (in milliseconds) and tags
     */
    @Override
    public void set(final K k, final V v, final SetOptions options) {
        final SetOptions opts = options == null ? SetOptions.create() : options;
        final long expiration = opts.expiration() > 0 ? opts.expiration() : ttl;

        // saturate, a ttl near Long.MAX_VALUE means "forever"
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
        return STALEABLE;
    }

    /**
     * Closes the wrapped store. Background refreshes still running will fail to write and log it.
     */
    @Override
    public void close() {
        store.close();
    }

    @Override
    public boolean isClosed() {
        return store.isClosed();
    }

    /**
     * Returns the number of keys with a load or background refresh in progress.
     *
     * @return the number of in-flight records
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public long ttl() {
        return ttl;
    }

    public long maxStaleMargin() {
        return maxStaleMargin;
    }

    static Staleness classify(final long logicalTtl, final long maxStaleMargin) {
        if (logicalTtl >= 0) {
            return Staleness.FRESH;
        } else if (logicalTtl >= -maxStaleMargin) {
            return Staleness.STALE;
        } else {
            return Staleness.EXPIRED;
        }
    }

    private static void checkKey(final Object k) {
        if (k == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }

    /**
     * Creates a new builder for StaleableCache instances.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * StaleableCache<String, User> cache = StaleableCache.<String, User> builder()
     *     .store(store)
     *     .ttl(60_000)
     *     .maxStaleMargin(300_000)
     *     .loadFunction(userRepository::findById)
     *     .build();
     * }</pre>
     *
     * @param <K> the key type
     * @param <V> the value type
     * @return a new Builder instance
     */
    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    enum Staleness {
        FRESH, STALE, EXPIRED
    }

    /**
     * In-flight record of one key: the outcome of the leader's work, published once through a
     * single-shot latch. Fields are written before {@link #release()} and read after {@link #await()}.
     */
    static final class Flight<V> {

        private final CountDownLatch latch = new CountDownLatch(1);

        private boolean settled;

        private V value;

        private RuntimeException error;

        void succeed(final V v) {
            value = v;
            settled = true;
        }

        void fail(final RuntimeException e) {
            error = e;
            settled = true;
        }

        boolean isSettled() {
            return settled;
        }

        void release() {
            latch.countDown();
        }

        V await() {
            try {
                latch.await();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CacheException("Interrupted while waiting for in-flight load", e);
            }

            return result();
        }

        V result() {
            if (error != null) {
                throw error;
            }

            return value;
        }
    }

    /**
     * Builder for StaleableCache instances. Fluent setters are generated by Lombok's
     * {@code @Accessors(chain = true, fluent = true)}.
     *
     * <p><b>Default Values:</b></p>
     * <ul>
     * <li>store: required</li>
     * <li>ttl: 0</li>
     * <li>maxStaleMargin: 0 (staleness disabled)</li>
     * <li>loadFunction: null (misses yield null)</li>
     * <li>shouldCache: null (every loaded value is stored)</li>
     * <li>asyncExecutor: null (the executor shared by all stores)</li>
     * </ul>
     *
     * @param <K> the key type
     * @param <V> the value type
     */
    @Data
    @Accessors(chain = true, fluent = true)
    public static class Builder<K, V> {

        private CacheStore<K, V> store;

        /**
         * Default expiration in milliseconds for values stored without one.
         */
        private long ttl;

        /**
         * How long in milliseconds an expired value may still be served while it is refreshed.
         */
        private long maxStaleMargin;

        private LoadFunction<K, V> loadFunction;

        private BiPredicate<? super K, ? super V> shouldCache;

        /**
         * Executor running background refreshes.
         */
        private AsyncExecutor asyncExecutor;

        public Builder() {
        }

        /**
         *
         * @return a new StaleableCache configured with the builder's settings
         * @throws IllegalArgumentException if store is not set, or ttl or maxStaleMargin is negative
         */
        public StaleableCache<K, V> build() {
            return new StaleableCache<>(store, ttl, maxStaleMargin, loadFunction, shouldCache, asyncExecutor);
        }
    }
}
