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

import java.io.Closeable;

import com.landawn.abacus.util.ContinuableFuture;

/**
 * The key/value contract shared by every store and every decorator in this library.
 * A store keeps values together with a physical time-to-live and reports the remaining
 * time-to-live on read. Decorators such as {@link StaleableCache} and {@link StaleCacheStore}
 * implement the same interface, so they can be stacked on top of any backend.
 *
 * <br><br>
 * Key features:
 * <ul>
 * <li>Reads that report the remaining time-to-live ({@link #getWithTtl(Object)})</li>
 * <li>Writes with per-entry expiration and tags ({@link SetOptions})</li>
 * <li>Tag based invalidation ({@link InvalidateOptions})</li>
 * <li>Asynchronous variants of the basic operations</li>
 * <li>Resource management via Closeable</li>
 * </ul>
 *
 * <br>
 * Missing keys are reported with {@link NotFoundException}, never with {@code null}, so that a
 * stored {@code null} and an absent entry can be told apart. Every other failure of a store is
 * reported with a {@link CacheException} or another unchecked exception.
 *
 * <br>
 * Example usage:
 * <pre>{@code
 * CacheStore<String, User> store = CacheFactory.createCaffeineStore(10_000);
 *
 * store.set("user:123", user, SetOptions.of(60_000).tags("users"));
 * TtlValue<User> cached = store.getWithTtl("user:123");
 * System.out.println(cached.value() + " expires in " + cached.ttl() + " ms");
 *
 * store.invalidate(InvalidateOptions.of("users"));
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @see AbstractCacheStore
 * @see StaleableCache
 * @see CacheFactory
 */
public interface CacheStore<K, V> extends Closeable {

    /**
     * Type identifier returned by {@link CaffeineStore#getType()}.
     */
    String CAFFEINE = "caffeine";

    /**
     * Type identifier returned by {@link DefaultCache#getType()}.
     */
    String CACHE = "cache";

    /**
     * Type identifier returned by {@link StaleableCache#getType()}.
     */
    String STALEABLE = "staleable";

    /**
     * Type identifier returned by {@link StaleCacheStore#getType()}.
     */
    String STALE_CACHE_WRAPPER = "stale-cache-wrapper";

    /**
     * Retrieves the value stored under the given key.
     *
     * @param k the cache key to look up
     * @return the stored value, which may be {@code null} if {@code null} was stored
     * @throws NotFoundException if no live entry exists for the key
     * @throws IllegalStateException if the store has been closed
     */
    V get(final K k);

    /**
     * Retrieves the value stored under the given key together with its remaining time-to-live.
     * Decorators may shift the reported time-to-live; a negative value then means the entry is
     * logically expired while it is still physically present.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * TtlValue<User> cached = store.getWithTtl("user:123");
     *
     * if (cached.ttl() < 0) {
     *     // logically expired, refresh it
     * }
     * }</pre>
     *
     * @param k the cache key to look up
     * @return the stored value and its remaining time-to-live in milliseconds
     * @throws NotFoundException if no live entry exists for the key
     * @throws IllegalStateException if the store has been closed
     */
    TtlValue<V> getWithTtl(final K k);

    /**
     * Stores a value with the store's default options.
     *
     * @param k the cache key
     * @param v the value to store
     * @see #set(Object, Object, SetOptions)
     */
    void set(final K k, final V v);

    /**
     * Stores a value with the given expiration and tags.
     * An expiration of {@code 0} (or less) means the caller did not request one; the store or
     * decorator decides what that means.
     *
     * @param k the cache key
     * @param v the value to store
     * @param options expiration (in milliseconds) and tags, must not be null
     * @throws IllegalStateException if the store has been closed
     */
    void set(final K k, final V v, final SetOptions options);

    /**
     * Removes the entry stored under the given key. Removing an absent key is not an error.
     *
     * @param k the cache key to remove
     */
    void delete(final K k);

    /**
     * Removes every entry tagged with any of the tags in the given options.
     *
     * @param options the tags to invalidate, must not be null
     */
    void invalidate(final InvalidateOptions options);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Returns the identifier of this store or decorator kind, e.g. {@link #STALEABLE}.
     *
     * @return the type identifier, never null
     */
    String getType();

    /**
     * Asynchronously retrieves the value stored under the given key.
     * The returned future fails with {@link NotFoundException} if the key is absent.
     *
     * @param k the cache key to look up
     * @return a ContinuableFuture completed with the stored value
     * @see #get(Object)
     */
    ContinuableFuture<V> asyncGet(final K k);

    /**
     * Asynchronously retrieves the value and remaining time-to-live stored under the given key.
     *
     * @param k the cache key to look up
     * @return a ContinuableFuture completed with the stored value and its time-to-live
     * @see #getWithTtl(Object)
     */
    ContinuableFuture<TtlValue<V>> asyncGetWithTtl(final K k);

    /**
     * Asynchronously stores a value with the given options.
     *
     * @param k the cache key
     * @param v the value to store
     * @param options expiration (in milliseconds) and tags
     * @return a ContinuableFuture that completes when the value has been stored
     * @see #set(Object, Object, SetOptions)
     */
    ContinuableFuture<Void> asyncSet(final K k, final V v, final SetOptions options);

    /**
     * Asynchronously removes the entry stored under the given key.
     *
     * @param k the cache key to remove
     * @return a ContinuableFuture that completes when the entry has been removed
     * @see #delete(Object)
     */
    ContinuableFuture<Void> asyncDelete(final K k);

    /**
     * Closes this store and releases its resources.
     * Decorators close the store they wrap.
     */
    @Override
    void close();

    /**
     * Checks whether this store has been closed.
     *
     * @return {@code true} if {@link #close()} has been called
     */
    boolean isClosed();
}
