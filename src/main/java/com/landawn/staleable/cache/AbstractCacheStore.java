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

import java.util.concurrent.TimeUnit;

import com.landawn.abacus.util.AsyncExecutor;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.IOUtil;
import com.landawn.abacus.util.N;

/**
 * Abstract base class for stores and decorators providing the common functionality.
 * It implements the asynchronous operations of {@link CacheStore} on a shared thread pool and
 * the {@link #set(Object, Object)} shortcut.
 *
 * <br><br>
 * Subclasses must implement:
 * <ul>
 * <li>{@link #get(Object)} and {@link #getWithTtl(Object)} - Retrieval</li>
 * <li>{@link #set(Object, Object, SetOptions)} - Storage with expiration and tags</li>
 * <li>{@link #delete(Object)}, {@link #invalidate(InvalidateOptions)}, {@link #clear()} - Removal</li>
 * <li>{@link #getType()} - Type identifier</li>
 * <li>{@link #close()}, {@link #isClosed()} - Lifecycle</li>
 * </ul>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @see CacheStore
 */
public abstract class AbstractCacheStore<K, V> implements CacheStore<K, V> {

    /**
     * Shared async executor for all stores and decorators.
     * Core pool size is max(64, CPU_CORES * 8), max pool size is max(128, CPU_CORES * 16),
     * and threads are kept alive for 180 seconds.
     * {@link StaleableCache} runs its background refreshes here unless configured otherwise.
     */
    protected static final AsyncExecutor asyncExecutor = new AsyncExecutor(//
            N.max(64, IOUtil.CPU_CORES * 8), // coreThreadPoolSize
            N.max(128, IOUtil.CPU_CORES * 16), // maxThreadPoolSize
            180L, TimeUnit.SECONDS);

    protected AbstractCacheStore() {
    }

    /**
     * Stores a value with empty {@link SetOptions}, leaving the expiration to the implementation.
     *
     * @param k the cache key
     * @param v the value to store
     */
    @Override
    public void set(final K k, final V v) {
        set(k, v, SetOptions.create());
    }

    @Override
    public ContinuableFuture<V> asyncGet(final K k) {
        return asyncExecutor.execute(() -> get(k));
    }

    @Override
    public ContinuableFuture<TtlValue<V>> asyncGetWithTtl(final K k) {
        return asyncExecutor.execute(() -> getWithTtl(k));
    }

    @Override
    public ContinuableFuture<Void> asyncSet(final K k, final V v, final SetOptions options) {
        return asyncExecutor.execute(() -> {
            set(k, v, options);

            return null;
        });
    }

    @Override
    public ContinuableFuture<Void> asyncDelete(final K k) {
        return asyncExecutor.execute(() -> {
            delete(k);

            return null;
        });
    }
}
