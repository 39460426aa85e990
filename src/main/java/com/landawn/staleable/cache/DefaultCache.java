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

import com.landawn.abacus.util.Charsets;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * A pass-through cache over a store keyed by strings.
 * Keys are translated before they reach the store:
 * <ul>
 * <li>{@code String} keys are used as they are</li>
 * <li>keys implementing {@link CacheKeyGenerator} supply their own key</li>
 * <li>any other key is Base64 encoded together with its class name, so {@code 1} and {@code 1L} stay apart</li>
 * </ul>
 * The optional key prefix is prepended to every translated key, which lets several caches share one
 * store without clashing.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * DefaultCache<Long, User> users = new DefaultCache<>(store, "user:");
 * users.set(123L, user, SetOptions.of(60_000));   // stored under "user:" + base64("java.lang.Long:123")
 *
 * StaleableCache<Long, User> staleable = new StaleableCache<>(users, 60_000, 300_000, userRepository::findById);
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class DefaultCache<K, V> extends AbstractCacheStore<K, V> {

    private final CacheStore<String, V> store;

    private final String keyPrefix;

    public DefaultCache(final CacheStore<String, V> store) {
        this(store, Strings.EMPTY_STRING);
    }

    /**
     *
     * @param store the wrapped store, must not be null
     * @param keyPrefix the prefix prepended to every key, may be null or empty
     * @throws IllegalArgumentException if store is null
     */
    public DefaultCache(final CacheStore<String, V> store, final String keyPrefix) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }

        this.store = store;
        this.keyPrefix = Strings.isEmpty(keyPrefix) ? Strings.EMPTY_STRING : keyPrefix;
    }

    @Override
    public V get(final K k) {
        return store.get(generateKey(k));
    }

    @Override
    public TtlValue<V> getWithTtl(final K k) {
        return store.getWithTtl(generateKey(k));
    }

    @Override
    public void set(final K k, final V v, final SetOptions options) {
        store.set(generateKey(k), v, options);
    }

    @Override
    public void delete(final K k) {
        store.delete(generateKey(k));
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
        return CACHE;
    }

    /**
     * Returns the store this cache delegates to.
     *
     * @return the wrapped store
     */
    public CacheStore<String, V> getStore() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }

    @Override
    public boolean isClosed() {
        return store.isClosed();
    }

    protected String generateKey(final K k) {
        if (k == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }

        final String key;

        if (k instanceof String) {
            key = (String) k;
        } else if (k instanceof CacheKeyGenerator) {
            key = ((CacheKeyGenerator) k).getCacheKey();
        } else {
            key = Strings.base64Encode((k.getClass().getName() + ':' + N.stringOf(k)).getBytes(Charsets.UTF_8));
        }

        return keyPrefix.isEmpty() ? key : keyPrefix + key;
    }
}
