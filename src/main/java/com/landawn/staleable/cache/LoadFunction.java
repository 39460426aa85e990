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
 * Produces a fresh value for a key, used by {@link StaleableCache} on misses and refreshes.
 *
 * <p>A load function may block; no timeout is applied to it by the cache. While a synchronous load is
 * running, every concurrent caller for the same key waits for it.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * LoadFunction<String, User> loader = userId -> userRepository.findById(userId);
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@FunctionalInterface
public interface LoadFunction<K, V> {

    /**
     *
     * @param key the key to load
     * @return the loaded value
     * @throws Exception if the value cannot be produced
     */
    V load(K key) throws Exception;
}
