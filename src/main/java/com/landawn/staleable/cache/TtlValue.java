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
 * A value read from a {@link CacheStore} together with its remaining time-to-live.
 *
 * <p>The time-to-live is in milliseconds. Stores report the physical remaining lifetime of the
 * entry; {@link StaleableCache} and {@link StaleCacheStore} report the logical one, which is
 * negative once the entry is past its requested expiration but still inside the stale margin.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * TtlValue<User> cached = cache.getWithTtl("user:123");
 * User user = cached.value();
 * boolean stale = cached.ttl() < 0;
 * }</pre>
 *
 * @param <V> the value type
 * @param value the stored value, may be null
 * @param ttl the remaining time-to-live in milliseconds, may be negative
 */
public record TtlValue<V>(V value, long ttl) {

    /**
     * Creates a new TtlValue.
     *
     * @param <V> the value type
     * @param value the stored value
     * @param ttl the remaining time-to-live in milliseconds
     * @return a new TtlValue
     */
    public static <V> TtlValue<V> of(final V value, final long ttl) {
        return new TtlValue<>(value, ttl);
    }
}
