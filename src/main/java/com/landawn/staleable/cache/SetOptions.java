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

import java.util.List;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Options of a {@link CacheStore#set(Object, Object, SetOptions)} call.
 * The fluent accessors are generated by Lombok's {@code @Accessors(chain = true, fluent = true)}.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * cache.set("user:123", user, SetOptions.of(60_000));
 * cache.set("user:123", user, SetOptions.create().expiration(60_000).tags(List.of("users")));
 * }</pre>
 */
@Data
@Accessors(chain = true, fluent = true)
public final class SetOptions {

    /**
     * Requested expiration in milliseconds. {@code 0} or negative means none was requested.
     */
    private long expiration;

    /**
     * Tags the entry is stored under, used by {@link CacheStore#invalidate(InvalidateOptions)}.
     */
    private List<String> tags = List.of();

    public static SetOptions create() {
        return new SetOptions();
    }

    public static SetOptions of(final long expiration) {
        return new SetOptions().expiration(expiration);
    }

    /**
     * Returns a copy of these options with the expiration replaced. The tags are kept.
     *
     * @param newExpiration the expiration of the copy, in milliseconds
     * @return a new SetOptions instance
     */
    public SetOptions withExpiration(final long newExpiration) {
        return new SetOptions().expiration(newExpiration).tags(tags);
    }
}
