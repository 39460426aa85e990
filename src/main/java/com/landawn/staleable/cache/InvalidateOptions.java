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
 * Options of a {@link CacheStore#invalidate(InvalidateOptions)} call.
 */
@Data
@Accessors(chain = true, fluent = true)
public final class InvalidateOptions {

    private List<String> tags = List.of();

    public static InvalidateOptions of(final String... tags) {
        return new InvalidateOptions().tags(List.of(tags));
    }

    public boolean isEmpty() {
        return tags == null || tags.isEmpty();
    }
}
