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
 * Thrown by a {@link CacheStore} when no live entry exists for the requested key.
 * {@link StaleableCache} recovers from it by loading the value; other callers see it as a plain miss.
 */
public class NotFoundException extends CacheException {

    private static final long serialVersionUID = 6028563102717954126L;

    private final transient Object key;

    public NotFoundException(final Object key) {
        super("Value not found in store for key: " + key);
        this.key = key;
    }

    /**
     * Returns the key that was looked up.
     *
     * @return the missing key
     */
    public Object getKey() {
        return key;
    }
}
