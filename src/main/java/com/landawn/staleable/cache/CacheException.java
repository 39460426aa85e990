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
 * Base class of the unchecked exceptions thrown by stores and decorators.
 * Checked exceptions thrown by a {@link LoadFunction} reach callers wrapped in this type.
 */
public class CacheException extends RuntimeException {

    private static final long serialVersionUID = -3518302714395123874L;

    public CacheException(final String message) {
        super(message);
    }

    public CacheException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CacheException(final Throwable cause) {
        super(cause);
    }
}
