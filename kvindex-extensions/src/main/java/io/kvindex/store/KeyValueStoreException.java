/*
 * KeyValueStoreException.java
 *
 * This source file is part of the kvindex open source project
 *
 * Copyright 2024-2026 the kvindex project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kvindex.store;

import io.kvindex.annotation.API;
import io.kvindex.util.LoggableException;

import javax.annotation.Nonnull;

/**
 * Thrown by a {@link KeyValueStore} when the underlying storage fails a read, write or delete. The cause is
 * the implementation's own exception.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class KeyValueStoreException extends LoggableException {
    public KeyValueStoreException(@Nonnull String message) {
        super(message);
    }

    public KeyValueStoreException(@Nonnull String message, @Nonnull Throwable cause) {
        super(message, cause);
    }

    @Nonnull
    @Override
    public KeyValueStoreException addLogInfo(@Nonnull String description, Object object) {
        super.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public KeyValueStoreException addLogInfo(@Nonnull Object... keyValue) {
        super.addLogInfo(keyValue);
        return this;
    }
}
