/*
 * IndexedModelException.java
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

package io.kvindex.record;

import io.kvindex.annotation.API;
import io.kvindex.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of the exceptions thrown by {@link IndexedModel}.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class IndexedModelException extends LoggableException {
    public IndexedModelException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public IndexedModelException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public IndexedModelException(@Nonnull String msg) {
        super(msg);
    }

    @Nonnull
    @Override
    public IndexedModelException addLogInfo(@Nonnull String description, Object object) {
        super.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public IndexedModelException addLogInfo(@Nonnull Object... keyValue) {
        super.addLogInfo(keyValue);
        return this;
    }
}
