/*
 * LoggableKeysAndValues.java
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

package io.kvindex.util;

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured context for the log line it ends up in. kvindex messages are a static
 * title (for example "Duplicate entry for unique index") plus keys and values describing the particular
 * occurrence (for example {@code field_name="email"}). Keeping the title static makes every occurrence easy
 * to search for, while the keys and values still say which key, field or index was involved.
 *
 * @param <T> the implementing type, returned from the fluent {@code addLogInfo} methods
 */
@API(API.Status.UNSTABLE)
public interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information as an unmodifiable map, in the order it was added.
     *
     * @return all log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add one key/value pair.
     *
     * @param description key of the pair
     * @param object value of the pair
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add a flattened list of pairs, keys at even positions and values at odd ones, so that
     * {@code ["k0", "v0", "k1", "v1"]} adds {@code k0=v0} and {@code k1=v1}. Keys are converted with
     * {@link String#valueOf(Object)}, which lets {@link LogMessageKeys} constants be passed directly.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if {@code keyValue} has an odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Export the log information in the flattened form accepted by {@link #addLogInfo(Object...)}.
     *
     * @return flattened key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
