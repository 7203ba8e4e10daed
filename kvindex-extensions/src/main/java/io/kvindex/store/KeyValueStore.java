/*
 * KeyValueStore.java
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

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The primitive ordered key-value store that indexes are maintained on. Keys are strings and are ordered by
 * the UTF-8 encoding of the key compared as unsigned bytes (equivalently, by Unicode code point). Values are
 * opaque blobs.
 *
 * <p>
 * Each call is an independent operation. Implementations need not offer any atomicity across calls, and
 * callers must not rely on it.
 * </p>
 *
 * <p>
 * All failures are reported as {@link KeyValueStoreException}.
 * </p>
 */
@API(API.Status.STABLE)
public interface KeyValueStore extends AutoCloseable {

    /**
     * Write a value, replacing any existing value for the key.
     *
     * @param key the key to write
     * @param value the value to associate with the key
     * @throws KeyValueStoreException if the write fails
     */
    void write(@Nonnull String key, @Nonnull byte[] value);

    /**
     * Read a single key or every key beginning with a prefix.
     *
     * @param key the exact key, or the prefix when {@code prefixScan} is set
     * @param prefixScan whether to return every entry whose key starts with {@code key}
     * @return the matching entries in key order; empty if there are none
     * @throws KeyValueStoreException if the read fails
     */
    @Nonnull
    List<KeyValue> read(@Nonnull String key, boolean prefixScan);

    /**
     * Remove a key. Removing a key that does not exist is not an error.
     *
     * @param key the key to remove
     * @throws KeyValueStoreException if the delete fails
     */
    void delete(@Nonnull String key);

    @Override
    void close();
}
