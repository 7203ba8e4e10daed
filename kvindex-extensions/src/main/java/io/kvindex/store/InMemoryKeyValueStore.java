/*
 * InMemoryKeyValueStore.java
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
import io.kvindex.util.LogMessageKeys;
import io.kvindex.util.StringUtils;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A {@link KeyValueStore} held in a sorted map. Keys are kept in {@link StringUtils#CODE_POINT_ORDER}, which
 * matches the byte order a persistent store would use for the same UTF-8 keys. Safe for concurrent use.
 * Nothing survives {@link #close()}.
 */
@API(API.Status.STABLE)
public class InMemoryKeyValueStore implements KeyValueStore {
    @Nonnull
    private final NavigableMap<String, byte[]> data = new ConcurrentSkipListMap<>(StringUtils.CODE_POINT_ORDER);
    private volatile boolean closed;

    @Override
    public void write(@Nonnull String key, @Nonnull byte[] value) {
        checkOpen(key);
        data.put(key, value.clone());
    }

    @Nonnull
    @Override
    public List<KeyValue> read(@Nonnull String key, boolean prefixScan) {
        checkOpen(key);
        if (!prefixScan) {
            byte[] value = data.get(key);
            return value == null ? ImmutableList.of() : ImmutableList.of(new KeyValue(key, value));
        }
        ImmutableList.Builder<KeyValue> results = ImmutableList.builder();
        for (Map.Entry<String, byte[]> entry : data.tailMap(key, true).entrySet()) {
            if (!entry.getKey().startsWith(key)) {
                break;
            }
            results.add(new KeyValue(entry.getKey(), entry.getValue()));
        }
        return results.build();
    }

    @Override
    public void delete(@Nonnull String key) {
        checkOpen(key);
        data.remove(key);
    }

    /**
     * Number of keys currently held.
     * @return the number of keys
     */
    public int size() {
        return data.size();
    }

    @Override
    public void close() {
        closed = true;
        data.clear();
    }

    private void checkOpen(@Nonnull String key) {
        if (closed) {
            throw new KeyValueStoreException("store is closed")
                    .addLogInfo(LogMessageKeys.KEY, key,
                            LogMessageKeys.STORE, getClass().getSimpleName());
        }
    }
}
