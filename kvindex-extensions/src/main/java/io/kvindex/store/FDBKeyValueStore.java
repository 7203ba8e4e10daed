/*
 * FDBKeyValueStore.java
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

import com.apple.foundationdb.Database;
import com.apple.foundationdb.FDBException;
import com.apple.foundationdb.Range;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.google.common.collect.ImmutableList;
import io.kvindex.annotation.API;
import io.kvindex.util.LogMessageKeys;
import io.kvindex.util.LoggableKeysAndValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * A {@link KeyValueStore} kept in FoundationDB. Every call runs in its own transaction through
 * {@link Database#run} or {@link Database#read}, so retryable conflicts are retried by the client and nothing
 * transactional is visible to the caller.
 *
 * <p>
 * A string key is stored as its UTF-8 bytes appended to a raw prefix. Several stores can therefore share one
 * cluster as long as no prefix is a prefix of another. The {@link Database} belongs to the caller and is not
 * closed by {@link #close()}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class FDBKeyValueStore implements KeyValueStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FDBKeyValueStore.class);

    @Nonnull
    private final Database database;
    @Nonnull
    private final byte[] prefix;
    private volatile boolean closed;

    public FDBKeyValueStore(@Nonnull Database database) {
        this(database, new byte[0]);
    }

    public FDBKeyValueStore(@Nonnull Database database, @Nonnull byte[] prefix) {
        this.database = database;
        this.prefix = prefix.clone();
    }

    @Nonnull
    public byte[] getPrefix() {
        return prefix.clone();
    }

    @Override
    public void write(@Nonnull String key, @Nonnull byte[] value) {
        final byte[] rawKey = rawKey(key);
        runWrapped(key, () -> database.run(tr -> {
            tr.set(rawKey, value);
            return null;
        }));
    }

    @Nonnull
    @Override
    public List<KeyValue> read(@Nonnull String key, boolean prefixScan) {
        final byte[] rawKey = rawKey(key);
        if (!prefixScan) {
            byte[] value = runWrapped(key, () -> database.read(tr -> tr.get(rawKey).join()));
            return value == null ? ImmutableList.of() : ImmutableList.of(new KeyValue(key, value));
        }
        List<com.apple.foundationdb.KeyValue> rawResults = runWrapped(key,
                () -> database.read(tr -> tr.getRange(Range.startsWith(rawKey)).asList().join()));
        ImmutableList.Builder<KeyValue> results = ImmutableList.builder();
        for (com.apple.foundationdb.KeyValue kv : rawResults) {
            results.add(new KeyValue(stringKey(kv.getKey()), kv.getValue()));
        }
        return results.build();
    }

    @Override
    public void delete(@Nonnull String key) {
        final byte[] rawKey = rawKey(key);
        runWrapped(key, () -> database.run(tr -> {
            tr.clear(rawKey);
            return null;
        }));
    }

    @Override
    public void close() {
        closed = true;
    }

    @Nonnull
    private byte[] rawKey(@Nonnull String key) {
        if (closed) {
            throw new KeyValueStoreException("store is closed")
                    .addLogInfo(LogMessageKeys.KEY, key,
                            LogMessageKeys.STORE, getClass().getSimpleName());
        }
        return ByteArrayUtil.join(prefix, key.getBytes(StandardCharsets.UTF_8));
    }

    @Nonnull
    private String stringKey(@Nonnull byte[] rawKey) {
        return new String(Arrays.copyOfRange(rawKey, prefix.length, rawKey.length), StandardCharsets.UTF_8);
    }

    private <T> T runWrapped(@Nonnull String key, @Nonnull Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RuntimeException ex) {
            throw wrapException(ex).addLogInfo(LogMessageKeys.KEY, key,
                    LogMessageKeys.STORE, getClass().getSimpleName());
        }
    }

    /**
     * Map a failure from the FoundationDB client to a {@link KeyValueStoreException}. Completion and execution
     * wrappers are removed first, and any log info already attached is carried over.
     *
     * @param ex the failure
     * @return an exception to throw
     */
    @Nonnull
    static KeyValueStoreException wrapException(@Nonnull Throwable ex) {
        if (ex instanceof KeyValueStoreException) {
            return (KeyValueStoreException)ex;
        }
        Object[] logInfo = ex instanceof LoggableKeysAndValues
                           ? ((LoggableKeysAndValues<?>)ex).exportLogInfo()
                           : new Object[0];
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof KeyValueStoreException) {
            return (KeyValueStoreException)cause;
        }
        if (cause instanceof FDBException) {
            FDBException fdbex = (FDBException)cause;
            if (LOGGER.isWarnEnabled() && fdbex.isRetryable()) {
                LOGGER.warn("retryable FoundationDB error escaped the retry loop: code={}", fdbex.getCode());
            }
            return new KeyValueStoreException("FoundationDB operation failed", fdbex)
                    .addLogInfo("fdb_error_code", fdbex.getCode())
                    .addLogInfo(logInfo);
        }
        return new KeyValueStoreException(String.valueOf(cause.getMessage()), cause).addLogInfo(logInfo);
    }

    @Override
    public String toString() {
        return "FDBKeyValueStore{" + ByteArrayUtil.printable(prefix) + "}";
    }
}
