/*
 * IndexedModel.java
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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.kvindex.annotation.API;
import io.kvindex.record.encoding.FieldValue;
import io.kvindex.record.encoding.IndexKeyEncoder;
import io.kvindex.record.locking.LockRegistry;
import io.kvindex.record.logging.KeyValueLogMessage;
import io.kvindex.record.logging.LogMessageKeys;
import io.kvindex.record.metadata.Index;
import io.kvindex.record.query.IndexMatcher;
import io.kvindex.record.query.Query;
import io.kvindex.record.serialization.JacksonRecordSerializer;
import io.kvindex.record.serialization.RecordSerializer;
import io.kvindex.record.serialization.StoredRecord;
import io.kvindex.store.KeyValue;
import io.kvindex.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A collection of records of one type kept in a {@link KeyValueStore}, with secondary indexes.
 *
 * <p>
 * Every record is written once per index: once under each declared {@link Index} and once under the identity
 * index. Each copy's key encodes the indexed value so that a prefix scan finds the records with a value, or all
 * records of an index in its order. See {@link IndexKeyEncoder} for the key layout.
 * </p>
 *
 * <p>
 * Saving a record whose indexed values changed removes the keys computed from the previous version. Unique indexes
 * are checked before anything is written. Each store call stands on its own, so a save that fails part way leaves
 * the keys written so far in place; nothing is rolled back.
 * </p>
 *
 * <p>
 * Saves and deletes of the same identity, and saves claiming the same value of a unique index, are serialized by
 * in-process locks. Two models sharing a store, in this process or another, are not coordinated.
 * </p>
 *
 * @param <M> type of record
 */
@API(API.Status.STABLE)
public class IndexedModel<M> {
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexedModel.class);

    @Nonnull
    private final KeyValueStore store;
    @Nonnull
    private final String namespace;
    @Nonnull
    private final List<Index> indexes;
    @Nonnull
    private final ModelOptions options;
    @Nonnull
    private final RecordSerializer<M> serializer;
    @Nonnull
    private final IndexKeyEncoder keyEncoder;
    @Nonnull
    private final IndexMatcher indexMatcher;
    @Nonnull
    private final LockRegistry lockRegistry;

    protected IndexedModel(@Nonnull Builder<M> builder) {
        this.store = builder.store;
        this.namespace = builder.namespace;
        this.indexes = ImmutableList.copyOf(builder.indexes);
        this.options = builder.options;
        this.serializer = builder.serializer;
        this.keyEncoder = new IndexKeyEncoder(namespace);
        this.indexMatcher = new IndexMatcher(indexes, options.getIdIndex());
        this.lockRegistry = new LockRegistry(builder.lockStripes);
    }

    @Nonnull
    public KeyValueStore getStore() {
        return store;
    }

    @Nonnull
    public String getNamespace() {
        return namespace;
    }

    /**
     * Get the declared indexes, not including the identity index.
     * @return the declared indexes in declaration order
     */
    @Nonnull
    public List<Index> getIndexes() {
        return indexes;
    }

    @Nonnull
    public ModelOptions getOptions() {
        return options;
    }

    @Nonnull
    public IndexKeyEncoder getKeyEncoder() {
        return keyEncoder;
    }

    /**
     * Save a record, creating it or replacing the stored version with the same identity.
     *
     * @param rec the record to save
     * @throws MissingIdentityException if the record's identity is missing, null or empty
     * @throws UnsupportedEncodingException if an indexed field is missing or has no key encoding
     * @throws UniqueConstraintViolationException if a unique index value belongs to another record
     * @throws io.kvindex.store.KeyValueStoreException if the store fails
     */
    public void save(@Nonnull M rec) {
        final StoredRecord stored = serializer.serialize(rec);
        final FieldValue identity = identityOf(stored);
        final Index idIndex = options.getIdIndex();

        // Encode every key before touching the store, so that a bad value fails the save with nothing written.
        final List<String> newKeys = new ArrayList<>(indexes.size());
        for (Index index : indexes) {
            newKeys.add(keyEncoder.recordKey(index, stored.getFields(), identity));
        }
        final String identityKey = keyEncoder.recordKey(idIndex, stored.getFields(), identity);
        final List<String> lockKeys = new ArrayList<>();
        lockKeys.add(keyEncoder.scanKey(idIndex, identity));
        for (Index index : indexes) {
            if (index.isUnique() && hasValue(stored.getField(index.getFieldName()))) {
                lockKeys.add(keyEncoder.scanKey(index, FieldValue.fromJson(index.getFieldName(), stored.getField(index.getFieldName()))));
            }
        }

        final StoredRecord previous;
        try (LockRegistry.HeldLocks ignored = lockRegistry.acquire(lockKeys)) {
            previous = loadByIdentity(identity);
            checkUniqueness(stored, identity);
            for (int i = 0; i < indexes.size(); i++) {
                final Index index = indexes.get(i);
                final String newKey = newKeys.get(i);
                if (previous != null) {
                    final String oldKey = keyEncoder.recordKey(index, previous.getFields(), identity);
                    if (!oldKey.equals(newKey)) {
                        logKeyOperation("deleting stale index key", LogMessageKeys.OLD_KEY, oldKey, LogMessageKeys.INDEX, index);
                        store.delete(oldKey);
                    }
                }
                logKeyOperation("writing index key", LogMessageKeys.KEY, newKey, LogMessageKeys.VALUE_SIZE, stored.getBlob().length);
                store.write(newKey, stored.getBlob());
            }
            logKeyOperation("writing identity key", LogMessageKeys.KEY, identityKey, LogMessageKeys.VALUE_SIZE, stored.getBlob().length);
            store.write(identityKey, stored.getBlob());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("saved record",
                    LogMessageKeys.NAMESPACE, namespace,
                    LogMessageKeys.IDENTITY, identity.getText(),
                    "created", previous == null));
        }
    }

    /**
     * Read the one record matching a query.
     *
     * @param query the query; its offset and limit are ignored
     * @return the record
     * @throws NoMatchingIndexException if no index answers the query
     * @throws RecordNotFoundException if no record matches
     * @throws MultipleRecordsFoundException if more than one record matches
     */
    @Nonnull
    public M read(@Nonnull Query query) {
        final List<IndexEntry> results = scan(query);
        if (results.isEmpty()) {
            throw new RecordNotFoundException("no record matches query",
                    LogMessageKeys.NAMESPACE, namespace,
                    LogMessageKeys.FIELD_NAME, query.getFieldName(),
                    LogMessageKeys.FIELD_VALUE, query.getValue());
        }
        if (results.size() > 1) {
            throw new MultipleRecordsFoundException("more than one record matches query",
                    LogMessageKeys.NAMESPACE, namespace,
                    LogMessageKeys.FIELD_NAME, query.getFieldName(),
                    LogMessageKeys.FIELD_VALUE, query.getValue(),
                    LogMessageKeys.RESULT_COUNT, results.size());
        }
        return serializer.deserialize(results.get(0).record);
    }

    /**
     * List the records matching a query, in the order of the index that answers it.
     *
     * @param query the query; a {@code null} value lists the whole index
     * @return the matching records after the query's offset, at most its limit of them if that is not {@code 0}
     * @throws NoMatchingIndexException if no index answers the query
     */
    @Nonnull
    public List<M> list(@Nonnull Query query) {
        final List<IndexEntry> results = scan(query);
        final int from = (int)Math.min(query.getOffset(), results.size());
        final int to = query.getLimit() == 0 ? results.size() : (int)Math.min((long)from + query.getLimit(), results.size());
        final List<M> records = new ArrayList<>(to - from);
        for (IndexEntry entry : results.subList(from, to)) {
            records.add(serializer.deserialize(entry.record));
        }
        logKeyOperation("listed records",
                LogMessageKeys.OFFSET, query.getOffset(),
                LogMessageKeys.LIMIT, query.getLimit(),
                LogMessageKeys.RESULT_COUNT, records.size());
        return records;
    }

    /**
     * Delete a record and all of its index keys.
     *
     * @param query a query on the identity index with the identity of the record to delete
     * @throws UnsupportedDeleteQueryException if the query is not an identity lookup
     * @throws RecordNotFoundException if there is no record with that identity
     */
    public void delete(@Nonnull Query query) {
        final Index idIndex = options.getIdIndex();
        if (!idIndex.hasShape(query.getFieldName(), query.getType(), query.getOrderType()) || query.getValue() == null) {
            throw new UnsupportedDeleteQueryException("delete is only supported by identity",
                    LogMessageKeys.FIELD_NAME, query.getFieldName(),
                    LogMessageKeys.INDEX_TYPE, query.getType(),
                    LogMessageKeys.ORDER_TYPE, query.getOrderType(),
                    LogMessageKeys.FIELD_VALUE, query.getValue());
        }
        final FieldValue identity = FieldValue.fromObject(idIndex.getFieldName(), query.getValue());
        final String scanKey = keyEncoder.scanKey(idIndex, identity);
        try (LockRegistry.HeldLocks ignored = lockRegistry.acquire(ImmutableList.of(scanKey))) {
            final List<IndexEntry> results = scanIndex(idIndex, identity);
            if (results.isEmpty()) {
                throw new RecordNotFoundException("no record to delete",
                        LogMessageKeys.NAMESPACE, namespace,
                        LogMessageKeys.IDENTITY, identity.getText());
            }
            final IndexEntry identityEntry = results.get(0);
            final StoredRecord stored = identityEntry.record;
            final FieldValue storedIdentity = identityOf(stored);
            for (Index index : indexes) {
                final String key = keyEncoder.recordKey(index, stored.getFields(), storedIdentity);
                logKeyOperation("deleting index key", LogMessageKeys.KEY, key, LogMessageKeys.INDEX, index);
                store.delete(key);
            }
            logKeyOperation("deleting identity key", LogMessageKeys.KEY, identityEntry.key);
            store.delete(identityEntry.key);
        }
    }

    @Nonnull
    private List<IndexEntry> scan(@Nonnull Query query) {
        final Index index = indexMatcher.match(query);
        final FieldValue value = query.getValue() == null ? null : FieldValue.fromObject(query.getFieldName(), query.getValue());
        return scanIndex(index, value);
    }

    /**
     * Scan an index for a value and keep the entries whose stored record really has that value. The scan prefix
     * alone can also cover longer ascending strings, and values that differ only in trailing padding.
     */
    @Nonnull
    private List<IndexEntry> scanIndex(@Nonnull Index index, @Nullable FieldValue value) {
        final String scanKey = keyEncoder.scanKey(index, value);
        final List<KeyValue> results = store.read(scanKey, true);
        final List<IndexEntry> entries = new ArrayList<>(results.size());
        for (KeyValue kv : results) {
            final StoredRecord stored = serializer.parse(kv.getValue());
            if (value == null || hasFieldText(stored, index.getFieldName(), value)) {
                entries.add(new IndexEntry(kv.getKey(), stored));
            }
        }
        logKeyOperation("scanned index", LogMessageKeys.SCAN_KEY, scanKey,
                LogMessageKeys.RESULT_COUNT, entries.size(),
                LogMessageKeys.SKIPPED_COUNT, results.size() - entries.size());
        return entries;
    }

    private static boolean hasFieldText(@Nonnull StoredRecord stored, @Nonnull String fieldName, @Nonnull FieldValue value) {
        final JsonNode node = stored.getField(fieldName);
        return hasValue(node) && node.isValueNode() && FieldValue.fromJson(fieldName, node).getText().equals(value.getText());
    }

    @Nullable
    private StoredRecord loadByIdentity(@Nonnull FieldValue identity) {
        final List<IndexEntry> results = scanIndex(options.getIdIndex(), identity);
        return results.isEmpty() ? null : results.get(0).record;
    }

    private void checkUniqueness(@Nonnull StoredRecord stored, @Nonnull FieldValue identity) {
        for (Index index : indexes) {
            if (!index.isUnique()) {
                continue;
            }
            final JsonNode node = stored.getField(index.getFieldName());
            if (!hasValue(node)) {
                continue;
            }
            final FieldValue value = FieldValue.fromJson(index.getFieldName(), node);
            for (IndexEntry entry : scanIndex(index, value)) {
                final FieldValue existingIdentity = identityOf(entry.record);
                if (!existingIdentity.equals(identity)) {
                    throw new UniqueConstraintViolationException(index, value.getText(), identity.getText(), existingIdentity.getText());
                }
            }
        }
    }

    @Nonnull
    private FieldValue identityOf(@Nonnull StoredRecord stored) {
        final String fieldName = options.getIdentityFieldName();
        final JsonNode node = stored.getField(fieldName);
        if (!hasValue(node) || (node.isTextual() && node.textValue().isEmpty())) {
            throw new MissingIdentityException("record has no identity",
                    LogMessageKeys.NAMESPACE, namespace,
                    LogMessageKeys.FIELD_NAME, fieldName);
        }
        return FieldValue.fromJson(fieldName, node);
    }

    private static boolean hasValue(@Nullable JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private void logKeyOperation(@Nonnull String title, @Nonnull Object... keysAndValues) {
        if (options.isDebug()) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of(title, withNamespace(keysAndValues)));
            }
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of(title, withNamespace(keysAndValues)));
        }
    }

    @Nonnull
    private Object[] withNamespace(@Nonnull Object[] keysAndValues) {
        Object[] result = Arrays.copyOf(keysAndValues, keysAndValues.length + 2);
        result[keysAndValues.length] = LogMessageKeys.NAMESPACE;
        result[keysAndValues.length + 1] = namespace;
        return result;
    }

    private static final class IndexEntry {
        @Nonnull
        private final String key;
        @Nonnull
        private final StoredRecord record;

        private IndexEntry(@Nonnull String key, @Nonnull StoredRecord record) {
            this.key = key;
            this.record = record;
        }
    }

    /**
     * Create a builder for a model of the given record class, serialized with Jackson by default.
     *
     * @param recordClass the class of the records
     * @param <M> type of record
     * @return a new builder
     */
    @Nonnull
    public static <M> Builder<M> newBuilder(@Nonnull Class<M> recordClass) {
        return new Builder<>(new JacksonRecordSerializer<>(recordClass));
    }

    @Nonnull
    public static <M> Builder<M> newBuilder(@Nonnull RecordSerializer<M> serializer) {
        return new Builder<>(serializer);
    }

    /**
     * A builder for {@link IndexedModel}.
     *
     * <pre><code>
     * IndexedModel&lt;User&gt; users = IndexedModel.newBuilder(User.class)
     *         .setStore(store)
     *         .setNamespace("users")
     *         .addIndex(Index.byEquality("email").asUnique())
     *         .build();
     * </code></pre>
     *
     * @param <M> type of record
     */
    public static class Builder<M> {
        @Nonnull
        private RecordSerializer<M> serializer;
        @Nullable
        private KeyValueStore store;
        @Nullable
        private String namespace;
        @Nonnull
        private final List<Index> indexes = new ArrayList<>();
        @Nonnull
        private ModelOptions options = ModelOptions.DEFAULT;
        private int lockStripes = LockRegistry.DEFAULT_STRIPES;

        protected Builder(@Nonnull RecordSerializer<M> serializer) {
            this.serializer = serializer;
        }

        @Nonnull
        public Builder<M> setStore(@Nonnull KeyValueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Set the namespace that starts every key of the model. Models sharing a store need different namespaces,
         * none of which may be a prefix of another followed by {@code ':'}.
         * @param namespace the namespace
         * @return this builder
         */
        @Nonnull
        public Builder<M> setNamespace(@Nonnull String namespace) {
            this.namespace = namespace;
            return this;
        }

        @Nonnull
        public Builder<M> addIndex(@Nonnull Index index) {
            indexes.add(index);
            return this;
        }

        @Nonnull
        public Builder<M> addIndexes(@Nonnull Index... newIndexes) {
            indexes.addAll(Arrays.asList(newIndexes));
            return this;
        }

        @Nonnull
        public Builder<M> setIndexes(@Nonnull Collection<Index> newIndexes) {
            indexes.clear();
            indexes.addAll(newIndexes);
            return this;
        }

        @Nonnull
        public Builder<M> setOptions(@Nonnull ModelOptions options) {
            this.options = options;
            return this;
        }

        @Nonnull
        public Builder<M> setSerializer(@Nonnull RecordSerializer<M> serializer) {
            this.serializer = serializer;
            return this;
        }

        /**
         * Set the number of lock stripes used to serialize saves and deletes.
         * @param lockStripes the number of stripes
         * @return this builder
         */
        @Nonnull
        public Builder<M> setLockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
            return this;
        }

        @Nonnull
        public IndexedModel<M> build() {
            Preconditions.checkState(store != null, "store must be set");
            Preconditions.checkState(namespace != null, "namespace must be set");
            Preconditions.checkState(lockStripes > 0, "lock stripes must be positive");
            IndexedModel<M> model = new IndexedModel<>(this);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("built indexed model",
                        LogMessageKeys.NAMESPACE, namespace,
                        LogMessageKeys.INDEX, model.indexMatcher.getCandidates()));
            }
            return model;
        }
    }
}
