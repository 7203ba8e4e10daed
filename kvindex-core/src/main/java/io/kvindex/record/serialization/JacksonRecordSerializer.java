/*
 * JacksonRecordSerializer.java
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

package io.kvindex.record.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvindex.annotation.API;
import io.kvindex.record.RecordSerializationException;
import io.kvindex.record.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Serialize records as JSON with Jackson.
 *
 * <p>
 * The fields of a new record are read back from the bytes it was written as, rather than taken from the tree
 * Jackson builds directly, so that numbers have the same representation as when a stored blob is parsed later.
 * </p>
 *
 * @param <M> type of record
 */
@API(API.Status.STABLE)
public class JacksonRecordSerializer<M> implements RecordSerializer<M> {
    @Nonnull
    private final ObjectMapper mapper;
    @Nonnull
    private final Class<M> recordClass;

    public JacksonRecordSerializer(@Nonnull Class<M> recordClass) {
        this(new ObjectMapper(), recordClass);
    }

    public JacksonRecordSerializer(@Nonnull ObjectMapper mapper, @Nonnull Class<M> recordClass) {
        this.mapper = mapper;
        this.recordClass = recordClass;
    }

    @Nonnull
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Nonnull
    @Override
    public StoredRecord serialize(@Nonnull M rec) {
        final byte[] blob;
        try {
            blob = mapper.writeValueAsBytes(rec);
        } catch (JsonProcessingException ex) {
            throw new RecordSerializationException("cannot serialize record", ex)
                    .addLogInfo(LogMessageKeys.VALUE_TYPE, rec.getClass().getName());
        }
        return parse(blob);
    }

    @Nonnull
    @Override
    public StoredRecord parse(@Nonnull byte[] serialized) {
        final JsonNode tree;
        try {
            tree = mapper.readTree(serialized);
        } catch (IOException ex) {
            throw new RecordSerializationException("cannot parse stored record", ex)
                    .addLogInfo(LogMessageKeys.VALUE_SIZE, serialized.length);
        }
        if (tree == null || !tree.isObject()) {
            throw new RecordSerializationException("record is not a JSON object",
                    LogMessageKeys.VALUE_TYPE, tree == null ? "EMPTY" : tree.getNodeType().name());
        }
        return new StoredRecord((ObjectNode)tree, serialized);
    }

    @Nonnull
    @Override
    public M deserialize(@Nonnull StoredRecord stored) {
        try {
            return mapper.treeToValue(stored.getFields(), recordClass);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new RecordSerializationException("cannot deserialize record", ex)
                    .addLogInfo(LogMessageKeys.VALUE_TYPE, recordClass.getName());
        }
    }
}
