/*
 * RecordSerializer.java
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

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;

/**
 * A converter between records and the blobs stored under their keys.
 *
 * <p>
 * Besides the blob, serializing a record yields the record's fields by name, which is what index keys are computed
 * from. The fields must be the same whether they come from {@link #serialize} or from {@link #parse} of the blob it
 * produced, or a changed record could leave stale keys behind.
 * </p>
 *
 * @param <M> type of record
 */
@API(API.Status.STABLE)
public interface RecordSerializer<M> {

    /**
     * Convert a record into its stored form.
     *
     * @param rec the record to serialize
     * @return the record's fields and blob
     * @throws io.kvindex.record.RecordSerializationException if the record cannot be serialized, or does not
     * serialize to an object
     */
    @Nonnull
    StoredRecord serialize(@Nonnull M rec);

    /**
     * Read the fields of a stored blob.
     *
     * @param serialized a blob produced by {@link #serialize}
     * @return the blob's fields and the blob itself
     * @throws io.kvindex.record.RecordSerializationException if the blob is not a serialized record
     */
    @Nonnull
    StoredRecord parse(@Nonnull byte[] serialized);

    /**
     * Convert a stored record back into a record.
     *
     * @param stored the stored form
     * @return the record
     * @throws io.kvindex.record.RecordSerializationException if the stored form does not describe a record
     */
    @Nonnull
    M deserialize(@Nonnull StoredRecord stored);
}
