/*
 * StoredRecord.java
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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A record as it is stored: its fields by name, and the blob written under each of its keys.
 */
@API(API.Status.STABLE)
public class StoredRecord {
    @Nonnull
    private final ObjectNode fields;
    @Nonnull
    private final byte[] blob;

    public StoredRecord(@Nonnull ObjectNode fields, @Nonnull byte[] blob) {
        this.fields = fields;
        this.blob = blob;
    }

    @Nonnull
    public ObjectNode getFields() {
        return fields;
    }

    /**
     * Get a field by name.
     * @param fieldName the field's name
     * @return the field's node, or {@code null} if the record has no such field
     */
    @Nullable
    public JsonNode getField(@Nonnull String fieldName) {
        return fields.get(fieldName);
    }

    @Nonnull
    public byte[] getBlob() {
        return blob;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
