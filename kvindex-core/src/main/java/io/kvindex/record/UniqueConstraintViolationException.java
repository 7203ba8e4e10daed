/*
 * UniqueConstraintViolationException.java
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
import io.kvindex.record.logging.LogMessageKeys;
import io.kvindex.record.metadata.Index;

import javax.annotation.Nonnull;

/**
 * An exception thrown when there is an attempt to save a record with a value that a unique index already holds
 * for a record with a different identity. Nothing has been written when this is thrown.
 */
@API(API.Status.STABLE)
@SuppressWarnings({"serial", "squid:S1948"})
public class UniqueConstraintViolationException extends IndexedModelException {
    @Nonnull
    private final Index index;
    @Nonnull
    private final String value;
    @Nonnull
    private final String identity;
    @Nonnull
    private final String existingIdentity;

    public UniqueConstraintViolationException(@Nonnull Index index, @Nonnull String value,
                                              @Nonnull String identity, @Nonnull String existingIdentity) {
        super("Duplicate entry for unique index",
                LogMessageKeys.INDEX, index,
                LogMessageKeys.FIELD_NAME, index.getFieldName(),
                LogMessageKeys.FIELD_VALUE, value,
                LogMessageKeys.IDENTITY, identity,
                LogMessageKeys.EXISTING_IDENTITY, existingIdentity);
        this.index = index;
        this.value = value;
        this.identity = identity;
        this.existingIdentity = existingIdentity;
    }

    /**
     * Get the unique index that would have been violated.
     * @return the index
     */
    @Nonnull
    public Index getIndex() {
        return index;
    }

    /**
     * Get the value both records have for the index's field.
     * @return the duplicated value
     */
    @Nonnull
    public String getValue() {
        return value;
    }

    /**
     * Get the identity of the record that was being saved.
     * @return the identity of the rejected record
     */
    @Nonnull
    public String getIdentity() {
        return identity;
    }

    /**
     * Get the identity of the record that already holds the value.
     * @return the identity of the existing record
     */
    @Nonnull
    public String getExistingIdentity() {
        return existingIdentity;
    }
}
