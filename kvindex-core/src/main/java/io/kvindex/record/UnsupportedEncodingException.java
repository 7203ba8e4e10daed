/*
 * UnsupportedEncodingException.java
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

import javax.annotation.Nonnull;

/**
 * Thrown when a field value cannot be encoded into an index key. This is the case for JSON null, missing fields,
 * objects and arrays, and for negative integers in an ordered index.
 */
@API(API.Status.STABLE)
@SuppressWarnings("serial")
public class UnsupportedEncodingException extends IndexedModelException {
    @Nonnull
    private final String fieldName;
    @Nonnull
    private final String valueType;

    public UnsupportedEncodingException(@Nonnull String msg, @Nonnull String fieldName, @Nonnull String valueType) {
        super(msg, LogMessageKeys.FIELD_NAME, fieldName, LogMessageKeys.VALUE_TYPE, valueType);
        this.fieldName = fieldName;
        this.valueType = valueType;
    }

    @Nonnull
    public String getFieldName() {
        return fieldName;
    }

    /**
     * Get the runtime type of the rejected value, such as {@code NULL}, {@code ARRAY} or {@code INTEGER}.
     * @return the name of the value's type
     */
    @Nonnull
    public String getValueType() {
        return valueType;
    }
}
