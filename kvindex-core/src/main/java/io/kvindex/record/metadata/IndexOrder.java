/*
 * IndexOrder.java
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

package io.kvindex.record.metadata;

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The ordering part of an {@link Index} or {@link io.kvindex.record.query.Query}: which field the keys are ordered
 * by, and in which direction. A {@code null} field name means the index's own field.
 */
@API(API.Status.STABLE)
public class IndexOrder {
    @Nullable
    private final String fieldName;
    @Nonnull
    private final OrderType type;

    public IndexOrder(@Nullable String fieldName, @Nonnull OrderType type) {
        this.fieldName = fieldName;
        this.type = type;
    }

    @Nonnull
    public static IndexOrder of(@Nonnull OrderType type) {
        return new IndexOrder(null, type);
    }

    @Nonnull
    public static IndexOrder by(@Nonnull String fieldName, @Nonnull OrderType type) {
        return new IndexOrder(fieldName, type);
    }

    @Nullable
    public String getFieldName() {
        return fieldName;
    }

    @Nonnull
    public OrderType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexOrder that = (IndexOrder)o;
        return Objects.equals(fieldName, that.fieldName) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, type);
    }

    @Override
    public String toString() {
        return fieldName == null ? type.toString() : (type + "(" + fieldName + ")");
    }
}
