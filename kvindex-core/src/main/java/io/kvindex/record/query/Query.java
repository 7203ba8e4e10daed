/*
 * Query.java
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

package io.kvindex.record.query;

import com.google.common.base.Preconditions;
import io.kvindex.annotation.API;
import io.kvindex.record.metadata.IndexOrder;
import io.kvindex.record.metadata.IndexTypes;
import io.kvindex.record.metadata.OrderType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A request to find records by the value of one field.
 *
 * <p>
 * A query names a field, an index type and an order direction, and is answered by the first index with the same
 * three (see {@link IndexMatcher}). The value is what the field must equal; a {@code null} value lists every record
 * in the index. {@code offset} and {@code limit} trim the results of a list; a limit of {@code 0} means no limit.
 * </p>
 *
 * <p>
 * Queries are immutable.
 * </p>
 */
@API(API.Status.STABLE)
public class Query {
    @Nonnull
    private final String fieldName;
    @Nonnull
    private final String type;
    @Nonnull
    private final IndexOrder order;
    @Nullable
    private final Object value;
    private final long offset;
    private final long limit;

    public Query(@Nonnull String fieldName, @Nonnull String type, @Nonnull IndexOrder order, @Nullable Object value) {
        this(fieldName, type, order, value, 0L, 0L);
    }

    public Query(@Nonnull String fieldName, @Nonnull String type, @Nonnull IndexOrder order, @Nullable Object value,
                 long offset, long limit) {
        Preconditions.checkArgument(offset >= 0, "offset must not be negative");
        Preconditions.checkArgument(limit >= 0, "limit must not be negative");
        this.fieldName = fieldName;
        this.type = type;
        this.order = order;
        this.value = value;
        this.offset = offset;
        this.limit = limit;
    }

    /**
     * An ascending equality query on a field.
     *
     * @param fieldName the field to filter on
     * @param value the value the field must have, or {@code null} to list all
     * @return a new query
     */
    @Nonnull
    public static Query equals(@Nonnull String fieldName, @Nullable Object value) {
        return equals(fieldName, value, OrderType.ASCENDING);
    }

    @Nonnull
    public static Query equals(@Nonnull String fieldName, @Nullable Object value, @Nonnull OrderType orderType) {
        return new Query(fieldName, IndexTypes.EQUALITY, IndexOrder.by(fieldName, orderType), value);
    }

    @Nonnull
    public String getFieldName() {
        return fieldName;
    }

    @Nonnull
    public String getType() {
        return type;
    }

    @Nonnull
    public IndexOrder getOrder() {
        return order;
    }

    @Nonnull
    public OrderType getOrderType() {
        return order.getType();
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public long getOffset() {
        return offset;
    }

    public long getLimit() {
        return limit;
    }

    @Nonnull
    public Query withValue(@Nullable Object newValue) {
        return new Query(fieldName, type, order, newValue, offset, limit);
    }

    @Nonnull
    public Query withOffset(long newOffset) {
        return new Query(fieldName, type, order, value, newOffset, limit);
    }

    @Nonnull
    public Query withLimit(long newLimit) {
        return new Query(fieldName, type, order, value, offset, newLimit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Query query = (Query)o;
        return offset == query.offset && limit == query.limit
                && fieldName.equals(query.fieldName)
                && type.equals(query.type)
                && order.equals(query.order)
                && Objects.equals(value, query.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, type, order, value, offset, limit);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append(fieldName).append(' ').append(type).append(' ').append(value)
                .append(" order ").append(order);
        if (offset > 0) {
            str.append(" offset ").append(offset);
        }
        if (limit > 0) {
            str.append(" limit ").append(limit);
        }
        return str.toString();
    }
}
