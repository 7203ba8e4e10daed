/*
 * Index.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.kvindex.annotation.API;
import io.kvindex.record.query.Query;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The definition of an index on one field of a record.
 *
 * <p>
 * An index has a field that records are filtered by, a type (only {@link IndexTypes#EQUALITY} for now) and an
 * {@link IndexOrder}. When the order names a different field, keys are grouped by the filter field and sorted by the
 * order field within each group. Everything else, such as uniqueness and string encoding, is held in the
 * {@linkplain #getOptions() options}; see {@link IndexOptions}.
 * </p>
 *
 * <p>
 * Indexes are immutable. The {@code as}/{@code with} methods return modified copies.
 * </p>
 */
@API(API.Status.STABLE)
public class Index {
    @Nonnull
    private final String fieldName;
    @Nonnull
    private final String type;
    @Nonnull
    private final IndexOrder order;
    @Nonnull
    private final Map<String, String> options;

    public Index(@Nonnull String fieldName, @Nonnull String type, @Nonnull IndexOrder order, @Nonnull Map<String, String> options) {
        Preconditions.checkArgument(!fieldName.isEmpty(), "index field name must not be empty");
        Preconditions.checkArgument(IndexTypes.EQUALITY.equals(type), "unsupported index type %s", type);
        this.fieldName = fieldName;
        this.type = type;
        this.order = order;
        this.options = ImmutableMap.copyOf(options);
        Preconditions.checkArgument(getStringPadLength() >= 0, "string pad length must not be negative");
    }

    /**
     * Create an equality index on a field, ordered ascending by that same field, with default string encoding.
     *
     * @param fieldName the field to index
     * @return a new index
     */
    @Nonnull
    public static Index byEquality(@Nonnull String fieldName) {
        return new Index(fieldName, IndexTypes.EQUALITY, IndexOrder.by(fieldName, OrderType.ASCENDING), IndexOptions.EMPTY_OPTIONS);
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

    /**
     * The field whose value is encoded into the ordered part of the key.
     * @return the order's field name, or this index's field when the order does not name one
     */
    @Nonnull
    public String getOrderFieldName() {
        return order.getFieldName() == null ? fieldName : order.getFieldName();
    }

    /**
     * Whether keys are filtered by one field and ordered by another.
     * @return {@code true} if the order field differs from the index field
     */
    public boolean hasSeparateOrderField() {
        return !fieldName.equals(getOrderFieldName());
    }

    @Nonnull
    public Map<String, String> getOptions() {
        return options;
    }

    @Nullable
    public String getOption(@Nonnull String key) {
        return options.get(key);
    }

    public boolean getBooleanOption(@Nonnull String key, boolean defaultValue) {
        final String option = getOption(key);
        if (option == null) {
            return defaultValue;
        } else {
            return Boolean.parseBoolean(option);
        }
    }

    public int getIntOption(@Nonnull String key, int defaultValue) {
        final String option = getOption(key);
        if (option == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(option);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("index option " + key + " is not an integer: " + option, ex);
        }
    }

    /**
     * Whether any two records with different identities must have different values for this index's field.
     * The default value for this is <code>false</code> if the option is not set explicitly.
     * @return the value of the "unique" option
     */
    public boolean isUnique() {
        return getBooleanOption(IndexOptions.UNIQUE_OPTION, false);
    }

    public int getStringPadLength() {
        return getIntOption(IndexOptions.STRING_PAD_LENGTH_OPTION, IndexOptions.DEFAULT_STRING_PAD_LENGTH);
    }

    public boolean isBase32Armor() {
        return getBooleanOption(IndexOptions.BASE32_ARMOR_OPTION, false);
    }

    /**
     * Whether this index has the same field, type and order type as the given shape. This is how queries and
     * indexes are matched; order field and options are not compared.
     *
     * @param otherFieldName field name to compare
     * @param otherType index type to compare
     * @param otherOrderType order type to compare
     * @return {@code true} if all three are equal
     */
    public boolean hasShape(@Nonnull String otherFieldName, @Nonnull String otherType, @Nonnull OrderType otherOrderType) {
        return fieldName.equals(otherFieldName) && type.equals(otherType) && order.getType() == otherOrderType;
    }

    @Nonnull
    public Index withOption(@Nonnull String key, @Nonnull String value) {
        Map<String, String> newOptions = new HashMap<>(options);
        newOptions.put(key, value);
        return new Index(fieldName, type, order, newOptions);
    }

    @Nonnull
    public Index asUnique() {
        return withOption(IndexOptions.UNIQUE_OPTION, Boolean.TRUE.toString());
    }

    @Nonnull
    public Index withOrder(@Nonnull IndexOrder newOrder) {
        return new Index(fieldName, type, newOrder, options);
    }

    /**
     * Change the direction, keeping the order field.
     * @param orderType the new direction
     * @return a copy of this index with the given order type
     */
    @Nonnull
    public Index withOrder(@Nonnull OrderType orderType) {
        return withOrder(new IndexOrder(order.getFieldName(), orderType));
    }

    @Nonnull
    public Index withStringPadLength(int stringPadLength) {
        Preconditions.checkArgument(stringPadLength >= 0, "string pad length must not be negative");
        return withOption(IndexOptions.STRING_PAD_LENGTH_OPTION, Integer.toString(stringPadLength));
    }

    @Nonnull
    public Index withBase32Armor(boolean base32Armor) {
        return withOption(IndexOptions.BASE32_ARMOR_OPTION, Boolean.toString(base32Armor));
    }

    /**
     * Build a query with exactly this index's shape. A {@code null} value lists every record in the index.
     * For an index with a separate order field, the value is the filter field's value.
     *
     * @param value the value to look up
     * @return a query that matches this index
     */
    @Nonnull
    public Query toQuery(@Nullable Object value) {
        return new Query(fieldName, type, order, value);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("Index {'").append(fieldName).append("'");
        if (!type.equals(IndexTypes.EQUALITY)) {
            str.append(", ").append(type);
        }
        str.append(", ").append(order);
        if (!options.isEmpty()) {
            str.append(", ").append(options);
        }
        str.append("}");
        return str.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || !getClass().equals(o.getClass())) {
            return false;
        }
        Index that = (Index) o;
        return this.fieldName.equals(that.fieldName)
                && this.type.equals(that.type)
                && this.order.equals(that.order)
                && this.options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, type, order);
    }
}
