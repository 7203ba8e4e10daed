/*
 * FieldValue.java
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

package io.kvindex.record.encoding;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvindex.annotation.API;
import io.kvindex.record.UnsupportedEncodingException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A field value that can be encoded into an index key. There are exactly four kinds; anything else is rejected
 * with {@link UnsupportedEncodingException} when the value is created.
 */
@API(API.Status.INTERNAL)
public final class FieldValue {
    /**
     * The supported kinds of value.
     */
    public enum Kind {
        STRING,
        /** A whole number that fits in a {@code long}. */
        INTEGER,
        /** Any other number, kept with its text as serialized. */
        FLOAT,
        BOOLEAN
    }

    @Nonnull
    private final Kind kind;
    @Nonnull
    private final Object value;
    @Nonnull
    private final String text;

    private FieldValue(@Nonnull Kind kind, @Nonnull Object value, @Nonnull String text) {
        this.kind = kind;
        this.value = value;
        this.text = text;
    }

    @Nonnull
    public static FieldValue ofString(@Nonnull String value) {
        return new FieldValue(Kind.STRING, value, value);
    }

    @Nonnull
    public static FieldValue ofInteger(long value) {
        return new FieldValue(Kind.INTEGER, value, Long.toString(value));
    }

    @Nonnull
    public static FieldValue ofFloat(double value, @Nonnull String text) {
        return new FieldValue(Kind.FLOAT, value, text);
    }

    @Nonnull
    public static FieldValue ofBoolean(boolean value) {
        return new FieldValue(Kind.BOOLEAN, value, Boolean.toString(value));
    }

    /**
     * Get the value of a field of a serialized record.
     *
     * @param fieldName the name of the field, for error reporting
     * @param node the field's node, or {@code null} if the record does not have the field
     * @return the field value
     * @throws UnsupportedEncodingException if the node is missing, null, or not a scalar
     */
    @Nonnull
    public static FieldValue fromJson(@Nonnull String fieldName, @Nullable JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new UnsupportedEncodingException("field is missing", fieldName, "MISSING");
        }
        if (node.isTextual()) {
            return ofString(node.textValue());
        }
        if (node.isBoolean()) {
            return ofBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return ofInteger(node.longValue());
        }
        if (node.isNumber()) {
            return ofFloat(node.doubleValue(), node.asText());
        }
        throw new UnsupportedEncodingException("field value has no key encoding", fieldName, node.getNodeType().name());
    }

    /**
     * Get the value given in a query.
     *
     * @param fieldName the name of the queried field, for error reporting
     * @param value a string, boxed number, boolean or {@link JsonNode}
     * @return the field value
     * @throws UnsupportedEncodingException if the value is of any other type
     */
    @Nonnull
    public static FieldValue fromObject(@Nonnull String fieldName, @Nullable Object value) {
        if (value instanceof FieldValue) {
            return (FieldValue)value;
        }
        if (value instanceof JsonNode) {
            return fromJson(fieldName, (JsonNode)value);
        }
        if (value instanceof String) {
            return ofString((String)value);
        }
        if (value instanceof Boolean) {
            return ofBoolean((Boolean)value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ofInteger(((Number)value).longValue());
        }
        if (value instanceof BigInteger && ((BigInteger)value).bitLength() < Long.SIZE) {
            return ofInteger(((BigInteger)value).longValue());
        }
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            return ofFloat(((Number)value).doubleValue(), value.toString());
        }
        if (value instanceof Double || value instanceof Float) {
            return ofFloat(((Number)value).doubleValue(), value.toString());
        }
        throw new UnsupportedEncodingException("query value has no key encoding", fieldName,
                value == null ? "NULL" : value.getClass().getSimpleName());
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public String getString() {
        return (String)value;
    }

    public long getLong() {
        return (Long)value;
    }

    public double getDouble() {
        return (Double)value;
    }

    /**
     * Get the value as it appears verbatim in keys: the string itself, or the number or boolean as text.
     * @return the value's text
     */
    @Nonnull
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldValue that = (FieldValue)o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
