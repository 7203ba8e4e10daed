/*
 * IndexKeyEncoder.java
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
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import io.kvindex.annotation.API;
import io.kvindex.record.UnsupportedEncodingException;
import io.kvindex.record.metadata.Index;
import io.kvindex.record.metadata.OrderType;
import io.kvindex.util.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Builds the store keys of one model. A key is
 * <pre>
 *     namespace:indexPrefix[:filterValue]:orderValue[:identity]
 * </pre>
 * where the index prefix is {@code by<Field>}, {@code byOrdered<Field>} or {@code byDescOrdered<Field>} as the
 * index is unordered, ascending or descending, the filter value is present only when the index orders by a
 * different field than it filters on, and the identity is present on every written key.
 *
 * <p>
 * Scan keys end with the separator, so that scanning for {@code 1} does not also return {@code 10}.
 * </p>
 *
 * <p>
 * Fragments that are written verbatim (unordered values, filter values and identities) have the separator and
 * the escape character escaped with {@link #ESCAPE}, so none of them can end early. Ascending strings are not
 * escaped, which would change their order; a scan for an ascending value can therefore also return keys of
 * longer values that start with the value and a separator, and callers must check the value of what they read.
 * </p>
 */
@API(API.Status.INTERNAL)
public class IndexKeyEncoder {
    public static final char SEPARATOR = ':';
    public static final char ESCAPE = '\\';
    private static final Escaper FRAGMENT_ESCAPER = Escapers.builder()
            .addEscape(ESCAPE, "" + ESCAPE + ESCAPE)
            .addEscape(SEPARATOR, "" + ESCAPE + SEPARATOR)
            .build();
    private static final int INTEGER_WIDTH = 19;

    @Nonnull
    private final String namespace;

    public IndexKeyEncoder(@Nonnull String namespace) {
        this.namespace = namespace;
    }

    @Nonnull
    public String getNamespace() {
        return namespace;
    }

    /**
     * The name that identifies an index within a namespace.
     *
     * @param index the index
     * @return {@code by<Field>}, {@code byOrdered<Field>} or {@code byDescOrdered<Field>}
     */
    @Nonnull
    public static String indexPrefix(@Nonnull Index index) {
        String field = StringUtils.titleCase(index.getFieldName());
        switch (index.getOrderType()) {
            case ASCENDING:
                return "byOrdered" + field;
            case DESCENDING:
                return "byDescOrdered" + field;
            case UNORDERED:
            default:
                return "by" + field;
        }
    }

    /**
     * Encode the value of an index's order field.
     *
     * @param index the index
     * @param value the order field's value
     * @return the key fragment
     * @throws UnsupportedEncodingException if the value is a negative integer and the index is ordered
     */
    @Nonnull
    public static String encodeOrderValue(@Nonnull Index index, @Nonnull FieldValue value) {
        final String encoded = encodeValue(index, value);
        return index.getOrderType().isOrdered() ? encoded : escape(encoded);
    }

    /**
     * Escape a fragment that is written into a key verbatim.
     *
     * @param fragment the text of the fragment
     * @return the fragment with every separator and escape character preceded by {@link #ESCAPE}
     */
    @Nonnull
    public static String escape(@Nonnull String fragment) {
        return FRAGMENT_ESCAPER.escape(fragment);
    }

    @Nonnull
    private static String encodeValue(@Nonnull Index index, @Nonnull FieldValue value) {
        final OrderType orderType = index.getOrderType();
        switch (value.getKind()) {
            case STRING:
                return OrderedStringEncoder.encode(value.getString(), orderType, index.getStringPadLength(), index.isBase32Armor());
            case INTEGER:
                long l = value.getLong();
                if (l < 0 && orderType.isOrdered()) {
                    throw new UnsupportedEncodingException("negative integers cannot be ordered",
                            index.getOrderFieldName(), value.getKind().name());
                }
                return String.format(Locale.ROOT, "%0" + INTEGER_WIDTH + "d", orderType == OrderType.DESCENDING ? Long.MAX_VALUE - l : l);
            case FLOAT:
                // Unpadded, so values of different magnitudes do not sort correctly.
                return orderType == OrderType.DESCENDING ? Double.toString(Double.MAX_VALUE - value.getDouble()) : value.getText();
            case BOOLEAN:
            default:
                return value.getText();
        }
    }

    /**
     * The key a record is written under in an index.
     *
     * @param index the index
     * @param fields the serialized record
     * @param identity the record's identity
     * @return the full key
     * @throws UnsupportedEncodingException if an indexed field is missing or cannot be encoded
     */
    @Nonnull
    public String recordKey(@Nonnull Index index, @Nonnull JsonNode fields, @Nonnull FieldValue identity) {
        StringBuilder sb = new StringBuilder(prefixOf(index));
        if (index.hasSeparateOrderField()) {
            sb.append(SEPARATOR).append(escape(FieldValue.fromJson(index.getFieldName(), fields.get(index.getFieldName())).getText()));
        }
        FieldValue orderValue = FieldValue.fromJson(index.getOrderFieldName(), fields.get(index.getOrderFieldName()));
        sb.append(SEPARATOR).append(encodeOrderValue(index, orderValue));
        sb.append(SEPARATOR).append(escape(identity.getText()));
        return sb.toString();
    }

    /**
     * The prefix to scan to find records in an index.
     *
     * <p>
     * Without a value this covers the whole index. With a value it covers the records whose indexed field has that
     * value: for an index ordered by its own field the value is encoded the way it is on write, and for an index
     * ordered by another field the filter value is used escaped.
     * </p>
     *
     * @param index the index
     * @param value the value of the index's field, or {@code null} for the whole index
     * @return the scan prefix, ending with {@link #SEPARATOR}
     */
    @Nonnull
    public String scanKey(@Nonnull Index index, @Nullable FieldValue value) {
        StringBuilder sb = new StringBuilder(prefixOf(index));
        if (value != null) {
            sb.append(SEPARATOR);
            if (index.hasSeparateOrderField()) {
                sb.append(escape(value.getText()));
            } else {
                sb.append(encodeOrderValue(index, value));
            }
        }
        return sb.append(SEPARATOR).toString();
    }

    @Nonnull
    private String prefixOf(@Nonnull Index index) {
        return namespace + SEPARATOR + indexPrefix(index);
    }
}
