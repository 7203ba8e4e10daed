/*
 * OrderedStringEncoder.java
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

import com.google.common.io.BaseEncoding;
import io.kvindex.annotation.API;
import io.kvindex.record.metadata.OrderType;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;

/**
 * Encodes strings so that their keys sort in the order of an index.
 *
 * <p>
 * Ascending strings are padded on the right with spaces to a fixed number of code points, so that a string sorts
 * before any longer string it is a prefix of. Descending strings have each code point {@code c} replaced by
 * {@code U+10FFFF - c} and are padded with {@code U+10FFFF}, which reverses their order. A descending string may
 * additionally be armored with base32hex, whose alphabet is itself in ascending order; its {@code '='} padding
 * is replaced by {@code '0'}.
 * </p>
 *
 * <p>
 * Strings that are already as long as the pad length are not truncated, so an index whose pad length is shorter
 * than its values does not keep them in order. Reversing a code point in {@code U+102000..U+1027FF} yields a
 * surrogate, which has no UTF-8 encoding of its own; such values do not round-trip through a byte-keyed store.
 * </p>
 */
@API(API.Status.INTERNAL)
public class OrderedStringEncoder {
    private static final int ASCENDING_PAD = ' ';
    private static final int DESCENDING_PAD = Character.MAX_CODE_POINT;
    private static final BaseEncoding BASE32_HEX = BaseEncoding.base32Hex();

    private OrderedStringEncoder() {
    }

    /**
     * Encode a string value for an index.
     *
     * @param value the string to encode
     * @param orderType the index's order
     * @param padLength number of code points to pad to; ignored for unordered indexes
     * @param base32Armor whether to base32hex encode descending values
     * @return the key fragment
     */
    @Nonnull
    public static String encode(@Nonnull String value, @Nonnull OrderType orderType, int padLength, boolean base32Armor) {
        switch (orderType) {
            case ASCENDING:
                return pad(new StringBuilder(value), value.codePointCount(0, value.length()), padLength, ASCENDING_PAD);
            case DESCENDING:
                String reversed = reverse(value, padLength);
                return base32Armor ? armor(reversed) : reversed;
            case UNORDERED:
            default:
                return value;
        }
    }

    @Nonnull
    private static String reverse(@Nonnull String value, int padLength) {
        StringBuilder sb = new StringBuilder(value.length() * 2);
        int count = 0;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            sb.appendCodePoint(Character.MAX_CODE_POINT - cp);
            i += Character.charCount(cp);
            count++;
        }
        return pad(sb, count, padLength, DESCENDING_PAD);
    }

    @Nonnull
    private static String pad(@Nonnull StringBuilder sb, int codePoints, int padLength, int padCodePoint) {
        for (int i = codePoints; i < padLength; i++) {
            sb.appendCodePoint(padCodePoint);
        }
        return sb.toString();
    }

    @Nonnull
    private static String armor(@Nonnull String reversed) {
        return BASE32_HEX.encode(reversed.getBytes(StandardCharsets.UTF_8)).replace('=', '0');
    }
}
