/*
 * OrderedStringEncoderTest.java
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

import io.kvindex.record.metadata.OrderType;
import io.kvindex.test.ParameterizedTestUtils;
import io.kvindex.util.StringUtils;
import org.junit.jupiter.api.Named;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link OrderedStringEncoder}.
 */
public class OrderedStringEncoderTest {
    private static final String MAX = new String(Character.toChars(Character.MAX_CODE_POINT));

    static Stream<Named<Boolean>> base32Armor() {
        return ParameterizedTestUtils.booleans("base32Armor");
    }

    @Nonnull
    private static String reversed(char c) {
        return new String(Character.toChars(Character.MAX_CODE_POINT - c));
    }

    @Test
    void ascendingPadsWithSpaces() {
        assertEquals("abc  ", OrderedStringEncoder.encode("abc", OrderType.ASCENDING, 5, false));
        assertEquals("abcdef", OrderedStringEncoder.encode("abcdef", OrderType.ASCENDING, 5, false));
        assertEquals("     ", OrderedStringEncoder.encode("", OrderType.ASCENDING, 5, false));
    }

    @Test
    void ascendingCountsCodePoints() {
        String smile = new String(Character.toChars(0x1F600));
        assertEquals(smile + " ", OrderedStringEncoder.encode(smile, OrderType.ASCENDING, 2, false));
    }

    @Test
    void ascendingIgnoresArmor() {
        assertEquals("ab  ", OrderedStringEncoder.encode("ab", OrderType.ASCENDING, 4, true));
    }

    @Test
    void descendingReversesCodePoints() {
        assertEquals(reversed('a') + MAX, OrderedStringEncoder.encode("a", OrderType.DESCENDING, 2, false));
        assertEquals(reversed('a') + reversed('b'), OrderedStringEncoder.encode("ab", OrderType.DESCENDING, 1, false));
    }

    @Test
    void descendingArmor() {
        // UTF-8 of U+10FFFE-'a', U+10FFFF in base32hex is "UI7RT7NKHUVRU===".
        assertEquals("UI7RT7NKHUVRU000", OrderedStringEncoder.encode("a", OrderType.DESCENDING, 2, true));
        assertEquals("UI7RVFO0", OrderedStringEncoder.encode("", OrderType.DESCENDING, 1, true));
    }

    @Test
    void unorderedIsVerbatim() {
        assertEquals("Hello, World", OrderedStringEncoder.encode("Hello, World", OrderType.UNORDERED, 40, true));
    }

    @Test
    void padLengthKeepsOrderAcrossSeparator() {
        // keys continue with ":<id>" after the fragment, and '0' sorts before ':'
        String a = OrderedStringEncoder.encode("a", OrderType.ASCENDING, 4, false) + ":1";
        String a0 = OrderedStringEncoder.encode("a0", OrderType.ASCENDING, 4, false) + ":2";
        assertTrue(StringUtils.compareByCodePoint(a, a0) < 0);

        String shortA = OrderedStringEncoder.encode("a", OrderType.ASCENDING, 1, false) + ":1";
        String shortA0 = OrderedStringEncoder.encode("a0", OrderType.ASCENDING, 1, false) + ":2";
        assertTrue(StringUtils.compareByCodePoint(shortA0, shortA) < 0, "pad length too short to keep order");
    }

    @Nonnull
    private static List<String> randomStrings(long seed) {
        Random random = new Random(seed);
        TreeSet<String> strings = new TreeSet<>(StringUtils.CODE_POINT_ORDER);
        while (strings.size() < 200) {
            int length = random.nextInt(12);
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                // mostly ascii letters, some accented Latin and CJK
                int pick = random.nextInt(10);
                if (pick < 7) {
                    sb.append((char)('a' + random.nextInt(3)));
                } else if (pick < 9) {
                    sb.append((char)(0xE0 + random.nextInt(8)));
                } else {
                    sb.append((char)(0x4E00 + random.nextInt(8)));
                }
            }
            strings.add(sb.toString());
        }
        return new ArrayList<>(strings);
    }

    @Test
    void ascendingPreservesOrder() {
        List<String> sorted = randomStrings(0x5eedL);
        List<String> encodedOrder = sorted.stream()
                .sorted(Comparator.comparing(s -> OrderedStringEncoder.encode(s, OrderType.ASCENDING, 16, false) + ":x", StringUtils.CODE_POINT_ORDER))
                .collect(Collectors.toList());
        assertEquals(sorted, encodedOrder);
    }

    @ParameterizedTest(name = "descendingReversesOrder[{0}]")
    @MethodSource("base32Armor")
    void descendingReversesOrder(boolean base32Armor) {
        List<String> reverseSorted = randomStrings(0xfeedL);
        reverseSorted.sort(StringUtils.CODE_POINT_ORDER.reversed());
        List<String> encodedOrder = reverseSorted.stream()
                .sorted(Comparator.comparing(s -> OrderedStringEncoder.encode(s, OrderType.DESCENDING, 16, base32Armor) + ":x", StringUtils.CODE_POINT_ORDER))
                .collect(Collectors.toList());
        assertEquals(reverseSorted, encodedOrder);
    }
}
