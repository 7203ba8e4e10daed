/*
 * StringUtilsTest.java
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

package io.kvindex.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests of the {@link StringUtils} utility class.
 */
public class StringUtilsTest {
    static Stream<Arguments> titleCase() {
        return Stream.of(
                Arguments.of("", ""),
                Arguments.of("id", "Id"),
                Arguments.of("email", "Email"),
                Arguments.of("Email", "Email"),
                Arguments.of("first name", "First Name"),
                Arguments.of("first_name", "First_name"),
                Arguments.of("user.email", "User.Email"),
                Arguments.of("\u00e9mile", "\u00c9mile"),
                Arguments.of("2fa", "2fa")
        );
    }

    @ParameterizedTest(name = "titleCase[{0}]")
    @MethodSource
    void titleCase(String s, String expected) {
        assertEquals(expected, StringUtils.titleCase(s));
    }

    @Test
    void codePointOrderAgreesWithUtf8ForSupplementaryCharacters() {
        // U+FFFD is one UTF-16 unit; U+1F600 is a surrogate pair starting with 0xD83D, which is less than 0xFFFD.
        String bmp = "\uFFFD";
        String supplementary = new String(Character.toChars(0x1F600));
        assertTrue(bmp.compareTo(supplementary) > 0);
        assertTrue(StringUtils.compareByCodePoint(bmp, supplementary) < 0);
        assertTrue(StringUtils.CODE_POINT_ORDER.compare(supplementary, bmp) > 0);
    }

    @Test
    void prefixSortsFirst() {
        assertTrue(StringUtils.compareByCodePoint("ns:byAge", "ns:byAge:") < 0);
        assertTrue(StringUtils.compareByCodePoint("ns:byAge:", "ns:byAge") > 0);
        assertEquals(0, StringUtils.compareByCodePoint("ns:byAge", "ns:byAge"));
    }

    @Test
    void sortByCodePoint() {
        List<String> strings = new ArrayList<>(Arrays.asList("b", "a ", "a", "\u00e9", "A", new String(Character.toChars(0x10FFFF)), "\uFFFF"));
        strings.sort(StringUtils.CODE_POINT_ORDER);
        assertEquals(Arrays.asList("A", "a", "a ", "b", "\u00e9", "\uFFFF", new String(Character.toChars(0x10FFFF))), strings);
    }
}
