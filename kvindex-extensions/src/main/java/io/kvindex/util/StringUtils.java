/*
 * StringUtils.java
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

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import java.util.Comparator;

/**
 * Utility methods for operating with {@link String}s.
 */
@API(API.Status.UNSTABLE)
public class StringUtils {
    /**
     * Orders strings by Unicode code point. This is the same order as comparing their UTF-8 encodings as
     * unsigned bytes, which is the native key order of the stores kvindex runs on. {@link String#compareTo(String)}
     * compares UTF-16 code units instead and disagrees for characters outside the Basic Multilingual Plane.
     */
    public static final Comparator<String> CODE_POINT_ORDER = StringUtils::compareByCodePoint;

    private StringUtils() {
    }

    /**
     * Compare two strings code point by code point.
     *
     * @param s1 the first string
     * @param s2 the second string
     * @return a negative number, zero or a positive number as {@code s1} sorts before, with or after {@code s2}
     * @see #CODE_POINT_ORDER
     */
    public static int compareByCodePoint(@Nonnull String s1, @Nonnull String s2) {
        int i1 = 0;
        int i2 = 0;
        while (i1 < s1.length() && i2 < s2.length()) {
            int c1 = s1.codePointAt(i1);
            int c2 = s2.codePointAt(i2);
            if (c1 != c2) {
                return Integer.compare(c1, c2);
            }
            i1 += Character.charCount(c1);
            i2 += Character.charCount(c2);
        }
        return Boolean.compare(i1 < s1.length(), i2 < s2.length());
    }

    /**
     * Upper-case the first letter of every word. A word starts after any character that is not a letter,
     * a digit or {@code '_'}, so {@code "email"} becomes {@code "Email"}, {@code "first name"} becomes
     * {@code "First Name"} and {@code "first_name"} becomes {@code "First_name"}.
     *
     * @param s the string to convert
     * @return {@code s} with the first letter of every word in title case
     */
    @Nonnull
    public static String titleCase(@Nonnull String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean atWordStart = true;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            sb.appendCodePoint(atWordStart ? Character.toTitleCase(cp) : cp);
            atWordStart = !(Character.isLetterOrDigit(cp) || cp == '_');
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
