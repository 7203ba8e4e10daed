/*
 * IndexOptions.java
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

import java.util.Collections;
import java.util.Map;

/**
 * The standard options for use with {@link Index}.
 *
 * An option key is just a string, so that options can be carried around and compared as a plain map.
 *
 * @see Index#getOptions
 */
@API(API.Status.UNSTABLE)
public class IndexOptions {

    /**
     * No options.
     *
     * The default for a new {@link Index}.
     */
    public static final Map<String, String> EMPTY_OPTIONS = Collections.emptyMap();

    /**
     * If {@code "true"}, saving a record whose value for the index's field is already held by a record with a
     * different identity fails with {@link io.kvindex.record.UniqueConstraintViolationException}.
     */
    public static final String UNIQUE_OPTION = "unique";
    /**
     * Options to set to enable {@link #UNIQUE_OPTION}.
     */
    public static final Map<String, String> UNIQUE_OPTIONS = Collections.singletonMap(UNIQUE_OPTION, Boolean.TRUE.toString());

    /**
     * The number of code points ordered string values are padded to. Strings at least this long are not padded,
     * and then no longer sort before longer strings that share their prefix, so this must be larger than any
     * string the index will see.
     */
    public static final String STRING_PAD_LENGTH_OPTION = "stringPadLength";
    /**
     * The pad length used when {@link #STRING_PAD_LENGTH_OPTION} is not set.
     */
    public static final int DEFAULT_STRING_PAD_LENGTH = 16;

    /**
     * If {@code "true"}, descending string values are written in base32hex rather than as reversed code points,
     * which are mostly unprintable. Only affects descending indexes.
     */
    public static final String BASE32_ARMOR_OPTION = "base32Armor";

    private IndexOptions() {
    }
}
