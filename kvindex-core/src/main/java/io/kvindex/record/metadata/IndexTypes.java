/*
 * IndexTypes.java
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

/**
 * The standard index types.
 *
 * An index type is just a string, so that a query can name a type no index has and fail to match rather than
 * fail to compile.
 */
@API(API.Status.STABLE)
public class IndexTypes {
    /**
     * An equality index: records are found by the exact value of one field, optionally ordered by another.
     */
    public static final String EQUALITY = "eq";

    private IndexTypes() {
    }
}
