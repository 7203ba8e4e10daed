/*
 * OrderType.java
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
 * How the keys of an {@link Index} are ordered by the value of its order field.
 */
@API(API.Status.STABLE)
public enum OrderType {
    /**
     * Values are written verbatim. Suitable for exact lookups only.
     */
    UNORDERED,
    /**
     * Values are encoded so that a prefix scan returns them smallest first.
     */
    ASCENDING,
    /**
     * Values are encoded so that a prefix scan returns them largest first.
     */
    DESCENDING;

    public boolean isOrdered() {
        return this != UNORDERED;
    }
}
