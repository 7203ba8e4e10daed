/*
 * LogMessageKeys.java
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

package io.kvindex.record.logging;

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;

/**
 * Common {@link KeyValueLogMessage} keys, also used for {@link io.kvindex.util.LoggableException} log info.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    NAMESPACE("namespace"),
    // index and query shape
    INDEX("index"),
    INDEX_TYPE("index_type"),
    FIELD_NAME("field_name"),
    ORDER_FIELD_NAME("order_field_name"),
    ORDER_TYPE("order_type"),
    // values
    FIELD_VALUE("field_value"),
    VALUE_TYPE("value_type"),
    IDENTITY("identity"),
    EXISTING_IDENTITY("existing_identity"),
    // keys and scans
    KEY("key"),
    OLD_KEY("old_key"),
    SCAN_KEY("scan_key"),
    RESULT_COUNT("result_count"),
    SKIPPED_COUNT("skipped_count"),
    VALUE_SIZE("value_size"),
    OFFSET("offset"),
    LIMIT("limit");

    private final String logKey;

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
