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

package io.kvindex.util;

import io.kvindex.annotation.API;

import java.util.Locale;

/**
 * {@link LoggableException} keys used by the store layer. All keys for this module are listed here so that
 * collisions and spelling drift are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    KEY,
    RESULT_COUNT,
    VALUE_SIZE,
    STORE,
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
