/*
 * KeyValue.java
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

package io.kvindex.store;

import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * One entry returned by {@link KeyValueStore#read(String, boolean)}. The value array is copied on the way in
 * and on the way out, so instances are immutable.
 */
@API(API.Status.STABLE)
public class KeyValue {
    @Nonnull
    private final String key;
    @Nonnull
    private final byte[] value;

    public KeyValue(@Nonnull String key, @Nonnull byte[] value) {
        this.key = key;
        this.value = value.clone();
    }

    @Nonnull
    public String getKey() {
        return key;
    }

    @Nonnull
    public byte[] getValue() {
        return value.clone();
    }

    public int getValueSize() {
        return value.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeyValue keyValue = (KeyValue)o;
        return key.equals(keyValue.key) && Arrays.equals(value, keyValue.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return key + "=" + value.length + " bytes";
    }
}
