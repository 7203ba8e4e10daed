/*
 * KeyValueStoreTestBase.java
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Behavior every {@link KeyValueStore} must have. Subclasses supply the store.
 */
public abstract class KeyValueStoreTestBase {
    protected KeyValueStore store;

    @Nonnull
    protected abstract KeyValueStore openStore();

    @BeforeEach
    void setUp() {
        store = openStore();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nonnull
    private static byte[] bytes(@Nonnull String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nonnull
    private List<String> scanKeys(@Nonnull String prefix) {
        return store.read(prefix, true).stream().map(KeyValue::getKey).collect(Collectors.toList());
    }

    @Test
    void writeThenExactRead() {
        store.write("ns:byId:1:1", bytes("one"));
        List<KeyValue> results = store.read("ns:byId:1:1", false);
        assertEquals(1, results.size());
        assertEquals("ns:byId:1:1", results.get(0).getKey());
        assertArrayEquals(bytes("one"), results.get(0).getValue());
    }

    @Test
    void exactReadOfMissingKey() {
        store.write("ns:byId:1:1", bytes("one"));
        assertThat(store.read("ns:byId:1", false), empty());
    }

    @Test
    void overwrite() {
        store.write("k", bytes("first"));
        store.write("k", bytes("second"));
        List<KeyValue> results = store.read("k", false);
        assertEquals(1, results.size());
        assertArrayEquals(bytes("second"), results.get(0).getValue());
    }

    @Test
    void delete() {
        store.write("k", bytes("value"));
        store.delete("k");
        assertThat(store.read("k", false), empty());
        // deleting again is not an error
        store.delete("k");
    }

    @Test
    void prefixScanReturnsKeysInOrder() {
        store.write("ns:byAge:0000000000000000030:1", bytes("a"));
        store.write("ns:byAge:0000000000000000005:2", bytes("b"));
        store.write("ns:byAge:0000000000000000017:3", bytes("c"));
        store.write("ns:byAgf:0000000000000000001:4", bytes("d"));
        store.write("ns:byAe:0000000000000000001:5", bytes("e"));
        assertThat(scanKeys("ns:byAge:"), contains(
                "ns:byAge:0000000000000000005:2",
                "ns:byAge:0000000000000000017:3",
                "ns:byAge:0000000000000000030:1"));
    }

    @Test
    void prefixScanOrdersByCodePoint() {
        String high = "p:" + new String(Character.toChars(0x10FFFE));
        String bmp = "p:\uFFFD";
        String ascii = "p:z";
        store.write(high, bytes("high"));
        store.write(bmp, bytes("bmp"));
        store.write(ascii, bytes("ascii"));
        assertThat(scanKeys("p:"), contains(ascii, bmp, high));
    }

    @Test
    void prefixScanWithNoMatches() {
        store.write("a:1", bytes("1"));
        assertThat(store.read("b:", true), empty());
    }
}
