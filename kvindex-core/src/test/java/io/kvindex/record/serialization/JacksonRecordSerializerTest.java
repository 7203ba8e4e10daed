/*
 * JacksonRecordSerializerTest.java
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

package io.kvindex.record.serialization;

import io.kvindex.record.RecordSerializationException;
import io.kvindex.record.User;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link JacksonRecordSerializer}.
 */
public class JacksonRecordSerializerTest {
    private final JacksonRecordSerializer<User> serializer = new JacksonRecordSerializer<>(User.class);

    @Test
    void serializeExposesFields() {
        User user = new User("1", "Ann", "a@x.com", "Paris", 30L);
        user.score = 0.5;
        user.active = true;
        StoredRecord stored = serializer.serialize(user);
        assertEquals("1", stored.getField("id").textValue());
        assertEquals(30L, stored.getField("age").longValue());
        assertTrue(stored.getField("age").isIntegralNumber());
        assertEquals("0.5", stored.getField("score").asText());
        assertTrue(stored.getField("active").booleanValue());
        assertEquals(user, serializer.deserialize(stored));
    }

    @Test
    void parseMatchesSerialize() {
        User user = User.withAge("2", 5);
        user.score = 1e21;
        StoredRecord stored = serializer.serialize(user);
        StoredRecord parsed = serializer.parse(stored.getBlob());
        assertEquals(stored.getFields(), parsed.getFields());
        assertArrayEquals(stored.getBlob(), parsed.getBlob());
        assertEquals(user, serializer.deserialize(parsed));
    }

    @Test
    void nullFieldsAreLeftOut() {
        StoredRecord stored = serializer.serialize(User.withEmail("3", "c@x.com"));
        assertFalse(stored.getFields().has("age"));
    }

    @Test
    void notAnObject() {
        assertThrows(RecordSerializationException.class, () -> serializer.parse("[1,2]".getBytes(StandardCharsets.UTF_8)));
        assertThrows(RecordSerializationException.class, () -> serializer.parse("{".getBytes(StandardCharsets.UTF_8)));
        assertThrows(RecordSerializationException.class, () -> serializer.parse(new byte[0]));
        JacksonRecordSerializer<String> strings = new JacksonRecordSerializer<>(String.class);
        assertThrows(RecordSerializationException.class, () -> strings.serialize("plain"));
    }

    @Test
    void wrongShapeFailsToDeserialize() {
        StoredRecord stored = serializer.parse("{\"id\":\"1\",\"age\":\"old\"}".getBytes(StandardCharsets.UTF_8));
        assertThrows(RecordSerializationException.class, () -> serializer.deserialize(stored));
    }
}
