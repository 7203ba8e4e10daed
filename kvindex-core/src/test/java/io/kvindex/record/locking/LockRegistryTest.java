/*
 * LockRegistryTest.java
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

package io.kvindex.record.locking;

import io.kvindex.test.Tags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LockRegistry}.
 */
public class LockRegistryTest {

    @Test
    void duplicateKeysLockOnce() {
        LockRegistry registry = new LockRegistry(4);
        try (LockRegistry.HeldLocks held = registry.acquire(List.of("a", "a", "a"))) {
            assertEquals(1, held.size());
        }
        // released, so acquiring again from this thread works
        try (LockRegistry.HeldLocks held = registry.acquire(List.of("a"))) {
            assertEquals(1, held.size());
        }
    }

    @Test
    void singleStripeSharesLock() {
        LockRegistry registry = new LockRegistry(1);
        try (LockRegistry.HeldLocks held = registry.acquire(List.of("a", "b", "c"))) {
            assertEquals(1, held.size());
        }
    }

    @Test
    @Tag(Tags.Concurrency)
    void mutualExclusion() throws Exception {
        LockRegistry registry = new LockRegistry();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                // overlapping key sets in different orders
                List<String> keys = i % 2 == 0 ? List.of("x", "y") : List.of("y", "x");
                futures.add(executor.submit(() -> {
                    try (LockRegistry.HeldLocks ignored = registry.acquire(keys)) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, maxInside.get());
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
}
