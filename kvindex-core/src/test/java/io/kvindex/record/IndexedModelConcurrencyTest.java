/*
 * IndexedModelConcurrencyTest.java
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

package io.kvindex.record;

import io.kvindex.record.metadata.Index;
import io.kvindex.store.InMemoryKeyValueStore;
import io.kvindex.store.KeyValue;
import io.kvindex.test.Tags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Saves and deletes racing on one model.
 */
@Tag(Tags.Concurrency)
public class IndexedModelConcurrencyTest {
    private static final int THREADS = 8;
    private static final int ROUNDS = 50;
    private static final Index AGE = Index.byEquality("age");
    private static final Index EMAIL = Index.byEquality("email").asUnique();

    private InMemoryKeyValueStore store;
    private IndexedModel<User> users;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        users = IndexedModel.newBuilder(User.class)
                .setStore(store)
                .setNamespace("users")
                .addIndexes(AGE, EMAIL)
                .build();
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        store.close();
    }

    private List<Future<Void>> race(List<Callable<Void>> tasks) {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Void>> futures = new ArrayList<>(tasks.size());
        for (Callable<Void> task : tasks) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        return futures;
    }

    private List<String> keys(String prefix) {
        return store.read(prefix, true).stream().map(KeyValue::getKey).collect(Collectors.toList());
    }

    @Test
    void sameIdentityLeavesOneKeyPerIndex() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                final User user = new User("1", "Ann", "a" + i + "@x.com", null, (long)(round * THREADS + i));
                tasks.add(() -> {
                    users.save(user);
                    return null;
                });
            }
            for (Future<Void> future : race(tasks)) {
                future.get();
            }
            assertThat(keys("users:byId:"), hasSize(1));
            assertThat(keys("users:byOrderedAge:"), hasSize(1));
            assertThat(keys("users:byOrderedEmail:"), hasSize(1));
            User saved = users.read(ModelOptions.DEFAULT_ID_INDEX.toQuery("1"));
            assertEquals("1", users.read(AGE.toQuery(saved.age)).id);
            assertEquals("1", users.read(EMAIL.toQuery(saved.email)).id);
        }
    }

    @Test
    void uniqueValueGoesToOneRecord() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            final String email = "shared" + round + "@x.com";
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                final User user = User.withEmail(round + "-" + i, email);
                user.age = (long)i;
                tasks.add(() -> {
                    users.save(user);
                    return null;
                });
            }
            int succeeded = 0;
            for (Future<Void> future : race(tasks)) {
                try {
                    future.get();
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause(), instanceOf(UniqueConstraintViolationException.class));
                }
            }
            assertEquals(1, succeeded);
            assertThat(keys("users:byOrderedEmail:" + email), hasSize(1));
        }
        assertThat(keys("users:byId:"), hasSize(ROUNDS));
    }

    @Test
    void deleteRacingSaves() throws Exception {
        users.save(new User("1", "Ann", "a@x.com", null, 1L));
        List<Callable<Void>> tasks = new ArrayList<>();
        tasks.add(() -> {
            users.delete(ModelOptions.DEFAULT_ID_INDEX.toQuery("1"));
            return null;
        });
        for (int i = 2; i < THREADS; i++) {
            final User user = new User("1", "Ann", "a@x.com", null, (long)i);
            tasks.add(() -> {
                users.save(user);
                return null;
            });
        }
        for (Future<Void> future : race(tasks)) {
            future.get();
        }
        int records = keys("users:byId:").size();
        assertThat(keys("users:byOrderedAge:"), hasSize(records));
        assertThat(keys("users:byOrderedEmail:"), hasSize(records));
    }
}
