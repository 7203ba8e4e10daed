/*
 * LockRegistry.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import io.kvindex.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * In-process mutual exclusion for keys of a model. Keys are hashed onto a fixed number of stripes, so unrelated
 * keys may occasionally share a lock. Several keys are always locked in stripe order, so two callers asking for
 * overlapping sets of keys cannot deadlock.
 */
@API(API.Status.INTERNAL)
public class LockRegistry {
    public static final int DEFAULT_STRIPES = 64;

    @Nonnull
    private final Striped<Lock> stripes;

    public LockRegistry() {
        this(DEFAULT_STRIPES);
    }

    public LockRegistry(int stripeCount) {
        this.stripes = Striped.lock(stripeCount);
    }

    /**
     * Block until every given key is locked.
     *
     * @param keys the keys to lock; duplicates are allowed
     * @return the held locks, to be closed when done
     */
    @Nonnull
    public HeldLocks acquire(@Nonnull Iterable<String> keys) {
        List<Lock> locks = ImmutableList.copyOf(stripes.bulkGet(keys));
        ImmutableList.Builder<Lock> acquired = ImmutableList.builder();
        Lock previous = null;
        try {
            for (Lock lock : locks) {
                // bulkGet sorts by stripe, so duplicates are adjacent
                if (lock != previous) {
                    lock.lock();
                    acquired.add(lock);
                    previous = lock;
                }
            }
        } catch (RuntimeException ex) {
            new HeldLocks(acquired.build()).close();
            throw ex;
        }
        return new HeldLocks(acquired.build());
    }

    /**
     * A set of locks taken by {@link #acquire}. Closing it releases them in reverse order.
     */
    public static class HeldLocks implements AutoCloseable {
        @Nonnull
        private final ImmutableList<Lock> locks;

        private HeldLocks(@Nonnull ImmutableList<Lock> locks) {
            this.locks = locks;
        }

        public int size() {
            return locks.size();
        }

        @Override
        public void close() {
            for (Lock lock : locks.reverse()) {
                lock.unlock();
            }
        }
    }
}
