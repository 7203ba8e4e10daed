/*
 * TestDatabaseExtension.java
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

package io.kvindex.test;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.FDB;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Opens a FoundationDB {@link Database} for tests tagged {@link Tags#RequiresFDB}. Register it as a static
 * field so the database is opened once per test class:
 *
 * <pre>{@code
 *     @RegisterExtension
 *     static final TestDatabaseExtension dbExtension = new TestDatabaseExtension();
 * }</pre>
 *
 * <p>
 * The client API version comes from the {@value #API_VERSION_PROPERTY} system property and the cluster file from
 * {@value #CLUSTER_FILE_PROPERTY}. When the latter is unset the client's default cluster file is used.
 * </p>
 */
public class TestDatabaseExtension implements BeforeAllCallback, AfterAllCallback {
    public static final String API_VERSION_PROPERTY = "io.kvindex.apiVersion";
    public static final String CLUSTER_FILE_PROPERTY = "io.kvindex.clusterFile";
    private static final int MIN_API_VERSION = 630;
    private static final int MAX_API_VERSION = 710;

    @Nullable
    private static volatile FDB fdb;

    @Nullable
    private Database db;

    public static int getAPIVersion() {
        int apiVersion = Integer.parseInt(System.getProperty(API_VERSION_PROPERTY, Integer.toString(MAX_API_VERSION)));
        if (apiVersion < MIN_API_VERSION || apiVersion > MAX_API_VERSION) {
            throw new IllegalStateException("unsupported API version " + apiVersion
                                            + " (must be between " + MIN_API_VERSION + " and " + MAX_API_VERSION + ")");
        }
        return apiVersion;
    }

    @Nonnull
    private static FDB getFDB() {
        if (fdb == null) {
            synchronized (TestDatabaseExtension.class) {
                if (fdb == null) {
                    FDB inst = FDB.selectAPIVersion(getAPIVersion());
                    inst.setUnclosedWarning(true);
                    fdb = inst;
                }
            }
        }
        return Objects.requireNonNull(fdb);
    }

    @Override
    public void beforeAll(final ExtensionContext extensionContext) {
        getFDB();
    }

    @Nonnull
    public Database getDatabase() {
        if (db == null) {
            String clusterFile = System.getProperty(CLUSTER_FILE_PROPERTY);
            db = clusterFile == null ? getFDB().open() : getFDB().open(clusterFile);
        }
        return db;
    }

    @Override
    public void afterAll(final ExtensionContext extensionContext) {
        if (db != null) {
            db.close();
            db = null;
        }
    }
}
