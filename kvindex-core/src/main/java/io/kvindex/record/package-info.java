/*
 * package-info.java
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

/**
 * Secondary indexes over a key-value store.
 *
 * <p>
 * An {@link io.kvindex.record.IndexedModel} stores records of one type in a {@link io.kvindex.store.KeyValueStore}
 * under a namespace. Each record is written once under its identity and once under every declared
 * {@link io.kvindex.record.metadata.Index}, with keys that sort in the index's order, so that
 * {@link io.kvindex.record.query.Query queries} can be answered with a single prefix scan.
 * </p>
 *
 * <p>
 * All exceptions thrown by the model extend {@link io.kvindex.record.IndexedModelException}.
 * </p>
 */
package io.kvindex.record;
