/*
 * IndexMatcher.java
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

package io.kvindex.record.query;

import com.google.common.collect.ImmutableList;
import io.kvindex.annotation.API;
import io.kvindex.record.NoMatchingIndexException;
import io.kvindex.record.logging.LogMessageKeys;
import io.kvindex.record.metadata.Index;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Finds the index that answers a {@link Query}. The declared indexes are tried in order, followed by the identity
 * index, and the first one with the query's field, type and order type wins.
 */
@API(API.Status.INTERNAL)
public class IndexMatcher {
    @Nonnull
    private final List<Index> candidates;

    public IndexMatcher(@Nonnull List<Index> declaredIndexes, @Nonnull Index identityIndex) {
        this.candidates = ImmutableList.<Index>builder().addAll(declaredIndexes).add(identityIndex).build();
    }

    /**
     * Get every index this matcher considers, the identity index last.
     * @return the candidate indexes in match order
     */
    @Nonnull
    public List<Index> getCandidates() {
        return candidates;
    }

    @Nonnull
    public Index match(@Nonnull Query query) {
        for (Index index : candidates) {
            if (index.hasShape(query.getFieldName(), query.getType(), query.getOrderType())) {
                return index;
            }
        }
        throw new NoMatchingIndexException("query does not match any index",
                LogMessageKeys.FIELD_NAME, query.getFieldName(),
                LogMessageKeys.INDEX_TYPE, query.getType(),
                LogMessageKeys.ORDER_TYPE, query.getOrderType(),
                LogMessageKeys.ORDER_FIELD_NAME, query.getOrder().getFieldName());
    }
}
