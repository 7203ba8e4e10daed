/*
 * ModelOptions.java
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

import io.kvindex.annotation.API;
import io.kvindex.record.metadata.Index;
import io.kvindex.record.metadata.OrderType;

import javax.annotation.Nonnull;

/**
 * Options for an {@link IndexedModel}.
 */
@API(API.Status.STABLE)
public class ModelOptions {
    /**
     * The identity index used unless another is set: an unordered equality index on {@code id}.
     */
    @Nonnull
    public static final Index DEFAULT_ID_INDEX = Index.byEquality("id").withOrder(OrderType.UNORDERED);
    @Nonnull
    public static final ModelOptions DEFAULT = newBuilder().build();

    private final boolean debug;
    @Nonnull
    private final Index idIndex;

    private ModelOptions(boolean debug, @Nonnull Index idIndex) {
        this.debug = debug;
        this.idIndex = idIndex;
    }

    /**
     * Whether every key written, scanned or deleted is logged at {@code INFO} rather than {@code DEBUG}.
     * @return {@code true} if key operations are logged at {@code INFO}
     */
    public boolean isDebug() {
        return debug;
    }

    @Nonnull
    public Index getIdIndex() {
        return idIndex;
    }

    @Nonnull
    public String getIdentityFieldName() {
        return idIndex.getFieldName();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ModelOptions{debug=" + debug + ", idIndex=" + idIndex + "}";
    }

    /**
     * A builder for {@link ModelOptions}.
     */
    public static class Builder {
        private boolean debug;
        @Nonnull
        private Index idIndex = DEFAULT_ID_INDEX;

        protected Builder() {
        }

        protected Builder(@Nonnull ModelOptions options) {
            this.debug = options.debug;
            this.idIndex = options.idIndex;
        }

        @Nonnull
        public Builder setDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Set the index that identifies records. Its field is the identity field every record must have.
         * @param idIndex the identity index
         * @return this builder
         */
        @Nonnull
        public Builder setIdIndex(@Nonnull Index idIndex) {
            this.idIndex = idIndex;
            return this;
        }

        @Nonnull
        public ModelOptions build() {
            return new ModelOptions(debug, idIndex);
        }
    }
}
