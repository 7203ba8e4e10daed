/*
 * API.java
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

package io.kvindex.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, field or method is for users of the index layer.
 *
 * <p>
 * A member inherits the status of its enclosing type unless it is annotated itself. A status may move
 * towards {@link Status#STABLE} at any time, but must only move away from it at the boundary described by
 * the status being left.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another kvindex module can reach it. May change without notice.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Callers should move off it before the next minor release.
         */
        DEPRECATED,

        /**
         * New and still settling. May change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Kept backwards-compatible until the next major release.
         */
        STABLE
    }
}
