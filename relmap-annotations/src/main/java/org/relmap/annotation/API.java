/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2024 Apple Inc. and the FoundationDB project authors
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

package org.relmap.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, field or method is for code built on top of relmap.
 *
 * <p>
 * A member inherits the status of its enclosing type unless it is annotated itself. A status may only move towards
 * {@link Status#STABLE} within a minor release; moving the other way is reserved for the release boundary each
 * status names.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other relmap packages can reach it. Adapters and applications must not depend on it.
         */
        INTERNAL,

        /**
         * Kept for compatibility and scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being shaped; may change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * Extension points for adapter authors. May change in a minor release, never in a patch release.
         */
        UNSTABLE,

        /**
         * Only changed incompatibly in a major release.
         */
        STABLE
    }
}
