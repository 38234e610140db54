/*
 * Composable.java
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

package org.relmap.relation;

import org.relmap.annotation.API;

import javax.annotation.Nonnull;

/**
 * Something whose output can be piped through a {@link Mapper}.
 *
 * @param <T> the type of the elements produced
 */
@API(API.Status.EXPERIMENTAL)
public interface Composable<T> extends Materializable<T> {

    /**
     * Build a pipeline. Neither side is evaluated until the returned composite is materialized.
     *
     * @param mapper the transformation to apply to this side's output
     * @param <R> the type of the mapped elements
     * @return a new composite
     */
    @Nonnull
    <R> Composite<T, R> andThen(@Nonnull Mapper<T, R> mapper);
}
