/*
 * Mapper.java
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
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Transforms a loaded collection into another collection. Mappers are the right hand side of a {@link Composite}.
 *
 * <p>
 * A mapper placed after a {@link Graph} receives a {@link LoadedGraph} and may use the child collections.
 * </p>
 *
 * @param <I> the type of the input elements
 * @param <O> the type of the output elements
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface Mapper<I, O> {

    @Nonnull
    List<O> apply(@Nonnull Loaded<I> input) throws RelationalException;
}
