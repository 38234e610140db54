/*
 * RelationFactory.java
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
import org.relmap.api.Dataset;
import org.relmap.api.Options;
import org.relmap.schema.Schema;

import javax.annotation.Nonnull;

/**
 * Creates relation instances for a {@link RelationDefinition}. Adapters plug in their own relation type here.
 */
@API(API.Status.UNSTABLE)
@FunctionalInterface
public interface RelationFactory {
    RelationFactory DEFAULT = Relation::new;

    @Nonnull
    Relation create(@Nonnull RelationDefinition definition, @Nonnull Dataset dataset, @Nonnull Schema schema,
                    @Nonnull MapperRegistry mappers, @Nonnull Options options);
}
