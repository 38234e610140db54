/*
 * MemoryRelation.java
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

package org.relmap.memory;

import org.relmap.annotation.API;
import org.relmap.api.Dataset;
import org.relmap.api.Options;
import org.relmap.api.QueryableDataset;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.relation.MapperRegistry;
import org.relmap.relation.Relation;
import org.relmap.relation.RelationDefinition;
import org.relmap.schema.Schema;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Map;

/**
 * A relation over a {@link MemoryDataset}, with the dataset's query operations. Every operation returns a new
 * relation over a new dataset.
 */
@API(API.Status.EXPERIMENTAL)
public class MemoryRelation extends Relation {

    public MemoryRelation(@Nonnull RelationDefinition definition, @Nonnull Dataset dataset) {
        super(definition, dataset);
    }

    public MemoryRelation(@Nonnull RelationDefinition definition, @Nonnull Dataset dataset, @Nonnull Schema schema,
                          @Nonnull MapperRegistry mappers, @Nonnull Options options) {
        super(definition, dataset, schema, mappers, options);
    }

    @Nonnull
    public MemoryRelation restrict(@Nonnull Map<String, ?> criteria) throws RelationalException {
        return withDataset(queryable().restrict(criteria));
    }

    /**
     * Keep the given attributes. With a schema, the schema is projected too.
     *
     * @param names the attributes to keep
     * @return the projected relation
     * @throws RelationalException if the schema does not have one of the attributes
     */
    @Nonnull
    public MemoryRelation project(@Nonnull String... names) throws RelationalException {
        final MemoryRelation projected = withDataset(queryable().project(Arrays.asList(names)));
        return hasSchema() ? projected.withSchema(getSchema().project(names)) : projected;
    }

    @Nonnull
    public MemoryRelation rename(@Nonnull Map<String, String> mapping) throws RelationalException {
        return withDataset(queryable().rename(mapping));
    }

    @Nonnull
    public MemoryRelation order(@Nonnull String... names) throws RelationalException {
        return withDataset(queryable().order(Arrays.asList(names)));
    }

    @Nonnull
    public MemoryRelation reverse() throws RelationalException {
        return withDataset(getDataset().unwrap(MemoryDataset.class).reverse());
    }

    @Nonnull
    public MemoryRelation join(@Nonnull MemoryRelation other) throws RelationalException {
        return withDataset(getDataset().unwrap(MemoryDataset.class).join(other.getDataset().unwrap(MemoryDataset.class)));
    }

    public int count() throws RelationalException {
        return queryable().count();
    }

    public int delete(@Nonnull Map<String, Object> tuple) throws RelationalException {
        return queryable().delete(tuple);
    }

    @Nonnull
    private QueryableDataset queryable() throws RelationalException {
        return getDataset().unwrap(QueryableDataset.class);
    }

    @Nonnull
    @Override
    public MemoryRelation withDataset(@Nonnull Dataset newDataset) {
        return (MemoryRelation) super.withDataset(newDataset);
    }

    @Nonnull
    @Override
    public MemoryRelation withDataset(@Nonnull Dataset newDataset, @Nonnull Options extraOptions) {
        return (MemoryRelation) super.withDataset(newDataset, extraOptions);
    }

    @Nonnull
    @Override
    public MemoryRelation with(@Nonnull Options extraOptions) {
        return (MemoryRelation) super.with(extraOptions);
    }

    @Nonnull
    @Override
    public MemoryRelation withSchema(@Nonnull Schema newSchema) {
        return (MemoryRelation) super.withSchema(newSchema);
    }

    @Nonnull
    @Override
    public MemoryRelation withMappers(@Nonnull MapperRegistry newMappers) {
        return (MemoryRelation) super.withMappers(newMappers);
    }

    @Nonnull
    @Override
    protected MemoryRelation newInstance(@Nonnull RelationDefinition newDefinition, @Nonnull Dataset newDataset,
                                         @Nonnull Schema newSchema, @Nonnull MapperRegistry newMappers,
                                         @Nonnull Options newOptions) {
        return new MemoryRelation(newDefinition, newDataset, newSchema, newMappers, newOptions);
    }
}
