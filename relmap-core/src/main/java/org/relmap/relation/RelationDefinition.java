/*
 * RelationDefinition.java
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
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.gateway.Gateway;
import org.relmap.schema.Schema;
import org.relmap.util.Assert;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything that describes a relation apart from the data it reads: its name, the dataset it reads from, its
 * canonical schema and its named views. Immutable.
 *
 * <p>
 * Relations are produced from a definition by {@link #create(Dataset)} or by a {@link Gateway}. The schema of every
 * view is derived once, when the definition is built or finalized.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class RelationDefinition {
    @Nonnull
    private final String name;
    @Nonnull
    private final String datasetName;
    @Nonnull
    private final Schema schema;
    @Nonnull
    private final ImmutableMap<String, ViewDefinition> views;
    @Nonnull
    private final ImmutableMap<String, Schema> viewSchemas;

    private RelationDefinition(@Nonnull String name, @Nonnull String datasetName, @Nonnull Schema schema,
                               @Nonnull ImmutableMap<String, ViewDefinition> views) throws RelationalException {
        this.name = name;
        this.datasetName = datasetName;
        this.schema = schema;
        this.views = views;
        final ImmutableMap.Builder<String, Schema> derived = ImmutableMap.builder();
        // an inferred schema is not complete until finalized, so its views are derived on demand until then
        if (schema.isFinalized()) {
            for (ViewDefinition view : views.values()) {
                derived.put(view.getName(), view.deriveSchema(schema));
            }
        }
        this.viewSchemas = derived.build();
    }

    /**
     * A definition without views reading the dataset of the same name.
     *
     * @param name the relation name
     * @param schema the schema
     * @return the definition
     */
    @Nonnull
    public static RelationDefinition of(@Nonnull String name, @Nonnull Schema schema) {
        try {
            return new RelationDefinition(name, name, schema, ImmutableMap.of());
        } catch (RelationalException e) {
            throw e.toUncheckedWrappedException();
        }
    }

    @Nonnull
    public static RelationDefinition of(@Nonnull String name) {
        return of(name, Schema.empty(name));
    }

    @Nonnull
    public static Builder builder(@Nonnull String name) {
        return new Builder(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getDatasetName() {
        return datasetName;
    }

    @Nonnull
    public Schema getSchema() {
        return schema;
    }

    @Nonnull
    public Map<String, ViewDefinition> getViews() {
        return views;
    }

    public boolean hasView(@Nonnull String viewName) {
        return views.containsKey(viewName);
    }

    @Nonnull
    public ViewDefinition getView(@Nonnull String viewName) throws RelationalException {
        final ViewDefinition view = views.get(viewName);
        if (view == null) {
            throw new RelationalException("relation <" + name + "> has no view named <" + viewName + ">", ErrorCode.UNDEFINED_VIEW)
                    .addContext("views", views.keySet());
        }
        return view;
    }

    @Nonnull
    public Schema viewSchema(@Nonnull String viewName) throws RelationalException {
        final ViewDefinition view = getView(viewName);
        final Schema derived = viewSchemas.get(viewName);
        return derived == null ? view.deriveSchema(schema) : derived;
    }

    /**
     * The base schema under the relation name, followed by the schema of each view under the view name. Views of a
     * schema that is not finalized yet are left out.
     *
     * @return the schemas by name
     */
    @Nonnull
    public Map<String, Schema> schemas() {
        final Map<String, Schema> schemas = new LinkedHashMap<>();
        schemas.put(name, schema);
        schemas.putAll(viewSchemas);
        return ImmutableMap.copyOf(schemas);
    }

    /**
     * A definition whose schema is finalized against the gateway. View schemas are derived again from the finalized
     * schema.
     *
     * @param gateway the gateway owning the dataset
     * @return the finalized definition, {@code this} if the schema already was
     * @throws RelationalException if inference fails
     */
    @Nonnull
    public RelationDefinition finalizeSchema(@Nonnull Gateway gateway) throws RelationalException {
        if (schema.isFinalized()) {
            return this;
        }
        return new RelationDefinition(name, datasetName, schema.finalizeSchema(gateway), views);
    }

    @Nonnull
    public Relation create(@Nonnull Dataset dataset) {
        return create(RelationFactory.DEFAULT, dataset, MapperRegistry.empty(), Options.none());
    }

    @Nonnull
    public Relation create(@Nonnull Dataset dataset, @Nonnull MapperRegistry mappers, @Nonnull Options options) {
        return create(RelationFactory.DEFAULT, dataset, mappers, options);
    }

    @Nonnull
    public Relation create(@Nonnull RelationFactory factory, @Nonnull Dataset dataset, @Nonnull MapperRegistry mappers,
                           @Nonnull Options options) {
        return factory.create(this, dataset, schema, mappers, options);
    }

    @Override
    public String toString() {
        return "RelationDefinition{" + name + ", dataset=" + datasetName + ", views=" + views.keySet() + "}";
    }

    /**
     * Builds a {@link RelationDefinition}.
     */
    public static final class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private String datasetName;
        @Nonnull
        private Schema schema;
        @Nonnull
        private final Map<String, ViewDefinition> views = new LinkedHashMap<>();

        private Builder(@Nonnull String name) {
            this.name = name;
            this.datasetName = name;
            this.schema = Schema.empty(name);
        }

        @Nonnull
        public Builder datasetName(@Nonnull String dataset) {
            this.datasetName = dataset;
            return this;
        }

        @Nonnull
        public Builder schema(@Nonnull Schema relationSchema) {
            this.schema = relationSchema;
            return this;
        }

        @Nonnull
        public Builder view(@Nonnull ViewDefinition view) throws RelationalException {
            Assert.that(!views.containsKey(view.getName()), ErrorCode.INVALID_PARAMETER,
                    () -> "view <" + view.getName() + "> is defined twice on relation <" + name + ">");
            views.put(view.getName(), view);
            return this;
        }

        @Nonnull
        public RelationDefinition build() throws RelationalException {
            return new RelationDefinition(name, datasetName, schema, ImmutableMap.copyOf(views));
        }
    }
}
