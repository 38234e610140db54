/*
 * Relation.java
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
import org.relmap.api.exceptions.AttributeNotFoundException;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.OperationUnsupportedException;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.api.exceptions.UncheckedRelationalException;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;
import org.relmap.schema.AssociationSet;
import org.relmap.schema.Attribute;
import org.relmap.schema.AttributeType;
import org.relmap.schema.Schema;
import org.relmap.util.RelationLoggingUtil;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Streams;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A schema-aware, composable view over a {@link Dataset}.
 *
 * <p>
 * A relation is a dataset plus a {@link Schema}, a {@link MapperRegistry} and a set of {@link Options}. Two tuple
 * functions are derived from the schema once, at construction: the read coercion applied to every tuple coming out
 * of the dataset, and the write coercion ({@link #getSchemaHash()}) applied to tuples going in. Relations are
 * immutable; every {@code with*} method returns a copy of the same concrete type and leaves this one untouched.
 * </p>
 *
 * <p>
 * Reading is lazy: {@link #iterator()}, {@link #each()} and {@link #stream()} re-read the dataset every time they are
 * called. {@link #call()} loads everything into a {@link Loaded} collection.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class Relation implements RelationNode, Iterable<Map<String, Object>> {
    private static final Logger logger = LogManager.getLogger(Relation.class);

    /**
     * The read coercion of every relation whose schema declares no read types.
     */
    public static final UnaryOperator<Map<String, Object>> NOOP_READ_SCHEMA = tuple -> tuple;

    private static final UnaryOperator<Map<String, Object>> UNCONSTRAINED_SCHEMA_HASH = LinkedHashMap::new;

    @Nonnull
    private final RelationDefinition definition;
    @Nonnull
    private final Dataset dataset;
    @Nonnull
    private final Schema schema;
    @Nonnull
    private final MapperRegistry mappers;
    @Nonnull
    private final Options options;
    @Nonnull
    private final UnaryOperator<Map<String, Object>> readSchema;
    @Nonnull
    private final UnaryOperator<Map<String, Object>> schemaHash;
    @Nonnull
    private final Supplier<Map<String, Schema>> schemas;
    @Nonnull
    private final Supplier<AssociationSet> associations;

    public Relation(@Nonnull RelationDefinition definition, @Nonnull Dataset dataset) {
        this(definition, dataset, definition.getSchema(), MapperRegistry.empty(), Options.none());
    }

    public Relation(@Nonnull RelationDefinition definition, @Nonnull Dataset dataset, @Nonnull Schema schema,
                    @Nonnull MapperRegistry mappers, @Nonnull Options options) {
        this.definition = definition;
        this.dataset = dataset;
        this.schema = schema;
        this.mappers = mappers;
        this.options = options;
        this.readSchema = schema.anyRead() ? schema.toRelationHash() : NOOP_READ_SCHEMA;
        this.schemaHash = schema.isEmpty() ? UNCONSTRAINED_SCHEMA_HASH : schema.toCommandHash();
        this.schemas = Suppliers.memoize(definition::schemas);
        this.associations = Suppliers.memoize(schema::getAssociations);
    }

    @Nonnull
    @Override
    public String getName() {
        return definition.getName();
    }

    @Nonnull
    public RelationDefinition getDefinition() {
        return definition;
    }

    @Nonnull
    public Dataset getDataset() {
        return dataset;
    }

    @Nonnull
    public Schema getSchema() {
        return schema;
    }

    @Nonnull
    public MapperRegistry getMappers() {
        return mappers;
    }

    @Nonnull
    public Options getOptions() {
        return options;
    }

    /**
     * The function applied to every tuple read from the dataset. The identity, {@link #NOOP_READ_SCHEMA}, unless the
     * schema declares at least one read type.
     *
     * @return the read coercion
     */
    @Nonnull
    public UnaryOperator<Map<String, Object>> getReadSchema() {
        return readSchema;
    }

    /**
     * The function applied to tuples before they are written to the dataset: the schema's command hash, or a plain
     * copy when there is no schema.
     *
     * @return the write coercion
     */
    @Nonnull
    public UnaryOperator<Map<String, Object>> getSchemaHash() {
        return schemaHash;
    }

    @Nonnull
    public Attribute attribute(@Nonnull String attributeName) throws AttributeNotFoundException {
        return schema.get(attributeName);
    }

    /**
     * The canonical type of an attribute.
     *
     * @param attributeName the attribute
     * @return its type
     * @throws AttributeNotFoundException if the schema has no such attribute
     */
    @Nonnull
    public AttributeType<?> get(@Nonnull String attributeName) throws AttributeNotFoundException {
        return attribute(attributeName).getType();
    }

    public boolean hasSchema() {
        return !schema.isEmpty();
    }

    @Override
    public boolean isCurried() {
        return false;
    }

    @Override
    public boolean isGraph() {
        return false;
    }

    @Nonnull
    public Map<String, Schema> schemas() {
        return schemas.get();
    }

    @Nonnull
    public AssociationSet associations() {
        return associations.get();
    }

    /**
     * Iterate over the decoded tuples. Coercion failures surface as {@link UncheckedRelationalException}.
     *
     * @return a fresh iterator over the dataset
     */
    @Nonnull
    @Override
    public Iterator<Map<String, Object>> iterator() {
        return Iterators.transform(dataset.iterator(), readSchema::apply);
    }

    /**
     * A restartable, lazy sequence of the decoded tuples.
     *
     * @return an iterable that re-reads the dataset on every iteration
     */
    @Nonnull
    public Iterable<Map<String, Object>> each() {
        return this::iterator;
    }

    @Nonnull
    public Stream<Map<String, Object>> stream() {
        return Streams.stream(iterator());
    }

    /**
     * Read all decoded tuples.
     *
     * @return the tuples, in dataset order
     * @throws RelationalException if a tuple cannot be decoded
     */
    @Nonnull
    public List<Map<String, Object>> collect() throws RelationalException {
        final List<Map<String, Object>> result = new ArrayList<>();
        try {
            Iterators.addAll(result, iterator());
        } catch (UncheckedRelationalException e) {
            throw e.unwrap();
        }
        return result;
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> toList() throws RelationalException {
        return collect();
    }

    @Nonnull
    @Override
    public Loaded<Map<String, Object>> call() throws RelationalException {
        final KeyValueLogMessage message = KeyValueLogMessage.build("relation materialized",
                LogMessageKeys.RELATION, getName());
        final long start = System.nanoTime();
        List<Map<String, Object>> tuples = null;
        RelationalException failure = null;
        try {
            tuples = collect();
            return new Loaded<>(tuples, this);
        } catch (RelationalException e) {
            failure = e;
            throw e;
        } catch (RuntimeException e) {
            failure = RelationalException.convert(e);
            throw e;
        } finally {
            final long totalMicros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start);
            RelationLoggingUtil.publishMaterializationLogs(logger, message, tuples == null ? 0 : tuples.size(),
                    failure, totalMicros, options);
        }
    }

    /**
     * A relation node is loaded independently of its parent.
     */
    @Nonnull
    @Override
    public Loaded<Map<String, Object>> callWith(@Nonnull Loaded<Map<String, Object>> parent) throws RelationalException {
        return call();
    }

    /**
     * Append a tuple, coerced with {@link #getSchemaHash()}.
     *
     * @param tuple the tuple
     * @throws RelationalException if coercion fails or the dataset rejects the tuple
     */
    public void insert(@Nonnull Map<String, Object> tuple) throws RelationalException {
        final Map<String, Object> coerced;
        try {
            coerced = schemaHash.apply(tuple);
        } catch (UncheckedRelationalException e) {
            throw e.unwrap();
        }
        dataset.insert(coerced);
    }

    @Nonnull
    public Graph combine(@Nonnull RelationNode... others) {
        return Graph.build(this, Arrays.asList(others));
    }

    /**
     * Evaluate a view of this relation's definition. The result is projected through the view's schema.
     *
     * @param viewName the view
     * @param args exactly as many arguments as the view takes
     * @return the view's relation
     * @throws RelationalException with {@link ErrorCode#UNDEFINED_VIEW} if there is no such view, with
     * {@link ErrorCode#INVALID_PARAMETER} if the argument count does not match
     */
    @Nonnull
    public Relation view(@Nonnull String viewName, @Nonnull Object... args) throws RelationalException {
        final ViewDefinition view = definition.getView(viewName);
        return definition.viewSchema(viewName).call(view.apply(this, Arrays.asList(args)));
    }

    /**
     * A view awaiting (some of) its arguments.
     *
     * @param viewName the view
     * @param args the arguments known so far
     * @return the curried view
     * @throws RelationalException with {@link ErrorCode#UNDEFINED_VIEW} if there is no such view, with
     * {@link ErrorCode#INVALID_PARAMETER} if there are more arguments than the view takes
     */
    @Nonnull
    public Curried curry(@Nonnull String viewName, @Nonnull Object... args) throws RelationalException {
        return new Curried(this, definition.getView(viewName), Arrays.asList(args));
    }

    @Nonnull
    @Override
    public <R> Composite<Map<String, Object>, R> andThen(@Nonnull Mapper<Map<String, Object>, R> mapper) {
        return new Composite<>(this, mapper);
    }

    /**
     * Pipe this relation through registered mappers, in order.
     *
     * @param mapperNames names in the relation's {@link MapperRegistry}
     * @return the pipeline
     * @throws RelationalException with {@link ErrorCode#UNDEFINED_MAPPER} if a name is not registered
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public Composite<?, Object> mapWith(@Nonnull String... mapperNames) throws RelationalException {
        if (mapperNames.length == 0) {
            throw new RelationalException("at least one mapper name is required", ErrorCode.INVALID_PARAMETER);
        }
        Composite<?, Object> pipeline = andThen((Mapper<Map<String, Object>, Object>) mappers.get(mapperNames[0]));
        for (String mapperName : ImmutableList.copyOf(mapperNames).subList(1, mapperNames.length)) {
            pipeline = pipeline.andThen((Mapper<Object, Object>) mappers.get(mapperName));
        }
        return pipeline;
    }

    @Nonnull
    public Relation withDataset(@Nonnull Dataset newDataset) {
        return newInstance(definition, newDataset, schema, mappers, options);
    }

    /**
     * A copy reading another dataset. Empty extra options keep the current option set; otherwise they are merged over
     * it.
     *
     * @param newDataset the dataset
     * @param extraOptions options to merge
     * @return the copy
     */
    @Nonnull
    public Relation withDataset(@Nonnull Dataset newDataset, @Nonnull Options extraOptions) {
        return newInstance(definition, newDataset, schema, mappers,
                extraOptions.isEmpty() ? options : options.merge(extraOptions));
    }

    @Nonnull
    public Relation with(@Nonnull Options extraOptions) {
        return withDataset(dataset, extraOptions);
    }

    @Nonnull
    public Relation withSchema(@Nonnull Schema newSchema) {
        return newInstance(definition, dataset, newSchema, mappers, options);
    }

    @Nonnull
    public Relation withMappers(@Nonnull MapperRegistry newMappers) {
        return newInstance(definition, dataset, schema, newMappers, options);
    }

    /**
     * Create a relation of the same concrete type. Subclasses override this to keep their type across copies.
     */
    @Nonnull
    protected Relation newInstance(@Nonnull RelationDefinition newDefinition, @Nonnull Dataset newDataset,
                                   @Nonnull Schema newSchema, @Nonnull MapperRegistry newMappers,
                                   @Nonnull Options newOptions) {
        return new Relation(newDefinition, newDataset, newSchema, newMappers, newOptions);
    }

    /**
     * Unwraps this relation as type T, if such a cast is possible. Adapter specific relations are reached this way.
     *
     * @param type the type to unwrap it as
     * @param <T> the generic type
     * @return this instance, as an instance of type T
     * @throws OperationUnsupportedException if the types are incompatible
     */
    @Nonnull
    public <T> T unwrap(@Nonnull Class<T> type) throws RelationalException {
        if (type.isInstance(this)) {
            return type.cast(this);
        }
        throw new OperationUnsupportedException("Cannot unwrap relation of type <" + getClass().getCanonicalName() + "> as type <" +
                type.getCanonicalName() + ">");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return dataset.equals(((Relation) o).dataset);
    }

    @Override
    public int hashCode() {
        return dataset.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getName() + ", dataset=" + dataset + "}";
    }
}
