/*
 * Schema.java
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

package org.relmap.schema;

import org.relmap.annotation.API;
import org.relmap.api.Dataset;
import org.relmap.api.QueryableDataset;
import org.relmap.api.exceptions.AttributeNotFoundException;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.gateway.Gateway;
import org.relmap.relation.Relation;
import org.relmap.util.Assert;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An ordered set of uniquely named {@link Attribute}s, describing the tuples of a relation.
 *
 * <p>
 * A schema derives two tuple functions from its attributes: {@link #toCommandHash()} for tuples on their way into a
 * dataset and {@link #toRelationHash()} for tuples read out of it. Schemas are immutable. A schema declared with a
 * {@link SchemaInferrer} starts out empty and unfinalized; {@link #finalizeSchema(Gateway)} returns the finalized
 * schema with the inferred attributes added after the declared ones.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Schema implements Iterable<Attribute> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Map<String, Attribute> attributes;
    @Nonnull
    private final AssociationSet associations;
    @Nullable
    private final SchemaInferrer inferrer;
    private final boolean finalized;

    @Nonnull
    private final UnaryOperator<Map<String, Object>> commandHash;
    @Nonnull
    private final UnaryOperator<Map<String, Object>> relationHash;

    private Schema(@Nonnull String name, @Nonnull Map<String, Attribute> attributes, @Nonnull AssociationSet associations,
                   @Nullable SchemaInferrer inferrer, boolean finalized) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.associations = associations;
        this.inferrer = inferrer;
        this.finalized = finalized;
        this.commandHash = this::commandHash;
        this.relationHash = this::relationHash;
    }

    @Nonnull
    public static Schema empty(@Nonnull String name) {
        return new Schema(name, new LinkedHashMap<>(), AssociationSet.empty(), null, true);
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
    public List<Attribute> getAttributes() {
        return ImmutableList.copyOf(attributes.values());
    }

    @Nonnull
    public List<String> getAttributeNames() {
        return ImmutableList.copyOf(attributes.keySet());
    }

    @Nonnull
    public AssociationSet getAssociations() {
        return associations;
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    public boolean isFinalized() {
        return finalized;
    }

    public boolean isInferred() {
        return inferrer != null;
    }

    /**
     * Whether at least one attribute declares a read type.
     *
     * @return {@code true} if reads need decoding
     */
    public boolean anyRead() {
        for (Attribute attribute : attributes.values()) {
            if (attribute.isRead()) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(@Nonnull String attributeName) {
        return attributes.containsKey(attributeName);
    }

    @Nonnull
    public Attribute get(@Nonnull String attributeName) throws AttributeNotFoundException {
        final Attribute attribute = attributes.get(attributeName);
        if (attribute == null) {
            throw new AttributeNotFoundException("attribute <" + attributeName + "> is not defined in schema <" + name + ">");
        }
        return attribute;
    }

    /**
     * The write path function: keeps the attributes of this schema that are present in the tuple and coerces them with
     * their canonical type. Fields that are not attributes are dropped.
     *
     * @return the tuple function, the same instance on every call
     */
    @Nonnull
    public UnaryOperator<Map<String, Object>> toCommandHash() {
        return commandHash;
    }

    /**
     * The read path function: decodes every attribute that has a read type and passes every other field through.
     *
     * @return the tuple function, the same instance on every call
     */
    @Nonnull
    public UnaryOperator<Map<String, Object>> toRelationHash() {
        return relationHash;
    }

    /**
     * A schema holding only the given attributes, in the given order, each tagged with this schema's name as source
     * unless it already has one.
     *
     * @param attributeNames the attributes to keep
     * @return the projected schema
     * @throws AttributeNotFoundException if a name is not an attribute of this schema
     */
    @Nonnull
    public Schema project(@Nonnull String... attributeNames) throws AttributeNotFoundException {
        final Map<String, Attribute> projected = new LinkedHashMap<>();
        for (String attributeName : attributeNames) {
            final Attribute attribute = get(attributeName);
            projected.put(attributeName, attribute.getSource() == null ? attribute.withSource(name) : attribute);
        }
        return new Schema(name, projected, associations, null, true);
    }

    /**
     * Complete this schema. For an inferred schema the gateway is asked for the dataset's attributes; declared
     * attributes take precedence over inferred ones with the same name.
     *
     * @param gateway the gateway owning the dataset
     * @return the finalized schema, {@code this} if nothing was left to do
     * @throws RelationalException if inference fails
     */
    @Nonnull
    public Schema finalizeSchema(@Nonnull Gateway gateway) throws RelationalException {
        if (finalized) {
            return this;
        }
        final Map<String, Attribute> merged = new LinkedHashMap<>(attributes);
        for (Attribute inferred : Objects.requireNonNull(inferrer).infer(name, gateway)) {
            merged.putIfAbsent(inferred.getName(), inferred);
        }
        return new Schema(name, merged, associations, inferrer, true);
    }

    /**
     * Auto-project a relation through this schema: the dataset is narrowed to the schema's attributes when it supports
     * it, and the relation gets this schema.
     *
     * @param relation the relation to project
     * @return a new relation using this schema
     * @throws RelationalException if the dataset cannot be projected
     */
    @Nonnull
    public Relation call(@Nonnull Relation relation) throws RelationalException {
        final Dataset dataset = relation.getDataset();
        if (!isEmpty() && dataset.isWrapperFor(QueryableDataset.class)) {
            final QueryableDataset projected = dataset.unwrap(QueryableDataset.class).project(getAttributeNames());
            return relation.withDataset(projected).withSchema(this);
        }
        return relation.withSchema(this);
    }

    @Nonnull
    @Override
    public Iterator<Attribute> iterator() {
        return attributes.values().iterator();
    }

    private Map<String, Object> commandHash(@Nonnull Map<String, Object> tuple) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Attribute attribute : attributes.values()) {
            if (tuple.containsKey(attribute.getName())) {
                try {
                    result.put(attribute.getName(), attribute.coerceForWrite(tuple.get(attribute.getName())));
                } catch (RelationalException e) {
                    throw e.addContext("attribute", attribute.getName()).toUncheckedWrappedException();
                }
            }
        }
        return result;
    }

    private Map<String, Object> relationHash(@Nonnull Map<String, Object> tuple) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : tuple.entrySet()) {
            final Attribute attribute = attributes.get(field.getKey());
            if (attribute == null) {
                result.put(field.getKey(), field.getValue());
            } else {
                try {
                    result.put(field.getKey(), attribute.coerceForRead(field.getValue()));
                } catch (RelationalException e) {
                    throw e.addContext("attribute", attribute.getName()).toUncheckedWrappedException();
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schema)) {
            return false;
        }
        Schema schema = (Schema) o;
        return finalized == schema.finalized && name.equals(schema.name) &&
                attributes.equals(schema.attributes) && associations.equals(schema.associations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, associations, finalized);
    }

    @Override
    public String toString() {
        return "Schema{" + name + attributes.values() + "}";
    }

    /**
     * Builds a {@link Schema}. Attribute names must be unique.
     */
    public static final class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private final Map<String, Attribute> attributes = new LinkedHashMap<>();
        @Nonnull
        private AssociationSet associations = AssociationSet.empty();
        @Nullable
        private SchemaInferrer inferrer;

        private Builder(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public Builder attribute(@Nonnull String attributeName, @Nonnull AttributeType<?> type) throws RelationalException {
            return attribute(Attribute.of(attributeName, type));
        }

        @Nonnull
        public Builder attribute(@Nonnull String attributeName, @Nonnull AttributeType<?> type, @Nonnull AttributeType<?> readType) throws RelationalException {
            return attribute(Attribute.of(attributeName, type, readType));
        }

        @Nonnull
        public Builder attribute(@Nonnull Attribute attribute) throws RelationalException {
            Assert.that(!attributes.containsKey(attribute.getName()), ErrorCode.DUPLICATE_ATTRIBUTE,
                    () -> "attribute <" + attribute.getName() + "> is defined twice in schema <" + name + ">");
            attributes.put(attribute.getName(), attribute);
            return this;
        }

        @Nonnull
        public Builder associations(@Nonnull AssociationSet associationSet) {
            this.associations = associationSet;
            return this;
        }

        @Nonnull
        public Builder inferrer(@Nonnull SchemaInferrer schemaInferrer) {
            this.inferrer = schemaInferrer;
            return this;
        }

        @Nonnull
        public Schema build() {
            return new Schema(name, new LinkedHashMap<>(attributes), associations, inferrer, inferrer == null);
        }
    }
}
