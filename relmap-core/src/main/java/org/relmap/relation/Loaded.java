/*
 * Loaded.java
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
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * An immutable, already materialized collection.
 *
 * <p>
 * Nothing here touches a dataset again: every operation works on the collection captured at construction. The source
 * is kept for inspection only.
 * </p>
 *
 * @param <T> the type of the elements
 */
@API(API.Status.EXPERIMENTAL)
public class Loaded<T> implements Composable<T>, Iterable<T> {
    @Nonnull
    private final List<T> collection;
    @Nullable
    private final Object source;

    public Loaded(@Nonnull List<? extends T> collection, @Nullable Object source) {
        this.collection = Collections.unmodifiableList(new ArrayList<>(collection));
        this.source = source;
    }

    @Nonnull
    public List<T> getCollection() {
        return collection;
    }

    /**
     * What this collection was loaded from: a relation, a composite or a graph.
     *
     * @return the source, or {@code null} if unknown
     */
    @Nullable
    public Object getSource() {
        return source;
    }

    @Nonnull
    @Override
    public Loaded<T> call() {
        return this;
    }

    @Nonnull
    @Override
    public List<T> toList() {
        return collection;
    }

    public int size() {
        return collection.size();
    }

    public boolean isEmpty() {
        return collection.isEmpty();
    }

    @Nonnull
    @Override
    public Iterator<T> iterator() {
        return collection.iterator();
    }

    @Nonnull
    public Stream<T> stream() {
        return collection.stream();
    }

    /**
     * The values of one field across all tuples, in order.
     *
     * @param key the field name
     * @return the values, {@code null} where a tuple lacks the field
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if the elements are not tuples
     */
    @Nonnull
    public List<Object> pluck(@Nonnull String key) throws RelationalException {
        final List<Object> values = new ArrayList<>(collection.size());
        for (T element : collection) {
            if (!(element instanceof Map)) {
                throw new RelationalException("cannot pluck <" + key + "> from a " +
                        (element == null ? "null" : element.getClass().getSimpleName()), ErrorCode.INVALID_PARAMETER);
            }
            values.add(((Map<?, ?>) element).get(key));
        }
        return values;
    }

    @Nonnull
    @Override
    public <R> Composite<T, R> andThen(@Nonnull Mapper<T, R> mapper) {
        return new Composite<>(this, mapper);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return collection.equals(((Loaded<?>) o).collection);
    }

    @Override
    public int hashCode() {
        return collection.hashCode();
    }

    @Override
    public String toString() {
        return "Loaded" + collection;
    }
}
