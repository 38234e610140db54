/*
 * MemoryDataset.java
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
import org.relmap.api.QueryableDataset;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An in-memory dataset. Tuples are stored as unmodifiable copies, in insertion order.
 *
 * <p>
 * Appends and reads are safe from any thread. The tuples are held as one immutable list that every write replaces
 * atomically, so readers always see a whole state and iteration works on the list current when the iterator is
 * created. Every derived dataset ({@link #restrict(Map)}, {@link #project(List)}, ...) is a new, detached dataset.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class MemoryDataset implements QueryableDataset {
    @Nonnull
    private final AtomicReference<ImmutableList<Map<String, Object>>> data;

    public MemoryDataset() {
        this.data = new AtomicReference<>(ImmutableList.of());
    }

    public MemoryDataset(@Nonnull Collection<? extends Map<String, Object>> tuples) {
        final ImmutableList.Builder<Map<String, Object>> copies = ImmutableList.builderWithExpectedSize(tuples.size());
        for (Map<String, Object> tuple : tuples) {
            copies.add(copyOf(tuple));
        }
        this.data = new AtomicReference<>(copies.build());
    }

    @Override
    public void insert(@Nonnull Map<String, Object> tuple) {
        final Map<String, Object> copy = copyOf(tuple);
        data.updateAndGet(current -> ImmutableList.<Map<String, Object>>builderWithExpectedSize(current.size() + 1)
                .addAll(current)
                .add(copy)
                .build());
    }

    @Nonnull
    @Override
    public Iterator<Map<String, Object>> iterator() {
        return data.get().iterator();
    }

    @Nonnull
    @Override
    public MemoryDataset restrict(@Nonnull Map<String, ?> criteria) {
        final List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> tuple : data.get()) {
            if (matches(tuple, criteria)) {
                matching.add(tuple);
            }
        }
        return new MemoryDataset(matching);
    }

    @Nonnull
    @Override
    public MemoryDataset project(@Nonnull List<String> names) {
        final List<Map<String, Object>> current = data.get();
        final List<Map<String, Object>> projected = new ArrayList<>(current.size());
        for (Map<String, Object> tuple : current) {
            final Map<String, Object> narrowed = new LinkedHashMap<>();
            for (String name : names) {
                if (tuple.containsKey(name)) {
                    narrowed.put(name, tuple.get(name));
                }
            }
            projected.add(narrowed);
        }
        return new MemoryDataset(projected);
    }

    @Nonnull
    @Override
    public MemoryDataset rename(@Nonnull Map<String, String> mapping) {
        final List<Map<String, Object>> current = data.get();
        final List<Map<String, Object>> renamed = new ArrayList<>(current.size());
        for (Map<String, Object> tuple : current) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> field : tuple.entrySet()) {
                copy.put(mapping.getOrDefault(field.getKey(), field.getKey()), field.getValue());
            }
            renamed.add(copy);
        }
        return new MemoryDataset(renamed);
    }

    /**
     * {@inheritDoc}
     *
     * <p>
     * The sort is stable. Values of one field must be mutually comparable.
     * </p>
     */
    @Nonnull
    @Override
    public MemoryDataset order(@Nonnull List<String> names) throws RelationalException {
        final List<Map<String, Object>> sorted = new ArrayList<>(data.get());
        try {
            sorted.sort(comparator(names));
        } catch (ClassCastException e) {
            throw new RelationalException("cannot order by fields holding values that do not compare",
                    ErrorCode.CANNOT_CONVERT_TYPE, e)
                    .addContext("fields", names);
        }
        return new MemoryDataset(sorted);
    }

    @Nonnull
    public MemoryDataset reverse() {
        return new MemoryDataset(data.get().reverse());
    }

    /**
     * Natural join: pairs every tuple of this dataset with every tuple of {@code other} that agrees on all fields
     * both have, merging the two.
     *
     * @param other the dataset to join with
     * @return the joined dataset
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if a pair of tuples shares no field
     */
    @Nonnull
    public MemoryDataset join(@Nonnull MemoryDataset other) throws RelationalException {
        final List<Map<String, Object>> joined = new ArrayList<>();
        for (Map<String, Object> left : data.get()) {
            for (Map<String, Object> right : other.data.get()) {
                final Set<String> shared = Sets.intersection(left.keySet(), right.keySet());
                if (shared.isEmpty()) {
                    throw new RelationalException("cannot join tuples without common fields", ErrorCode.INVALID_PARAMETER)
                            .addContext("left", left.keySet())
                            .addContext("right", right.keySet());
                }
                if (agreeOn(shared, left, right)) {
                    final Map<String, Object> merged = new LinkedHashMap<>(left);
                    merged.putAll(right);
                    joined.add(merged);
                }
            }
        }
        return new MemoryDataset(joined);
    }

    @Override
    public int count() {
        return data.get().size();
    }

    @Override
    public int delete(@Nonnull Map<String, Object> tuple) {
        while (true) {
            final ImmutableList<Map<String, Object>> current = data.get();
            final ImmutableList.Builder<Map<String, Object>> kept = ImmutableList.builderWithExpectedSize(current.size());
            int removed = 0;
            for (Map<String, Object> existing : current) {
                if (existing.equals(tuple)) {
                    removed++;
                } else {
                    kept.add(existing);
                }
            }
            if (removed == 0 || data.compareAndSet(current, kept.build())) {
                return removed;
            }
        }
    }

    /**
     * The tuples currently stored.
     *
     * @return an immutable copy of the tuples
     */
    @Nonnull
    public List<Map<String, Object>> getTuples() {
        return data.get();
    }

    /**
     * Replace all tuples at once. Readers see either the old or the new tuples, never a mix.
     */
    void replaceContents(@Nonnull List<Map<String, Object>> tuples) {
        data.set(ImmutableList.copyOf(tuples));
    }

    private static boolean matches(@Nonnull Map<String, Object> tuple, @Nonnull Map<String, ?> criteria) {
        for (Map.Entry<String, ?> criterion : criteria.entrySet()) {
            final Object actual = tuple.get(criterion.getKey());
            final Object expected = criterion.getValue();
            if (expected instanceof Collection) {
                if (!((Collection<?>) expected).contains(actual)) {
                    return false;
                }
            } else if (!Objects.equals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean agreeOn(@Nonnull Set<String> fields, @Nonnull Map<String, Object> left,
                                   @Nonnull Map<String, Object> right) {
        for (String field : fields) {
            if (!Objects.equals(left.get(field), right.get(field))) {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    private static Comparator<Map<String, Object>> comparator(@Nonnull List<String> names) {
        Comparator<Map<String, Object>> result = (a, b) -> 0;
        for (String name : names) {
            result = result.thenComparing((a, b) -> compareValues(a.get(name), b.get(name)));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static int compareValues(Object a, Object b) {
        if (a == null) {
            return b == null ? 0 : 1;
        }
        if (b == null) {
            return -1;
        }
        return ((Comparable<Object>) a).compareTo(b);
    }

    @Nonnull
    private static Map<String, Object> copyOf(@Nonnull Map<String, Object> tuple) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tuple));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return data.get().equals(((MemoryDataset) o).data.get());
    }

    @Override
    public int hashCode() {
        return data.get().hashCode();
    }

    @Override
    public String toString() {
        return "MemoryDataset" + data.get();
    }
}
