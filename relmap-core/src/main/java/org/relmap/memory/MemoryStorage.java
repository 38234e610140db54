/*
 * MemoryStorage.java
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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe registry of {@link MemoryDataset}s by name. This is the connection of a {@link MemoryGateway}.
 */
@API(API.Status.EXPERIMENTAL)
public class MemoryStorage {
    @Nonnull
    private final ConcurrentMap<String, MemoryDataset> data = new ConcurrentHashMap<>();

    @Nullable
    public MemoryDataset get(@Nonnull String name) {
        return data.get(name);
    }

    /**
     * Register a new, empty dataset. A dataset already registered under the name is replaced, with its tuples.
     *
     * @param name the dataset name
     * @return the new dataset
     */
    @Nonnull
    public MemoryDataset createDataset(@Nonnull String name) {
        final MemoryDataset dataset = new MemoryDataset();
        data.put(name, dataset);
        return dataset;
    }

    @Nonnull
    public MemoryDataset getOrCreateDataset(@Nonnull String name) {
        return data.computeIfAbsent(name, ignored -> new MemoryDataset());
    }

    public boolean containsKey(@Nonnull String name) {
        return data.containsKey(name);
    }

    public int size() {
        return data.size();
    }

    @Nonnull
    public Set<String> getDatasetNames() {
        return ImmutableSortedSet.copyOf(data.keySet());
    }

    /**
     * Capture the registered datasets and their tuples.
     *
     * @return the snapshot
     */
    @Nonnull
    public Snapshot snapshot() {
        final ImmutableMap.Builder<String, MemoryDataset> datasets = ImmutableMap.builder();
        final ImmutableMap.Builder<String, List<Map<String, Object>>> contents = ImmutableMap.builder();
        for (Map.Entry<String, MemoryDataset> entry : data.entrySet()) {
            datasets.put(entry.getKey(), entry.getValue());
            contents.put(entry.getKey(), entry.getValue().getTuples());
        }
        return new Snapshot(datasets.build(), contents.build());
    }

    /**
     * Put the storage back into the state of the snapshot. Datasets registered since are dropped, replaced ones are
     * registered again and every captured dataset gets its captured tuples back. Dataset instances held by relations
     * stay valid.
     *
     * @param snapshot a snapshot of this storage
     */
    public void restore(@Nonnull Snapshot snapshot) {
        data.keySet().retainAll(snapshot.datasets.keySet());
        for (Map.Entry<String, MemoryDataset> entry : snapshot.datasets.entrySet()) {
            entry.getValue().replaceContents(snapshot.contents.get(entry.getKey()));
            data.put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * The state of a {@link MemoryStorage} at one point in time.
     */
    public static final class Snapshot {
        @Nonnull
        private final Map<String, MemoryDataset> datasets;
        @Nonnull
        private final Map<String, List<Map<String, Object>>> contents;

        private Snapshot(@Nonnull Map<String, MemoryDataset> datasets, @Nonnull Map<String, List<Map<String, Object>>> contents) {
            this.datasets = datasets;
            this.contents = contents;
        }

        @Nonnull
        public Set<String> getDatasetNames() {
            return datasets.keySet();
        }
    }
}
