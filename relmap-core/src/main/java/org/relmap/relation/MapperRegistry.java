/*
 * MapperRegistry.java
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

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named mappers available to a relation through {@link Relation#mapWith(String...)}. Immutable; registering a mapper
 * returns a new registry.
 */
@API(API.Status.EXPERIMENTAL)
public final class MapperRegistry {
    private static final MapperRegistry EMPTY = new MapperRegistry(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, Mapper<?, ?>> mappers;

    private MapperRegistry(@Nonnull ImmutableMap<String, Mapper<?, ?>> mappers) {
        this.mappers = mappers;
    }

    @Nonnull
    public static MapperRegistry empty() {
        return EMPTY;
    }

    @Nonnull
    public MapperRegistry with(@Nonnull String name, @Nonnull Mapper<?, ?> mapper) {
        final Map<String, Mapper<?, ?>> copy = new LinkedHashMap<>(mappers);
        copy.put(name, mapper);
        return new MapperRegistry(ImmutableMap.copyOf(copy));
    }

    @Nonnull
    public Mapper<?, ?> get(@Nonnull String name) throws RelationalException {
        final Mapper<?, ?> mapper = mappers.get(name);
        if (mapper == null) {
            throw new RelationalException("no mapper registered under <" + name + ">", ErrorCode.UNDEFINED_MAPPER)
                    .addContext("mappers", mappers.keySet());
        }
        return mapper;
    }

    public boolean containsKey(@Nonnull String name) {
        return mappers.containsKey(name);
    }

    @Nonnull
    public Set<String> names() {
        return mappers.keySet();
    }

    public boolean isEmpty() {
        return mappers.isEmpty();
    }

    @Override
    public String toString() {
        return "MapperRegistry" + mappers.keySet();
    }
}
