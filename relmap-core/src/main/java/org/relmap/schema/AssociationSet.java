/*
 * AssociationSet.java
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
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Iterator;
import java.util.Set;

/**
 * The associations of a schema, by name. Immutable.
 */
@API(API.Status.EXPERIMENTAL)
public final class AssociationSet implements Iterable<Association> {
    private static final AssociationSet EMPTY = new AssociationSet(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, Association> associations;

    private AssociationSet(@Nonnull ImmutableMap<String, Association> associations) {
        this.associations = associations;
    }

    @Nonnull
    public static AssociationSet empty() {
        return EMPTY;
    }

    @Nonnull
    public static AssociationSet of(@Nonnull Collection<? extends Association> associations) {
        final ImmutableMap.Builder<String, Association> builder = ImmutableMap.builder();
        for (Association association : associations) {
            builder.put(association.getName(), association);
        }
        return new AssociationSet(builder.buildOrThrow());
    }

    @Nonnull
    public Association get(@Nonnull String name) throws RelationalException {
        final Association association = associations.get(name);
        if (association == null) {
            throw new RelationalException("no association named <" + name + ">", ErrorCode.UNDEFINED_ASSOCIATION);
        }
        return association;
    }

    public boolean containsKey(@Nonnull String name) {
        return associations.containsKey(name);
    }

    @Nonnull
    public Set<String> names() {
        return associations.keySet();
    }

    public int size() {
        return associations.size();
    }

    public boolean isEmpty() {
        return associations.isEmpty();
    }

    @Nonnull
    @Override
    public Iterator<Association> iterator() {
        return associations.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssociationSet && associations.equals(((AssociationSet) o).associations);
    }

    @Override
    public int hashCode() {
        return associations.hashCode();
    }

    @Override
    public String toString() {
        return "AssociationSet" + associations.keySet();
    }
}
