/*
 * LoadedGraph.java
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

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * The result of loading a {@link Graph}: the root tuples, plus one loaded collection per child node, in node order.
 */
@API(API.Status.EXPERIMENTAL)
public class LoadedGraph extends Loaded<Map<String, Object>> {
    @Nonnull
    private final Loaded<Map<String, Object>> root;
    @Nonnull
    private final List<String> nodeNames;
    @Nonnull
    private final List<Loaded<Map<String, Object>>> nodes;

    public LoadedGraph(@Nonnull Graph source, @Nonnull Loaded<Map<String, Object>> root,
                       @Nonnull List<String> nodeNames, @Nonnull List<Loaded<Map<String, Object>>> nodes) {
        super(root.getCollection(), source);
        this.root = root;
        this.nodeNames = ImmutableList.copyOf(nodeNames);
        this.nodes = ImmutableList.copyOf(nodes);
    }

    @Nonnull
    public Loaded<Map<String, Object>> getRoot() {
        return root;
    }

    @Nonnull
    public List<Loaded<Map<String, Object>>> getNodes() {
        return nodes;
    }

    @Nonnull
    public Loaded<Map<String, Object>> getNode(int position) {
        return nodes.get(position);
    }

    /**
     * The loaded child read from the relation with the given name. When several children read the same relation
     * the first one wins.
     *
     * @param name the relation name
     * @return the loaded child
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if no child reads that relation
     */
    @Nonnull
    public Loaded<Map<String, Object>> getNode(@Nonnull String name) throws RelationalException {
        final int position = nodeNames.indexOf(name);
        if (position < 0) {
            throw new RelationalException("graph has no node named <" + name + ">", ErrorCode.INVALID_PARAMETER)
                    .addContext("nodes", nodeNames);
        }
        return nodes.get(position);
    }

    @Nonnull
    public List<String> getNodeNames() {
        return nodeNames;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return nodes.equals(((LoadedGraph) o).nodes);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + nodes.hashCode();
    }
}
