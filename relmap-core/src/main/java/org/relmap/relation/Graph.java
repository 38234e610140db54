/*
 * Graph.java
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
import org.relmap.api.exceptions.RelationalException;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A root node combined with child nodes that are loaded together with it.
 *
 * <p>
 * Loading a graph loads the root once and then evaluates every child once, against the whole loaded root. A child
 * is never evaluated per root tuple. Matching root tuples with child tuples is left to mappers down the pipeline.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Graph implements RelationNode {
    private static final Logger logger = LogManager.getLogger(Graph.class);

    @Nonnull
    private final RelationNode root;
    @Nonnull
    private final List<RelationNode> nodes;

    private Graph(@Nonnull RelationNode root, @Nonnull List<RelationNode> nodes) {
        this.root = root;
        this.nodes = nodes;
    }

    @Nonnull
    public static Graph build(@Nonnull RelationNode root, @Nonnull List<? extends RelationNode> nodes) {
        return new Graph(root, ImmutableList.copyOf(nodes));
    }

    @Nonnull
    public RelationNode getRoot() {
        return root;
    }

    @Nonnull
    public List<RelationNode> getNodes() {
        return nodes;
    }

    @Nonnull
    @Override
    public String getName() {
        return root.getName();
    }

    @Override
    public boolean isCurried() {
        return false;
    }

    @Override
    public boolean isGraph() {
        return true;
    }

    /**
     * A graph with the given nodes appended.
     *
     * @param others the nodes to add
     * @return the new graph
     */
    @Nonnull
    public Graph combine(@Nonnull RelationNode... others) {
        return new Graph(root, ImmutableList.<RelationNode>builder().addAll(nodes).addAll(Arrays.asList(others)).build());
    }

    @Nonnull
    @Override
    public LoadedGraph call() throws RelationalException {
        return loadNodes(root.call());
    }

    @Nonnull
    @Override
    public LoadedGraph callWith(@Nonnull Loaded<Map<String, Object>> parent) throws RelationalException {
        return loadNodes(root.callWith(parent));
    }

    @Nonnull
    private LoadedGraph loadNodes(@Nonnull Loaded<Map<String, Object>> loadedRoot) throws RelationalException {
        final List<String> names = new ArrayList<>(nodes.size());
        final List<Loaded<Map<String, Object>>> loadedNodes = new ArrayList<>(nodes.size());
        for (RelationNode node : nodes) {
            names.add(node.getName());
            loadedNodes.add(node.callWith(loadedRoot));
        }
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("graph loaded",
                    LogMessageKeys.RELATION, getName(),
                    LogMessageKeys.TUPLE_COUNT, loadedRoot.size(),
                    LogMessageKeys.NODE_COUNT, nodes.size()));
        }
        return new LoadedGraph(this, loadedRoot, names, loadedNodes);
    }

    @Nonnull
    @Override
    public <R> Composite<Map<String, Object>, R> andThen(@Nonnull Mapper<Map<String, Object>, R> mapper) {
        return new Composite<>(this, mapper);
    }

    @Override
    public String toString() {
        return "Graph{" + root + " -> " + nodes + "}";
    }
}
