/*
 * RelationNode.java
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

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * A node of a {@link Graph}: a plain {@link Relation}, a {@link Curried} view or a nested {@link Graph}.
 *
 * <p>
 * Generic code branches on {@link #isCurried()} and {@link #isGraph()} instead of inspecting types.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface RelationNode extends Composable<Map<String, Object>> {

    /**
     * Name of the relation this node reads, used to find the node's result in a {@link LoadedGraph}.
     *
     * @return the relation name
     */
    @Nonnull
    String getName();

    boolean isCurried();

    boolean isGraph();

    /**
     * Load this node as a child of an already loaded parent. The parent is the whole loaded collection, so a node is
     * evaluated once per parent load and never once per parent tuple.
     *
     * @param parent the loaded parent tuples
     * @return the loaded tuples of this node
     * @throws RelationalException if loading fails
     */
    @Nonnull
    Loaded<Map<String, Object>> callWith(@Nonnull Loaded<Map<String, Object>> parent) throws RelationalException;
}
