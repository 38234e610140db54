/*
 * Curried.java
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
import org.relmap.util.Assert;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A view of a relation that still waits for some of its positional arguments.
 *
 * <p>
 * {@link #apply(Object...)} adds arguments. Once the view's arity is reached the view is evaluated and the resulting
 * {@link Relation} is returned; until then every application returns a new {@code Curried}. As a node of a
 * {@link Graph} a curried view receives the loaded root as its next argument.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class Curried implements RelationNode {
    @Nonnull
    private final Relation relation;
    @Nonnull
    private final ViewDefinition view;
    @Nonnull
    private final List<Object> arguments;

    Curried(@Nonnull Relation relation, @Nonnull ViewDefinition view, @Nonnull List<Object> arguments) throws RelationalException {
        Assert.that(arguments.size() <= view.getArity(), ErrorCode.INVALID_PARAMETER,
                () -> "view <" + view.getName() + "> expects " + view.getArity() + " argument(s) but got " + arguments.size());
        this.relation = relation;
        this.view = view;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    @Nonnull
    public Relation getRelation() {
        return relation;
    }

    @Nonnull
    public ViewDefinition getView() {
        return view;
    }

    @Nonnull
    public List<Object> getArguments() {
        return arguments;
    }

    public int getArity() {
        return view.getArity();
    }

    public boolean isSatisfied() {
        return arguments.size() == view.getArity();
    }

    /**
     * Add arguments.
     *
     * @param args the next arguments
     * @return the view's relation if all arguments are now known, otherwise a new curried view
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if there are too many arguments, or
     * whatever the view throws
     */
    @Nonnull
    public RelationNode apply(@Nonnull Object... args) throws RelationalException {
        final List<Object> all = new ArrayList<>(arguments);
        all.addAll(Arrays.asList(args));
        Assert.that(all.size() <= view.getArity(), ErrorCode.INVALID_PARAMETER,
                () -> "view <" + view.getName() + "> expects " + view.getArity() + " argument(s) but got " + all.size());
        if (all.size() < view.getArity()) {
            return new Curried(relation, view, all);
        }
        return relation.view(view.getName(), all.toArray());
    }

    @Nonnull
    @Override
    public String getName() {
        return relation.getName();
    }

    @Override
    public boolean isCurried() {
        return true;
    }

    @Override
    public boolean isGraph() {
        return false;
    }

    @Nonnull
    @Override
    public Loaded<Map<String, Object>> call() throws RelationalException {
        Assert.that(isSatisfied(), ErrorCode.INVALID_PARAMETER,
                () -> "view <" + view.getName() + "> is missing " + (view.getArity() - arguments.size()) + " argument(s)");
        return relation.view(view.getName(), arguments.toArray()).call();
    }

    @Nonnull
    @Override
    public Loaded<Map<String, Object>> callWith(@Nonnull Loaded<Map<String, Object>> parent) throws RelationalException {
        return apply(parent).call();
    }

    @Nonnull
    @Override
    public <R> Composite<Map<String, Object>, R> andThen(@Nonnull Mapper<Map<String, Object>, R> mapper) {
        return new Composite<>(this, mapper);
    }

    @Override
    public String toString() {
        return "Curried{" + getName() + "." + view.getName() + arguments + "}";
    }
}
