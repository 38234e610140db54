/*
 * ViewDefinition.java
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
import org.relmap.schema.Schema;
import org.relmap.util.Assert;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A named, possibly parametrized, derived relation.
 *
 * <p>
 * The body turns a relation plus {@link #getArity()} positional arguments into a new relation. The schema function
 * derives the view's projected schema from the base schema of the owning {@link RelationDefinition}; the result of a
 * view is always projected through that schema.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class ViewDefinition {
    @Nonnull
    private final String name;
    private final int arity;
    @Nonnull
    private final ViewSchema schema;
    @Nonnull
    private final ViewBody body;

    private ViewDefinition(@Nonnull String name, int arity, @Nonnull ViewSchema schema, @Nonnull ViewBody body) {
        this.name = name;
        this.arity = arity;
        this.schema = schema;
        this.body = body;
    }

    /**
     * A view that keeps the base schema.
     *
     * @param name the view name
     * @param arity number of positional arguments the body expects
     * @param body the body
     * @return the view
     */
    @Nonnull
    public static ViewDefinition of(@Nonnull String name, int arity, @Nonnull ViewBody body) {
        return of(name, arity, base -> base, body);
    }

    @Nonnull
    public static ViewDefinition of(@Nonnull String name, int arity, @Nonnull ViewSchema schema, @Nonnull ViewBody body) {
        Assert.thatUnchecked(arity >= 0, ErrorCode.INVALID_PARAMETER, () -> "view <" + name + "> has a negative arity");
        return new ViewDefinition(name, arity, schema, body);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    @Nonnull
    public Schema deriveSchema(@Nonnull Schema base) throws RelationalException {
        return schema.derive(base);
    }

    /**
     * Run the body.
     *
     * @param relation the relation the view is evaluated on
     * @param args exactly {@link #getArity()} arguments
     * @return the relation produced by the body, not yet projected
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if the argument count is wrong, or
     * whatever the body throws
     */
    @Nonnull
    public Relation apply(@Nonnull Relation relation, @Nonnull List<Object> args) throws RelationalException {
        Assert.that(args.size() == arity, ErrorCode.INVALID_PARAMETER,
                () -> "view <" + name + "> expects " + arity + " argument(s) but got " + args.size());
        return Objects.requireNonNull(body.apply(relation, args), "view body returned null");
    }

    @Override
    public String toString() {
        return "View{" + name + "/" + arity + "}";
    }

    /**
     * The body of a view.
     */
    @FunctionalInterface
    public interface ViewBody {
        @Nonnull
        Relation apply(@Nonnull Relation relation, @Nonnull List<Object> args) throws RelationalException;
    }

    /**
     * Derives a view's schema from the base schema.
     */
    @FunctionalInterface
    public interface ViewSchema {
        @Nonnull
        Schema derive(@Nonnull Schema base) throws RelationalException;
    }
}
