/*
 * Composite.java
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

/**
 * A left side whose output is piped through a mapper on the right. Building a composite evaluates nothing; the left
 * side is loaded and mapped each time the composite itself is materialized.
 *
 * @param <I> the type produced by the left side
 * @param <O> the type produced by the mapper
 */
@API(API.Status.EXPERIMENTAL)
public class Composite<I, O> implements Composable<O> {
    @Nonnull
    private final Materializable<I> left;
    @Nonnull
    private final Mapper<I, O> right;

    public Composite(@Nonnull Materializable<I> left, @Nonnull Mapper<I, O> right) {
        this.left = left;
        this.right = right;
    }

    @Nonnull
    public Materializable<I> getLeft() {
        return left;
    }

    @Nonnull
    public Mapper<I, O> getRight() {
        return right;
    }

    @Nonnull
    @Override
    public Loaded<O> call() throws RelationalException {
        return new Loaded<>(right.apply(left.call()), this);
    }

    @Nonnull
    @Override
    public <R> Composite<O, R> andThen(@Nonnull Mapper<O, R> mapper) {
        return new Composite<>(this, mapper);
    }

    @Override
    public String toString() {
        return "Composite{" + left + " >> " + right + "}";
    }
}
