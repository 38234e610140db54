/*
 * Materializable.java
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

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Something that can be loaded into a {@link Loaded} collection.
 *
 * @param <T> the type of the loaded elements
 */
@API(API.Status.EXPERIMENTAL)
public interface Materializable<T> {

    /**
     * Load everything.
     *
     * @return the loaded elements
     * @throws RelationalException if reading or transforming fails
     */
    @Nonnull
    Loaded<T> call() throws RelationalException;

    @Nonnull
    default List<T> toList() throws RelationalException {
        return call().getCollection();
    }

    @Nonnull
    default Optional<T> first() throws RelationalException {
        final List<T> collection = call().getCollection();
        return collection.isEmpty() ? Optional.empty() : Optional.ofNullable(collection.get(0));
    }

    /**
     * The single element, if there is one.
     *
     * @return the element, or empty if there is none
     * @throws RelationalException with {@link ErrorCode#TUPLE_COUNT_MISMATCH} if there is more than one
     */
    @Nonnull
    default Optional<T> one() throws RelationalException {
        final List<T> collection = call().getCollection();
        if (collection.size() > 1) {
            throw new RelationalException("The relation consists of more than one tuple", ErrorCode.TUPLE_COUNT_MISMATCH)
                    .addContext("count", collection.size());
        }
        return collection.isEmpty() ? Optional.empty() : Optional.ofNullable(collection.get(0));
    }

    @Nonnull
    default T oneOrThrow() throws RelationalException {
        return one().orElseThrow(() -> new RelationalException("The relation does not contain any tuples", ErrorCode.TUPLE_COUNT_MISMATCH));
    }
}
