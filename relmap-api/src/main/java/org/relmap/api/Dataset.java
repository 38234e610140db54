/*
 * Dataset.java
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

package org.relmap.api;

import org.relmap.annotation.API;
import org.relmap.api.exceptions.OperationUnsupportedException;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The raw, ordered tuple collection a relation reads from.
 *
 * <p>
 * This is the whole surface a relation relies on: iterate and append. Adapters that can do more expose it through a
 * sub-interface, such as {@link QueryableDataset}, reached with {@link #unwrap(Class)}. A dataset knows nothing about
 * schemas; coercion is done by the relation on top of it.
 * </p>
 *
 * <p>
 * Iteration must be restartable: every call to {@link #iterator()} starts from the first tuple.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface Dataset extends Iterable<Map<String, Object>> {

    /**
     * Append a tuple. No deduplication is done.
     *
     * @param tuple the tuple to append, already coerced by the caller
     * @throws RelationalException if the backing store rejects the tuple
     */
    void insert(@Nonnull Map<String, Object> tuple) throws RelationalException;

    @Nonnull
    default Stream<Map<String, Object>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Unwraps this dataset as type T, if such a cast is possible. Adapter specific operations are reached this way
     * instead of being forwarded implicitly.
     *
     * @param type the type to unwrap it as
     * @param <T> the generic type
     * @return this instance, as an instance of type T
     * @throws OperationUnsupportedException if the types are incompatible
     */
    @Nonnull
    default <T> T unwrap(@Nonnull Class<T> type) throws RelationalException {
        if (type.isInstance(this)) {
            return type.cast(this);
        }
        throw new OperationUnsupportedException("Cannot unwrap dataset of type <" + getClass().getCanonicalName() + "> as type <" +
                type.getCanonicalName() + ">");
    }

    default boolean isWrapperFor(@Nonnull Class<?> type) {
        return type.isInstance(this);
    }
}
