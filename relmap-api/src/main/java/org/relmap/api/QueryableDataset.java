/*
 * QueryableDataset.java
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
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * A {@link Dataset} that can restrict, project and reorder itself. Every operation returns a new dataset and leaves
 * this one untouched; how the work is done (eagerly, lazily, remotely) is up to the implementation.
 */
@API(API.Status.UNSTABLE)
public interface QueryableDataset extends Dataset {

    /**
     * Keep the tuples matching every criterion. A criterion whose value is a {@link java.util.Collection} matches when
     * the tuple's value is one of its elements, any other value matches by equality.
     *
     * @param criteria field name to expected value
     * @return the restricted dataset
     */
    @Nonnull
    QueryableDataset restrict(@Nonnull Map<String, ?> criteria);

    /**
     * Keep only the given fields, in the given order.
     *
     * @param names the fields to keep
     * @return the projected dataset
     */
    @Nonnull
    QueryableDataset project(@Nonnull List<String> names);

    @Nonnull
    QueryableDataset rename(@Nonnull Map<String, String> mapping);

    /**
     * Sort by the given fields, ascending, {@code null} values last.
     *
     * @param names the fields to sort by, most significant first
     * @return the sorted dataset
     * @throws RelationalException with {@link ErrorCode#CANNOT_CONVERT_TYPE} if the values of a field cannot be
     * compared with each other
     */
    @Nonnull
    QueryableDataset order(@Nonnull List<String> names) throws RelationalException;

    int count();

    /**
     * Remove every tuple equal to {@code tuple}.
     *
     * @param tuple the tuple to remove
     * @return the number of tuples removed
     */
    int delete(@Nonnull Map<String, Object> tuple);
}
