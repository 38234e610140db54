/*
 * Association.java
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

import javax.annotation.Nonnull;

/**
 * A named relationship between the relation owning a schema and another relation. How an association is resolved into
 * a read is up to the code that defines it; the core only stores and hands out descriptors.
 */
@API(API.Status.UNSTABLE)
public interface Association {

    @Nonnull
    String getName();

    /**
     * The name of the relation this association points to.
     *
     * @return the target relation name
     */
    @Nonnull
    String getTarget();
}
