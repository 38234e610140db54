/*
 * BasicTransaction.java
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

package org.relmap.gateway;

import org.relmap.annotation.API;
import org.relmap.api.Options;

import javax.annotation.Nonnull;

/**
 * A {@link Transaction} that only records whether a rollback was requested.
 */
@API(API.Status.INTERNAL)
public class BasicTransaction implements Transaction {
    @Nonnull
    private final Options options;
    private volatile boolean rollbackRequested;

    public BasicTransaction(@Nonnull Options options) {
        this.options = options;
    }

    @Override
    public void rollback() {
        rollbackRequested = true;
    }

    @Override
    public boolean isRollbackRequested() {
        return rollbackRequested;
    }

    @Nonnull
    @Override
    public Options getOptions() {
        return options;
    }
}
