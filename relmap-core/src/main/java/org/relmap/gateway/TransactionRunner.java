/*
 * TransactionRunner.java
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
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;

/**
 * Runs a {@link TransactionBody} with whatever transactional guarantees the adapter offers. Isolation, retries and
 * nesting are all up to the implementation.
 */
@API(API.Status.EXPERIMENTAL)
public interface TransactionRunner {

    /**
     * Run the body.
     *
     * @param options the transaction options
     * @param body the body
     * @param <T> the type of the body's value
     * @return the outcome
     * @throws RelationalException whatever the body throws, after the runner undid what it could
     */
    @Nonnull
    <T> TransactionOutcome<T> run(@Nonnull Options options, @Nonnull TransactionBody<T> body) throws RelationalException;
}
