/*
 * NoOpTransactionRunner.java
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
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;

/**
 * The runner of gateways without transaction support. It runs the body once and always reports a commit: nothing is
 * atomic, nothing is isolated and a requested rollback undoes nothing.
 */
@API(API.Status.EXPERIMENTAL)
public final class NoOpTransactionRunner implements TransactionRunner {
    public static final NoOpTransactionRunner INSTANCE = new NoOpTransactionRunner();

    private static final Logger logger = LogManager.getLogger(NoOpTransactionRunner.class);

    private NoOpTransactionRunner() {
    }

    @Nonnull
    @Override
    public <T> TransactionOutcome<T> run(@Nonnull Options options, @Nonnull TransactionBody<T> body) throws RelationalException {
        final BasicTransaction transaction = new BasicTransaction(options);
        final T value = body.run(transaction);
        if (transaction.isRollbackRequested()) {
            logger.warn(KeyValueLogMessage.of("rollback requested but not supported by the gateway",
                    LogMessageKeys.TRANSACTION_ID, options.getOption(Options.Name.TRANSACTION_ID)));
        }
        return TransactionOutcome.committed(value);
    }
}
