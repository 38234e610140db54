/*
 * MemoryTransactionRunner.java
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

package org.relmap.memory;

import org.relmap.annotation.API;
import org.relmap.api.Options;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.gateway.BasicTransaction;
import org.relmap.gateway.TransactionBody;
import org.relmap.gateway.TransactionOutcome;
import org.relmap.gateway.TransactionRunner;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;

import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;

/**
 * Runs transactions against a {@link MemoryStorage} by snapshotting it first and restoring the snapshot when the body
 * asks for a rollback or fails. Concurrent writers are not isolated from each other.
 *
 * <p>
 * {@link Options.Name#TRANSACTION_TIMEOUT} is checked once the body returns, since a running body is never interrupted.
 * A body that overran its deadline is rolled back and the transaction fails with {@link ErrorCode#TRANSACTION_TIMEOUT}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class MemoryTransactionRunner implements TransactionRunner {
    @Nonnull
    private final MemoryStorage storage;
    @Nonnull
    private final Logger logger;

    public MemoryTransactionRunner(@Nonnull MemoryStorage storage, @Nonnull Logger logger) {
        this.storage = storage;
        this.logger = logger;
    }

    @Nonnull
    @Override
    public <T> TransactionOutcome<T> run(@Nonnull Options options, @Nonnull TransactionBody<T> body) throws RelationalException {
        final MemoryStorage.Snapshot snapshot = storage.snapshot();
        final BasicTransaction transaction = new BasicTransaction(options);
        final long start = System.nanoTime();
        final T value;
        try {
            value = body.run(transaction);
        } catch (RelationalException | RuntimeException e) {
            storage.restore(snapshot);
            logOutcome(options, "failed");
            throw e;
        }
        final long timeoutMillis = options.getOption(Options.Name.TRANSACTION_TIMEOUT);
        final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (timeoutMillis >= 0 && elapsedMillis > timeoutMillis) {
            storage.restore(snapshot);
            logOutcome(options, "timed out");
            throw new RelationalException("transaction exceeded its timeout", ErrorCode.TRANSACTION_TIMEOUT)
                    .addContext("timeout_millis", timeoutMillis)
                    .addContext("elapsed_millis", elapsedMillis);
        }
        if (transaction.isRollbackRequested()) {
            storage.restore(snapshot);
            logOutcome(options, "rolled back");
            return TransactionOutcome.rolledBack();
        }
        logOutcome(options, "committed");
        return TransactionOutcome.committed(value);
    }

    private void logOutcome(@Nonnull Options options, @Nonnull String outcome) {
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("memory transaction finished",
                    LogMessageKeys.TRANSACTION_ID, options.getOption(Options.Name.TRANSACTION_ID),
                    LogMessageKeys.OUTCOME, outcome));
        }
    }
}
