/*
 * MemoryGateway.java
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
import org.relmap.gateway.Adapter;
import org.relmap.gateway.Gateway;
import org.relmap.gateway.TransactionRunner;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;
import org.relmap.relation.RelationFactory;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A gateway keeping its datasets in a {@link MemoryStorage}. Datasets are created the first time they are asked for.
 * Transactions restore the storage on rollback.
 */
@API(API.Status.EXPERIMENTAL)
@Adapter(MemoryGateway.ADAPTER)
public class MemoryGateway extends Gateway {
    public static final String ADAPTER = "memory";

    @Nonnull
    private final MemoryStorage connection;
    @Nonnull
    private volatile Logger logger = LogManager.getLogger(MemoryGateway.class);

    public MemoryGateway() {
        this(new MemoryStorage());
    }

    public MemoryGateway(@Nonnull MemoryStorage connection) {
        this.connection = connection;
    }

    @Nonnull
    @Override
    public MemoryStorage getConnection() {
        return connection;
    }

    @Nonnull
    @Override
    public MemoryDataset dataset(@Nonnull String name) {
        MemoryDataset dataset = connection.get(name);
        if (dataset == null) {
            dataset = connection.getOrCreateDataset(name);
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("created dataset",
                        LogMessageKeys.ADAPTER, ADAPTER,
                        LogMessageKeys.DATASET, name));
            }
        }
        return dataset;
    }

    @Override
    public boolean hasDataset(@Nonnull String name) {
        return connection.containsKey(name);
    }

    @Nonnull
    @Override
    public List<String> schema() {
        return ImmutableList.copyOf(connection.getDatasetNames());
    }

    @Override
    public void useLogger(@Nonnull Logger newLogger) {
        this.logger = newLogger;
    }

    @Nonnull
    @Override
    public Logger getLogger() {
        return logger;
    }

    @Nonnull
    @Override
    protected RelationFactory relationFactory() {
        return MemoryRelation::new;
    }

    @Nonnull
    @Override
    protected TransactionRunner transactionRunner(@Nonnull Options options) {
        return new MemoryTransactionRunner(connection, logger);
    }
}
