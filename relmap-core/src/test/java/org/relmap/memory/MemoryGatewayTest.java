/*
 * MemoryGatewayTest.java
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

import org.relmap.api.Options;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.gateway.Gateway;
import org.relmap.relation.MapperRegistry;
import org.relmap.relation.Relation;
import org.relmap.relation.RelationDefinition;
import org.relmap.utils.LogAppenderRule;
import org.relmap.utils.RelationalAssertions;

import com.google.common.util.concurrent.Uninterruptibles;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class MemoryGatewayTest {

    @RegisterExtension
    final LogAppenderRule gatewayLogs = new LogAppenderRule("MemoryGatewayTestLogs", MemoryGateway.class, Level.DEBUG);

    @Test
    void setupByAdapter() throws RelationalException {
        final Gateway gateway = Gateway.setup(MemoryGateway.ADAPTER);
        Assertions.assertThat(gateway).isInstanceOf(MemoryGateway.class);
        Assertions.assertThat(gateway.getConnection()).isInstanceOf(MemoryStorage.class);
        Assertions.assertThat(Gateway.setup(MemoryGateway.ADAPTER, "ignored")).isInstanceOf(MemoryGateway.class);
    }

    @Test
    void datasetsAreCreatedOnDemand() {
        final MemoryGateway gateway = new MemoryGateway();
        Assertions.assertThat(gateway.hasDataset("users")).isFalse();
        final MemoryDataset users = gateway.dataset("users");
        Assertions.assertThat(gateway.hasDataset("users")).isTrue();
        Assertions.assertThat(gateway.dataset("users")).isSameAs(users);
        Assertions.assertThat(gatewayLogs.getLogEventMessages())
                .containsExactly("created dataset adapter=\"memory\" dataset=\"users\"");
    }

    @Test
    void schemaListsDatasetNames() {
        final MemoryStorage storage = new MemoryStorage();
        storage.createDataset("users");
        storage.createDataset("tasks");
        Assertions.assertThat(new MemoryGateway(storage).schema()).containsExactly("tasks", "users");
    }

    @Test
    void relationsAreMemoryRelations() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        gateway.dataset("users").insert(Map.of("id", 1));
        final Relation relation = gateway.relation(RelationDefinition.of("users"));
        Assertions.assertThat(relation).isInstanceOf(MemoryRelation.class);
        Assertions.assertThat(relation.toList()).containsExactly(Map.of("id", 1));

        final Relation renamed = gateway.relation(RelationDefinition.of("people"), MapperRegistry.empty(),
                Options.builder().withOption(Options.Name.DATASET_NAME, "users").build());
        Assertions.assertThat(renamed.getDataset()).isSameAs(gateway.dataset("users"));
    }

    @Test
    void useLogger() {
        final MemoryGateway gateway = new MemoryGateway();
        final Logger logger = LogManager.getLogger("custom");
        gateway.useLogger(logger);
        Assertions.assertThat(gateway.getLogger()).isSameAs(logger);
    }

    @Test
    void committedTransactionReturnsValue() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        final Integer value = gateway.transaction(transaction -> {
            gateway.dataset("users").insert(Map.of("id", 1));
            return 42;
        });
        Assertions.assertThat(value).isEqualTo(42);
        Assertions.assertThat(gateway.dataset("users").count()).isEqualTo(1);
    }

    @Test
    void rolledBackTransactionRestoresStorage() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        final MemoryDataset users = gateway.dataset("users");
        users.insert(Map.of("id", 1));

        final String value = gateway.transaction(transaction -> {
            users.insert(Map.of("id", 2));
            gateway.dataset("tasks").insert(Map.of("id", 3));
            transaction.rollback();
            return "ignored";
        });
        Assertions.assertThat(value).isNull();
        Assertions.assertThat(users.getTuples()).containsExactly(Map.of("id", 1));
        Assertions.assertThat(gateway.hasDataset("tasks")).isFalse();
    }

    @Test
    void failedTransactionRestoresStorageAndRethrows() {
        final MemoryGateway gateway = new MemoryGateway();
        final MemoryDataset users = gateway.dataset("users");

        RelationalAssertions.assertThrows(() -> gateway.transaction(transaction -> {
            users.insert(Map.of("id", 2));
            throw new RelationalException("constraint violated", ErrorCode.INTERNAL_ERROR);
        })).hasErrorCode(ErrorCode.INTERNAL_ERROR).containsInMessage("constraint violated");
        Assertions.assertThat(users.count()).isZero();

        Assertions.assertThatThrownBy(() -> gateway.transaction(transaction -> {
            users.insert(Map.of("id", 3));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        Assertions.assertThat(users.count()).isZero();
    }

    @Test
    void transactionOutcomeIsLogged() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        gateway.transaction(Options.builder().withOption(Options.Name.TRANSACTION_ID, "tx-1").build(), transaction -> {
            transaction.rollback();
            return null;
        });
        Assertions.assertThat(gatewayLogs.getLastLogEventMessage())
                .isEqualTo("memory transaction finished outcome=\"rolled back\" transaction_id=\"tx-1\"");
    }

    @Test
    void overrunningTransactionIsRolledBack() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        final MemoryDataset users = gateway.dataset("users");
        final Options options = Options.builder()
                .withOption(Options.Name.TRANSACTION_TIMEOUT, 1L)
                .withOption(Options.Name.TRANSACTION_ID, "tx-slow")
                .build();

        RelationalAssertions.assertThrows(() -> gateway.transaction(options, transaction -> {
            users.insert(Map.of("id", 1));
            Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
            return null;
        })).hasErrorCode(ErrorCode.TRANSACTION_TIMEOUT);
        Assertions.assertThat(users.count()).isZero();
        Assertions.assertThat(gatewayLogs.getLastLogEventMessage())
                .isEqualTo("memory transaction finished outcome=\"timed out\" transaction_id=\"tx-slow\"");
    }

    @Test
    void transactionWithinTimeoutCommits() throws RelationalException {
        final MemoryGateway gateway = new MemoryGateway();
        final Integer value = gateway.transaction(
                Options.builder().withOption(Options.Name.TRANSACTION_TIMEOUT, 60_000L).build(),
                transaction -> {
                    gateway.dataset("users").insert(Map.of("id", 1));
                    return 7;
                });
        Assertions.assertThat(value).isEqualTo(7);
        Assertions.assertThat(gateway.dataset("users").count()).isEqualTo(1);
    }

    @Test
    void readersNeverSeeAPartialRollback() throws Exception {
        final MemoryGateway gateway = new MemoryGateway();
        final MemoryDataset users = gateway.dataset("users");
        for (int i = 0; i < 1000; i++) {
            users.insert(Map.of("id", i));
        }
        final AtomicBoolean done = new AtomicBoolean();
        final AtomicInteger unexpectedCounts = new AtomicInteger();
        final Thread reader = new Thread(() -> {
            while (!done.get()) {
                final int count = users.count();
                if (count != 1000 && count != 1001) {
                    unexpectedCounts.incrementAndGet();
                }
            }
        });
        reader.start();
        try {
            for (int i = 0; i < 1000; i++) {
                final int id = 1000 + i;
                gateway.transaction(transaction -> {
                    users.insert(Map.of("id", id));
                    transaction.rollback();
                    return null;
                });
            }
        } finally {
            done.set(true);
            reader.join(10_000);
        }
        Assertions.assertThat(unexpectedCounts.get()).isZero();
        Assertions.assertThat(users.count()).isEqualTo(1000);
    }

    @Test
    void insertsAfterRestoreExtendTheRestoredTuples() {
        final MemoryStorage storage = new MemoryStorage();
        final MemoryDataset users = storage.createDataset("users");
        users.insert(Map.of("id", 1));
        final MemoryStorage.Snapshot snapshot = storage.snapshot();
        users.insert(Map.of("id", 2));
        storage.restore(snapshot);
        users.insert(Map.of("id", 3));
        Assertions.assertThat(users.getTuples()).containsExactly(Map.of("id", 1), Map.of("id", 3));
    }
}
