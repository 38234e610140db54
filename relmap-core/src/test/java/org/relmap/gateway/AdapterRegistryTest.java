/*
 * AdapterRegistryTest.java
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

import org.relmap.api.exceptions.AdapterLoadException;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.memory.MemoryGateway;
import org.relmap.memory.MemoryGatewayFactory;
import org.relmap.utils.LogAppenderRule;
import org.relmap.utils.RelationalAssertions;

import org.apache.logging.log4j.Level;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.concurrent.atomic.AtomicInteger;

public class AdapterRegistryTest {

    @RegisterExtension
    final LogAppenderRule registryLogs = new LogAppenderRule("AdapterRegistryTestLogs", AdapterRegistry.class, Level.DEBUG);

    /**
     * Records the arguments it was created with.
     */
    static class RecordingFactory implements GatewayFactory {
        private final String adapter;
        private final boolean takesArguments;
        final List<List<Object>> created = new ArrayList<>();

        RecordingFactory(String adapter, boolean takesArguments) {
            this.adapter = adapter;
            this.takesArguments = takesArguments;
        }

        @Nonnull
        @Override
        public String getAdapter() {
            return adapter;
        }

        @Override
        public boolean takesArguments() {
            return takesArguments;
        }

        @Nonnull
        @Override
        public Gateway create(@Nonnull List<Object> args) {
            created.add(args);
            return new MemoryGateway();
        }
    }

    @Test
    void registerAndResolve() throws RelationalException {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of());
        final RecordingFactory factory = new RecordingFactory("sql", true);
        registry.register(factory);

        Assertions.assertThat(registry.isRegistered("sql")).isTrue();
        Assertions.assertThat(registry.find("sql")).isSameAs(factory);
        Assertions.assertThat(registry.resolve("sql")).isSameAs(factory);
        Assertions.assertThat(registry.adapters()).containsExactly("sql");
        Assertions.assertThat(registryLogs.getLastLogEventMessage()).contains("registered adapter").contains("adapter=\"sql\"");
    }

    @Test
    void duplicateRegistrationFails() throws RelationalException {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of());
        final RecordingFactory first = new RecordingFactory("sql", true);
        registry.register(first);
        RelationalAssertions.assertThrows(() -> registry.register(new RecordingFactory("sql", false)))
                .hasErrorCode(ErrorCode.DUPLICATE_ADAPTER);
        Assertions.assertThat(registry.find("sql")).isSameAs(first);
    }

    @Test
    void deregister() throws RelationalException {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of());
        final RecordingFactory factory = new RecordingFactory("sql", true);
        registry.register(factory);
        Assertions.assertThat(registry.deregister("sql")).isSameAs(factory);
        Assertions.assertThat(registry.deregister("sql")).isNull();
        Assertions.assertThat(registry.find("sql")).isNull();
    }

    @Test
    void unknownAdapterTriggersDiscovery() throws RelationalException {
        final AtomicInteger loads = new AtomicInteger();
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> {
            loads.incrementAndGet();
            return List.of(new MemoryGatewayFactory());
        });
        Assertions.assertThat(registry.isRegistered("memory")).isFalse();
        Assertions.assertThat(registry.resolve("memory")).isInstanceOf(MemoryGatewayFactory.class);
        Assertions.assertThat(loads).hasValue(1);
        registry.resolve("memory");
        Assertions.assertThat(loads).hasValue(1);
        Assertions.assertThat(registryLogs.getLogEventMessages()).anyMatch(message -> message.contains("found adapter"));
    }

    @Test
    void unresolvableAdapter() {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of(new MemoryGatewayFactory()));
        RelationalAssertions.assertThrows(() -> registry.resolve("missing_adapter"))
                .isInstanceOfException(AdapterLoadException.class)
                .hasErrorCode(ErrorCode.ADAPTER_LOAD_FAILED)
                .containsInMessage("Failed to load adapter <missing_adapter>");
    }

    @Test
    void brokenServiceConfiguration() {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> {
            throw new ServiceConfigurationError("bad provider");
        });
        RelationalAssertions.assertThrows(() -> registry.resolve("memory"))
                .hasErrorCode(ErrorCode.ADAPTER_LOAD_FAILED)
                .hasCauseInstanceOf(ServiceConfigurationError.class);
    }

    @Test
    void discoveredDuplicateIsIgnored() throws RelationalException {
        final RecordingFactory explicit = new RecordingFactory("memory", true);
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of(new MemoryGatewayFactory()));
        registry.register(explicit);
        registry.discover();
        Assertions.assertThat(registry.find("memory")).isSameAs(explicit);
        Assertions.assertThat(registryLogs.getLastLogEvent().getLevel()).isEqualTo(Level.WARN);
        Assertions.assertThat(registryLogs.getLastLogEventMessage()).contains("duplicate adapter");
    }

    @Test
    void argumentsOnlyReachFactoriesThatTakeThem() throws RelationalException {
        final AdapterRegistry registry = AdapterRegistry.withLoader(type -> List.of());
        final RecordingFactory withArgs = new RecordingFactory("sql", true);
        final RecordingFactory withoutArgs = new RecordingFactory("cache", false);
        registry.register(withArgs);
        registry.register(withoutArgs);

        registry.setup("sql", "jdbc:h2:mem", 5);
        registry.setup("cache", "ignored");
        Assertions.assertThat(withArgs.created).containsExactly(List.of("jdbc:h2:mem", 5));
        Assertions.assertThat(withoutArgs.created).containsExactly(List.of());
    }
}
