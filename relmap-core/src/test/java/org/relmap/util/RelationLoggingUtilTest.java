/*
 * RelationLoggingUtilTest.java
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

package org.relmap.util;

import org.relmap.api.Dataset;
import org.relmap.api.Options;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;
import org.relmap.memory.MemoryDataset;
import org.relmap.relation.MapperRegistry;
import org.relmap.relation.Relation;
import org.relmap.relation.RelationDefinition;
import org.relmap.schema.Schema;
import org.relmap.schema.Types;
import org.relmap.utils.LogAppenderRule;
import org.relmap.utils.RelationalAssertions;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class RelationLoggingUtilTest {

    @RegisterExtension
    final LogAppenderRule relationLogs = new LogAppenderRule("RelationLoggingUtilTestLogs", Relation.class, Level.DEBUG);

    private static Relation users(Schema schema, Options options) {
        return RelationDefinition.of("users", schema).create(
                new MemoryDataset(List.of(Map.of("id", "1"), Map.of("id", "abc"))),
                MapperRegistry.empty(), options);
    }

    @Test
    void materializationIsLoggedAtDebug() throws RelationalException {
        users(Schema.empty("users"), Options.none()).call();
        final LogEvent event = relationLogs.getLastLogEvent();
        Assertions.assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
        Assertions.assertThat(relationLogs.getLastLogEventMessage())
                .startsWith("relation materialized relation=\"users\" total_micros=\"")
                .endsWith("tuple_count=\"2\"");
    }

    @Test
    void materializationIsLoggedAtInfoWhenRequested() throws RelationalException {
        users(Schema.empty("users"), Options.builder().withOption(Options.Name.LOG_MATERIALIZATION, true).build()).call();
        Assertions.assertThat(relationLogs.getLastLogEvent().getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void slowMaterializationIsLoggedAtInfo() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("relation materialized", LogMessageKeys.RELATION, "users");
        RelationLoggingUtil.publishMaterializationLogs(LogManager.getLogger(Relation.class), message, 7, null,
                3_000_000L, Options.none());
        Assertions.assertThat(relationLogs.getLastLogEvent().getLevel()).isEqualTo(Level.INFO);
        Assertions.assertThat(relationLogs.getLastLogEventMessage())
                .isEqualTo("relation materialized relation=\"users\" total_micros=\"3000000\" tuple_count=\"7\"");
    }

    @Test
    void failedMaterializationIsLoggedAtError() throws RelationalException {
        final Schema schema = Schema.builder("users").attribute("id", Types.STRING, Types.Coercible.INT).build();
        RelationalAssertions.assertThrows(() -> users(schema, Options.none()).call())
                .hasErrorCode(ErrorCode.CANNOT_CONVERT_TYPE);
        final LogEvent event = relationLogs.getLastLogEvent();
        Assertions.assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        Assertions.assertThat(event.getThrown()).isInstanceOf(RelationalException.class);
        Assertions.assertThat(relationLogs.getLastLogEventMessage())
                .contains("code=\"" + ErrorCode.CANNOT_CONVERT_TYPE.getErrorCode() + "\"")
                .doesNotContain("tuple_count");
    }

    @Test
    void uncheckedFailureIsLoggedAtError() {
        final Dataset broken = new Dataset() {
            @Override
            public Iterator<Map<String, Object>> iterator() {
                throw new IllegalStateException("backing store closed");
            }

            @Override
            public void insert(@Nonnull Map<String, Object> tuple) {
                throw new IllegalStateException("backing store closed");
            }
        };
        final Relation relation = RelationDefinition.of("users", Schema.empty("users"))
                .create(broken, MapperRegistry.empty(), Options.none());
        Assertions.assertThatThrownBy(relation::call)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("backing store closed");
        final LogEvent event = relationLogs.getLastLogEvent();
        Assertions.assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        Assertions.assertThat(event.getThrown()).isInstanceOf(RelationalException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        Assertions.assertThat(relationLogs.getLastLogEventMessage())
                .contains("code=\"" + ErrorCode.UNKNOWN.getErrorCode() + "\"")
                .doesNotContain("tuple_count");
    }
}
