/*
 * OptionsTest.java
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

import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.InternalErrorException;
import org.relmap.api.exceptions.RelationalException;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OptionsTest {
    @Test
    void none() {
        assertNull(Options.NONE.getOption(Options.Name.TRANSACTION_ID));
        Assertions.assertThat(Options.none().isEmpty()).isTrue();
    }

    @Test
    void defaults() {
        final boolean autoFinalize = Options.none().getOption(Options.Name.AUTO_FINALIZE_SCHEMA);
        Assertions.assertThat(autoFinalize).isTrue();
        assertEquals(Boolean.FALSE, Options.none().getOption(Options.Name.LOG_MATERIALIZATION));
        assertEquals(Long.valueOf(-1L), Options.none().getOption(Options.Name.TRANSACTION_TIMEOUT));
        Assertions.assertThat(Options.none().hasOption(Options.Name.AUTO_FINALIZE_SCHEMA)).isFalse();
    }

    @Test
    void simpleOptions() throws RelationalException {
        Options options = Options.builder()
                .withOption(Options.Name.DATASET_NAME, "people")
                .withOption(Options.Name.LOG_MATERIALIZATION, true)
                .build();
        assertEquals("people", options.getOption(Options.Name.DATASET_NAME));
        assertEquals(Boolean.TRUE, options.getOption(Options.Name.LOG_MATERIALIZATION));
        Assertions.assertThat(options.hasOption(Options.Name.DATASET_NAME)).isTrue();
        Assertions.assertThat(options.isEmpty()).isFalse();
    }

    @Test
    void unsettingAnOption() throws RelationalException {
        Options options = Options.builder()
                .withOption(Options.Name.DATASET_NAME, "people")
                .withOption(Options.Name.DATASET_NAME, null)
                .build();
        Assertions.assertThat(options.hasOption(Options.Name.DATASET_NAME)).isFalse();
    }

    @Test
    void parentChildOptions() throws RelationalException {
        Options parent = Options.builder()
                .withOption(Options.Name.TRANSACTION_ID, "tx-1")
                .withOption(Options.Name.DATASET_NAME, "users")
                .build();
        Options child = Options.builder()
                .withOption(Options.Name.DATASET_NAME, "people")
                .build();

        Options options = parent.withChild(child);
        assertEquals("tx-1", options.getOption(Options.Name.TRANSACTION_ID));
        assertEquals("people", options.getOption(Options.Name.DATASET_NAME));
        Assertions.assertThat(child.withChild(child)).isSameAs(child);

        // a child that already has a parent cannot be re-parented
        Options adopted = Options.builder().fromOptions(options).build();
        Assertions.assertThatThrownBy(() -> parent.withChild(adopted))
                .isInstanceOf(InternalErrorException.class);
        Assertions.assertThatThrownBy(() -> Options.builder().fromOptions(options).fromOptions(parent))
                .isInstanceOf(InternalErrorException.class);
    }

    @Test
    void withOptionKeepsParent() throws RelationalException {
        Options parent = Options.builder().withOption(Options.Name.TRANSACTION_ID, "tx-1").build();
        Options options = parent.withChild(Options.none())
                .withOption(Options.Name.LOG_MATERIALIZATION, true);
        assertEquals("tx-1", options.getOption(Options.Name.TRANSACTION_ID));
        assertEquals(Boolean.TRUE, options.getOption(Options.Name.LOG_MATERIALIZATION));
    }

    @Test
    void merge() throws RelationalException {
        Options base = Options.builder()
                .withOption(Options.Name.TRANSACTION_ID, "tx-1")
                .withOption(Options.Name.DATASET_NAME, "users")
                .build();
        Assertions.assertThat(base.merge(Options.none())).isSameAs(base);

        Options merged = base.merge(Options.builder().withOption(Options.Name.DATASET_NAME, "people").build());
        assertEquals("tx-1", merged.getOption(Options.Name.TRANSACTION_ID));
        assertEquals("people", merged.getOption(Options.Name.DATASET_NAME));
        assertEquals("users", base.getOption(Options.Name.DATASET_NAME));
    }

    @Test
    void violatedContract() {
        Assertions.assertThatThrownBy(() -> Options.builder().withOption(Options.Name.DATASET_NAME, 0))
                .isInstanceOf(RelationalException.class)
                .hasMessage("Option DATASET_NAME should be of type class java.lang.String but is class java.lang.Integer")
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_PARAMETER);

        Assertions.assertThatThrownBy(() -> Options.builder().withOption(Options.Name.TRANSACTION_TIMEOUT, 10))
                .isInstanceOf(RelationalException.class)
                .hasMessage("Option TRANSACTION_TIMEOUT should be of type class java.lang.Long but is class java.lang.Integer");

        Assertions.assertThatThrownBy(() -> Options.builder().withOption(Options.Name.TRANSACTION_TIMEOUT, -2L))
                .isInstanceOf(RelationalException.class)
                .hasMessage("Option TRANSACTION_TIMEOUT should be in range [-1, " + Long.MAX_VALUE + "] but is -2");
    }

    @Test
    void fromString() throws RelationalException {
        Options options = Options.builder()
                .withOptionFromString(Options.Name.LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS, "500")
                .withOptionFromString(Options.Name.AUTO_FINALIZE_SCHEMA, "false")
                .build();
        assertEquals(Long.valueOf(500L), options.getOption(Options.Name.LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS));
        assertEquals(Boolean.FALSE, options.getOption(Options.Name.AUTO_FINALIZE_SCHEMA));

        Assertions.assertThatThrownBy(() -> Options.builder().withOptionFromString(Options.Name.TRANSACTION_TIMEOUT, "soon"))
                .isInstanceOf(RelationalException.class)
                .hasMessage("Cannot parse <soon> as Long")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void properties() throws RelationalException {
        Properties properties = new Properties();
        properties.setProperty("TRANSACTION_ID", "tx-7");
        properties.setProperty("TRANSACTION_TIMEOUT", "2500");
        Options options = Options.fromProperties(properties);
        assertEquals("tx-7", options.getOption(Options.Name.TRANSACTION_ID));
        assertEquals(Long.valueOf(2500L), options.getOption(Options.Name.TRANSACTION_TIMEOUT));

        Properties written = Options.toProperties(options);
        Assertions.assertThat(written).containsEntry("TRANSACTION_ID", "tx-7").containsEntry("TRANSACTION_TIMEOUT", "2500");
        Assertions.assertThat(Options.fromProperties(written)).isEqualTo(options);
        Assertions.assertThat(Options.fromProperties(null)).isSameAs(Options.none());

        properties.setProperty("NOT_AN_OPTION", "x");
        Assertions.assertThatThrownBy(() -> Options.fromProperties(properties))
                .isInstanceOf(RelationalException.class)
                .hasMessage("Unknown option <NOT_AN_OPTION>")
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_PARAMETER);
    }
}
