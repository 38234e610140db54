/*
 * SchemaTest.java
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

import org.relmap.api.exceptions.AttributeNotFoundException;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.memory.MemoryGateway;
import org.relmap.utils.RelationalAssertions;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SchemaTest {

    private static Schema users() throws RelationalException {
        return Schema.builder("users")
                .attribute("id", Types.STRING, Types.Coercible.INT)
                .attribute("name", Types.Coercible.STRING)
                .build();
    }

    private static Map<String, Object> tuple(Object... keysAndValues) {
        final Map<String, Object> tuple = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            tuple.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return tuple;
    }

    @Test
    void attributesKeepDeclarationOrder() throws RelationalException {
        final Schema schema = users();
        Assertions.assertThat(schema.getAttributeNames()).containsExactly("id", "name");
        Assertions.assertThat(schema.size()).isEqualTo(2);
        Assertions.assertThat(schema.isEmpty()).isFalse();
        Assertions.assertThat(schema.isFinalized()).isTrue();
        Assertions.assertThat(schema.anyRead()).isTrue();
        Assertions.assertThat(schema.getAssociations().isEmpty()).isTrue();
    }

    @Test
    void duplicateAttributeIsRejected() {
        RelationalAssertions.assertThrows(() -> Schema.builder("users")
                        .attribute("id", Types.INT)
                        .attribute("id", Types.STRING))
                .hasErrorCode(ErrorCode.DUPLICATE_ATTRIBUTE)
                .containsInMessage("id");
    }

    @Test
    void unknownAttribute() throws RelationalException {
        final Schema schema = users();
        RelationalAssertions.assertThrows(() -> schema.get("email"))
                .isInstanceOfException(AttributeNotFoundException.class)
                .hasErrorCode(ErrorCode.UNDEFINED_ATTRIBUTE);
        Assertions.assertThat(schema.contains("email")).isFalse();
    }

    @Test
    void commandHashKeepsOnlyAttributes() throws RelationalException {
        final Schema schema = Schema.builder("users")
                .attribute("id", Types.Coercible.INT)
                .attribute("name", Types.Coercible.STRING)
                .build();
        final Map<String, Object> written = schema.toCommandHash().apply(tuple("name", 42, "id", "7", "junk", true));
        Assertions.assertThat(written).containsExactly(Map.entry("id", 7), Map.entry("name", "42"));
    }

    @Test
    void commandHashWrapsConversionFailures() throws RelationalException {
        final Schema schema = Schema.builder("users").attribute("id", Types.Coercible.INT).build();
        RelationalAssertions.assertThrowsUnchecked(() -> schema.toCommandHash().apply(tuple("id", "abc")))
                .hasErrorCode(ErrorCode.CANNOT_CONVERT_TYPE)
                .containsInMessage("Coercible::Int");
    }

    @Test
    void relationHashDecodesReadTypesOnly() throws RelationalException {
        final Map<String, Object> read = users().toRelationHash().apply(tuple("id", "1", "name", "Jane", "extra", 3));
        Assertions.assertThat(read).containsExactly(Map.entry("id", 1), Map.entry("name", "Jane"), Map.entry("extra", 3));
    }

    @Test
    void tupleFunctionsAreCached() throws RelationalException {
        final Schema schema = users();
        Assertions.assertThat(schema.toCommandHash()).isSameAs(schema.toCommandHash());
        Assertions.assertThat(schema.toRelationHash()).isSameAs(schema.toRelationHash());
    }

    @Test
    void nullValuesPassCoercion() throws RelationalException {
        final Map<String, Object> read = users().toRelationHash().apply(tuple("id", null));
        Assertions.assertThat(read).containsEntry("id", null);
    }

    @Test
    void projectTagsSource() throws RelationalException {
        final Schema projected = users().project("name");
        Assertions.assertThat(projected.getAttributeNames()).containsExactly("name");
        Assertions.assertThat(projected.get("name").getSource()).isEqualTo("users");
        RelationalAssertions.assertThrows(() -> users().project("email"))
                .hasErrorCode(ErrorCode.UNDEFINED_ATTRIBUTE);
    }

    @Test
    void inferredSchemaIsFinalizedAgainstGateway() throws RelationalException {
        final SchemaInferrer inferrer = (dataset, gateway) -> List.of(
                Attribute.of("id", Types.Coercible.INT),
                Attribute.of("name", Types.Coercible.STRING),
                Attribute.of("score", Types.Coercible.DECIMAL));
        final Schema declared = Schema.builder("users")
                .attribute("name", Types.Strict.STRING)
                .inferrer(inferrer)
                .build();
        Assertions.assertThat(declared.isFinalized()).isFalse();
        Assertions.assertThat(declared.isInferred()).isTrue();

        final Schema finalized = declared.finalizeSchema(new MemoryGateway());
        Assertions.assertThat(finalized.isFinalized()).isTrue();
        Assertions.assertThat(finalized.getAttributeNames()).containsExactly("name", "id", "score");
        Assertions.assertThat(finalized.get("name").getType()).isEqualTo(Types.Strict.STRING);
        Assertions.assertThat(finalized.toCommandHash().apply(tuple("score", "1.50")))
                .containsEntry("score", new BigDecimal("1.50"));
        Assertions.assertThat(finalized.finalizeSchema(new MemoryGateway())).isSameAs(finalized);
    }

    @Test
    void strictTypesRejectOtherJavaTypes() {
        RelationalAssertions.assertThrows(() -> Types.Strict.INT.coerce("1"))
                .hasErrorCode(ErrorCode.CANNOT_CONVERT_TYPE);
    }

    @Test
    void coercibleBoolean() throws RelationalException {
        Assertions.assertThat(Types.Coercible.BOOLEAN.coerce("t")).isTrue();
        Assertions.assertThat(Types.Coercible.BOOLEAN.coerce(" FALSE ")).isFalse();
        RelationalAssertions.assertThrows(() -> Types.Coercible.BOOLEAN.coerce("maybe"))
                .hasErrorCode(ErrorCode.CANNOT_CONVERT_TYPE);
    }
}
