/*
 * LoadedTest.java
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

package org.relmap.relation;

import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.memory.MemoryDataset;
import org.relmap.utils.RelationalAssertions;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class LoadedTest {

    @Test
    void loadedDoesNotTouchDatasetAgain() throws RelationalException {
        final MemoryDataset dataset = new MemoryDataset(List.of(Map.of("id", 1)));
        final Loaded<Map<String, Object>> loaded = RelationDefinition.of("users").create(dataset).call();
        dataset.insert(Map.of("id", 2));
        Assertions.assertThat(loaded.getCollection()).containsExactly(Map.of("id", 1));
        Assertions.assertThat(loaded.call()).isSameAs(loaded);
        Assertions.assertThat(loaded.toList()).isSameAs(loaded.getCollection());
    }

    @Test
    void collectionIsImmutableCopy() {
        final List<String> source = new ArrayList<>(List.of("a", "b"));
        final Loaded<String> loaded = new Loaded<>(source, null);
        source.add("c");
        Assertions.assertThat(loaded).containsExactly("a", "b");
        Assertions.assertThatThrownBy(() -> loaded.getCollection().add("d"))
                .isInstanceOf(UnsupportedOperationException.class);
        Assertions.assertThat(loaded.getSource()).isNull();
    }

    @Test
    void pluckReadsOneField() throws RelationalException {
        final Map<String, Object> partial = new HashMap<>();
        partial.put("name", "Joe");
        final Loaded<Map<String, Object>> loaded = new Loaded<>(Arrays.<Map<String, Object>>asList(Map.of("id", 1, "name", "Jane"), partial), null);
        Assertions.assertThat(loaded.pluck("id")).containsExactly(1, null);
        Assertions.assertThat(loaded.pluck("name")).containsExactly("Jane", "Joe");

        final Loaded<String> strings = new Loaded<>(List.of("a"), null);
        RelationalAssertions.assertThrows(() -> strings.pluck("id"))
                .hasErrorCode(ErrorCode.INVALID_PARAMETER);
    }

    @Test
    void oneAndFirst() throws RelationalException {
        Assertions.assertThat(new Loaded<>(List.of("a", "b"), null).first()).contains("a");
        Assertions.assertThat(new Loaded<String>(List.of(), null).first()).isEmpty();
        Assertions.assertThat(new Loaded<>(List.of("a"), null).oneOrThrow()).isEqualTo("a");
        RelationalAssertions.assertThrows(() -> new Loaded<>(List.of("a", "b"), null).one())
                .hasErrorCode(ErrorCode.TUPLE_COUNT_MISMATCH);
    }

    @Test
    void sizeAndStream() {
        final Loaded<Integer> loaded = new Loaded<>(List.of(1, 2, 3), null);
        Assertions.assertThat(loaded.size()).isEqualTo(3);
        Assertions.assertThat(loaded.isEmpty()).isFalse();
        Assertions.assertThat(loaded.stream().mapToInt(Integer::intValue).sum()).isEqualTo(6);
        Assertions.assertThat(loaded).isEqualTo(new Loaded<>(List.of(1, 2, 3), "elsewhere"));
    }
}
