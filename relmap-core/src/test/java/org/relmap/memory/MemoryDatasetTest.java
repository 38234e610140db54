/*
 * MemoryDatasetTest.java
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

import org.relmap.api.exceptions.ErrorCode;
import org.relmap.utils.RelationalAssertions;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class MemoryDatasetTest {

    private static MemoryDataset users() {
        return new MemoryDataset(List.of(
                Map.of("id", 3, "name", "Joe", "age", 30),
                Map.of("id", 1, "name", "Jane", "age", 41),
                Map.of("id", 2, "name", "Jade", "age", 30)));
    }

    @Test
    void insertKeepsOrderAndDuplicates() {
        final MemoryDataset dataset = new MemoryDataset();
        dataset.insert(Map.of("id", 1));
        dataset.insert(Map.of("id", 2));
        dataset.insert(Map.of("id", 1));
        Assertions.assertThat(dataset).containsExactly(Map.of("id", 1), Map.of("id", 2), Map.of("id", 1));
        Assertions.assertThat(dataset.count()).isEqualTo(3);
    }

    @Test
    void storedTuplesAreDetached() {
        final Map<String, Object> tuple = new HashMap<>();
        tuple.put("id", 1);
        final MemoryDataset dataset = new MemoryDataset();
        dataset.insert(tuple);
        tuple.put("id", 2);
        Assertions.assertThat(dataset.getTuples()).containsExactly(Map.of("id", 1));
        Assertions.assertThatThrownBy(() -> dataset.iterator().next().put("id", 3))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void restrictByValueAndMembership() {
        Assertions.assertThat(users().restrict(Map.of("age", 30)).project(List.of("id")))
                .containsExactly(Map.of("id", 3), Map.of("id", 2));
        Assertions.assertThat(users().restrict(Map.of("name", Set.of("Jane", "Jade"))).count()).isEqualTo(2);
        Assertions.assertThat(users().restrict(Map.of("age", 30, "name", "Jade")).count()).isEqualTo(1);
        Assertions.assertThat(users().restrict(Map.of("missing", 1)).count()).isZero();
    }

    @Test
    void projectKeepsRequestedOrder() {
        Assertions.assertThat(users().project(List.of("name", "id", "unknown")).getTuples().get(0).keySet())
                .containsExactly("name", "id");
    }

    @Test
    void rename() {
        Assertions.assertThat(users().rename(Map.of("name", "fullName")).getTuples().get(0))
                .containsOnlyKeys("id", "fullName", "age")
                .containsEntry("fullName", "Joe");
    }

    @Test
    void orderIsStableWithNullsLast() throws Exception {
        final Map<String, Object> noAge = new HashMap<>();
        noAge.put("id", 4);
        noAge.put("age", null);
        final MemoryDataset dataset = users();
        dataset.insert(noAge);
        Assertions.assertThat(dataset.order(List.of("age")).project(List.of("id")))
                .containsExactly(Map.of("id", 3), Map.of("id", 2), Map.of("id", 1), Map.of("id", 4));
        Assertions.assertThat(dataset.order(List.of("age", "id")).project(List.of("id")))
                .containsExactly(Map.of("id", 2), Map.of("id", 3), Map.of("id", 1), Map.of("id", 4));
        Assertions.assertThat(dataset.reverse().project(List.of("id")))
                .containsExactly(Map.of("id", 4), Map.of("id", 2), Map.of("id", 1), Map.of("id", 3));
    }

    @Test
    void orderingIncomparableValuesFails() {
        final MemoryDataset dataset = new MemoryDataset(List.of(Map.of("id", 1), Map.of("id", "two")));
        RelationalAssertions.assertThrows(() -> dataset.order(List.of("id")))
                .hasErrorCode(ErrorCode.CANNOT_CONVERT_TYPE)
                .hasCauseInstanceOf(ClassCastException.class);
        Assertions.assertThat(dataset.project(List.of("id"))).containsExactly(Map.of("id", 1), Map.of("id", "two"));
    }

    @Test
    void naturalJoin() throws Exception {
        final MemoryDataset tasks = new MemoryDataset(List.of(
                Map.of("userId", 1, "title", "write"),
                Map.of("userId", 3, "title", "ship")));
        final MemoryDataset joined = users().rename(Map.of("id", "userId")).join(tasks);
        Assertions.assertThat(joined.project(List.of("name", "title")))
                .containsExactly(Map.of("name", "Joe", "title", "ship"), Map.of("name", "Jane", "title", "write"));

        RelationalAssertions.assertThrows(() -> users().join(new MemoryDataset(List.of(Map.of("other", 1)))))
                .hasErrorCode(ErrorCode.INVALID_PARAMETER);
    }

    @Test
    void deleteRemovesEveryEqualTuple() {
        final MemoryDataset dataset = new MemoryDataset();
        dataset.insert(Map.of("id", 1));
        dataset.insert(Map.of("id", 2));
        dataset.insert(Map.of("id", 1));
        Assertions.assertThat(dataset.delete(Map.of("id", 1))).isEqualTo(2);
        Assertions.assertThat(dataset.delete(Map.of("id", 9))).isZero();
        Assertions.assertThat(dataset).containsExactly(Map.of("id", 2));
    }

    @Test
    void derivedDatasetsAreDetached() {
        final MemoryDataset dataset = users();
        final MemoryDataset restricted = dataset.restrict(Map.of("age", 30));
        dataset.insert(Map.of("id", 9, "age", 30));
        Assertions.assertThat(restricted.count()).isEqualTo(2);
    }
}
