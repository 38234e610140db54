/*
 * TransactionOutcome.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * What a {@link TransactionRunner} reports: the body's value when committed, or the rolled back marker. A body that
 * returned {@code null} and a rolled back transaction are told apart by {@link #isRolledBack()}.
 *
 * @param <T> the type of the body's value
 */
@API(API.Status.EXPERIMENTAL)
public final class TransactionOutcome<T> {
    private static final TransactionOutcome<?> ROLLED_BACK = new TransactionOutcome<>(null, true);

    @Nullable
    private final T value;
    private final boolean rolledBack;

    private TransactionOutcome(@Nullable T value, boolean rolledBack) {
        this.value = value;
        this.rolledBack = rolledBack;
    }

    @Nonnull
    public static <T> TransactionOutcome<T> committed(@Nullable T value) {
        return new TransactionOutcome<>(value, false);
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> TransactionOutcome<T> rolledBack() {
        return (TransactionOutcome<T>) ROLLED_BACK;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    /**
     * The body's value.
     *
     * @return the value, {@code null} if rolled back
     */
    @Nullable
    public T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return rolledBack ? "RolledBack" : "Committed(" + value + ")";
    }
}
