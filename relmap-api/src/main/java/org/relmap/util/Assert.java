/*
 * Assert.java
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

import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * A set of helper methods for validating input, pre-conditions, ... etc.
 */
public final class Assert {

    public static void that(boolean mustBeTrue, @Nonnull final ErrorCode errorCodeIfNotTrue, @Nonnull final Supplier<String> messageSupplier) throws RelationalException {
        if (!mustBeTrue) {
            throw new RelationalException(messageSupplier.get(), errorCodeIfNotTrue);
        }
    }

    public static void thatUnchecked(boolean mustBeTrue, @Nonnull final ErrorCode errorCodeIfNotTrue, @Nonnull final Supplier<String> messageSupplier) {
        if (!mustBeTrue) {
            throw new RelationalException(messageSupplier.get(), errorCodeIfNotTrue).toUncheckedWrappedException();
        }
    }

    private Assert() {
    }
}
