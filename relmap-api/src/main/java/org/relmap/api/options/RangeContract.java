/*
 * RangeContract.java
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

package org.relmap.api.options;

import org.relmap.api.Options;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;

/**
 * Requires a comparable option value to lie within {@code [min, max]}.
 *
 * @param <T> the type of the bounds
 */
public final class RangeContract<T extends Comparable<T>> implements OptionContract {
    @Nonnull
    private final T min;
    @Nonnull
    private final T max;

    private RangeContract(@Nonnull T min, @Nonnull T max) {
        this.min = min;
        this.max = max;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void validate(@Nonnull Options.Name name, Object value) throws RelationalException {
        if (value == null) {
            return;
        }
        T t = (T) value;
        if (t.compareTo(min) < 0 || t.compareTo(max) > 0) {
            throw new RelationalException("Option " + name + " should be in range [" + min + ", " + max + "] but is " + value,
                    ErrorCode.INVALID_PARAMETER);
        }
    }

    public static <T extends Comparable<T>> RangeContract<T> of(@Nonnull T min, @Nonnull T max) {
        return new RangeContract<>(min, max);
    }
}
