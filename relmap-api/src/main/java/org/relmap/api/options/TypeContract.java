/*
 * TypeContract.java
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
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * Requires an option value to be an instance of a given class.
 *
 * @param <T> the required type
 */
public final class TypeContract<T> implements OptionContractWithConversion<T> {
    @Nonnull
    private final Class<T> type;
    @Nonnull
    private final Function<String, T> fromString;

    private TypeContract(@Nonnull Class<T> type, @Nonnull Function<String, T> fromString) {
        this.type = type;
        this.fromString = fromString;
    }

    @Override
    public void validate(@Nonnull Options.Name name, Object value) throws RelationalException {
        if (value != null && !type.isInstance(value)) {
            throw new RelationalException("Option " + name + " should be of type " + type + " but is " + value.getClass(),
                    ErrorCode.INVALID_PARAMETER);
        }
    }

    @Nullable
    @Override
    public T fromString(@Nonnull String valueAsString) throws RelationalException {
        try {
            return fromString.apply(valueAsString);
        } catch (RuntimeException e) {
            throw new RelationalException("Cannot parse <" + valueAsString + "> as " + type.getSimpleName(),
                    ErrorCode.INVALID_PARAMETER, e);
        }
    }

    public static TypeContract<Boolean> booleanType() {
        return new TypeContract<>(Boolean.class, Boolean::parseBoolean);
    }

    public static TypeContract<Long> longType() {
        return new TypeContract<>(Long.class, Long::parseLong);
    }

    public static TypeContract<String> stringType() {
        return new TypeContract<>(String.class, Function.identity());
    }
}
