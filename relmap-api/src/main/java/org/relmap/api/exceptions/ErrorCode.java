/*
 * ErrorCode.java
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

package org.relmap.api.exceptions;

import org.relmap.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Error codes carried by every {@link RelationalException}.
 *
 * <p>
 * Codes are five characters long. The first two characters name the class of the error, the same way SQLSTATE values
 * do: {@code 22} for data errors, {@code 42} for references to things that do not exist, {@code 08} for adapter and
 * gateway configuration, {@code XX} for internal errors.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public enum ErrorCode {
    // data
    INVALID_PARAMETER("22023"),
    CANNOT_CONVERT_TYPE("22000"),
    TUPLE_COUNT_MISMATCH("21000"),

    // references
    UNDEFINED_ATTRIBUTE("42703"),
    UNDEFINED_VIEW("42P10"),
    UNDEFINED_MAPPER("42P11"),
    UNDEFINED_ASSOCIATION("42P12"),
    DUPLICATE_ATTRIBUTE("42701"),

    // gateway and adapter configuration
    MISSING_ADAPTER_IDENTIFIER("08M01"),
    ADAPTER_LOAD_FAILED("08M02"),
    DUPLICATE_ADAPTER("08M03"),

    // transactions
    TRANSACTION_TIMEOUT("25T01"),

    UNSUPPORTED_OPERATION("0A000"),
    INTERNAL_ERROR("XX000"),
    UNKNOWN("XXXXX");

    private static final Map<String, ErrorCode> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(ErrorCode::getErrorCode, Function.identity()));

    @Nonnull
    private final String errorCode;

    ErrorCode(@Nonnull String errorCode) {
        this.errorCode = errorCode;
    }

    @Nonnull
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Look up the error code for its five character representation.
     *
     * @param errorCode the code, as returned by {@link #getErrorCode()}
     * @return the matching code, or {@link #UNKNOWN} if none matches
     */
    @Nonnull
    public static ErrorCode get(@Nullable String errorCode) {
        if (errorCode == null) {
            return UNKNOWN;
        }
        return BY_CODE.getOrDefault(errorCode, UNKNOWN);
    }
}
